package mchmm.hmm.model;

import java.util.Arrays;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import mchmm.util.Algebra;
import mchmm.util.Sampler;

/**
 * Emission family shared by all channels of a model. The channels are independent
 * given the hidden state, so the likelihood of an observation vector is the
 * product of the per-channel likelihoods.
 */
public abstract class EmissionModel {
	protected final static Logger myLogger = Logger.getLogger(EmissionModel.class);

	protected final int N; // #states
	protected final int C; // #channels
	protected final double[][][] B; // per-channel emission tables, [C][rows][N]

	protected EmissionModel(double[][]... B) {
		if(B==null) throw new NullPointerException("emission tables must not be null.");
		if(B.length==0) throw new MalformedModelException("at least one emission channel is required.");
		this.C = B.length;
		this.B = new double[C][][];
		for(int c=0; c<C; c++) {
			if(B[c]==null || B[c].length==0 || B[c][0]==null)
				throw new MalformedModelException("emission table of channel "+c+" is empty.");
			this.B[c] = Algebra.copyOf(B[c]);
		}
		this.N = this.B[0][0].length;
		if(N==0) throw new MalformedModelException("emission tables have no states.");
		for(int c=0; c<C; c++) {
			for(int r=0; r<this.B[c].length; r++) {
				if(this.B[c][r]==null || this.B[c][r].length!=N)
					throw new MalformedModelException("row "+r+" of the emission table of channel "+c+
							" should have "+N+" columns, one per state.");
				for(int j=0; j<N; j++) {
					if(Double.isNaN(this.B[c][r][j]) || Double.isInfinite(this.B[c][r][j]))
						throw new MalformedModelException("emission table of channel "+c+
								" has a non-finite entry at ("+r+", "+j+").");
				}
			}
		}
	}

	/**
	 * Checks the family specific constraints on the emission tables.
	 * @throws MalformedModelException
	 */
	protected abstract void validate(double tolerance);

	/**
	 * Multiplies emiss[j] by the likelihood of value x on the given channel under state j.
	 */
	protected abstract void multiply(int channel, double x, double[] emiss);

	/**
	 * Draws a value for the given channel from the emission distribution of the given state.
	 */
	public abstract double sample(int channel, int state, Sampler sampler);

	public abstract String family();

	/**
	 * @param ob one value per channel
	 * @return likelihood of the observation vector under each state
	 */
	public double[] likelihood(double[] ob) {
		if(ob.length!=C)
			throw new IllegalArgumentException("observation has "+ob.length+
					" channels but the model has "+C+".");
		final double[] emiss = new double[N];
		Arrays.fill(emiss, 1.0);
		for(int c=0; c<C; c++)
			this.multiply(c, ob[c], emiss);
		return emiss;
	}

	/**
	 * Draws one observation vector from the given state.
	 */
	public double[] sample(int state, Sampler sampler) {
		final double[] ob = new double[C];
		for(int c=0; c<C; c++)
			ob[c] = this.sample(c, state, sampler);
		return ob;
	}

	public int numStates() {
		return N;
	}

	public int numChannels() {
		return C;
	}

	/**
	 * @return a copy of the emission table of the given channel
	 */
	public double[][] getTable(int channel) {
		return Algebra.copyOf(B[channel]);
	}

	protected String print() {
		StringBuilder sb = new StringBuilder();
		sb.append("emission (").append(family()).append(")\n");
		for(int c=0; c<C; c++) {
			sb.append(" channel ").append(c).append("\n");
			for(int r=0; r<B[c].length; r++)
				sb.append("  ").append(StringUtils.join(ArrayUtils.toObject(B[c][r]), '\t')).append("\n");
		}
		return sb.toString();
	}
}
