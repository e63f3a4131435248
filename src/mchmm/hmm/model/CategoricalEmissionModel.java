package mchmm.hmm.model;

import mchmm.util.Algebra;
import mchmm.util.Sampler;

/**
 * Discrete emissions. The table of channel k is numSymbols x N and column
 * stochastic: B[k][s][j] = p(channel k emits s | state j). The likelihood of
 * symbol s is the table row s, a lookup without computation.
 */
public class CategoricalEmissionModel extends EmissionModel {

	private final double[][][] columns; // [C][N][numSymbols], sampling distributions per state

	public CategoricalEmissionModel(double[][]... B) {
		super(B);
		this.columns = new double[C][N][];
		for(int c=0; c<C; c++) {
			for(int r=0; r<this.B[c].length; r++) {
				for(int j=0; j<N; j++) {
					if(this.B[c][r][j]<0)
						throw new MalformedModelException("emission table of channel "+c+
								" has a negative probability at symbol "+r+", state "+j+".");
				}
			}
			for(int j=0; j<N; j++)
				columns[c][j] = Algebra.column(this.B[c], j);
		}
		myLogger.debug("categorical emissions: "+C+" channels, "+N+" states");
	}

	@Override
	protected void validate(double tolerance) {
		for(int c=0; c<C; c++) {
			for(int j=0; j<N; j++) {
				if(!Algebra.sumsToOne(columns[c][j], tolerance))
					throw new MalformedModelException("column "+j+" of the emission table of channel "+c+
							" does not sum to 1.");
			}
		}
	}

	@Override
	protected void multiply(int channel, double x, double[] emiss) {
		final double[] row = B[channel][symbol(channel, x)];
		for(int j=0; j<N; j++)
			emiss[j] *= row[j];
	}

	@Override
	public double sample(int channel, int state, Sampler sampler) {
		return sampler.categorical(columns[channel][state]);
	}

	@Override
	public String family() {
		return "categorical";
	}

	public int numSymbols(int channel) {
		return B[channel].length;
	}

	private int symbol(int channel, double x) {
		final int M = B[channel].length;
		if(x<0 || x>=M || x!=Math.rint(x))
			throw new OutOfRangeSymbolException(channel, x, M);
		return (int) x;
	}
}
