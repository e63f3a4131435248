package mchmm.hmm.data;

import java.util.Arrays;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;

import mchmm.util.Constants;

/**
 * Immutable sequence of T observations, each a vector with one value per channel.
 * Categorical channels hold symbol indices stored as doubles.
 */
public final class ObservationSequence {

	private final double[][] obs; // [T][C]
	private final int T;
	private final int C;

	private ObservationSequence(double[][] obs, int C) {
		this.obs = obs;
		this.T = obs.length;
		this.C = C;
	}

	/**
	 * @param channels one array per channel, each of length T
	 */
	public static ObservationSequence ofValues(double[]... channels) {
		if(channels==null) throw new NullPointerException("channels must not be null.");
		if(channels.length==0) throw new IllegalArgumentException("at least one channel is required.");
		final int C = channels.length;
		final int T = channels[0].length;
		for(int c=1; c<C; c++) {
			if(channels[c].length!=T)
				throw new IllegalArgumentException("channel "+c+" has "+channels[c].length+
						" observations but channel 0 has "+T+".");
		}
		double[][] obs = new double[T][C];
		for(int t=0; t<T; t++)
			for(int c=0; c<C; c++)
				obs[t][c] = channels[c][t];
		return new ObservationSequence(obs, C);
	}

	/**
	 * @param channels one array of symbol indices per channel, each of length T
	 */
	public static ObservationSequence ofSymbols(int[]... channels) {
		if(channels==null) throw new NullPointerException("channels must not be null.");
		double[][] values = new double[channels.length][];
		for(int c=0; c<channels.length; c++) {
			values[c] = new double[channels[c].length];
			for(int t=0; t<values[c].length; t++) values[c][t] = channels[c][t];
		}
		return ofValues(values);
	}

	public static ObservationSequence empty() {
		return empty(Constants.NUM_CHANNELS);
	}

	public static ObservationSequence empty(int numChannels) {
		return new ObservationSequence(new double[0][numChannels], numChannels);
	}

	public int length() {
		return T;
	}

	public int numChannels() {
		return C;
	}

	public double value(int t, int channel) {
		return obs[t][channel];
	}

	/**
	 * @return a copy of the observation vector at step t
	 */
	public double[] get(int t) {
		return obs[t].clone();
	}

	/**
	 * @return a copy of the values of one channel across all steps
	 */
	public double[] channel(int channel) {
		double[] values = new double[T];
		for(int t=0; t<T; t++) values[t] = obs[t][channel];
		return values;
	}

	@Override
	public boolean equals(Object o) {
		if(this==o) return true;
		if(!(o instanceof ObservationSequence)) return false;
		ObservationSequence that = (ObservationSequence) o;
		return this.C==that.C && Arrays.deepEquals(this.obs, that.obs);
	}

	@Override
	public int hashCode() {
		return 31*C+Arrays.deepHashCode(obs);
	}

	@Override
	public String toString() {
		String[] steps = new String[T];
		for(int t=0; t<T; t++)
			steps[t] = StringUtils.join(ArrayUtils.toObject(obs[t]), ',');
		return "["+StringUtils.join(steps, ' ')+"]";
	}
}
