package mchmm.hmm.model;

import mchmm.util.Algebra;

/**
 * Score trellis, back pointers and decoded path of one Viterbi run.
 */
public final class ViterbiUnit {
	final double[][] v; // [T+1][N], scores rescaled to sum to 1 per step
	final int[][] trace; // [T+1][N], trace[t][j] is the best predecessor of j at t, row 0 unused
	final double[] logscale;
	final int[] path;
	double probability;

	ViterbiUnit(int T, int N) {
		this.v = new double[T+1][N];
		this.trace = new int[T+1][N];
		this.logscale = new double[T+1];
		this.path = new int[T+1];
	}

	/**
	 * Picks the best final state, lowest index on ties, and follows the back pointers.
	 */
	void finalise() {
		final int T = path.length-1;
		int tr = Algebra.maxIndex(v[T]);
		path[T] = tr;
		for(int t=T-1; t>=0; t--) {
			tr = trace[t+1][tr];
			path[t] = tr;
		}
		double s = Math.log(v[T][path[T]]);
		for(double l : logscale) s += l;
		this.probability = s;
	}

	/**
	 * @return the most probable state sequence, T+1 entries
	 */
	public int[] path() {
		return path.clone();
	}

	public int state(int t) {
		return path[t];
	}

	/**
	 * @return a copy of the score trellis
	 */
	public double[][] scores() {
		return Algebra.copyOf(v);
	}

	/**
	 * @return a copy of the back pointers, row 0 is unused
	 */
	public int[][] backPointers() {
		return Algebra.copyOf(trace);
	}

	/**
	 * @return natural log of the joint probability of the decoded path and the observations
	 */
	public double probability() {
		return probability;
	}

	public int length() {
		return path.length-1;
	}
}
