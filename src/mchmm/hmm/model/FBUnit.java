package mchmm.hmm.model;

import mchmm.util.Algebra;

/**
 * Forward or backward messages over T+1 steps. Every step is rescaled to sum to 1
 * except the initial backward message, and the log of each scale factor is kept
 * so that the probability of the observations can still be recovered.
 */
public final class FBUnit {
	final double[][] probsMat; // [T+1][N]
	final double[] logscale;
	final boolean backward;
	double probability;

	FBUnit(boolean backward, int T, int N) {
		this.backward = backward;
		this.probsMat = new double[T+1][N];
		this.logscale = new double[T+1];
	}

	/**
	 * @return a copy of the messages, row t for step t
	 */
	public double[][] probsMat() {
		return Algebra.copyOf(probsMat);
	}

	public double[] probs(int t) {
		return probsMat[t].clone();
	}

	/**
	 * @return log of the normalising constant applied at each step, 0 where none was applied
	 */
	public double[] logscale() {
		return logscale.clone();
	}

	/**
	 * @return natural log of the probability of all observations given the model
	 */
	public double probability() {
		return probability;
	}

	public boolean isBackward() {
		return backward;
	}

	public int length() {
		return probsMat.length-1;
	}

	public int numStates() {
		return probsMat[0].length;
	}
}
