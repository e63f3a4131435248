package mchmm.hmm.model;

import mchmm.hmm.data.ObservationSequence;

/**
 * Hidden path and observations drawn by a {@link SequenceGenerator}. The path has
 * one more entry than there are observations: state 0 comes from the initial
 * distribution and observation t is emitted by state t+1.
 */
public final class GeneratedSequence {
	private final int[] path;
	private final ObservationSequence observations;

	GeneratedSequence(int[] path, ObservationSequence observations) {
		this.path = path;
		this.observations = observations;
	}

	public int[] path() {
		return path.clone();
	}

	public int state(int t) {
		return path[t];
	}

	public ObservationSequence observations() {
		return observations;
	}

	public int length() {
		return observations.length();
	}
}
