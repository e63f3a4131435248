package mchmm.hmm.model;

/**
 * Thrown when a message cannot be normalised because it sums to zero, i.e. the
 * observations are impossible under every state at that timestep.
 */
public class ZeroLikelihoodException extends HmmException {

	private static final long serialVersionUID = -1730981262937416088L;

	private final int step;

	public ZeroLikelihoodException(int step, double sum) {
		super("zero-likelihood observation at step "+step+
				" (normalising sum "+sum+").");
		this.step = step;
	}

	public int getStep() {
		return step;
	}
}
