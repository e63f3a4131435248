package mchmm.hmm.model;

/**
 * Thrown when model parameters are not valid probability tables or their
 * dimensions disagree.
 */
public class MalformedModelException extends HmmException {

	private static final long serialVersionUID = -6870392159617512391L;

	public MalformedModelException(String message) {
		super(message);
	}
}
