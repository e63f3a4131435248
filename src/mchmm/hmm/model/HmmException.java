package mchmm.hmm.model;

/**
 * Base class of the failures raised by model construction and inference.
 */
public class HmmException extends RuntimeException {

	private static final long serialVersionUID = 4386215770911437245L;

	public HmmException(String message) {
		super(message);
	}
}
