package mchmm.hmm.model;

/**
 * Thrown when a categorical channel is asked for the likelihood of a value that is
 * not a symbol index in [0, numSymbols).
 */
public class OutOfRangeSymbolException extends HmmException {

	private static final long serialVersionUID = 2095317548126679021L;

	private final int channel;
	private final double value;
	private final int numSymbols;

	public OutOfRangeSymbolException(int channel, double value, int numSymbols) {
		super("symbol "+value+" on channel "+channel+
				" is out of range [0, "+numSymbols+").");
		this.channel = channel;
		this.value = value;
		this.numSymbols = numSymbols;
	}

	public int getChannel() {
		return channel;
	}

	public double getValue() {
		return value;
	}

	public int getNumSymbols() {
		return numSymbols;
	}
}
