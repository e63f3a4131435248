package mchmm.hmm.model;

import org.apache.log4j.Logger;

import mchmm.hmm.data.ObservationSequence;
import mchmm.util.Sampler;

/**
 * Ancestral sampling of hidden paths and observations from a {@link HiddenMarkovModel}.
 */
public class SequenceGenerator {
	private final static Logger myLogger = Logger.getLogger(SequenceGenerator.class);

	private final HiddenMarkovModel hmm;
	private final Sampler sampler;

	public SequenceGenerator(HiddenMarkovModel hmm, Sampler sampler) {
		if(hmm==null) throw new NullPointerException("hmm must not be null.");
		if(sampler==null) throw new NullPointerException("sampler must not be null.");
		this.hmm = hmm;
		this.sampler = sampler;
	}

	/**
	 * Draws state 0 from pi, then for each of the given number of steps draws the
	 * next state from the row of A of the current state and one value per channel
	 * from the emission distribution of that next state.
	 *
	 * @param length number of observations, the path has length+1 states
	 */
	public GeneratedSequence generate(int length) {
		if(length<0) throw new IllegalArgumentException("sequence length must not be negative: "+length);
		final EmissionModel emission = hmm.getEmission();
		final int C = emission.numChannels();
		myLogger.debug("generate: "+length+" steps, "+C+" channels");

		final int[] path = new int[length+1];
		final double[][] values = new double[C][length];
		path[0] = sampler.categorical(hmm.pi());
		for(int i=0; i<length; i++) {
			path[i+1] = sampler.categorical(hmm.a(path[i]));
			final double[] ob = emission.sample(path[i+1], sampler);
			for(int c=0; c<C; c++) values[c][i] = ob[c];
		}
		return new GeneratedSequence(path, ObservationSequence.ofValues(values));
	}
}
