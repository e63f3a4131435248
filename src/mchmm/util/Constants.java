package mchmm.util;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

public class Constants {

	// tolerance on |sum-1| for initial, transition and categorical emission distributions
	public final static double PROB_TOLERANCE = 1e-6;

	public final static int NUM_CHANNELS = 3;

	private Constants() {}

	public static long seed() {
		return System.nanoTime();
	}

	public static RandomGenerator randomGenerator(long seed) {
		return new Well19937c(seed);
	}

	public static RandomGenerator randomGenerator() {
		return randomGenerator(seed());
	}
}
