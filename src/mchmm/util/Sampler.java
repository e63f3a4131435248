package mchmm.util;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Draws categorical indices and Gaussian values from an externally supplied
 * {@link RandomGenerator}. Swapping the generator, e.g. for a seeded one, is the
 * only way to change the stream of draws.
 */
public class Sampler {

	private final RandomGenerator rg;

	public Sampler(RandomGenerator rg) {
		if(rg==null) throw new NullPointerException("random generator must not be null.");
		this.rg = rg;
	}

	public Sampler(long seed) {
		this(Constants.randomGenerator(seed));
	}

	public Sampler() {
		this(Constants.randomGenerator());
	}

	/**
	 * Inverse-CDF sampling: draws u uniformly from [0,1) and returns the smallest
	 * index whose cumulative weight is at least u. Zero-weight entries are never
	 * returned, and rounding that leaves the total just below u falls back to the
	 * last positive entry.
	 *
	 * @param dist non-negative weights summing to 1
	 */
	public int categorical(double[] dist) {
		final double u = rg.nextDouble();
		double cum = 0;
		int last = -1;
		for(int i=0; i<dist.length; i++) {
			if(dist[i]<=0) continue;
			cum += dist[i];
			last = i;
			if(cum>=u) return i;
		}
		if(last<0) throw new IllegalArgumentException("distribution has no positive weight.");
		return last;
	}

	public double gaussian(double mean, double sd) {
		return new NormalDistribution(rg, mean, sd).sample();
	}
}
