package mchmm.hmm.model;

import java.util.Arrays;

import org.apache.log4j.Logger;

import mchmm.hmm.data.ObservationSequence;
import mchmm.util.Algebra;

/**
 * Maximum a posteriori state path of a {@link HiddenMarkovModel}. Uses the same step
 * convention as {@link ForwardBackward}: the score at step 0 is pi and observation t
 * is emitted on entering step t+1.
 *
 * <p>Scores are rescaled to sum to 1 at each step, which leaves every argmax
 * unchanged. Ties, both between predecessors and between final states, are
 * resolved to the lowest state index.
 */
public class Viterbi {
	private final static Logger myLogger = Logger.getLogger(Viterbi.class);

	private Viterbi() {}

	/**
	 * @throws ZeroLikelihoodException if no path has positive probability
	 */
	public static ViterbiUnit decode(HiddenMarkovModel hmm, ObservationSequence obs) {
		hmm.checkChannels(obs);
		final int T = obs.length();
		final int N = hmm.numStates();
		myLogger.debug("viterbi: "+T+" steps x "+N+" states");

		final ViterbiUnit vb = new ViterbiUnit(T, N);
		final double[][] v = vb.v;
		final int[][] trace = vb.trace;
		System.arraycopy(hmm.pi(), 0, v[0], 0, N);
		Arrays.fill(trace[0], -1);

		for(int t=0; t<T; t++) {
			final double[] emiss = hmm.likelihood(obs, t);
			for(int j=0; j<N; j++) {
				double a, c = v[t][0]*hmm.a(0, j)*emiss[j];
				int s = 0;
				for(int i=1; i<N; i++) {
					a = v[t][i]*hmm.a(i, j)*emiss[j];
					if(a > c) {
						c = a;
						s = i;
					}
				}
				trace[t+1][j] = s;
				v[t+1][j] = c;
			}
			final double sum = Algebra.normalize(v[t+1]);
			if(!Algebra.isPositiveFinite(sum)) {
				myLogger.error("all paths have zero probability at step "+t+", sum is "+sum);
				throw new ZeroLikelihoodException(t, sum);
			}
			vb.logscale[t+1] = Math.log(sum);
		}

		vb.finalise();
		return vb;
	}
}
