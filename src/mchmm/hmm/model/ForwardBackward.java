package mchmm.hmm.model;

import java.util.Arrays;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.log4j.Logger;

import mchmm.hmm.data.ObservationSequence;
import mchmm.util.Algebra;

/**
 * Filtering, backward messages and smoothing for a {@link HiddenMarkovModel}.
 *
 * <p>Step 0 carries no observation: the forward message at step 0 is the initial
 * distribution, and observation t (zero-based) is emitted on entering step t+1.
 * All messages are rescaled at every step to avoid underflow; the logs of the
 * scale factors are summed to give the log-likelihood of the observations.
 */
public class ForwardBackward {
	private final static Logger myLogger = Logger.getLogger(ForwardBackward.class);

	private ForwardBackward() {}

	/**
	 * f[0] = pi, f[t+1] proportional to e(obs[t]) * (A^T f[t]).
	 *
	 * @return T+1 filtering distributions, row t is p(state at t | obs up to t)
	 * @throws ZeroLikelihoodException if an observation is impossible under every state
	 */
	public static FBUnit forward(HiddenMarkovModel hmm, ObservationSequence obs) {
		hmm.checkChannels(obs);
		final int T = obs.length();
		final int N = hmm.numStates();
		myLogger.debug("forward: "+T+" steps x "+N+" states");

		final FBUnit fw = new FBUnit(false, T, N);
		final double[][] probsMat = fw.probsMat;
		System.arraycopy(hmm.pi(), 0, probsMat[0], 0, N);

		double tmp;
		for(int t=0; t<T; t++) {
			final double[] emiss = hmm.likelihood(obs, t);
			for(int j=0; j<N; j++) {
				tmp = 0;
				for(int i=0; i<N; i++)
					tmp += probsMat[t][i]*hmm.a(i, j);
				probsMat[t+1][j] = emiss[j]*tmp;
			}
			fw.logscale[t+1] = Math.log(scale(probsMat[t+1], t));
		}
		fw.probability = StatUtils.sum(fw.logscale);
		return fw;
	}

	/**
	 * b[T] = 1 for every state, b[t-1] proportional to A (e(obs[t-1]) * b[t]).
	 *
	 * @return T+1 backward messages, row t proportional to p(obs after t | state at t)
	 * @throws ZeroLikelihoodException if an observation is impossible under every state
	 */
	public static FBUnit backward(HiddenMarkovModel hmm, ObservationSequence obs) {
		hmm.checkChannels(obs);
		final int T = obs.length();
		final int N = hmm.numStates();
		myLogger.debug("backward: "+T+" steps x "+N+" states");

		final FBUnit bw = new FBUnit(true, T, N);
		final double[][] probsMat = bw.probsMat;
		Arrays.fill(probsMat[T], 1.0);

		double tmp;
		final double[] eb = new double[N];
		for(int t=T; t>=1; t--) {
			final double[] emiss = hmm.likelihood(obs, t-1);
			for(int j=0; j<N; j++)
				eb[j] = emiss[j]*probsMat[t][j];
			for(int i=0; i<N; i++) {
				tmp = 0;
				for(int j=0; j<N; j++)
					tmp += hmm.a(i, j)*eb[j];
				probsMat[t-1][i] = tmp;
			}
			bw.logscale[t-1] = Math.log(scale(probsMat[t-1], t-1));
		}

		double s = 0;
		for(int i=0; i<N; i++)
			s += hmm.pi(i)*probsMat[0][i];
		bw.probability = Math.log(s)+StatUtils.sum(bw.logscale);
		return bw;
	}

	/**
	 * Elementwise product of forward and backward messages, each row normalised.
	 * Both must come from the same model and observations.
	 *
	 * @return T+1 posterior distributions, row t is p(state at t | all obs)
	 */
	public static double[][] smooth(FBUnit fw, FBUnit bw) {
		if(fw==null || bw==null) throw new NullPointerException("forward and backward messages must not be null.");
		if(fw.backward || !bw.backward)
			throw new IllegalArgumentException("expected a forward and a backward unit, in this order.");
		if(fw.length()!=bw.length() || fw.numStates()!=bw.numStates())
			throw new IllegalArgumentException("forward ("+(fw.length()+1)+"x"+fw.numStates()+
					") and backward ("+(bw.length()+1)+"x"+bw.numStates()+") messages differ in shape.");
		final int T = fw.length();
		final int N = fw.numStates();
		final double[][] posterior = new double[T+1][N];
		for(int t=0; t<=T; t++) {
			for(int j=0; j<N; j++)
				posterior[t][j] = fw.probsMat[t][j]*bw.probsMat[t][j];
			scale(posterior[t], t);
		}
		return posterior;
	}

	/**
	 * Runs {@link #forward}, {@link #backward} and {@link #smooth} on the same input.
	 */
	public static double[][] posterior(HiddenMarkovModel hmm, ObservationSequence obs) {
		return smooth(forward(hmm, obs), backward(hmm, obs));
	}

	private static double scale(double[] probs, int t) {
		final double s = Algebra.normalize(probs);
		if(!Algebra.isPositiveFinite(s)) {
			myLogger.error("cannot normalise message at step "+t+", sum is "+s);
			throw new ZeroLikelihoodException(t, s);
		}
		return s;
	}
}
