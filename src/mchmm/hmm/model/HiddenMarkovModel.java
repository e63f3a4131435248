package mchmm.hmm.model;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import mchmm.hmm.data.ObservationSequence;
import mchmm.util.Algebra;
import mchmm.util.Constants;

/**
 * Immutable parameters of a discrete-time hidden Markov model: the initial state
 * distribution pi, the row-stochastic transition matrix A with
 * A[i][j] = p(next state j | current state i), and one emission family shared by
 * all observation channels. All tables are validated on construction, so the
 * inference routines never re-check them. Instances are safe to share across
 * threads.
 */
public final class HiddenMarkovModel {
	private final static Logger myLogger = Logger.getLogger(HiddenMarkovModel.class);

	private final int N; // #states
	private final double[] pi;
	private final double[][] A;
	private final EmissionModel emission;

	public HiddenMarkovModel(double[] pi,
			double[][] A,
			EmissionModel emission,
			double tolerance) {
		if(pi==null) throw new NullPointerException("pi must not be null.");
		if(A==null) throw new NullPointerException("A must not be null.");
		if(emission==null) throw new NullPointerException("emission must not be null.");
		this.N = pi.length;
		this.pi = pi.clone();
		this.A = Algebra.copyOf(A);
		this.emission = emission;
		this.validate(tolerance);
		myLogger.debug("hmm: "+N+" states, "+emission.numChannels()+
				" "+emission.family()+" channels");
	}

	public HiddenMarkovModel(double[] pi,
			double[][] A,
			EmissionModel emission) {
		this(pi, A, emission, Constants.PROB_TOLERANCE);
	}

	/**
	 * @param B1 numSymbols x N column-stochastic table of channel 1, likewise B2 and B3
	 */
	public static HiddenMarkovModel categorical(double[] pi,
			double[][] A,
			double[][] B1,
			double[][] B2,
			double[][] B3) {
		return new HiddenMarkovModel(pi, A, new CategoricalEmissionModel(B1, B2, B3));
	}

	/**
	 * @param B1 2 x N table of channel 1 holding per-state means and standard deviations,
	 * likewise B2 and B3
	 */
	public static HiddenMarkovModel gaussian(double[] pi,
			double[][] A,
			double[][] B1,
			double[][] B2,
			double[][] B3) {
		return new HiddenMarkovModel(pi, A, new GaussianEmissionModel(B1, B2, B3));
	}

	private void validate(double tolerance) {
		if(N==0) throw new MalformedModelException("model has no states.");
		checkDistribution(pi, tolerance, "initial distribution");
		if(A.length!=N)
			throw new MalformedModelException("transition matrix should have "+N+" rows, one per state, "
					+ "but has "+A.length+".");
		for(int i=0; i<N; i++) {
			if(A[i]==null || A[i].length!=N)
				throw new MalformedModelException("row "+i+" of the transition matrix should have "+N+" columns.");
			checkDistribution(A[i], tolerance, "row "+i+" of the transition matrix");
		}
		if(emission.numStates()!=N)
			throw new MalformedModelException("emission tables have "+emission.numStates()+
					" states but the initial distribution has "+N+".");
		emission.validate(tolerance);
	}

	private static void checkDistribution(double[] dist, double tolerance, String what) {
		for(int i=0; i<dist.length; i++) {
			if(!(dist[i]>=0) || Double.isInfinite(dist[i]))
				throw new MalformedModelException(what+" has an invalid probability "+dist[i]+" at "+i+".");
		}
		if(!Algebra.sumsToOne(dist, tolerance))
			throw new MalformedModelException(what+" does not sum to 1.");
	}

	/**
	 * @return likelihood of the observation vector at step t under each state
	 */
	public double[] likelihood(ObservationSequence obs, int t) {
		return emission.likelihood(obs.get(t));
	}

	void checkChannels(ObservationSequence obs) {
		if(obs==null) throw new NullPointerException("observations must not be null.");
		if(obs.numChannels()!=emission.numChannels())
			throw new IllegalArgumentException("observations have "+obs.numChannels()+
					" channels but the model has "+emission.numChannels()+".");
	}

	public int numStates() {
		return N;
	}

	public int numChannels() {
		return emission.numChannels();
	}

	public double[] getInitial() {
		return pi.clone();
	}

	public double[][] getTransition() {
		return Algebra.copyOf(A);
	}

	public EmissionModel getEmission() {
		return emission;
	}

	double pi(int i) {
		return pi[i];
	}

	double[] pi() {
		return pi;
	}

	double a(int i, int j) {
		return A[i][j];
	}

	double[] a(int i) {
		return A[i];
	}

	public void print() {
		StringBuilder sb = new StringBuilder();
		sb.append("\ninitial\n ").append(StringUtils.join(ArrayUtils.toObject(pi), '\t')).append("\n");
		sb.append("transition\n");
		for(int i=0; i<N; i++)
			sb.append(" ").append(StringUtils.join(ArrayUtils.toObject(A[i]), '\t')).append("\n");
		sb.append(emission.print());
		myLogger.info(sb.toString());
	}
}
