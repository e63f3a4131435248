package mchmm.hmm.model;

import static mchmm.hmm.model.HmmFixtures.assertRowsSumToOne;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import mchmm.hmm.data.ObservationSequence;
import mchmm.util.Sampler;

public class ForwardBackwardTest {

	private static final double DELTA = 1e-4;

	/**
	 * Example taken from https://en.wikipedia.org/wiki/Forward%E2%80%93backward_algorithm.
	 */
	@Test
	public void testSmoothingUmbrellaExample() {
		final double[][] result = ForwardBackward.posterior(HmmFixtures.umbrella(), HmmFixtures.umbrellaDays());
		assertEquals(6, result.length);
		assertEquals(0.6469, result[0][0], DELTA);
		assertEquals(0.3531, result[0][1], DELTA);
		assertEquals(0.8673, result[1][0], DELTA);
		assertEquals(0.1327, result[1][1], DELTA);
		assertEquals(0.8204, result[2][0], DELTA);
		assertEquals(0.1796, result[2][1], DELTA);
		assertEquals(0.3075, result[3][0], DELTA);
		assertEquals(0.6925, result[3][1], DELTA);
		assertEquals(0.8204, result[4][0], DELTA);
		assertEquals(0.1796, result[4][1], DELTA);
		assertEquals(0.8673, result[5][0], DELTA);
		assertEquals(0.1327, result[5][1], DELTA);
	}

	@Test
	public void testFilteringUmbrellaExample() {
		final FBUnit fw = ForwardBackward.forward(HmmFixtures.umbrella(), HmmFixtures.umbrellaDays());
		assertEquals(5, fw.length());
		assertTrue(!fw.isBackward());
		final double[][] f = fw.probsMat();
		assertArrayEquals(new double[]{0.5, 0.5}, f[0], 0);
		assertEquals(0.8182, f[1][0], DELTA);
		assertEquals(0.8834, f[2][0], DELTA);
		assertEquals(0.1907, f[3][0], DELTA);
		assertEquals(0.7308, f[4][0], DELTA);
		assertEquals(0.8673, f[5][0], DELTA);
		assertRowsSumToOne(f);
		// the last filtering distribution is also the last smoothing distribution
		assertArrayEquals(f[5], ForwardBackward.posterior(HmmFixtures.umbrella(), HmmFixtures.umbrellaDays())[5], 1e-12);
	}

	@Test
	public void testObservationLogLikelihood() {
		final FBUnit fw = ForwardBackward.forward(HmmFixtures.umbrella(), HmmFixtures.umbrellaDays());
		final FBUnit bw = ForwardBackward.backward(HmmFixtures.umbrella(), HmmFixtures.umbrellaDays());
		assertEquals(-3.372502044332175, fw.probability(), 1e-12);
		assertEquals(fw.probability(), bw.probability(), 1e-12);
		assertEquals(0.0, fw.logscale()[0], 0);
		assertEquals(0.0, bw.logscale()[5], 0);
	}

	@Test
	public void testBackwardMessages() {
		final FBUnit bw = ForwardBackward.backward(HmmFixtures.umbrella(), HmmFixtures.umbrellaDays());
		assertTrue(bw.isBackward());
		final double[][] b = bw.probsMat();
		assertEquals(6, b.length);
		assertArrayEquals(new double[]{1.0, 1.0}, b[5], 0);
		for(int t=0; t<5; t++) {
			assertEquals(1.0, b[t][0]+b[t][1], 1e-12);
			assertTrue(b[t][0]>0 && b[t][1]>0);
		}
	}

	@Test
	public void testBeliefGrowsWithConsistentEvidence() {
		final ObservationSequence obs = ObservationSequence.ofSymbols(
				new int[]{0, 0, 0}, new int[]{0, 0, 0}, new int[]{0, 0, 0});
		final double[][] f = ForwardBackward.forward(HmmFixtures.sticky(), obs).probsMat();
		assertEquals(4, f.length);
		for(int t=1; t<f.length; t++)
			assertTrue(f[t][0]>=f[t-1][0]);
		assertTrue(f[3][0]>0.9);
		assertEquals(0.9, f[1][0], 1e-12);
		assertEquals(0.985207100591716, f[3][0], 1e-12);
	}

	@Test
	public void testEmptySequence() {
		final HiddenMarkovModel hmm = HmmFixtures.cycle();
		final ObservationSequence obs = ObservationSequence.empty();
		final FBUnit fw = ForwardBackward.forward(hmm, obs);
		final FBUnit bw = ForwardBackward.backward(hmm, obs);
		assertEquals(0, fw.length());
		assertArrayEquals(hmm.getInitial(), fw.probs(0), 0);
		assertArrayEquals(new double[]{1.0, 1.0, 1.0}, bw.probs(0), 0);
		assertEquals(0.0, fw.probability(), 0);
		assertEquals(0.0, bw.probability(), 1e-15);
		final double[][] posterior = ForwardBackward.smooth(fw, bw);
		assertEquals(1, posterior.length);
		assertArrayEquals(hmm.getInitial(), posterior[0], 1e-15);
	}

	@Test
	public void testSingleStateModel() {
		final HiddenMarkovModel hmm = HmmFixtures.singleState();
		final ObservationSequence obs = ObservationSequence.ofSymbols(
				new int[]{0, 1, 1, 0}, new int[]{0, 0, 0, 0}, new int[]{2, 0, 1, 2});
		final double[][] f = ForwardBackward.forward(hmm, obs).probsMat();
		final double[][] b = ForwardBackward.backward(hmm, obs).probsMat();
		final double[][] p = ForwardBackward.posterior(hmm, obs);
		for(int t=0; t<=4; t++) {
			assertArrayEquals(new double[]{1.0}, f[t], 1e-15);
			assertArrayEquals(new double[]{1.0}, b[t], 1e-15);
			assertArrayEquals(new double[]{1.0}, p[t], 1e-15);
		}
	}

	@Test
	public void testRowsSumToOneOnGeneratedData() {
		final HiddenMarkovModel[] models = new HiddenMarkovModel[]{
				HmmFixtures.umbrella(), HmmFixtures.cycle(), HmmFixtures.gaussian()};
		final Sampler sampler = new Sampler(2024L);
		for(HiddenMarkovModel hmm : models) {
			for(int length : new int[]{0, 1, 10, 500}) {
				final ObservationSequence obs = new SequenceGenerator(hmm, sampler).generate(length).observations();
				final FBUnit fw = ForwardBackward.forward(hmm, obs);
				final FBUnit bw = ForwardBackward.backward(hmm, obs);
				assertRowsSumToOne(fw.probsMat());
				assertRowsSumToOne(ForwardBackward.smooth(fw, bw));
				assertEquals(fw.probability(), bw.probability(), 1e-6*Math.max(1, Math.abs(fw.probability())));
			}
		}
	}

	@Test
	public void testLongSequenceDoesNotUnderflow() {
		final HiddenMarkovModel hmm = HmmFixtures.gaussian();
		final ObservationSequence obs = new SequenceGenerator(hmm, new Sampler(5L)).generate(20000).observations();
		final FBUnit fw = ForwardBackward.forward(hmm, obs);
		assertRowsSumToOne(fw.probsMat());
		assertTrue(fw.probability()<-1000);
		assertTrue(!Double.isInfinite(fw.probability()));
	}

	@Test
	public void testZeroLikelihoodObservation() {
		// symbol 1 on channel 3 is never emitted by state 0 and state 0 is the only reachable state
		final HiddenMarkovModel hmm = HiddenMarkovModel.categorical(
				new double[]{1.0, 0.0},
				new double[][]{{1.0, 0.0}, {0.5, 0.5}},
				new double[][]{{1.0, 1.0}},
				new double[][]{{1.0, 1.0}},
				new double[][]{{1.0, 0.0}, {0.0, 1.0}});
		final ObservationSequence obs = ObservationSequence.ofSymbols(
				new int[]{0, 0, 0}, new int[]{0, 0, 0}, new int[]{0, 1, 0});
		try {
			ForwardBackward.forward(hmm, obs);
			fail("expected ZeroLikelihoodException");
		} catch(ZeroLikelihoodException e) {
			assertEquals(1, e.getStep());
		}
		try {
			ForwardBackward.backward(hmm, obs);
			fail("expected ZeroLikelihoodException");
		} catch(ZeroLikelihoodException e) {
			assertEquals(0, e.getStep());
		}
	}

	@Test(expected = OutOfRangeSymbolException.class)
	public void testOutOfRangeSymbol() {
		ForwardBackward.forward(HmmFixtures.umbrella(), ObservationSequence.ofSymbols(
				new int[]{0, 2}, new int[]{0, 0}, new int[]{0, 0}));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testChannelCountMismatch() {
		ForwardBackward.forward(HmmFixtures.umbrella(), ObservationSequence.ofSymbols(
				new int[]{0, 1}, new int[]{0, 0}));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSmoothingNeedsMatchingMessages() {
		final HiddenMarkovModel hmm = HmmFixtures.umbrella();
		final FBUnit fw = ForwardBackward.forward(hmm, HmmFixtures.umbrellaDays());
		final FBUnit bw = ForwardBackward.backward(hmm, ObservationSequence.ofSymbols(
				new int[]{0}, new int[]{0}, new int[]{0}));
		ForwardBackward.smooth(fw, bw);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSmoothingNeedsForwardThenBackward() {
		final HiddenMarkovModel hmm = HmmFixtures.umbrella();
		final FBUnit fw = ForwardBackward.forward(hmm, HmmFixtures.umbrellaDays());
		final FBUnit bw = ForwardBackward.backward(hmm, HmmFixtures.umbrellaDays());
		ForwardBackward.smooth(bw, fw);
	}
}
