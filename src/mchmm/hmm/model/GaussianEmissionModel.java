package mchmm.hmm.model;

import org.apache.commons.math3.distribution.NormalDistribution;

import mchmm.util.Sampler;

/**
 * Continuous emissions. The table of channel k is 2 x N, holding the mean (row 0)
 * and the standard deviation (row 1) of a normal density per state.
 */
public class GaussianEmissionModel extends EmissionModel {

	private final NormalDistribution[][] densities; // [C][N]

	public GaussianEmissionModel(double[][]... B) {
		super(B);
		this.densities = new NormalDistribution[C][N];
		for(int c=0; c<C; c++) {
			if(this.B[c].length!=2)
				throw new MalformedModelException("emission table of channel "+c+" has "+this.B[c].length+
						" rows, expected 2 (mean, standard deviation).");
			for(int j=0; j<N; j++) {
				if(this.B[c][1][j]<=0)
					throw new MalformedModelException("standard deviation of channel "+c+", state "+j+
							" is "+this.B[c][1][j]+", must be positive.");
				// no generator, densities are only evaluated
				densities[c][j] = new NormalDistribution(null, this.B[c][0][j], this.B[c][1][j],
						NormalDistribution.DEFAULT_INVERSE_ABSOLUTE_ACCURACY);
			}
		}
		myLogger.debug("gaussian emissions: "+C+" channels, "+N+" states");
	}

	@Override
	protected void validate(double tolerance) {
		// all constraints are checked on construction
	}

	@Override
	protected void multiply(int channel, double x, double[] emiss) {
		final NormalDistribution[] d = densities[channel];
		for(int j=0; j<N; j++)
			emiss[j] *= d[j].density(x);
	}

	@Override
	public double sample(int channel, int state, Sampler sampler) {
		return sampler.gaussian(mean(channel, state), sd(channel, state));
	}

	@Override
	public String family() {
		return "gaussian";
	}

	public double mean(int channel, int state) {
		return B[channel][0][state];
	}

	public double sd(int channel, int state) {
		return B[channel][1][state];
	}
}
