package com.github.micycle1.deblender.optimize;

import com.github.micycle1.deblender.Factor;
import com.github.micycle1.deblender.linalg.DenseNorms;

/**
 * Steps from the Lipschitz constant of the data-term gradient:
 * {@code step_A = slack / (wMax ||S||²)} and
 * {@code step_S = slack / (wMax ||A||²)}, with spectral norms. A zero factor
 * yields {@code slack / wMax}.
 */
public class LipschitzStepPolicy implements StepSizePolicy {

	public static final double DEFAULT_SLACK = 0.9;

	private final double wMax;
	private final double slack;

	/**
	 * @param wMax  largest pixel weight (1 for unweighted data)
	 * @param slack fraction of the maximal step, in (0, 1]
	 */
	public LipschitzStepPolicy(double wMax, double slack) {
		if (!(wMax > 0) || !Double.isFinite(wMax)) {
			throw new IllegalArgumentException("Maximum weight must be positive and finite but was " + wMax);
		}
		if (!(slack > 0) || slack > 1) {
			throw new IllegalArgumentException("Slack must lie in (0, 1] but was " + slack);
		}
		this.wMax = wMax;
		this.slack = slack;
	}

	@Override
	public double step(Factor which, double[][] a, double[][] s) {
		double norm2 = DenseNorms.squaredSpectralNorm(which == Factor.A ? s : a);
		if (norm2 == 0) {
			return slack / wMax;
		}
		return slack / (wMax * norm2);
	}

	public double getWMax() {
		return wMax;
	}

	public double getSlack() {
		return slack;
	}

	@Override
	public String toString() {
		return "LipschitzStepPolicy[wMax=" + wMax + ", slack=" + slack + "]";
	}
}
