package com.github.micycle1.deblender.prox;

/**
 * Keeps every column of a B x K spectral matrix on the unit simplex: negative
 * entries are clipped to zero and each column is rescaled to sum to one. A
 * column with no positive entry becomes uniform.
 * <p>
 * Rescaling (rather than the Euclidean simplex projection) preserves the
 * band ratios of a sampled spectrum.
 */
public final class UnitSimplexProximal implements ProximalOperator {

	public static final UnitSimplexProximal INSTANCE = new UnitSimplexProximal();

	private UnitSimplexProximal() {
	}

	@Override
	public double[][] apply(double[][] x, double step) {
		final int rows = x.length;
		if (rows == 0) {
			return new double[0][];
		}
		final int cols = x[0].length;
		double[][] out = new double[rows][cols];
		for (int k = 0; k < cols; k++) {
			double sum = 0;
			for (int b = 0; b < rows; b++) {
				double v = x[b][k] > 0 ? x[b][k] : 0.0;
				out[b][k] = v;
				sum += v;
			}
			for (int b = 0; b < rows; b++) {
				out[b][k] = sum > 0 ? out[b][k] / sum : 1.0 / rows;
			}
		}
		return out;
	}

	@Override
	public String toString() {
		return "UnitSimplexProximal";
	}
}
