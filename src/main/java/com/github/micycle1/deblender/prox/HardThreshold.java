package com.github.micycle1.deblender.prox;

/**
 * L0 sparsity: entries whose magnitude is below {@code threshold * step} are
 * set to zero, and the result is kept non-negative.
 */
public final class HardThreshold implements ProximalOperator {

	private final double threshold;

	public HardThreshold(double threshold) {
		if (threshold < 0) {
			throw new IllegalArgumentException("L0 threshold must be non-negative, got " + threshold);
		}
		this.threshold = threshold;
	}

	public double getThreshold() {
		return threshold;
	}

	@Override
	public double[][] apply(double[][] x, double step) {
		final double t = threshold * step;
		double[][] out = new double[x.length][];
		for (int i = 0; i < x.length; i++) {
			double[] row = x[i];
			double[] o = new double[row.length];
			for (int j = 0; j < row.length; j++) {
				double v = row[j];
				o[j] = (Math.abs(v) < t || v < 0) ? 0.0 : v;
			}
			out[i] = o;
		}
		return out;
	}

	@Override
	public String toString() {
		return "HardThreshold[" + threshold + "]";
	}
}
