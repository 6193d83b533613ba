package com.github.micycle1.deblender.prox;

/**
 * L1 sparsity with non-negativity: {@code max(x - threshold * step, 0)}.
 */
public final class SoftThresholdPlus implements ProximalOperator {

	private final double threshold;

	public SoftThresholdPlus(double threshold) {
		if (threshold < 0) {
			throw new IllegalArgumentException("L1 threshold must be non-negative, got " + threshold);
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
				o[j] = Math.max(row[j] - t, 0.0);
			}
			out[i] = o;
		}
		return out;
	}

	@Override
	public String toString() {
		return "SoftThresholdPlus[" + threshold + "]";
	}
}
