package com.github.micycle1.deblender.prox;

/** Projection onto the non-negative orthant. */
public final class PositiveProjection implements ProximalOperator {

	public static final PositiveProjection INSTANCE = new PositiveProjection();

	private PositiveProjection() {
	}

	@Override
	public double[][] apply(double[][] x, double step) {
		double[][] out = new double[x.length][];
		for (int i = 0; i < x.length; i++) {
			double[] row = x[i];
			double[] o = new double[row.length];
			for (int j = 0; j < row.length; j++) {
				o[j] = row[j] > 0 ? row[j] : 0.0;
			}
			out[i] = o;
		}
		return out;
	}

	@Override
	public String toString() {
		return "PositiveProjection";
	}
}
