package com.github.micycle1.deblender.prox;

/** Projection onto {0}; used for equality constraints such as symmetry. */
public final class ZeroProjection implements ProximalOperator {

	public static final ZeroProjection INSTANCE = new ZeroProjection();

	private ZeroProjection() {
	}

	@Override
	public double[][] apply(double[][] x, double step) {
		double[][] out = new double[x.length][];
		for (int i = 0; i < x.length; i++) {
			out[i] = new double[x[i].length];
		}
		return out;
	}

	@Override
	public String toString() {
		return "ZeroProjection";
	}
}
