package com.github.micycle1.deblender;

import java.util.Objects;

import com.github.micycle1.deblender.prox.ProximalOperator;

/**
 * The objective step handed to the optimization runtime: a gradient step on
 * the data term followed by the factor's proximal operator,
 * {@code prox(X - step · ∇X, step)}.
 * <p>
 * The observation, weights, transfer operators and the two proximal operators
 * are fixed at construction. Each call returns a new factor; neither input is
 * modified.
 */
public final class ProximalGradientStep {

	private final double[][] data;
	private final double[][] weights;
	private final TransferOperators transfer;
	private final ProximalOperator proxA;
	private final ProximalOperator proxS;

	public ProximalGradientStep(double[][] data, double[][] weights, TransferOperators transfer, ProximalOperator proxA,
			ProximalOperator proxS) {
		this.data = Objects.requireNonNull(data, "data must not be null");
		this.weights = weights;
		this.transfer = transfer;
		this.proxA = Objects.requireNonNull(proxA, "proxA must not be null");
		this.proxS = Objects.requireNonNull(proxS, "proxS must not be null");
	}

	/**
	 * @param x     current value of the factor being updated
	 * @param step  step size chosen by the runtime
	 * @param which the factor {@code x} stands for
	 * @param other current value of the other factor
	 * @return the updated factor
	 */
	public double[][] update(double[][] x, double step, Factor which, double[][] other) {
		final double[][] a = which == Factor.A ? x : other;
		final double[][] s = which == Factor.S ? x : other;
		double[][] grad = GradientEngine.gradient(which, a, s, data, weights, transfer);
		double[][] candidate = new double[x.length][];
		for (int i = 0; i < x.length; i++) {
			double[] xi = x[i];
			double[] gi = grad[i];
			double[] ci = new double[xi.length];
			for (int j = 0; j < xi.length; j++) {
				ci[j] = xi[j] - step * gi[j];
			}
			candidate[i] = ci;
		}
		return proximal(which).apply(candidate, step);
	}

	public ProximalOperator proximal(Factor which) {
		return which == Factor.A ? proxA : proxS;
	}

	public TransferOperators getTransfer() {
		return transfer;
	}

	public double[][] getData() {
		return data;
	}

	public double[][] getWeights() {
		return weights;
	}
}
