package com.github.micycle1.deblender;

/**
 * Gradient of the weighted data term
 * {@code ½ Σ_b Σ_i W[b][i] (model[b][i] - Y[b][i])²} with respect to either
 * factor, where the model is built exactly as in {@link ForwardModel}.
 */
public final class GradientEngine {

	private GradientEngine() {
	}

	/**
	 * @param target   which factor to differentiate against
	 * @param a        B x K spectral factor
	 * @param s        K x n morphology factor
	 * @param data     B x n observation (sky already subtracted)
	 * @param weights  B x n per-pixel weights, or null for unit weights
	 * @param transfer transfer operators (null means identity transfer)
	 * @return B x K when {@code target} is A, K x n when it is S
	 */
	public static double[][] gradient(Factor target, double[][] a, double[][] s, double[][] data, double[][] weights,
			TransferOperators transfer) {
		if (target == null) {
			throw new IllegalArgumentException("Expected either 'A' or 'S' as gradient target");
		}
		final int bands = a.length;
		final int k = s.length;
		final int n = k == 0 ? data[0].length : s[0].length;
		if (data.length != bands || data[0].length != n) {
			throw new IllegalArgumentException("Data is " + data.length + "x" + data[0].length + " but the model is " + bands + "x" + n);
		}
		if (weights != null && (weights.length != bands || weights[0].length != n)) {
			throw new IllegalArgumentException("Weights are " + weights.length + "x" + weights[0].length + " but the model is " + bands + "x" + n);
		}

		if (transfer != null && transfer.getComponentCount() >= 0 && transfer.getComponentCount() != k) {
			throw new IllegalArgumentException("Transfer operators cover " + transfer.getComponentCount() + " components but S has " + k);
		}

		// transferred morphologies, reused by the A gradient
		double[][][] gs = new double[k][bands][];
		double[][] model = new double[bands][n];
		for (int pk = 0; pk < k; pk++) {
			for (int b = 0; b < bands; b++) {
				gs[pk][b] = transfer == null ? s[pk]
						: (b > 0 && transfer.sharesPreviousBand(pk, b)) ? gs[pk][b - 1] : transfer.apply(pk, b, s[pk]);
				double w = a[b][pk];
				double[] g = gs[pk][b];
				double[] mb = model[b];
				for (int i = 0; i < n; i++) {
					mb[i] += w * g[i];
				}
			}
		}

		// weighted residual, in place
		for (int b = 0; b < bands; b++) {
			double[] mb = model[b];
			double[] yb = data[b];
			double[] wb = weights == null ? null : weights[b];
			for (int i = 0; i < n; i++) {
				double d = mb[i] - yb[i];
				mb[i] = wb == null ? d : wb[i] * d;
			}
		}
		final double[][] diff = model;

		switch (target) {
			case A: {
				double[][] result = new double[bands][k];
				for (int pk = 0; pk < k; pk++) {
					for (int b = 0; b < bands; b++) {
						double[] g = gs[pk][b];
						double[] db = diff[b];
						double sum = 0;
						for (int i = 0; i < n; i++) {
							sum += db[i] * g[i];
						}
						result[b][pk] = sum;
					}
				}
				return result;
			}
			case S: {
				double[][] result = new double[k][n];
				for (int pk = 0; pk < k; pk++) {
					double[] rk = result[pk];
					for (int b = 0; b < bands; b++) {
						double w = a[b][pk];
						if (w == 0) {
							continue;
						}
						double[] back = transfer == null ? diff[b] : transfer.applyTranspose(pk, b, diff[b]);
						for (int i = 0; i < n; i++) {
							rk[i] += w * back[i];
						}
					}
				}
				return result;
			}
			default:
				throw new IllegalArgumentException("Expected either 'A' or 'S' as gradient target but received " + target);
		}
	}

	/** Symbol-based variant; only "A" and "S" are accepted. */
	public static double[][] gradient(String target, double[][] a, double[][] s, double[][] data, double[][] weights,
			TransferOperators transfer) {
		return gradient(Factor.fromSymbol(target), a, s, data, weights, transfer);
	}
}
