package com.github.micycle1.deblender;

/**
 * Predicts the band stack from the two factors.
 * <p>
 * The whole-blend model is {@code model[b] = Σ_k A[b][k] · Γ[k][b] · S[k]}.
 * With translation disabled it reduces to the dense product {@code A · S},
 * convolved band-wise by the PSF when there is one. The single-component model
 * restricts the same computation to one k, so summing it over every component
 * reproduces the whole-blend model.
 */
public final class ForwardModel {

	private ForwardModel() {
	}

	/**
	 * @param a        B x K spectral factor
	 * @param s        K x n morphology factor
	 * @param transfer transfer operators; null means no translation and no PSF
	 * @return B x n model
	 */
	public static double[][] model(double[][] a, double[][] s, TransferOperators transfer) {
		final int bands = a.length;
		final int k = s.length;
		checkFactors(a, s);
		checkBands(transfer, bands);
		final int n = k == 0 ? 0 : s[0].length;

		if (transfer == null || transfer.isTranslationDisabled()) {
			double[][] model = new double[bands][n];
			for (int b = 0; b < bands; b++) {
				double[] mb = model[b];
				for (int pk = 0; pk < k; pk++) {
					double w = a[b][pk];
					if (w == 0) {
						continue;
					}
					double[] sk = s[pk];
					for (int i = 0; i < n; i++) {
						mb[i] += w * sk[i];
					}
				}
			}
			if (transfer != null && transfer.getPsf() != null) {
				model = transfer.getPsf().convolve(model);
			}
			return model;
		}

		checkComponents(transfer, k);
		double[][] model = new double[bands][n];
		for (int pk = 0; pk < k; pk++) {
			accumulate(model, a, s, transfer, pk);
		}
		return model;
	}

	/** Whole-blend model reshaped to B x rows x cols. */
	public static double[][][] model(double[][] a, double[][] s, TransferOperators transfer, int rows, int cols) {
		return ImageShapes.unflatten(model(a, s, transfer), rows, cols);
	}

	/** Whole-blend model for a morphology given as K x rows x cols. */
	public static double[][] model(double[][] a, double[][][] s, TransferOperators transfer) {
		return model(a, ImageShapes.flatten(s), transfer);
	}

	/**
	 * Model of component {@code k} alone.
	 *
	 * @return B x n model
	 */
	public static double[][] componentModel(double[][] a, double[][] s, TransferOperators transfer, int k) {
		checkFactors(a, s);
		if (k < 0 || k >= s.length) {
			throw new IllegalArgumentException("Component " + k + " out of range [0, " + s.length + ")");
		}
		final int bands = a.length;
		checkBands(transfer, bands);
		final int n = s[k].length;
		double[][] model = new double[bands][n];

		if (transfer == null || transfer.isTranslationDisabled()) {
			for (int b = 0; b < bands; b++) {
				double w = a[b][k];
				for (int i = 0; i < n; i++) {
					model[b][i] = w * s[k][i];
				}
			}
			if (transfer != null && transfer.getPsf() != null) {
				model = transfer.getPsf().convolve(model);
			}
			return model;
		}

		checkComponents(transfer, s.length);
		accumulate(model, a, s, transfer, k);
		return model;
	}

	public static double[][][] componentModel(double[][] a, double[][] s, TransferOperators transfer, int k, int rows, int cols) {
		return ImageShapes.unflatten(componentModel(a, s, transfer, k), rows, cols);
	}

	public static double[][] componentModel(double[][] a, double[][][] s, TransferOperators transfer, int k) {
		return componentModel(a, ImageShapes.flatten(s), transfer, k);
	}

	// model[b] += A[b][k] * Γ[k][b] S[k]
	private static void accumulate(double[][] model, double[][] a, double[][] s, TransferOperators transfer, int k) {
		double[] gs = null;
		for (int b = 0; b < model.length; b++) {
			if (gs == null || !transfer.sharesPreviousBand(k, b)) {
				gs = transfer.apply(k, b, s[k]);
			}
			double w = a[b][k];
			double[] mb = model[b];
			for (int i = 0; i < mb.length; i++) {
				mb[i] += w * gs[i];
			}
		}
	}

	private static void checkFactors(double[][] a, double[][] s) {
		for (double[] row : a) {
			if (row.length != s.length) {
				throw new IllegalArgumentException("A has " + row.length + " components but S has " + s.length);
			}
		}
	}

	private static void checkBands(TransferOperators transfer, int bands) {
		if (transfer != null && transfer.getBandCount() != bands) {
			throw new IllegalArgumentException("Transfer operators cover " + transfer.getBandCount() + " bands but A has " + bands);
		}
	}

	private static void checkComponents(TransferOperators transfer, int k) {
		if (transfer.getComponentCount() != k) {
			throw new IllegalArgumentException("Transfer operators cover " + transfer.getComponentCount() + " components but S has " + k);
		}
	}
}
