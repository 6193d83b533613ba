package com.github.micycle1.deblender.linalg;

import org.ojalgo.matrix.decomposition.SingularValue;
import org.ojalgo.matrix.store.R064Store;

/**
 * Norms of the dense factor matrices.
 */
public final class DenseNorms {

	private DenseNorms() {
	}

	/**
	 * Largest singular value of a (small) dense matrix, via ojAlgo's SVD. The
	 * factor matrices are at most (K+G) x (N*M), so the decomposition runs on the
	 * narrow side.
	 */
	public static double spectralNorm(double[][] m) {
		if (m.length == 0 || m[0].length == 0) {
			return 0.0;
		}
		final int rows = m.length;
		final int cols = m[0].length;
		final R064Store store = R064Store.FACTORY.make(rows, cols);
		for (int i = 0; i < rows; i++) {
			for (int j = 0; j < cols; j++) {
				store.set(i, j, m[i][j]);
			}
		}
		final SingularValue<Double> svd = SingularValue.R064.make(store);
		if (!svd.decompose(store)) {
			throw new IllegalStateException("Failed to decompose " + rows + "x" + cols + " matrix");
		}
		return svd.getOperatorNorm();
	}

	/**
	 * Square of the spectral norm, taken from the Gram matrix on the narrow side
	 * ({@code m m^T} or {@code m^T m}, whichever is smaller).
	 */
	public static double squaredSpectralNorm(double[][] m) {
		if (m.length == 0 || m[0].length == 0) {
			return 0.0;
		}
		return spectralNorm(m.length <= m[0].length ? gram(m) : gram(transpose(m)));
	}

	/** m m^T */
	public static double[][] gram(double[][] m) {
		final int rows = m.length;
		double[][] g = new double[rows][rows];
		for (int i = 0; i < rows; i++) {
			for (int j = i; j < rows; j++) {
				double s = 0.0;
				double[] a = m[i], b = m[j];
				for (int c = 0; c < a.length; c++) {
					s += a[c] * b[c];
				}
				g[i][j] = s;
				g[j][i] = s;
			}
		}
		return g;
	}

	public static double[][] transpose(double[][] m) {
		if (m.length == 0) {
			return new double[0][0];
		}
		double[][] t = new double[m[0].length][m.length];
		for (int i = 0; i < m.length; i++) {
			for (int j = 0; j < m[i].length; j++) {
				t[j][i] = m[i][j];
			}
		}
		return t;
	}

	public static boolean isFinite(double[][] m) {
		for (double[] row : m) {
			for (double v : row) {
				if (!Double.isFinite(v)) {
					return false;
				}
			}
		}
		return true;
	}

	public static double frobenius(double[][] m) {
		double s = 0.0;
		for (double[] row : m) {
			for (double v : row) {
				s += v * v;
			}
		}
		return Math.sqrt(s);
	}

	/** ||a - b||_F */
	public static double frobeniusDistance(double[][] a, double[][] b) {
		double s = 0.0;
		for (int i = 0; i < a.length; i++) {
			for (int j = 0; j < a[i].length; j++) {
				double d = a[i][j] - b[i][j];
				s += d * d;
			}
		}
		return Math.sqrt(s);
	}

	public static double[][] copy(double[][] m) {
		double[][] c = new double[m.length][];
		for (int i = 0; i < m.length; i++) {
			c[i] = m[i].clone();
		}
		return c;
	}
}
