package com.github.micycle1.deblender.linalg;

import java.util.Arrays;
import java.util.List;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;
import org.ejml.sparse.csc.CommonOps_DSCC;

/**
 * Small set of sparse kernels over EJML's compressed sparse column matrices.
 * <p>
 * Products against plain {@code double[]} vectors are written directly against
 * the CSC arrays, so no {@code DMatrixRMaj} wrapping is needed on the hot path
 * of the gradient and forward-model loops.
 */
public final class SparseOps {

	private SparseOps() {
	}

	/** y = A x */
	public static double[] mult(DMatrixSparseCSC A, double[] x) {
		if (x.length != A.numCols) {
			throw new IllegalArgumentException("Vector length " + x.length + " does not match operator columns " + A.numCols);
		}
		double[] y = new double[A.numRows];
		final int[] cp = A.col_idx;
		final int[] ri = A.nz_rows;
		final double[] a = A.nz_values;
		for (int j = 0; j < A.numCols; j++) {
			double xj = x[j];
			if (xj == 0.0) {
				continue;
			}
			for (int p = cp[j], pe = cp[j + 1]; p < pe; p++) {
				y[ri[p]] += a[p] * xj;
			}
		}
		return y;
	}

	/** y = A^T x */
	public static double[] multTransA(DMatrixSparseCSC A, double[] x) {
		if (x.length != A.numRows) {
			throw new IllegalArgumentException("Vector length " + x.length + " does not match operator rows " + A.numRows);
		}
		double[] y = new double[A.numCols];
		final int[] cp = A.col_idx;
		final int[] ri = A.nz_rows;
		final double[] a = A.nz_values;
		for (int j = 0; j < A.numCols; j++) {
			double sum = 0.0;
			for (int p = cp[j], pe = cp[j + 1]; p < pe; p++) {
				sum += a[p] * x[ri[p]];
			}
			y[j] = sum;
		}
		return y;
	}

	/**
	 * Left-to-right product of the given operators, i.e.
	 * {@code compose(A, B, C) = A·B·C}.
	 */
	public static DMatrixSparseCSC compose(DMatrixSparseCSC... ops) {
		if (ops.length == 0) {
			throw new IllegalArgumentException("Nothing to compose");
		}
		DMatrixSparseCSC out = ops[ops.length - 1];
		for (int i = ops.length - 2; i >= 0; i--) {
			out = CommonOps_DSCC.mult(ops[i], out, (DMatrixSparseCSC) null);
		}
		return out;
	}

	public static DMatrixSparseCSC identity(int n) {
		return CommonOps_DSCC.identity(n);
	}

	public static DMatrixSparseCSC zero(int n) {
		return new DMatrixSparseCSC(n, n, 0);
	}

	/**
	 * Block-diagonal concatenation. Blocks may be rectangular; block i occupies
	 * the rows and columns following block i-1.
	 */
	public static DMatrixSparseCSC blockDiagonal(List<DMatrixSparseCSC> blocks) {
		int rows = 0, cols = 0, nnz = 0;
		for (DMatrixSparseCSC b : blocks) {
			rows += b.numRows;
			cols += b.numCols;
			nnz += b.nz_length;
		}
		DMatrixSparseTriplet tr = new DMatrixSparseTriplet(rows, cols, Math.max(1, nnz));
		int r0 = 0, c0 = 0;
		for (DMatrixSparseCSC b : blocks) {
			for (int j = 0; j < b.numCols; j++) {
				for (int p = b.col_idx[j], pe = b.col_idx[j + 1]; p < pe; p++) {
					tr.addItem(r0 + b.nz_rows[p], c0 + j, b.nz_values[p]);
				}
			}
			r0 += b.numRows;
			c0 += b.numCols;
		}
		return DConvertMatrixStruct.convert(tr, (DMatrixSparseCSC) null);
	}

	/**
	 * Dense row view of a sparse matrix. Only meant for the small operators fed to
	 * the cone projection.
	 */
	public static double[][] toDenseRows(DMatrixSparseCSC A) {
		double[][] rows = new double[A.numRows][A.numCols];
		for (int j = 0; j < A.numCols; j++) {
			for (int p = A.col_idx[j], pe = A.col_idx[j + 1]; p < pe; p++) {
				rows[A.nz_rows[p]][j] += A.nz_values[p];
			}
		}
		return rows;
	}

	/**
	 * Power iteration on A^T A, returning an estimate of the spectral norm of A.
	 * An all-zero operator has norm 0.
	 */
	public static double spectralNorm(DMatrixSparseCSC A, int maxIters, double tol) {
		if (A.nz_length == 0) {
			return 0.0;
		}
		double[] x = new double[A.numCols];
		Arrays.fill(x, 1.0 / Math.sqrt(A.numCols));
		double sigma2 = 0.0;
		for (int it = 0; it < maxIters; it++) {
			double[] y = multTransA(A, mult(A, x));
			double nrm = norm2(y);
			if (nrm == 0.0) {
				// start vector in the null space; retry with a non-uniform one
				for (int i = 0; i < x.length; i++) {
					x[i] = (i % 2 == 0 ? 1.0 : -0.5) * (1.0 + i);
				}
				scale(x, 1.0 / norm2(x));
				continue;
			}
			scale(y, 1.0 / nrm);
			x = y;
			if (Math.abs(nrm - sigma2) <= tol * nrm) {
				sigma2 = nrm;
				break;
			}
			sigma2 = nrm;
		}
		return Math.sqrt(sigma2);
	}

	static double dot(double[] a, double[] b) {
		double s = 0.0;
		for (int i = 0; i < a.length; i++) {
			s += a[i] * b[i];
		}
		return s;
	}

	static double norm2(double[] a) {
		return Math.sqrt(dot(a, a));
	}

	private static void scale(double[] a, double f) {
		for (int i = 0; i < a.length; i++) {
			a[i] *= f;
		}
	}
}
