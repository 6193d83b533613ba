package com.github.micycle1.deblender.linalg;

import org.ejml.data.DMatrixSparseCSC;

/**
 * Applies one sparse operator to the row-major flattening of a K x n factor
 * matrix, and returns the result folded back into K rows. A block-diagonal
 * operator with one n x n block per row therefore acts on each row separately.
 */
public final class RowStackedOperator {

	private final DMatrixSparseCSC op;
	private final int blockCount;
	private double norm = -1; // lazily estimated

	public RowStackedOperator(DMatrixSparseCSC op, int blockCount) {
		if (blockCount <= 0 || op.numCols % blockCount != 0 || op.numRows % blockCount != 0) {
			throw new IllegalArgumentException(
					"Operator " + op.numRows + "x" + op.numCols + " cannot be split into " + blockCount + " row blocks");
		}
		this.op = op;
		this.blockCount = blockCount;
	}

	public DMatrixSparseCSC getMatrix() {
		return op;
	}

	public int getBlockCount() {
		return blockCount;
	}

	/** L x, with x given as K rows. */
	public double[][] apply(double[][] x) {
		return fold(SparseOps.mult(op, flatten(x, op.numCols)), op.numRows);
	}

	/** L^T y, with y given as K rows. */
	public double[][] applyTranspose(double[][] y) {
		return fold(SparseOps.multTransA(op, flatten(y, op.numRows)), op.numCols);
	}

	/** Spectral norm of the operator, estimated once by power iteration. */
	public double spectralNorm() {
		if (norm < 0) {
			norm = SparseOps.spectralNorm(op, 200, 1e-8);
		}
		return norm;
	}

	private double[] flatten(double[][] x, int expected) {
		if (x.length != blockCount) {
			throw new IllegalArgumentException("Expected " + blockCount + " rows but got " + x.length);
		}
		int width = expected / blockCount;
		double[] flat = new double[expected];
		for (int k = 0; k < blockCount; k++) {
			if (x[k].length != width) {
				throw new IllegalArgumentException("Row " + k + " has length " + x[k].length + ", expected " + width);
			}
			System.arraycopy(x[k], 0, flat, k * width, width);
		}
		return flat;
	}

	private double[][] fold(double[] flat, int total) {
		int width = total / blockCount;
		double[][] out = new double[blockCount][width];
		for (int k = 0; k < blockCount; k++) {
			System.arraycopy(flat, k * width, out[k], 0, width);
		}
		return out;
	}

	@Override
	public String toString() {
		return "RowStackedOperator{" + op.numRows + "x" + op.numCols + ", blocks=" + blockCount + ", nnz=" + op.nz_length + "}";
	}
}
