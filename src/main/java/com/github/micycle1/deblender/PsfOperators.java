package com.github.micycle1.deblender;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.ejml.data.DMatrixSparseCSC;

import com.github.micycle1.deblender.linalg.SparseOps;
import com.github.micycle1.deblender.operators.OperatorFactory;

/**
 * PSF convolution operators, either one shared by every band or one per band.
 */
public final class PsfOperators {

	private final DMatrixSparseCSC shared;
	private final List<DMatrixSparseCSC> perBand;

	private PsfOperators(DMatrixSparseCSC shared, List<DMatrixSparseCSC> perBand) {
		this.shared = shared;
		this.perBand = perBand;
	}

	public static PsfOperators shared(DMatrixSparseCSC op) {
		return new PsfOperators(op, null);
	}

	public static PsfOperators perBand(List<DMatrixSparseCSC> ops) {
		if (ops.isEmpty()) {
			throw new IllegalArgumentException("Per-band PSF needs at least one band");
		}
		return new PsfOperators(null, Collections.unmodifiableList(new ArrayList<>(ops)));
	}

	/**
	 * One operator built from a single kernel, reused for every band.
	 */
	public static PsfOperators adapt(double[][] kernel, int rows, int cols, double threshold, OperatorFactory factory) {
		return shared(factory.psf(kernel, rows, cols, threshold));
	}

	/**
	 * One operator per band, each thresholded at {@code threshold}.
	 */
	public static PsfOperators adaptPerBand(double[][][] kernels, int bands, int rows, int cols, double threshold, OperatorFactory factory) {
		if (kernels.length != bands) {
			throw new IllegalArgumentException("Expected a PSF for each of the " + bands + " bands but got " + kernels.length);
		}
		List<DMatrixSparseCSC> ops = new ArrayList<>(bands);
		for (int b = 0; b < bands; b++) {
			ops.add(factory.psf(kernels[b], rows, cols, threshold));
		}
		return perBand(ops);
	}

	public boolean isShared() {
		return shared != null;
	}

	public DMatrixSparseCSC forBand(int band) {
		return shared != null ? shared : perBand.get(band);
	}

	/** Number of distinct operators (1 when shared). */
	public int size() {
		return shared != null ? 1 : perBand.size();
	}

	/** Convolves every band of a B x n image stack with its PSF. */
	public double[][] convolve(double[][] bands) {
		if (shared == null && bands.length != perBand.size()) {
			throw new IllegalArgumentException("Expected " + perBand.size() + " bands but got " + bands.length);
		}
		double[][] out = new double[bands.length][];
		for (int b = 0; b < bands.length; b++) {
			out[b] = SparseOps.mult(forBand(b), bands[b]);
		}
		return out;
	}
}
