package com.github.micycle1.deblender;

import java.util.List;

import org.ejml.data.DMatrixSparseCSC;

import com.github.micycle1.deblender.optimize.ConvergenceRecord;

/**
 * Output of a deblend: the factors, the reconstructed model and the operators
 * used to build it.
 */
public final class DeblendResult {

	private final double[][] a;
	private final double[][][] s;
	private final double[][][] model;
	private final PsfOperators psf;
	private final TransferOperators transfer;
	private final int iterations;
	private final boolean converged;
	private final List<ConvergenceRecord> trace;

	DeblendResult(double[][] a, double[][][] s, double[][][] model, PsfOperators psf, TransferOperators transfer, int iterations,
			boolean converged, List<ConvergenceRecord> trace) {
		this.a = a;
		this.s = s;
		this.model = model;
		this.psf = psf;
		this.transfer = transfer;
		this.iterations = iterations;
		this.converged = converged;
		this.trace = trace;
	}

	/** B x (K+G) spectra. */
	public double[][] getA() {
		return a;
	}

	/** (K+G) x N x M morphologies, centred. */
	public double[][][] getS() {
		return s;
	}

	/** B x N x M reconstruction. */
	public double[][][] getModel() {
		return model;
	}

	/** Null when no PSF was given. */
	public PsfOperators getPsf() {
		return psf;
	}

	public TransferOperators getTransfer() {
		return transfer;
	}

	public List<DMatrixSparseCSC> getTx() {
		return transfer.getTx();
	}

	public List<DMatrixSparseCSC> getTy() {
		return transfer.getTy();
	}

	public int getIterations() {
		return iterations;
	}

	public boolean isConverged() {
		return converged;
	}

	/** Null unless tracing was requested. */
	public List<ConvergenceRecord> getTrace() {
		return trace;
	}
}
