package com.github.micycle1.deblender.optimize;

/**
 * Per-iteration state of an optimization run, kept when tracing is requested.
 */
public final class ConvergenceRecord {

	public final int iteration;
	public final double stepA;
	public final double stepS;
	/** Relative Frobenius change of A in this iteration. */
	public final double changeA;
	public final double changeS;
	/** Largest relative primal residual over all constraints (0 without constraints). */
	public final double residual;

	public ConvergenceRecord(int iteration, double stepA, double stepS, double changeA, double changeS, double residual) {
		this.iteration = iteration;
		this.stepA = stepA;
		this.stepS = stepS;
		this.changeA = changeA;
		this.changeS = changeS;
		this.residual = residual;
	}

	@Override
	public String toString() {
		return String.format("it=%d stepA=%.4g stepS=%.4g dA=%.4g dS=%.4g res=%.4g", iteration, stepA, stepS, changeA, changeS, residual);
	}
}
