package com.github.micycle1.deblender.optimize;

import java.util.Collections;
import java.util.List;

/**
 * Final factors of a run plus how it ended.
 */
public final class OptimizationResult {

	private final double[][] a;
	private final double[][] s;
	private final int iterations;
	private final boolean converged;
	private final List<ConvergenceRecord> trace;

	public OptimizationResult(double[][] a, double[][] s, int iterations, boolean converged, List<ConvergenceRecord> trace) {
		this.a = a;
		this.s = s;
		this.iterations = iterations;
		this.converged = converged;
		this.trace = trace == null ? null : Collections.unmodifiableList(trace);
	}

	public double[][] getA() {
		return a;
	}

	public double[][] getS() {
		return s;
	}

	public int getIterations() {
		return iterations;
	}

	public boolean isConverged() {
		return converged;
	}

	/** Per-iteration records, or null when tracing was off. */
	public List<ConvergenceRecord> getTrace() {
		return trace;
	}

	@Override
	public String toString() {
		return "OptimizationResult[iterations=" + iterations + ", converged=" + converged + "]";
	}
}
