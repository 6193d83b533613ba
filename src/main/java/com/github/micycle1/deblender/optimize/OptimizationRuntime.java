package com.github.micycle1.deblender.optimize;

/**
 * Runs the alternating minimization of a deblend problem.
 */
public interface OptimizationRuntime {

	/**
	 * @return the final factors; the problem's initial factors are not modified
	 * @throws IllegalStateException if the iteration produces non-finite values
	 */
	OptimizationResult run(OptimizationProblem problem);
}
