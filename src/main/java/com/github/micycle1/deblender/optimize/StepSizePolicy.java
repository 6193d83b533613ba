package com.github.micycle1.deblender.optimize;

import com.github.micycle1.deblender.Factor;

/**
 * Chooses the gradient step for one factor given the current value of both.
 */
@FunctionalInterface
public interface StepSizePolicy {

	/**
	 * @param which the factor about to be updated
	 * @param a     current B x K spectra
	 * @param s     current K x n morphologies
	 * @return a positive, finite step
	 */
	double step(Factor which, double[][] a, double[][] s);
}
