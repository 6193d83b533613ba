package com.github.micycle1.deblender.prox;

/**
 * Approximate monotonic enforcement, pixel by pixel along a precomputed
 * ordering. This is the alternative to the exact {@link ConeProjection}.
 * <p>
 * Contract: after {@code enforce} returns, for every row k with
 * {@code seeks[k]} and every pixel i, {@code x[k][i] <= x[k][reference[i]] +
 * threshold}. Implementations update {@code x} in place.
 */
public interface PixelwiseMonotonicEnforcer {

	/**
	 * @param x             factor rows, updated in place
	 * @param step          step size of the enclosing proximal step
	 * @param seeks         which rows are constrained
	 * @param distanceOrder pixel indices sorted by ascending distance from the
	 *                      centre
	 * @param reference     designated inward neighbour of each pixel (the centre
	 *                      references itself)
	 * @param threshold     tolerated excess over the reference value
	 */
	void enforce(double[][] x, double step, boolean[] seeks, int[] distanceOrder, int[] reference, double threshold);
}
