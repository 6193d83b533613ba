package com.github.micycle1.deblender.operators;

import org.ejml.data.DMatrixSparseCSC;

/**
 * OperatorFactory: builds the raw sparse operators the deblender composes and
 * selects among.
 * <p>
 * Conventions:
 * <ul>
 * <li>Images of {@code rows x cols} pixels are flattened row-major, so pixel
 * {@code (y, x)} has index {@code y * cols + x}.</li>
 * <li>Every operator returned is square, {@code n x n} with
 * {@code n = rows * cols}, and acts on column vectors.</li>
 * <li>The centre pixel is {@code ((rows - 1) / 2, (cols - 1) / 2)}; callers
 * that need a well defined centre validate odd dimensions beforehand.</li>
 * </ul>
 * Implementations must be stateless or immutable; operators are shared
 * read-only once built.
 */
public interface OperatorFactory {

	/**
	 * Convolution with a 2-D kernel (centred on its middle element), zero outside
	 * the image. Kernel entries with magnitude below {@code threshold} are dropped.
	 */
	DMatrixSparseCSC psf(double[][] kernel, int rows, int cols, double threshold);

	/**
	 * Sub-pixel translation pair. The x operator samples every output pixel at
	 * {@code x + dx} of its input, the y operator at {@code y + dy}. Interpolation
	 * weights below {@code threshold} are dropped.
	 */
	Translation translation(double dx, double dy, int rows, int cols, double threshold);

	/**
	 * Radial monotonicity: row i is {@code Σ w_j e_j - e_i} over the inward
	 * neighbours j of pixel i, so that {@code L x >= 0} means no pixel is brighter
	 * than its inward neighbourhood. The centre row is empty.
	 *
	 * @param useNearest when true each row references exactly one neighbour (the
	 *                   one nearest to the centre) with weight 1; otherwise the
	 *                   weight is spread over every neighbour that is closer to the
	 *                   centre.
	 */
	DMatrixSparseCSC radialMonotonic(int rows, int cols, boolean useNearest);

	/**
	 * Point symmetry: row i is {@code e_i - e_mirror(i)} where the mirror is the
	 * reflection through the centre pixel. {@code L x = 0} for symmetric images.
	 */
	DMatrixSparseCSC symmetry(int rows, int cols);

	/**
	 * Horizontal gradient towards column {@code cx}: {@code L x >= 0} when values
	 * never decrease when stepping towards that column.
	 */
	DMatrixSparseCSC gradientX(int rows, int cols, int cx);

	/** Vertical counterpart of {@link #gradientX}. */
	DMatrixSparseCSC gradientY(int rows, int cols, int cy);

	DMatrixSparseCSC identity(int rows, int cols);

	DMatrixSparseCSC zero(int rows, int cols);
}
