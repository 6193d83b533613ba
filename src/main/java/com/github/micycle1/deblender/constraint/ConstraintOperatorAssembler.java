package com.github.micycle1.deblender.constraint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.ejml.data.DMatrixSparseCSC;

import com.github.micycle1.deblender.linalg.RowStackedOperator;
import com.github.micycle1.deblender.linalg.SparseOps;
import com.github.micycle1.deblender.operators.OperatorFactory;

/**
 * <p>
 * Builds the block-diagonal constraint operator for one {@link ConstraintType}:
 * one block per component, holding either the real operator (the component
 * seeks the constraint) or the type's neutral placeholder.
 * </p>
 *
 * <p>
 * The real operator and the placeholders are built once per call and shared
 * between blocks; the block-diagonal matrix is assembled by
 * {@link SparseOps#blockDiagonal(List)}.
 * </p>
 */
public class ConstraintOperatorAssembler {

	private final OperatorFactory factory;
	private final boolean useNearest;

	/**
	 * @param factory    source of the raw constraint operators
	 * @param useNearest whether the radial monotonic operator references only the
	 *                   nearest inward neighbour of each pixel
	 */
	public ConstraintOperatorAssembler(OperatorFactory factory, boolean useNearest) {
		this.factory = Objects.requireNonNull(factory, "factory must not be null");
		this.useNearest = useNearest;
	}

	/**
	 * @return the block operator, or null when the type needs no linear operator
	 * @throws IllegalArgumentException if {@code rows} or {@code cols} is even
	 */
	public RowStackedOperator assemble(ConstraintType type, int rows, int cols, boolean[] seeks) {
		Objects.requireNonNull(type, "type must not be null");
		if (rows % 2 == 0 || cols % 2 == 0) {
			throw new IllegalArgumentException("Shape must have an odd width and height, received shape (" + rows + ", " + cols + ")");
		}
		if (!type.requiresLinearOperator()) {
			return null;
		}
		if (seeks.length == 0) {
			throw new IllegalArgumentException("Seeks vector must name at least one component");
		}

		DMatrixSparseCSC real = buildOperator(type, rows, cols);
		DMatrixSparseCSC neutral = type.getPlaceholder() == ConstraintType.Placeholder.ZERO ? factory.zero(rows, cols)
				: factory.identity(rows, cols);

		List<DMatrixSparseCSC> blocks = new ArrayList<>(seeks.length);
		for (boolean s : seeks) {
			blocks.add(s ? real : neutral);
		}
		return new RowStackedOperator(SparseOps.blockDiagonal(blocks), seeks.length);
	}

	DMatrixSparseCSC buildOperator(ConstraintType type, int rows, int cols) {
		switch (type) {
			case MONOTONIC:
				return factory.radialMonotonic(rows, cols, useNearest);
			case SYMMETRY:
				return factory.symmetry(rows, cols);
			case GRADIENT_X:
				return factory.gradientX(rows, cols, cols / 2);
			case GRADIENT_Y:
				return factory.gradientY(rows, cols, rows / 2);
			default:
				throw new IllegalArgumentException("No linear operator for constraint " + type);
		}
	}
}
