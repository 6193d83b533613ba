package com.github.micycle1.deblender.constraint;

import com.github.micycle1.deblender.prox.PositiveProjection;
import com.github.micycle1.deblender.prox.ProximalOperator;
import com.github.micycle1.deblender.prox.ZeroProjection;

/**
 * Shape constraints a morphology can seek. Each constant carries its
 * single-letter symbol, the placeholder block used for components that do not
 * seek it, and the projection applied to the constrained quantity {@code L S}.
 */
public enum ConstraintType {

	/** Radial monotonic decay: {@code L S >= 0}. */
	MONOTONIC('M', Placeholder.IDENTITY),
	/** Point symmetry: {@code L S = 0}. */
	SYMMETRY('S', Placeholder.ZERO),
	/** Non-negative horizontal gradient towards the centre column. */
	GRADIENT_X('X', Placeholder.IDENTITY),
	/** Non-negative vertical gradient towards the centre row. */
	GRADIENT_Y('Y', Placeholder.IDENTITY),
	/**
	 * Strict per-pixel monotonicity, enforced by a direct projection of S (cone
	 * projection or pixelwise) rather than through a linear operator.
	 */
	STRICT_MONOTONIC('m', Placeholder.NONE);

	/** Block substituted for components that do not seek a constraint. */
	public enum Placeholder {
		IDENTITY, ZERO, NONE
	}

	public static final String SYMBOLS = "SMmXY";

	private final char symbol;
	private final Placeholder placeholder;

	ConstraintType(char symbol, Placeholder placeholder) {
		this.symbol = symbol;
		this.placeholder = placeholder;
	}

	public char getSymbol() {
		return symbol;
	}

	public Placeholder getPlaceholder() {
		return placeholder;
	}

	public boolean requiresLinearOperator() {
		return placeholder != Placeholder.NONE;
	}

	/**
	 * Projection applied to {@code L S}; null for {@link #STRICT_MONOTONIC}, whose
	 * proximal depends on the image shape and is built separately.
	 */
	public ProximalOperator linearProximal() {
		switch (this) {
			case SYMMETRY:
				return ZeroProjection.INSTANCE;
			case STRICT_MONOTONIC:
				return null;
			default:
				return PositiveProjection.INSTANCE;
		}
	}

	public static ConstraintType fromSymbol(char symbol) {
		for (ConstraintType t : values()) {
			if (t.symbol == symbol) {
				return t;
			}
		}
		throw new IllegalArgumentException("Each constraint should be null or in " + SYMBOLS + " but received '" + symbol + "'");
	}
}
