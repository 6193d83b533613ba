package com.github.micycle1.deblender.constraint;

import java.util.Objects;

import com.github.micycle1.deblender.linalg.RowStackedOperator;
import com.github.micycle1.deblender.prox.ProximalOperator;

/**
 * A constraint {@code prox(L X)} on one factor. A null operator stands for the
 * identity, i.e. the proximal acts on the factor itself.
 */
public final class LinearConstraint {

	private final ConstraintType type;
	private final RowStackedOperator operator;
	private final ProximalOperator proximal;

	public LinearConstraint(ConstraintType type, RowStackedOperator operator, ProximalOperator proximal) {
		this.type = type;
		this.operator = operator;
		this.proximal = Objects.requireNonNull(proximal, "proximal must not be null");
	}

	public ConstraintType getType() {
		return type;
	}

	/** May be null (identity). */
	public RowStackedOperator getOperator() {
		return operator;
	}

	public ProximalOperator getProximal() {
		return proximal;
	}

	public double[][] apply(double[][] x) {
		return operator == null ? x : operator.apply(x);
	}

	public double[][] applyTranspose(double[][] y) {
		return operator == null ? y : operator.applyTranspose(y);
	}

	/** Spectral norm of L (1 for the identity). */
	public double norm() {
		return operator == null ? 1.0 : operator.spectralNorm();
	}

	@Override
	public String toString() {
		return "LinearConstraint[" + type + ", " + (operator == null ? "identity" : operator) + ", " + proximal + "]";
	}
}
