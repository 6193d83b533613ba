package com.github.micycle1.deblender.prox;

/**
 * A constraint-enforcing map applied after an unconstrained gradient step.
 * <p>
 * Implementations never modify {@code x}; they return a fresh matrix of the
 * same shape. {@code step} is the gradient step size the proximal is paired
 * with (thresholds scale with it).
 */
@FunctionalInterface
public interface ProximalOperator {

	double[][] apply(double[][] x, double step);

	/** Applies this operator, then {@code next}. */
	default ProximalOperator andThen(ProximalOperator next) {
		return new ChainedProximal(this, next);
	}
}
