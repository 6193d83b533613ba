package com.github.micycle1.deblender.prox;

import java.util.Objects;

/**
 * Two proximal operators applied in sequence. The second one is applied last,
 * so its constraint holds exactly on the output.
 */
public final class ChainedProximal implements ProximalOperator {

	private final ProximalOperator first;
	private final ProximalOperator then;

	public ChainedProximal(ProximalOperator first, ProximalOperator then) {
		this.first = Objects.requireNonNull(first, "first must not be null");
		this.then = Objects.requireNonNull(then, "then must not be null");
	}

	@Override
	public double[][] apply(double[][] x, double step) {
		return then.apply(first.apply(x, step), step);
	}

	public ProximalOperator getFirst() {
		return first;
	}

	public ProximalOperator getThen() {
		return then;
	}

	@Override
	public String toString() {
		return first + " -> " + then;
	}
}
