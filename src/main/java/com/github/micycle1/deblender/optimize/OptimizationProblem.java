package com.github.micycle1.deblender.optimize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.github.micycle1.deblender.Factor;
import com.github.micycle1.deblender.ProximalGradientStep;
import com.github.micycle1.deblender.constraint.LinearConstraint;

/**
 * Everything a runtime needs: starting factors, the objective step, the step
 * policy, the linear constraints of each factor and the stopping rule.
 */
public final class OptimizationProblem {

	public static final int DEFAULT_MAX_ITER = 1000;
	public static final double DEFAULT_E_REL = 1e-3;

	private final double[][] a0;
	private final double[][] s0;
	private final ProximalGradientStep objective;
	private final StepSizePolicy steps;
	private final List<LinearConstraint> constraintsA;
	private final List<LinearConstraint> constraintsS;
	private final int maxIter;
	private final double eRel;
	private final boolean traceback;

	/**
	 * @param constraintsA constraints on A, or null/empty for none
	 * @param constraintsS constraints on S, or null/empty for none
	 */
	public OptimizationProblem(double[][] a0, double[][] s0, ProximalGradientStep objective, StepSizePolicy steps,
			List<LinearConstraint> constraintsA, List<LinearConstraint> constraintsS, int maxIter, double eRel, boolean traceback) {
		this.a0 = Objects.requireNonNull(a0, "a0 must not be null");
		this.s0 = Objects.requireNonNull(s0, "s0 must not be null");
		this.objective = Objects.requireNonNull(objective, "objective must not be null");
		this.steps = Objects.requireNonNull(steps, "steps must not be null");
		if (maxIter < 0) {
			throw new IllegalArgumentException("maxIter must be non-negative but was " + maxIter);
		}
		if (!(eRel >= 0) || !Double.isFinite(eRel)) {
			throw new IllegalArgumentException("eRel must be non-negative and finite but was " + eRel);
		}
		this.constraintsA = copy(constraintsA);
		this.constraintsS = copy(constraintsS);
		this.maxIter = maxIter;
		this.eRel = eRel;
		this.traceback = traceback;
	}

	private static List<LinearConstraint> copy(List<LinearConstraint> list) {
		return list == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(list));
	}

	public double[][] getInitial(Factor which) {
		return which == Factor.A ? a0 : s0;
	}

	public List<LinearConstraint> getConstraints(Factor which) {
		return which == Factor.A ? constraintsA : constraintsS;
	}

	public ProximalGradientStep getObjective() {
		return objective;
	}

	public StepSizePolicy getSteps() {
		return steps;
	}

	public int getMaxIter() {
		return maxIter;
	}

	public double getERel() {
		return eRel;
	}

	public boolean isTraceback() {
		return traceback;
	}
}
