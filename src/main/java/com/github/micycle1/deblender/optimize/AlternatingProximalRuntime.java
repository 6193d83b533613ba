package com.github.micycle1.deblender.optimize;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.deblender.Factor;
import com.github.micycle1.deblender.ProximalGradientStep;
import com.github.micycle1.deblender.constraint.LinearConstraint;
import com.github.micycle1.deblender.linalg.DenseNorms;

/**
 * <p>
 * Alternating block minimization: each outer iteration updates A, then S.
 * </p>
 *
 * <p>
 * A factor without linear constraints takes one proximal-gradient step. A
 * factor with constraints {@code g_i(L_i X)} takes one linearized ADMM step,
 * keeping a split variable Z and a scaled dual U per constraint:
 * </p>
 *
 * <pre>
 * X' = X - Σ_i (step_f / step_g_i) L_i^T (L_i X - Z_i + U_i)
 * X  = prox_f(X' - step_f ∇f(X'), step_f)
 * Z_i = prox_g_i(L_i X + U_i, step_g_i)
 * U_i = U_i + L_i X - Z_i
 * </pre>
 *
 * <p>
 * with {@code step_g_i = C step_f ||L_i||²} for C constraints. The run stops
 * once the relative change of both factors is at most {@code eRel} and every
 * primal residual {@code ||L_i X - Z_i||} is at most {@code eRel ||L_i X||},
 * or after {@code maxIter} iterations.
 * </p>
 */
public class AlternatingProximalRuntime implements OptimizationRuntime {

	private static final Logger logger = LoggerFactory.getLogger(AlternatingProximalRuntime.class);

	private static final double RESIDUAL_FLOOR = 1e-12;

	@Override
	public OptimizationResult run(OptimizationProblem problem) {
		final ProximalGradientStep objective = problem.getObjective();
		final StepSizePolicy steps = problem.getSteps();
		final double eRel = problem.getERel();

		double[][] a = DenseNorms.copy(problem.getInitial(Factor.A));
		double[][] s = DenseNorms.copy(problem.getInitial(Factor.S));
		Split splitA = new Split(problem.getConstraints(Factor.A), a);
		Split splitS = new Split(problem.getConstraints(Factor.S), s);
		List<ConvergenceRecord> trace = problem.isTraceback() ? new ArrayList<>() : null;

		boolean converged = false;
		int it = 0;
		while (it < problem.getMaxIter() && !converged) {
			double stepA = checkStep(steps.step(Factor.A, a, s), Factor.A, it);
			double[][] newA = splitA.update(objective, a, stepA, Factor.A, s);
			checkFinite(newA, Factor.A, it);

			double stepS = checkStep(steps.step(Factor.S, newA, s), Factor.S, it);
			double[][] newS = splitS.update(objective, s, stepS, Factor.S, newA);
			checkFinite(newS, Factor.S, it);

			double changeA = relativeChange(a, newA);
			double changeS = relativeChange(s, newS);
			double residual = Math.max(splitA.lastResidual, splitS.lastResidual);
			a = newA;
			s = newS;
			it++;

			converged = changeA <= eRel && changeS <= eRel && splitA.satisfied(eRel) && splitS.satisfied(eRel);
			if (trace != null) {
				trace.add(new ConvergenceRecord(it, stepA, stepS, changeA, changeS, residual));
			}
			if (logger.isTraceEnabled()) {
				logger.trace("it={} stepA={} stepS={} dA={} dS={} res={}", it, stepA, stepS, changeA, changeS, residual);
			}
		}
		logger.debug("Stopped after {} iterations, converged={}", it, converged);
		return new OptimizationResult(a, s, it, converged, trace);
	}

	private static double checkStep(double step, Factor which, int it) {
		if (!(step > 0) || !Double.isFinite(step)) {
			throw new IllegalStateException("Invalid step " + step + " for " + which + " at iteration " + it);
		}
		return step;
	}

	private static void checkFinite(double[][] x, Factor which, int it) {
		if (!DenseNorms.isFinite(x)) {
			throw new IllegalStateException("Factor " + which + " became non-finite at iteration " + it);
		}
	}

	private static double relativeChange(double[][] before, double[][] after) {
		double diff = DenseNorms.frobeniusDistance(before, after);
		if (diff == 0) {
			return 0;
		}
		double norm = DenseNorms.frobenius(after);
		return norm == 0 ? Double.POSITIVE_INFINITY : diff / norm;
	}

	/**
	 * ADMM state of one factor; empty when the factor has no constraints.
	 */
	private static final class Split {

		final List<LinearConstraint> constraints;
		final double[] norms2;
		final double[][][] z;
		final double[][][] u;
		final double[] residuals;
		final double[] scales;
		double lastResidual;

		Split(List<LinearConstraint> constraints, double[][] x0) {
			this.constraints = constraints;
			final int c = constraints.size();
			norms2 = new double[c];
			z = new double[c][][];
			u = new double[c][][];
			residuals = new double[c];
			scales = new double[c];
			for (int i = 0; i < c; i++) {
				LinearConstraint lc = constraints.get(i);
				double norm = lc.norm();
				norms2[i] = norm * norm;
				z[i] = DenseNorms.copy(lc.apply(x0));
				u[i] = new double[z[i].length][];
				for (int r = 0; r < z[i].length; r++) {
					u[i][r] = new double[z[i][r].length];
				}
			}
		}

		double[][] update(ProximalGradientStep objective, double[][] x, double stepF, Factor which, double[][] other) {
			if (constraints.isEmpty()) {
				return objective.update(x, stepF, which, other);
			}
			final int c = constraints.size();

			// X' = X - Σ (step_f / step_g_i) L_i^T (L_i X - Z_i + U_i)
			double[][] corrected = DenseNorms.copy(x);
			for (int i = 0; i < c; i++) {
				if (norms2[i] == 0) {
					continue; // L_i = 0 places no constraint
				}
				LinearConstraint lc = constraints.get(i);
				double[][] lx = lc.apply(x);
				double[][] d = new double[lx.length][];
				for (int r = 0; r < lx.length; r++) {
					d[r] = new double[lx[r].length];
					for (int j = 0; j < d[r].length; j++) {
						d[r][j] = lx[r][j] - z[i][r][j] + u[i][r][j];
					}
				}
				double[][] back = lc.applyTranspose(d);
				double f = 1.0 / (c * norms2[i]); // step_f / step_g_i
				for (int r = 0; r < corrected.length; r++) {
					for (int j = 0; j < corrected[r].length; j++) {
						corrected[r][j] -= f * back[r][j];
					}
				}
			}
			double[][] next = objective.update(corrected, stepF, which, other);

			lastResidual = 0;
			for (int i = 0; i < c; i++) {
				LinearConstraint lc = constraints.get(i);
				double stepG = c * stepF * Math.max(norms2[i], RESIDUAL_FLOOR);
				double[][] lx = lc.apply(next);
				double[][] v = new double[lx.length][];
				for (int r = 0; r < lx.length; r++) {
					v[r] = new double[lx[r].length];
					for (int j = 0; j < v[r].length; j++) {
						v[r][j] = lx[r][j] + u[i][r][j];
					}
				}
				double[][] zi = lc.getProximal().apply(v, stepG);
				double[][] ui = new double[lx.length][];
				for (int r = 0; r < lx.length; r++) {
					ui[r] = new double[lx[r].length];
					for (int j = 0; j < ui[r].length; j++) {
						ui[r][j] = v[r][j] - zi[r][j];
					}
				}
				z[i] = zi;
				u[i] = ui;

				double res = DenseNorms.frobeniusDistance(lx, zi);
				double scale = DenseNorms.frobenius(lx);
				residuals[i] = res;
				scales[i] = scale;
				lastResidual = Math.max(lastResidual, scale > 0 ? res / scale : res);
			}
			return next;
		}

		boolean satisfied(double eRel) {
			for (int i = 0; i < residuals.length; i++) {
				if (residuals[i] > eRel * scales[i] + RESIDUAL_FLOOR) {
					return false;
				}
			}
			return true;
		}
	}
}
