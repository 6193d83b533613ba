package com.github.micycle1.deblender.optimize;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.micycle1.deblender.Factor;
import com.github.micycle1.deblender.ForwardModel;
import com.github.micycle1.deblender.ProximalGradientStep;
import com.github.micycle1.deblender.constraint.ConstraintType;
import com.github.micycle1.deblender.constraint.LinearConstraint;
import com.github.micycle1.deblender.linalg.DenseNorms;
import com.github.micycle1.deblender.prox.PositiveProjection;
import com.github.micycle1.deblender.prox.UnitSimplexProximal;

public class AlternatingProximalRuntimeTest {

	private static final double[][] A = { { 0.8, 0.3 }, { 0.2, 0.7 } };
	private static final double[][] S = { { 4, 2, 1, 0, 0 }, { 0, 0, 1, 3, 5 } };

	private final AlternatingProximalRuntime runtime = new AlternatingProximalRuntime();

	private static ProximalGradientStep objective(double[][] data) {
		return new ProximalGradientStep(data, null, null, UnitSimplexProximal.INSTANCE, PositiveProjection.INSTANCE);
	}

	private static double loss(double[][] a, double[][] s, double[][] y) {
		double[][] model = ForwardModel.model(a, s, null);
		double f = 0;
		for (int b = 0; b < y.length; b++) {
			for (int i = 0; i < y[b].length; i++) {
				double d = model[b][i] - y[b][i];
				f += 0.5 * d * d;
			}
		}
		return f;
	}

	@Test
	void exactFactorsAreAFixedPoint() {
		double[][] y = ForwardModel.model(A, S, null);
		OptimizationProblem problem = new OptimizationProblem(A, S, objective(y), new LipschitzStepPolicy(1, 0.9), null, null, 50, 1e-6, true);
		OptimizationResult result = runtime.run(problem);
		assertTrue(result.isConverged());
		assertEquals(1, result.getIterations());
		assertEquals(1, result.getTrace().size());
		for (int b = 0; b < 2; b++) {
			assertArrayEquals(A[b], result.getA()[b], 1e-12);
		}
	}

	@Test
	void identityConstraintKeepsFixedPoint() {
		double[][] y = ForwardModel.model(A, S, null);
		LinearConstraint positive = new LinearConstraint(ConstraintType.MONOTONIC, null, PositiveProjection.INSTANCE);
		OptimizationProblem problem = new OptimizationProblem(A, S, objective(y), new LipschitzStepPolicy(1, 0.9), null, List.of(positive), 50,
				1e-6, false);
		OptimizationResult result = runtime.run(problem);
		assertTrue(result.isConverged());
		assertEquals(1, result.getIterations());
		assertNull(result.getTrace());
		assertArrayEquals(S[1], result.getS()[1], 1e-12);
	}

	@Test
	void lossDecreasesFromPerturbedStart() {
		double[][] y = ForwardModel.model(A, S, null);
		double[][] a0 = { { 0.5, 0.5 }, { 0.5, 0.5 } };
		double[][] s0 = { { 1, 1, 1, 1, 1 }, { 1, 0, 1, 0, 1 } };
		OptimizationProblem problem = new OptimizationProblem(a0, s0, objective(y), new LipschitzStepPolicy(1, 0.9), null, null, 300, 1e-9,
				false);
		OptimizationResult result = runtime.run(problem);
		assertTrue(loss(result.getA(), result.getS(), y) < 0.1 * loss(a0, s0, y));
		for (double[] row : result.getS()) {
			for (double v : row) {
				assertTrue(v >= 0);
			}
		}
		// initial factors untouched
		assertEquals(0.5, a0[0][0]);
	}

	@Test
	void zeroIterationsReturnsStart() {
		double[][] y = ForwardModel.model(A, S, null);
		OptimizationResult result = runtime
				.run(new OptimizationProblem(A, S, objective(y), new LipschitzStepPolicy(1, 0.9), null, null, 0, 1e-3, false));
		assertEquals(0, result.getIterations());
		assertFalse(result.isConverged());
		assertNotSame(A, result.getA());
		assertEquals(0.0, DenseNorms.frobeniusDistance(A, result.getA()));
	}

	@Test
	void invalidStepFails() {
		double[][] y = ForwardModel.model(A, S, null);
		StepSizePolicy broken = (which, a, s) -> which == Factor.S ? Double.NaN : 0.1;
		OptimizationProblem problem = new OptimizationProblem(A, S, objective(y), broken, null, null, 5, 1e-3, false);
		assertThrows(IllegalStateException.class, () -> runtime.run(problem));
	}

	@Test
	void problemValidatesSettings() {
		double[][] y = ForwardModel.model(A, S, null);
		assertThrows(IllegalArgumentException.class,
				() -> new OptimizationProblem(A, S, objective(y), new LipschitzStepPolicy(1, 0.9), null, null, -1, 1e-3, false));
		assertThrows(IllegalArgumentException.class,
				() -> new OptimizationProblem(A, S, objective(y), new LipschitzStepPolicy(1, 0.9), null, null, 10, Double.NaN, false));
	}
}
