package com.github.micycle1.deblender;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.github.micycle1.deblender.operators.StandardOperatorFactory;

public class GradientEngineTest {

	private static final int BANDS = 2, ROWS = 5, COLS = 5;

	private final StandardOperatorFactory factory = new StandardOperatorFactory();

	private TransferOperators transfer(boolean withPsf) {
		PsfOperators psf = withPsf ? PsfOperators.adapt(TestImages.smallPsf(), ROWS, COLS, 1e-2, factory) : null;
		return TransferOperators.compose(Arrays.asList(Peak.of(1.5, 2), Peak.of(3, 3.25)), BANDS, ROWS, COLS, psf, factory, 1e-8);
	}

	// ½ Σ W (model - Y)²
	private static double objective(double[][] a, double[][] s, double[][] y, double[][] w, TransferOperators t) {
		double[][] model = ForwardModel.model(a, s, t);
		double f = 0;
		for (int b = 0; b < y.length; b++) {
			for (int i = 0; i < y[b].length; i++) {
				double d = model[b][i] - y[b][i];
				f += 0.5 * (w == null ? 1 : w[b][i]) * d * d;
			}
		}
		return f;
	}

	@ParameterizedTest
	@ValueSource(booleans = { true, false })
	void gradientOfAMatchesFiniteDifferences(boolean withPsf) {
		TransferOperators t = transfer(withPsf);
		double[][] a = TestImages.random(BANDS, 2, 11);
		double[][] s = TestImages.random(2, ROWS * COLS, 12);
		double[][] y = TestImages.random(BANDS, ROWS * COLS, 13);
		double[][] w = TestImages.random(BANDS, ROWS * COLS, 14);

		double[][] grad = GradientEngine.gradient(Factor.A, a, s, y, w, t);
		assertEquals(BANDS, grad.length);
		assertEquals(2, grad[0].length);
		final double h = 1e-6;
		for (int b = 0; b < BANDS; b++) {
			for (int k = 0; k < 2; k++) {
				double orig = a[b][k];
				a[b][k] = orig + h;
				double fp = objective(a, s, y, w, t);
				a[b][k] = orig - h;
				double fm = objective(a, s, y, w, t);
				a[b][k] = orig;
				double fd = (fp - fm) / (2 * h);
				assertEquals(fd, grad[b][k], 1e-5 * (1 + Math.abs(fd)), "A[" + b + "][" + k + "]");
			}
		}
	}

	@ParameterizedTest
	@ValueSource(booleans = { true, false })
	void gradientOfSMatchesFiniteDifferences(boolean withPsf) {
		TransferOperators t = transfer(withPsf);
		double[][] a = TestImages.random(BANDS, 2, 21);
		double[][] s = TestImages.random(2, ROWS * COLS, 22);
		double[][] y = TestImages.random(BANDS, ROWS * COLS, 23);

		double[][] grad = GradientEngine.gradient(Factor.S, a, s, y, null, t);
		final double h = 1e-6;
		for (int k = 0; k < 2; k++) {
			for (int i = 0; i < ROWS * COLS; i += 3) {
				double orig = s[k][i];
				s[k][i] = orig + h;
				double fp = objective(a, s, y, null, t);
				s[k][i] = orig - h;
				double fm = objective(a, s, y, null, t);
				s[k][i] = orig;
				double fd = (fp - fm) / (2 * h);
				assertEquals(fd, grad[k][i], 1e-5 * (1 + Math.abs(fd)), "S[" + k + "][" + i + "]");
			}
		}
	}

	@Test
	void gradientVanishesAtExactFit() {
		TransferOperators t = transfer(true);
		double[][] a = TestImages.random(BANDS, 2, 31);
		double[][] s = TestImages.random(2, ROWS * COLS, 32);
		double[][] y = ForwardModel.model(a, s, t);
		for (double[] row : GradientEngine.gradient(Factor.S, a, s, y, null, t)) {
			for (double v : row) {
				assertEquals(0.0, v, 1e-12);
			}
		}
	}

	@Test
	void symbolOverloadAgreesWithEnum() {
		double[][] a = TestImages.random(BANDS, 2, 41);
		double[][] s = TestImages.random(2, ROWS * COLS, 42);
		double[][] y = TestImages.random(BANDS, ROWS * COLS, 43);
		TransferOperators t = transfer(false);
		TestImages.assertArrayClose(GradientEngine.gradient(Factor.A, a, s, y, null, t), GradientEngine.gradient("A", a, s, y, null, t), 0);
	}

	@Test
	void unknownFactorRejected() {
		double[][] a = { { 1 } };
		double[][] s = { { 1 } };
		double[][] y = { { 1 } };
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> GradientEngine.gradient("B", a, s, y, null, null));
		assertTrue(e.getMessage().contains("'A' or 'S'"));
		assertThrows(IllegalArgumentException.class, () -> GradientEngine.gradient((Factor) null, a, s, y, null, null));
	}

	@Test
	void mismatchedDataRejected() {
		double[][] a = { { 1 } };
		double[][] s = { { 1, 2 } };
		assertThrows(IllegalArgumentException.class, () -> GradientEngine.gradient(Factor.S, a, s, new double[][] { { 1, 2, 3 } }, null, null));
		assertThrows(IllegalArgumentException.class,
				() -> GradientEngine.gradient(Factor.S, a, s, new double[][] { { 1, 2 } }, new double[][] { { 1 } }, null));
	}

	@Test
	void transferComponentCountChecked() {
		TransferOperators t = TransferOperators.compose(List.of(Peak.of(2, 2)), 1, 5, 5, null, factory, 1e-8);
		double[][] a = { { 1, 1 } };
		double[][] s = new double[2][25];
		assertThrows(IllegalArgumentException.class, () -> GradientEngine.gradient(Factor.S, a, s, new double[1][25], null, t));
	}
}
