package com.github.micycle1.deblender;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Random;

/**
 * Small fixtures shared by the deblender tests.
 */
public final class TestImages {

	private TestImages() {
	}

	public static double[][] random(int rows, int cols, long seed) {
		Random rnd = new Random(seed);
		double[][] m = new double[rows][cols];
		for (int i = 0; i < rows; i++) {
			for (int j = 0; j < cols; j++) {
				m[i][j] = rnd.nextDouble();
			}
		}
		return m;
	}

	/** Centred Gaussian profile, flattened row-major. */
	public static double[] gaussian(int rows, int cols, double sigma) {
		final int cy = rows / 2, cx = cols / 2;
		double[] s = new double[rows * cols];
		for (int y = 0; y < rows; y++) {
			for (int x = 0; x < cols; x++) {
				double r2 = (x - cx) * (x - cx) + (y - cy) * (y - cy);
				s[y * cols + x] = Math.exp(-r2 / (2 * sigma * sigma));
			}
		}
		return s;
	}

	public static double[][] smallPsf() {
		return new double[][] { { 0.05, 0.1, 0.05 }, { 0.1, 0.4, 0.1 }, { 0.05, 0.1, 0.05 } };
	}

	public static void assertArrayClose(double[][] expected, double[][] actual, double tol) {
		assertEquals(expected.length, actual.length, "row count");
		for (int i = 0; i < expected.length; i++) {
			assertArrayEquals(expected[i], actual[i], tol, "row " + i);
		}
	}
}
