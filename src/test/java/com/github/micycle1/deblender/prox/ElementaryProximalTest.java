package com.github.micycle1.deblender.prox;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class ElementaryProximalTest {

	@Test
	void positiveProjectionClipsNegatives() {
		double[][] x = { { -1, 0, 2 } };
		assertArrayEquals(new double[] { 0, 0, 2 }, PositiveProjection.INSTANCE.apply(x, 1)[0]);
		assertEquals(-1.0, x[0][0]);
	}

	@Test
	void zeroProjection() {
		double[][] out = ZeroProjection.INSTANCE.apply(new double[][] { { 1, 2 }, { 3 } }, 1);
		assertArrayEquals(new double[2], out[0]);
		assertArrayEquals(new double[1], out[1]);
	}

	@Test
	void hardThresholdScalesWithStep() {
		HardThreshold prox = new HardThreshold(0.5);
		double[][] x = { { 0.3, 0.6, -1, 2 } };
		assertArrayEquals(new double[] { 0, 0.6, 0, 2 }, prox.apply(x, 1)[0]);
		assertArrayEquals(new double[] { 0, 0, 0, 2 }, prox.apply(x, 2)[0]);
		assertThrows(IllegalArgumentException.class, () -> new HardThreshold(-1));
	}

	@Test
	void softThresholdShrinksTowardsZero() {
		SoftThresholdPlus prox = new SoftThresholdPlus(0.5);
		assertArrayEquals(new double[] { 0, 0.1, 1.5, 0 }, prox.apply(new double[][] { { 0.3, 0.6, 2, -3 } }, 1)[0], 1e-12);
		assertArrayEquals(new double[] { 0, 0, 1, 0 }, prox.apply(new double[][] { { 0.3, 0.6, 2, -3 } }, 2)[0], 1e-12);
	}

	@Test
	void simplexColumnsSumToOne() {
		double[][] a = { { 2, -1, 0 }, { 6, 3, 0 } };
		double[][] out = UnitSimplexProximal.INSTANCE.apply(a, 1);
		assertEquals(0.25, out[0][0], 1e-12);
		assertEquals(0.75, out[1][0], 1e-12);
		assertEquals(0.0, out[0][1], 1e-12);
		assertEquals(1.0, out[1][1], 1e-12);
		// no positive entry: uniform
		assertEquals(0.5, out[0][2], 1e-12);
		assertEquals(0.5, out[1][2], 1e-12);
		assertEquals(2.0, a[0][0]);
	}

	@Test
	void chainAppliesSecondLast() {
		ProximalOperator shift = (x, step) -> new double[][] { { x[0][0] - 5 } };
		double[][] out = shift.andThen(PositiveProjection.INSTANCE).apply(new double[][] { { 3 } }, 1);
		assertEquals(0.0, out[0][0]);
		out = PositiveProjection.INSTANCE.andThen(shift).apply(new double[][] { { 3 } }, 1);
		assertEquals(-2.0, out[0][0]);
		assertTrue(shift.andThen(PositiveProjection.INSTANCE) instanceof ChainedProximal);
	}
}
