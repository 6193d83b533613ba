package com.github.micycle1.deblender;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class ImageShapesTest {

	@Test
	void oddify() {
		assertArrayEquals(new int[] { 2, 5, 5 }, ImageShapes.oddify(new int[] { 2, 4, 5 }, false));
		assertArrayEquals(new int[] { 2, 3, 5 }, ImageShapes.oddify(new int[] { 2, 4, 5 }, true));
		assertArrayEquals(new int[] { 1, 7, 9 }, ImageShapes.oddify(new int[] { 1, 7, 9 }, true));
	}

	@Test
	void padThenTruncateRecoversOriginal() {
		double[][][] img = { TestImages.random(4, 6, 1), TestImages.random(4, 6, 2) };
		double[][][] padded = ImageShapes.reshapeToOdd(img, false, 0);
		assertArrayEquals(new int[] { 2, 5, 7 }, ImageShapes.shapeOf(padded));
		assertEquals(0.0, padded[1][4][6]);
		assertEquals(img[1][3][5], padded[1][3][5]);

		double[][][] back = ImageShapes.reshape(padded, new int[] { 2, 4, 6 }, 0);
		for (int b = 0; b < 2; b++) {
			TestImages.assertArrayClose(img[b], back[b], 0);
		}
	}

	@Test
	void truncationCrops() {
		double[][][] img = { TestImages.random(4, 4, 3) };
		double[][][] cropped = ImageShapes.reshapeToOdd(img, true, 0);
		assertArrayEquals(new int[] { 1, 3, 3 }, ImageShapes.shapeOf(cropped));
		assertEquals(img[0][2][2], cropped[0][2][2]);
	}

	@Test
	void fillValueUsedForPadding() {
		double[][][] img = { { { 1, 2 } } };
		double[][][] padded = ImageShapes.reshape(img, new int[] { 1, 1, 3 }, -1);
		assertArrayEquals(new double[] { 1, 2, -1 }, padded[0][0]);
	}

	@Test
	void oddImageReturnedAsIs() {
		double[][][] img = { TestImages.random(3, 5, 4) };
		assertSame(img, ImageShapes.reshapeToOdd(img, false, 0));
	}

	@Test
	void bandCountMustMatch() {
		double[][][] img = { TestImages.random(3, 3, 5) };
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ImageShapes.reshape(img, new int[] { 2, 3, 3 }, 0));
		assertTrue(e.getMessage().contains("same number of bands"));
	}

	@Test
	void flattenIsRowMajor() {
		double[][][] img = { { { 1, 2, 3 }, { 4, 5, 6 } } };
		double[][] flat = ImageShapes.flatten(img);
		assertArrayEquals(new double[] { 1, 2, 3, 4, 5, 6 }, flat[0]);
		double[][][] back = ImageShapes.unflatten(flat, 2, 3);
		assertEquals(6.0, back[0][1][2]);
		assertThrows(IllegalArgumentException.class, () -> ImageShapes.unflatten(flat, 3, 3));
	}
}
