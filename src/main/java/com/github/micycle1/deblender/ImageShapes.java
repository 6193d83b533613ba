package com.github.micycle1.deblender;

import java.util.Arrays;

/**
 * Shape helpers for band stacks ({@code double[B][N][M]}) and their row-major
 * flattening ({@code double[B][N*M]}, pixel (y, x) at index {@code y*M + x}).
 */
public final class ImageShapes {

	private ImageShapes() {
	}

	/** @return {B, N, M} */
	public static int[] shapeOf(double[][][] img) {
		if (img.length == 0) {
			throw new IllegalArgumentException("Image must have at least one band");
		}
		return new int[] { img.length, img[0].length, img[0].length == 0 ? 0 : img[0][0].length };
	}

	/**
	 * Nearest odd shape: even spatial dimensions grow by one, or shrink by one
	 * when {@code truncate} is set. The band count is kept.
	 */
	public static int[] oddify(int[] shape, boolean truncate) {
		int[] out = shape.clone();
		for (int i = 1; i < out.length; i++) {
			if (out[i] % 2 == 0) {
				out[i] += truncate ? -1 : 1;
			}
		}
		return out;
	}

	/**
	 * Copies {@code img} into a new stack of shape {@code newShape}. The original
	 * keeps its top-left corner; grown pixels get {@code fill}, shrunk dimensions
	 * are cropped.
	 *
	 * @param newShape {B, N, M}; B must match the image
	 */
	public static double[][][] reshape(double[][][] img, int[] newShape, double fill) {
		int[] old = shapeOf(img);
		if (newShape.length != 3) {
			throw new IllegalArgumentException("Expected a shape of (bands, rows, cols) but received " + newShape.length + " dimensions");
		}
		if (old[0] != newShape[0]) {
			throw new IllegalArgumentException("The old and new shape must have the same number of bands, received " + old[0] + " and " + newShape[0]);
		}
		final int rows = newShape[1], cols = newShape[2];
		final int copyRows = Math.min(rows, old[1]), copyCols = Math.min(cols, old[2]);
		double[][][] out = new double[old[0]][rows][cols];
		for (int b = 0; b < old[0]; b++) {
			for (int y = 0; y < rows; y++) {
				double[] row = out[b][y];
				if (fill != 0) {
					Arrays.fill(row, fill);
				}
				if (y < copyRows) {
					System.arraycopy(img[b][y], 0, row, 0, copyCols);
				}
			}
		}
		return out;
	}

	/**
	 * Reshapes to the nearest odd shape, or returns {@code img} itself when both
	 * spatial dimensions are already odd.
	 */
	public static double[][][] reshapeToOdd(double[][][] img, boolean truncate, double fill) {
		int[] shape = shapeOf(img);
		int[] odd = oddify(shape, truncate);
		if (odd[1] == shape[1] && odd[2] == shape[2]) {
			return img;
		}
		return reshape(img, odd, fill);
	}

	/** K x rows x cols to K x (rows*cols). */
	public static double[][] flatten(double[][][] img) {
		double[][] out = new double[img.length][];
		for (int k = 0; k < img.length; k++) {
			out[k] = flattenBand(img[k]);
		}
		return out;
	}

	public static double[] flattenBand(double[][] band) {
		final int rows = band.length;
		final int cols = rows == 0 ? 0 : band[0].length;
		double[] out = new double[rows * cols];
		for (int y = 0; y < rows; y++) {
			if (band[y].length != cols) {
				throw new IllegalArgumentException("Ragged image: row " + y + " has " + band[y].length + " columns, expected " + cols);
			}
			System.arraycopy(band[y], 0, out, y * cols, cols);
		}
		return out;
	}

	/** K x (rows*cols) to K x rows x cols. */
	public static double[][][] unflatten(double[][] flat, int rows, int cols) {
		double[][][] out = new double[flat.length][rows][cols];
		for (int k = 0; k < flat.length; k++) {
			if (flat[k].length != rows * cols) {
				throw new IllegalArgumentException("Row " + k + " has " + flat[k].length + " pixels but shape (" + rows + ", " + cols + ") needs " + rows * cols);
			}
			for (int y = 0; y < rows; y++) {
				System.arraycopy(flat[k], y * cols, out[k][y], 0, cols);
			}
		}
		return out;
	}

	static void checkSameShape(String name, double[][][] expected, double[][][] actual) {
		int[] e = shapeOf(expected);
		int[] a = shapeOf(actual);
		if (e[0] != a[0] || e[1] != a[1] || e[2] != a[2]) {
			throw new IllegalArgumentException(name + " shape (" + a[0] + ", " + a[1] + ", " + a[2] + ") does not match image shape (" + e[0] + ", "
					+ e[1] + ", " + e[2] + ")");
		}
	}
}
