package com.github.micycle1.deblender.operators;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;

import com.github.micycle1.deblender.linalg.SparseOps;

/**
 * Default {@link OperatorFactory}: every operator is assembled as a
 * {@code DMatrixSparseTriplet} and converted to CSC once.
 */
public class StandardOperatorFactory implements OperatorFactory {

	@Override
	public DMatrixSparseCSC psf(double[][] kernel, int rows, int cols, double threshold) {
		final int kh = kernel.length;
		final int kw = kernel[0].length;
		final int kcy = kh / 2, kcx = kw / 2;
		final int n = rows * cols;

		int kernelNnz = 0;
		for (double[] kr : kernel) {
			for (double v : kr) {
				if (Math.abs(v) >= threshold && v != 0) {
					kernelNnz++;
				}
			}
		}
		DMatrixSparseTriplet tr = new DMatrixSparseTriplet(n, n, Math.max(1, kernelNnz * n));
		for (int y = 0; y < rows; y++) {
			for (int x = 0; x < cols; x++) {
				final int row = y * cols + x;
				for (int i = 0; i < kh; i++) {
					// out(y,x) += k(i,j) * in(y - (i - kcy), x - (j - kcx))
					final int sy = y - (i - kcy);
					if (sy < 0 || sy >= rows) {
						continue;
					}
					for (int j = 0; j < kw; j++) {
						final double v = kernel[i][j];
						if (v == 0 || Math.abs(v) < threshold) {
							continue;
						}
						final int sx = x - (j - kcx);
						if (sx < 0 || sx >= cols) {
							continue;
						}
						tr.addItem(row, sy * cols + sx, v);
					}
				}
			}
		}
		return DConvertMatrixStruct.convert(tr, (DMatrixSparseCSC) null);
	}

	@Override
	public Translation translation(double dx, double dy, int rows, int cols, double threshold) {
		final int ix = (int) Math.floor(dx);
		final int iy = (int) Math.floor(dy);
		final double fx = dx - ix;
		final double fy = dy - iy;
		final int n = rows * cols;

		DMatrixSparseTriplet txr = new DMatrixSparseTriplet(n, n, 2 * n);
		DMatrixSparseTriplet tyr = new DMatrixSparseTriplet(n, n, 2 * n);
		for (int y = 0; y < rows; y++) {
			for (int x = 0; x < cols; x++) {
				final int row = y * cols + x;
				addTap(txr, row, y, x + ix, 1 - fx, rows, cols, threshold);
				addTap(txr, row, y, x + ix + 1, fx, rows, cols, threshold);
				addTap(tyr, row, y + iy, x, 1 - fy, rows, cols, threshold);
				addTap(tyr, row, y + iy + 1, x, fy, rows, cols, threshold);
			}
		}
		return new Translation(DConvertMatrixStruct.convert(txr, (DMatrixSparseCSC) null),
				DConvertMatrixStruct.convert(tyr, (DMatrixSparseCSC) null), fx, fy);
	}

	private static void addTap(DMatrixSparseTriplet tr, int row, int sy, int sx, double w, int rows, int cols, double threshold) {
		if (w <= 0 || w < threshold || sy < 0 || sy >= rows || sx < 0 || sx >= cols) {
			return;
		}
		tr.addItem(row, sy * cols + sx, w);
	}

	@Override
	public DMatrixSparseCSC radialMonotonic(int rows, int cols, boolean useNearest) {
		final int cy = (rows - 1) / 2, cx = (cols - 1) / 2;
		final int n = rows * cols;
		DMatrixSparseTriplet tr = new DMatrixSparseTriplet(n, n, 9 * n);

		for (int y = 0; y < rows; y++) {
			for (int x = 0; x < cols; x++) {
				if (y == cy && x == cx) {
					continue; // centre has no inward neighbour
				}
				final int row = y * cols + x;
				final double own = dist2(y - cy, x - cx);

				if (useNearest) {
					int best = -1;
					double bestD = own;
					for (int oy = -1; oy <= 1; oy++) {
						for (int ox = -1; ox <= 1; ox++) {
							int ny = y + oy, nx = x + ox;
							if ((oy == 0 && ox == 0) || ny < 0 || ny >= rows || nx < 0 || nx >= cols) {
								continue;
							}
							double d = dist2(ny - cy, nx - cx);
							if (d < bestD) {
								bestD = d;
								best = ny * cols + nx;
							}
						}
					}
					tr.addItem(row, best, 1.0);
				} else {
					// weight inward neighbours by the cosine between the step and the
					// direction to the centre
					final double ux = cx - x, uy = cy - y;
					final double un = Math.sqrt(ux * ux + uy * uy);
					double[] w = new double[9];
					double wsum = 0;
					for (int oy = -1; oy <= 1; oy++) {
						for (int ox = -1; ox <= 1; ox++) {
							int ny = y + oy, nx = x + ox;
							if ((oy == 0 && ox == 0) || ny < 0 || ny >= rows || nx < 0 || nx >= cols) {
								continue;
							}
							if (dist2(ny - cy, nx - cx) >= own) {
								continue;
							}
							double cos = (ox * ux + oy * uy) / (Math.sqrt(ox * ox + oy * oy) * un);
							if (cos > 0) {
								w[(oy + 1) * 3 + ox + 1] = cos;
								wsum += cos;
							}
						}
					}
					for (int oy = -1; oy <= 1; oy++) {
						for (int ox = -1; ox <= 1; ox++) {
							double v = w[(oy + 1) * 3 + ox + 1];
							if (v > 0) {
								tr.addItem(row, (y + oy) * cols + x + ox, v / wsum);
							}
						}
					}
				}
				tr.addItem(row, row, -1.0);
			}
		}
		return DConvertMatrixStruct.convert(tr, (DMatrixSparseCSC) null);
	}

	@Override
	public DMatrixSparseCSC symmetry(int rows, int cols) {
		final int n = rows * cols;
		DMatrixSparseTriplet tr = new DMatrixSparseTriplet(n, n, 2 * n);
		for (int i = 0; i < n; i++) {
			int mirror = n - 1 - i;
			if (mirror == i) {
				continue;
			}
			tr.addItem(i, i, 1.0);
			tr.addItem(i, mirror, -1.0);
		}
		return DConvertMatrixStruct.convert(tr, (DMatrixSparseCSC) null);
	}

	@Override
	public DMatrixSparseCSC gradientX(int rows, int cols, int cx) {
		final int n = rows * cols;
		DMatrixSparseTriplet tr = new DMatrixSparseTriplet(n, n, 2 * n);
		for (int y = 0; y < rows; y++) {
			for (int x = 0; x < cols; x++) {
				if (x == cx) {
					continue;
				}
				int row = y * cols + x;
				int step = x < cx ? 1 : -1;
				tr.addItem(row, row + step, 1.0);
				tr.addItem(row, row, -1.0);
			}
		}
		return DConvertMatrixStruct.convert(tr, (DMatrixSparseCSC) null);
	}

	@Override
	public DMatrixSparseCSC gradientY(int rows, int cols, int cy) {
		final int n = rows * cols;
		DMatrixSparseTriplet tr = new DMatrixSparseTriplet(n, n, 2 * n);
		for (int y = 0; y < rows; y++) {
			if (y == cy) {
				continue;
			}
			int step = y < cy ? cols : -cols;
			for (int x = 0; x < cols; x++) {
				int row = y * cols + x;
				tr.addItem(row, row + step, 1.0);
				tr.addItem(row, row, -1.0);
			}
		}
		return DConvertMatrixStruct.convert(tr, (DMatrixSparseCSC) null);
	}

	@Override
	public DMatrixSparseCSC identity(int rows, int cols) {
		return SparseOps.identity(rows * cols);
	}

	@Override
	public DMatrixSparseCSC zero(int rows, int cols) {
		return SparseOps.zero(rows * cols);
	}

	private static double dist2(int dy, int dx) {
		return dx * dx + dy * dy;
	}
}
