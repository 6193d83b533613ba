package com.github.micycle1.deblender.prox;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.stream.IntStream;

import org.ejml.data.DMatrixSparseCSC;

import com.github.micycle1.deblender.linalg.DenseNorms;
import com.github.micycle1.deblender.operators.OperatorFactory;

/**
 * Strict monotonicity through a {@link PixelwiseMonotonicEnforcer}, followed
 * by an optional secondary proximal (non-negativity or sparsity) so that the
 * secondary constraint holds exactly on the output.
 */
public final class StrictMonotonicProximal implements ProximalOperator {

	private final PixelwiseMonotonicEnforcer enforcer;
	private final boolean[] seeks;
	private final int[] distanceOrder;
	private final int[] reference;
	private final double threshold;
	private final ProximalOperator chain;

	StrictMonotonicProximal(PixelwiseMonotonicEnforcer enforcer, boolean[] seeks, int[] distanceOrder, int[] reference, double threshold,
			ProximalOperator chain) {
		this.enforcer = Objects.requireNonNull(enforcer, "enforcer must not be null");
		this.seeks = seeks.clone();
		this.distanceOrder = distanceOrder;
		this.reference = reference;
		this.threshold = threshold;
		this.chain = chain;
	}

	/**
	 * Precomputes the pixel ordering and inward references for an odd
	 * {@code rows x cols} image. References come from the nearest-neighbour radial
	 * monotonicity operator of {@code factory}: the single {@code +1} entry of each
	 * row.
	 */
	public static StrictMonotonicProximal build(int rows, int cols, boolean[] seeks, ProximalOperator chain, double threshold,
			OperatorFactory factory, PixelwiseMonotonicEnforcer enforcer) {
		if (rows % 2 == 0 || cols % 2 == 0) {
			throw new IllegalArgumentException("Shape must have an odd width and height, received shape (" + rows + ", " + cols + ")");
		}
		final int n = rows * cols;
		DMatrixSparseCSC op = factory.radialMonotonic(rows, cols, true);
		int[] reference = IntStream.range(0, n).toArray();
		for (int j = 0; j < op.numCols; j++) {
			for (int p = op.col_idx[j], pe = op.col_idx[j + 1]; p < pe; p++) {
				if (op.nz_values[p] == 1.0) {
					reference[op.nz_rows[p]] = j;
				}
			}
		}

		final int cy = (rows - 1) >> 1;
		final int cx = (cols - 1) >> 1;
		double[] distance = new double[n];
		for (int y = 0; y < rows; y++) {
			for (int x = 0; x < cols; x++) {
				distance[y * cols + x] = Math.hypot(x - cx, y - cy);
			}
		}
		int[] order = IntStream.range(0, n).boxed().sorted(Comparator.comparingDouble((Integer i) -> distance[i])).mapToInt(Integer::intValue)
				.toArray();
		return new StrictMonotonicProximal(enforcer, seeks, order, reference, threshold, chain);
	}

	@Override
	public double[][] apply(double[][] x, double step) {
		double[][] out = DenseNorms.copy(x);
		enforcer.enforce(out, step, seeks, distanceOrder, reference, threshold);
		return chain == null ? out : chain.apply(out, step);
	}

	public int[] getReference() {
		return reference.clone();
	}

	public int[] getDistanceOrder() {
		return distanceOrder.clone();
	}

	@Override
	public String toString() {
		return "StrictMonotonicProximal[seeks=" + Arrays.toString(seeks) + ", threshold=" + threshold + (chain == null ? "" : ", then " + chain) + "]";
	}
}
