package com.github.micycle1.deblender.prox;

import java.util.ArrayList;
import java.util.List;

import com.github.micycle1.deblender.linalg.SparseOps;
import com.github.micycle1.deblender.operators.OperatorFactory;

/**
 * <p>
 * Maps each morphology row onto the polyhedral cone
 * {@code {x : G_i · x >= 0 for every row G_i of G}}.
 * </p>
 *
 * <p>
 * The result is found by successive facet projection. An interior
 * reference point Q (a spike of magnitude n at index (n-1)/2, the centre pixel
 * of an odd image) is "ray-cast" from the current point Y: every violated
 * half-space is crossed somewhere along the segment Y to Q, at fraction
 * {@code t = -Y_p / (Q_p - Y_p)} where {@code Y_p, Q_p} are the signed scalar
 * projections onto the half-space normal. One crossed facet is selected, and Y,
 * Q and every remaining normal are projected onto the hyperplane orthogonal to
 * it. The selected facet is dropped, so the loop ends after at most n
 * iterations, earlier once no half-space is violated.
 * </p>
 *
 * <p>
 * Every dropped facet stays active (Y remains orthogonal to it), and the
 * remaining normals are tested in the projected space, where their sign agrees
 * with the original inequality. The output therefore satisfies every original
 * half-space. Projecting an already feasible row returns it unchanged.
 * </p>
 *
 * <p>
 * The output is not always the nearest point of the cone. With
 * {@link FacetOrder#LARGEST_CROSSING} it is on 3x3 grids and 1-D profiles; on
 * 5x5 grids about half of random rows land farther away than the nearest point
 * (by up to roughly 0.35 in Euclidean distance).
 * {@link FacetOrder#NEAREST_CROSSING} misses more often and by more.
 * </p>
 *
 * <p>
 * Which crossed facet to select is configurable, see {@link FacetOrder}.
 * </p>
 */
public final class ConeProjection implements ProximalOperator {

	/**
	 * Facet selection rule among the violated half-spaces.
	 */
	public enum FacetOrder {
		/** Select the facet crossed last on the way from Y to Q. */
		LARGEST_CROSSING,
		/** Select the facet crossed first on the way from Y to Q. */
		NEAREST_CROSSING
	}

	private static final double NORMAL_EPS = 1e-12;
	private static final double DEGENERATE_RATIO = 1e-9;

	private final double[][] normals;
	private final FacetOrder order;
	private final boolean[] seeks;

	/**
	 * @param normals half-space normals, one per row; each must have the length of
	 *                the projected rows
	 * @param order   facet selection rule
	 * @param seeks   per-row flag; rows with a false flag are passed through. Null
	 *                means every row is projected.
	 */
	public ConeProjection(double[][] normals, FacetOrder order, boolean[] seeks) {
		if (normals.length == 0) {
			throw new IllegalArgumentException("Cone needs at least one half-space");
		}
		final int n = normals[0].length;
		for (double[] g : normals) {
			if (g.length != n) {
				throw new IllegalArgumentException("Half-space normals must share one dimension");
			}
		}
		this.normals = normals;
		this.order = order == null ? FacetOrder.LARGEST_CROSSING : order;
		this.seeks = seeks == null ? null : seeks.clone();
	}

	/**
	 * Cone of radially monotonic profiles on an odd {@code rows x cols} image,
	 * using the nearest-inward-neighbour monotonicity operator.
	 */
	public static ConeProjection radialMonotonic(int rows, int cols, OperatorFactory factory, FacetOrder order, boolean[] seeks) {
		if (rows % 2 == 0 || cols % 2 == 0) {
			throw new IllegalArgumentException("Shape must have an odd width and height, received shape (" + rows + ", " + cols + ")");
		}
		return new ConeProjection(SparseOps.toDenseRows(factory.radialMonotonic(rows, cols, true)), order, seeks);
	}

	public FacetOrder getFacetOrder() {
		return order;
	}

	public int getDimension() {
		return normals[0].length;
	}

	@Override
	public double[][] apply(double[][] x, double step) {
		if (seeks != null && seeks.length != x.length) {
			throw new IllegalArgumentException("Expected " + seeks.length + " rows but got " + x.length);
		}
		double[][] out = new double[x.length][];
		for (int k = 0; k < x.length; k++) {
			out[k] = (seeks == null || seeks[k]) ? project(x[k]) : x[k].clone();
		}
		return out;
	}

	/**
	 * Projects a single row onto the cone.
	 */
	public double[] project(double[] row) {
		final int n = getDimension();
		if (row.length != n) {
			throw new IllegalArgumentException("Row length " + row.length + " does not match cone dimension " + n);
		}
		double[] y = row.clone();
		double[] q = new double[n];
		q[(n - 1) / 2] = n;

		List<Facet> vs = new ArrayList<>(normals.length);
		for (double[] g : normals) {
			double n0 = norm(g);
			if (n0 > 0) {
				vs.add(new Facet(g.clone(), n0));
			}
		}

		for (int iter = 0; iter < n && !vs.isEmpty(); iter++) {
			int index = selectFacet(y, q, vs);
			if (index < 0) {
				break; // feasible
			}
			double[] u = vs.remove(index).normal;
			projectOut(y, u);
			projectOut(q, u);
			for (Facet f : vs) {
				projectOut(f.normal, u);
			}
		}
		return y;
	}

	private int selectFacet(double[] y, double[] q, List<Facet> vs) {
		final double tol = NORMAL_EPS * (1.0 + norm(y));
		int index = -1;
		double best = 0;
		for (int i = 0; i < vs.size(); i++) {
			Facet f = vs.get(i);
			double[] v = f.normal;
			double nv = norm(v);
			if (nv < DEGENERATE_RATIO * f.initialNorm) {
				continue; // dependent on facets already used
			}
			double yp = dot(y, v) / nv;
			if (yp >= -tol) {
				continue;
			}
			double qp = dot(q, v) / nv;
			double denom = qp - yp;
			// Q on the violated side as well: count the facet as crossed at Q
			double t = denom > 0 ? -yp / denom : 1.0;
			if (index < 0 || (order == FacetOrder.LARGEST_CROSSING ? t > best : t < best)) {
				best = t;
				index = i;
			}
		}
		return index;
	}

	private static final class Facet {
		final double[] normal;
		final double initialNorm;

		Facet(double[] normal, double initialNorm) {
			this.normal = normal;
			this.initialNorm = initialNorm;
		}
	}

	// a <- a - (a.u / u.u) u
	private static void projectOut(double[] a, double[] u) {
		double uu = dot(u, u);
		if (uu == 0) {
			return;
		}
		double f = dot(a, u) / uu;
		if (f == 0) {
			return;
		}
		for (int i = 0; i < a.length; i++) {
			a[i] -= f * u[i];
		}
	}

	private static double dot(double[] a, double[] b) {
		double s = 0.0;
		for (int i = 0; i < a.length; i++) {
			s += a[i] * b[i];
		}
		return s;
	}

	private static double norm(double[] a) {
		return Math.sqrt(dot(a, a));
	}

	@Override
	public String toString() {
		return "ConeProjection[" + normals.length + " half-spaces, " + order + "]";
	}
}
