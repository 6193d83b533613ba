package com.github.micycle1.deblender.prox;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.deblender.linalg.SparseOps;
import com.github.micycle1.deblender.operators.StandardOperatorFactory;
import com.github.micycle1.deblender.prox.ConeProjection.FacetOrder;

/**
 * Compares the facet-walk cone projection against the nearest point of the
 * cone, found by solving {@code min |x - y|^2 s.t. G x >= 0} with ojAlgo's
 * convex solver. The facet walk always lands in the cone, but is not always
 * the nearest point.
 */
public class ConeProjectionReferenceTest {

	private static final Logger LOGGER = LoggerFactory.getLogger(ConeProjectionReferenceTest.class);

	private static final int ROWS = 100;
	private static final double EXACT_TOL = 1e-5;

	private final StandardOperatorFactory factory = new StandardOperatorFactory();

	private double[][] normals(int rows, int cols) {
		return SparseOps.toDenseRows(factory.radialMonotonic(rows, cols, true));
	}

	private static double[] nearestInCone(double[][] g, double[] y) {
		final int n = y.length;
		ExpressionsBasedModel model = new ExpressionsBasedModel();
		Variable[] x = new Variable[n];
		for (int i = 0; i < n; i++) {
			x[i] = model.addVariable("x" + i);
		}
		// 0.5 |x|^2 - y.x
		Expression objective = model.addExpression("objective").weight(1.0);
		for (int i = 0; i < n; i++) {
			objective.set(x[i], x[i], 0.5);
			objective.set(x[i], -y[i]);
		}
		for (int r = 0; r < g.length; r++) {
			Expression row = model.addExpression("g" + r).lower(0.0);
			for (int i = 0; i < n; i++) {
				if (g[r][i] != 0) {
					row.set(x[i], g[r][i]);
				}
			}
		}
		Optimisation.Result result = model.minimise();
		assertTrue(result.getState().isFeasible(), "reference solve failed: " + result.getState());
		double[] out = new double[n];
		for (int i = 0; i < n; i++) {
			out[i] = result.doubleValue(i);
		}
		return out;
	}

	private static double distance(double[] a, double[] b) {
		double s = 0;
		for (int i = 0; i < a.length; i++) {
			s += (a[i] - b[i]) * (a[i] - b[i]);
		}
		return Math.sqrt(s);
	}

	private static double minSlack(double[][] g, double[] x) {
		double min = Double.POSITIVE_INFINITY;
		for (double[] row : g) {
			double s = 0;
			for (int i = 0; i < x.length; i++) {
				s += row[i] * x[i];
			}
			min = Math.min(min, s);
		}
		return min;
	}

	/** Extra distance over the nearest point, per input row. */
	private double[] gaps(int size, FacetOrder order, long seed) {
		double[][] g = normals(size, size);
		ConeProjection cone = new ConeProjection(g, order, null);
		Random rnd = new Random(seed);
		double[] gaps = new double[ROWS];
		for (int r = 0; r < ROWS; r++) {
			double[] y = new double[size * size];
			for (int i = 0; i < y.length; i++) {
				y[i] = rnd.nextGaussian();
			}
			double[] p = cone.project(y);
			double[] ref = nearestInCone(g, y);
			assertTrue(minSlack(g, p) >= -1e-9);
			assertTrue(minSlack(g, ref) >= -1e-6);
			gaps[r] = distance(p, y) - distance(ref, y);
			// nothing in the cone is closer than the reference
			assertTrue(gaps[r] >= -1e-6, "reference not optimal, gap " + gaps[r]);
		}
		return gaps;
	}

	private static int nonExact(double[] gaps) {
		int count = 0;
		for (double d : gaps) {
			if (d > EXACT_TOL) {
				count++;
			}
		}
		return count;
	}

	private static double sum(double[] gaps) {
		double s = 0;
		for (double d : gaps) {
			s += Math.max(d, 0);
		}
		return s;
	}

	private static double worst(double[] gaps) {
		double w = 0;
		for (double d : gaps) {
			w = Math.max(w, d);
		}
		return w;
	}

	@Test
	void largestCrossingIsNearestOn3x3() {
		double[] gaps = gaps(3, FacetOrder.LARGEST_CROSSING, 11);
		assertEquals(0, nonExact(gaps), "worst gap " + worst(gaps));
	}

	@Test
	void facetOrdersAgainstNearestPointOn5x5() {
		double[] largest = gaps(5, FacetOrder.LARGEST_CROSSING, 5);
		double[] nearest = gaps(5, FacetOrder.NEAREST_CROSSING, 5);
		LOGGER.info("5x5 LARGEST_CROSSING: {}/{} rows off the nearest point, worst extra distance {}", nonExact(largest), ROWS,
				worst(largest));
		LOGGER.info("5x5 NEAREST_CROSSING: {}/{} rows off the nearest point, worst extra distance {}", nonExact(nearest), ROWS,
				worst(nearest));

		// neither rule is exact on larger grids
		assertTrue(nonExact(nearest) > 0);
		assertTrue(sum(largest) <= sum(nearest));
	}
}
