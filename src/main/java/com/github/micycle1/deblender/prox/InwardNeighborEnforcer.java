package com.github.micycle1.deblender.prox;

/**
 * Walks outwards from the centre and clips every pixel to its inward
 * neighbour's value plus the threshold. Since references are always closer to
 * the centre, they are final by the time a pixel is visited.
 */
public class InwardNeighborEnforcer implements PixelwiseMonotonicEnforcer {

	@Override
	public void enforce(double[][] x, double step, boolean[] seeks, int[] distanceOrder, int[] reference, double threshold) {
		for (int k = 0; k < x.length; k++) {
			if (seeks != null && !seeks[k]) {
				continue;
			}
			double[] row = x[k];
			for (int i : distanceOrder) {
				int ref = reference[i];
				if (ref == i) {
					continue;
				}
				double cap = row[ref] + threshold;
				if (row[i] > cap) {
					row[i] = cap;
				}
			}
		}
	}
}
