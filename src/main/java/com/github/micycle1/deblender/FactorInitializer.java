package com.github.micycle1.deblender;

import java.util.List;
import java.util.Objects;
import java.util.Random;

import com.github.micycle1.deblender.prox.UnitSimplexProximal;

/**
 * Builds the starting spectral and morphology factors from the peak positions.
 * <p>
 * Spectra are sampled at each peak pixel and normalised onto the unit simplex.
 * Morphologies start as a spike at the image centre, which is where the
 * transfer operators map each peak. Components without a usable peak fall back
 * to random non-negative values, and the fallback is reported to the listener.
 */
public class FactorInitializer {

	private static final double TINY = 1e-10;

	private final Random random;
	private final DiagnosticListener listener;

	public FactorInitializer(Random random, DiagnosticListener listener) {
		this.random = Objects.requireNonNull(random, "random must not be null");
		this.listener = listener == null ? DiagnosticListener.NONE : listener;
	}

	/**
	 * @param bands      B
	 * @param components K (including garbage collectors)
	 * @param peaks      one entry per component (null entries allowed), or null
	 *                   for a fully random start
	 * @param img        B x N x M image the peaks are sampled from; required when
	 *                   peaks are given
	 * @return B x K spectra with every column on the unit simplex
	 */
	public double[][] initSpectra(int bands, int components, List<Peak> peaks, double[][][] img) {
		double[][] a = new double[bands][components];
		if (peaks == null) {
			for (int b = 0; b < bands; b++) {
				for (int k = 0; k < components; k++) {
					a[b][k] = random.nextDouble();
				}
			}
			return UnitSimplexProximal.INSTANCE.apply(a, 0);
		}
		checkPeaks(peaks, components, img);
		for (int k = 0; k < components; k++) {
			Peak peak = peaks.get(k);
			if (peak == null) {
				listener.onEvent(new DiagnosticEvent(DiagnosticEvent.Kind.RANDOM_SPECTRUM, k, "Using random spectrum for component " + k));
				randomColumn(a, k);
				continue;
			}
			boolean flux = false;
			for (int b = 0; b < bands; b++) {
				a[b][k] = img[b][peak.row()][peak.column()];
				flux |= a[b][k] > 0;
			}
			if (!flux) {
				listener.onEvent(new DiagnosticEvent(DiagnosticEvent.Kind.ZERO_FLUX_PEAK, k,
						"Peak " + k + " at " + peak + " has no flux, using random spectrum"));
				randomColumn(a, k);
			}
		}
		return UnitSimplexProximal.INSTANCE.apply(a, 0);
	}

	/**
	 * @return K x (rows*cols) morphologies
	 */
	public double[][] initMorphologies(int rows, int cols, int components, List<Peak> peaks, double[][][] img) {
		final int n = rows * cols;
		final int centre = (rows / 2) * cols + cols / 2;
		double[][] s = new double[components][n];
		if (img == null || peaks == null) {
			for (int k = 0; k < components; k++) {
				s[k][centre] = 1;
			}
			return s;
		}
		checkPeaks(peaks, components, img);
		for (int k = 0; k < components; k++) {
			Peak peak = peaks.get(k);
			if (peak == null) {
				listener.onEvent(new DiagnosticEvent(DiagnosticEvent.Kind.RANDOM_MORPHOLOGY, k, "Using random morphology for component " + k));
				for (int i = 0; i < n; i++) {
					s[k][i] = random.nextDouble();
				}
				continue;
			}
			double mean = 0;
			for (double[][] band : img) {
				mean += band[peak.row()][peak.column()];
			}
			mean /= img.length;
			s[k][centre] = Math.abs(mean) + TINY;
		}
		return s;
	}

	private void randomColumn(double[][] a, int k) {
		for (double[] row : a) {
			row[k] = random.nextDouble();
		}
	}

	private static void checkPeaks(List<Peak> peaks, int components, double[][][] img) {
		if (img == null) {
			throw new IllegalArgumentException("An image is required to initialize from peaks");
		}
		if (peaks.size() != components) {
			throw new IllegalArgumentException("Expected " + components + " peaks but got " + peaks.size());
		}
		final int rows = img[0].length, cols = img[0][0].length;
		for (Peak p : peaks) {
			if (p != null && (p.x < 0 || p.y < 0 || p.row() < 0 || p.row() >= rows || p.column() < 0 || p.column() >= cols)) {
				throw new IllegalArgumentException("Peak " + p + " lies outside the " + rows + "x" + cols + " image");
			}
		}
	}
}
