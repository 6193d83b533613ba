package com.github.micycle1.deblender;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.micycle1.deblender.DeblendOptions.MonotonicEnforcement;
import com.github.micycle1.deblender.linalg.DenseNorms;
import com.github.micycle1.deblender.operators.StandardOperatorFactory;
import com.github.micycle1.deblender.prox.ConeProjection.FacetOrder;

public class DeblenderTest {

	private static final int ROWS = 11, COLS = 11;
	private static final double[][] SPECTRA = { { 0.8, 0.3 }, { 0.2, 0.7 } };
	private static final List<Peak> PEAKS = List.of(Peak.of(3, 5), Peak.of(7, 4));

	private final List<DiagnosticEvent> events = new ArrayList<>();

	/** Two overlapping Gaussian sources in two bands. */
	private static double[][][] blend() {
		double[][] s = { TestImages.gaussian(ROWS, COLS, 1.2), TestImages.gaussian(ROWS, COLS, 1.0) };
		TransferOperators t = TransferOperators.compose(PEAKS, 2, ROWS, COLS, null, new StandardOperatorFactory(), 1e-8);
		return ForwardModel.model(SPECTRA, s, t, ROWS, COLS);
	}

	private DeblendOptions.Builder options() {
		return DeblendOptions.builder().peaks(PEAKS).seed(1L).listener(events::add);
	}

	@Test
	void twoSourcesReconstructed() {
		double[][][] img = blend();
		DeblendResult result = Deblender.deblend(img, options().maxIter(500).eRel(0).build());

		assertEquals(500, result.getIterations());
		double[][] flatImg = ImageShapes.flatten(img);
		double[][] flatModel = ImageShapes.flatten(result.getModel());
		assertTrue(DenseNorms.frobeniusDistance(flatImg, flatModel) < 1e-2 * DenseNorms.frobenius(flatImg));
		for (int b = 0; b < 2; b++) {
			for (int k = 0; k < 2; k++) {
				assertEquals(SPECTRA[b][k], result.getA()[b][k], 0.05, "A[" + b + "][" + k + "]");
			}
		}
		assertEquals(2, result.getS().length);
		assertEquals(ROWS, result.getS()[0].length);
		assertEquals(2, result.getTx().size());
		assertNull(result.getPsf());
		assertNull(result.getTrace());
		assertTrue(events.isEmpty());
	}

	@Test
	void monotonicConstraintKeepsFactorsValid() {
		DeblendResult result = Deblender.deblend(blend(), options().constraints("MS").maxIter(50).traceback(true).build());
		for (int k = 0; k < 2; k++) {
			assertEquals(1.0, result.getA()[0][k] + result.getA()[1][k], 1e-9);
		}
		for (double[][] sk : result.getS()) {
			for (double[] row : sk) {
				for (double v : row) {
					assertTrue(v >= 0);
				}
			}
		}
		assertEquals(result.getIterations(), result.getTrace().size());
	}

	@Test
	void strictMonotonicEnforcementModes() {
		double[][][] img = ImageShapes.reshape(blend(), new int[] { 2, 7, 7 }, 0);
		List<Peak> peaks = List.of(Peak.of(3, 3));
		for (MonotonicEnforcement mode : MonotonicEnforcement.values()) {
			DeblendResult result = Deblender.deblend(img, DeblendOptions.builder().peaks(peaks).constraints("m").monotonicEnforcement(mode)
					.coneFacetOrder(FacetOrder.NEAREST_CROSSING).garbageCollectors(1).maxIter(10).seed(3L).listener(events::add).build());
			assertEquals(2, result.getS().length);
			assertEquals(7, result.getModel()[0].length);
		}
	}

	@Test
	void perComponentConstraints() {
		DeblendResult result = Deblender.deblend(blend(), options().constraints(Arrays.asList("M", null)).maxIter(5).build());
		assertTrue(result.getIterations() > 0 && result.getIterations() <= 5);
	}

	@Test
	void l0TakesPrecedenceOverL1() {
		Deblender.deblend(blend(), options().l0Threshold(0.01).l1Threshold(0.01).maxIter(1).build());
		assertTrue(events.stream().anyMatch(e -> e.getKind() == DiagnosticEvent.Kind.L1_IGNORED));
	}

	@Test
	void garbageCollectorsStartRandom() {
		DeblendResult result = Deblender.deblend(blend(), options().garbageCollectors(1).maxIter(2).build());
		assertEquals(3, result.getA()[0].length);
		assertEquals(3, result.getS().length);
		assertTrue(events.stream().anyMatch(e -> e.getKind() == DiagnosticEvent.Kind.RANDOM_SPECTRUM && e.getComponent() == 2));
		assertTrue(events.stream().anyMatch(e -> e.getKind() == DiagnosticEvent.Kind.RANDOM_MORPHOLOGY && e.getComponent() == 2));
	}

	@Test
	void evenImageIsPaddedOrTruncated() {
		double[][][] img = ImageShapes.reshape(blend(), new int[] { 2, 10, 10 }, 0);
		DeblendResult padded = Deblender.deblend(img, options().maxIter(1).build());
		assertEquals(11, padded.getModel()[0].length);
		assertEquals(DiagnosticEvent.Kind.IMAGE_RESHAPED, events.get(0).getKind());

		DeblendResult truncated = Deblender.deblend(img, options().truncate(true).maxIter(1).build());
		assertEquals(9, truncated.getS()[0].length);
		assertEquals(9, truncated.getS()[0][0].length);
	}

	@Test
	void psfAndWeightsAccepted() {
		double[][][] img = blend();
		double[][][] weights = new double[2][ROWS][COLS];
		for (double[][] band : weights) {
			for (double[] row : band) {
				Arrays.fill(row, 2.0);
			}
		}
		DeblendResult result = Deblender.deblend(img,
				options().psf(TestImages.smallPsf()).weights(weights).sky(new double[2][ROWS][COLS]).maxIter(3).build());
		assertNotNull(result.getPsf());
		assertTrue(result.getPsf().isShared());
	}

	@Test
	void runsWithoutPeaks() {
		DeblendResult result = Deblender.deblend(blend(), DeblendOptions.builder().components(2).seed(5L).maxIter(3).listener(events::add).build());
		assertEquals(2, result.getS().length);
		assertTrue(events.isEmpty());
		assertTrue(result.getTransfer().isTranslationDisabled());
		assertNull(result.getTx());
		assertNull(result.getTy());
	}

	@Test
	void weightShapeMismatchRejected() {
		double[][][] weights = new double[2][ROWS][COLS - 2];
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
				() -> Deblender.deblend(blend(), options().weights(weights).build()));
		assertTrue(e.getMessage().contains("Weights"));
	}

	@Test
	void negativeWeightsRejected() {
		double[][][] weights = new double[2][ROWS][COLS];
		weights[0][0][0] = -1;
		assertThrows(IllegalArgumentException.class, () -> Deblender.deblend(blend(), options().weights(weights).build()));
	}

	@Test
	void unknownConstraintRejected() {
		assertThrows(IllegalArgumentException.class, () -> Deblender.deblend(blend(), options().constraints("Z").build()));
	}

	@Test
	void peakOutsideImageRejected() {
		DeblendOptions opts = DeblendOptions.builder().peaks(List.of(Peak.of(20, 3))).build();
		assertThrows(IllegalArgumentException.class, () -> Deblender.deblend(blend(), opts));
	}

	@Test
	void invalidOptionsRejected() {
		assertThrows(IllegalArgumentException.class, () -> DeblendOptions.builder().build());
		assertThrows(IllegalArgumentException.class, () -> DeblendOptions.builder().peaks(PEAKS).slack(0).build());
		assertThrows(IllegalArgumentException.class, () -> DeblendOptions.builder().peaks(PEAKS).maxIter(-1).build());
		assertThrows(IllegalArgumentException.class, () -> DeblendOptions.builder().peaks(PEAKS).components(3).build());
	}
}
