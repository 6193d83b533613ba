package com.github.micycle1.deblender;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.deblender.constraint.ConstraintOperatorAssembler;
import com.github.micycle1.deblender.constraint.ConstraintSpec;
import com.github.micycle1.deblender.constraint.ConstraintType;
import com.github.micycle1.deblender.constraint.LinearConstraint;
import com.github.micycle1.deblender.linalg.RowStackedOperator;
import com.github.micycle1.deblender.operators.OperatorFactory;
import com.github.micycle1.deblender.optimize.LipschitzStepPolicy;
import com.github.micycle1.deblender.optimize.OptimizationProblem;
import com.github.micycle1.deblender.optimize.OptimizationResult;
import com.github.micycle1.deblender.prox.ConeProjection;
import com.github.micycle1.deblender.prox.HardThreshold;
import com.github.micycle1.deblender.prox.PositiveProjection;
import com.github.micycle1.deblender.prox.ProximalOperator;
import com.github.micycle1.deblender.prox.SoftThresholdPlus;
import com.github.micycle1.deblender.prox.StrictMonotonicProximal;
import com.github.micycle1.deblender.prox.UnitSimplexProximal;

/**
 * <p>
 * Separates a multi-band image of overlapping sources into one spectrum and one
 * morphology per source, by constrained non-negative matrix factorization
 * {@code Y ≈ Σ_k A[:,k] ⊗ Γ[k] S[k]}.
 * </p>
 *
 * <p>
 * The image is first brought to odd dimensions so every morphology has a
 * centre pixel. Each morphology is modelled centred and moved to its peak by
 * the transfer operators Γ (translation, plus the PSF when one is given).
 * Spectra are kept on the unit simplex; morphologies are non-negative (or
 * sparse, with an L0/L1 threshold) and may additionally be constrained to be
 * monotonic, symmetric or to have positive gradients.
 * </p>
 *
 * <p>
 * Example:
 * </p>
 *
 * <pre>
 * DeblendResult result = Deblender.deblend(img, DeblendOptions.builder()
 * 		.peaks(List.of(Peak.of(12, 20), Peak.of(30, 18)))
 * 		.constraints("M")
 * 		.build());
 * </pre>
 */
public final class Deblender {

	private static final Logger logger = LoggerFactory.getLogger(Deblender.class);

	private Deblender() {
	}

	/**
	 * @param img     B x N x M band stack
	 * @param options settings, see {@link DeblendOptions}
	 * @return spectra, morphologies and the reconstructed model, all at the odd
	 *         working shape
	 * @throws IllegalArgumentException for inconsistent shapes or settings
	 * @throws IllegalStateException    if the optimization becomes numerically
	 *                                  invalid
	 */
	public static DeblendResult deblend(double[][][] img, DeblendOptions options) {
		final DiagnosticListener listener = options.getListener();
		final OperatorFactory factory = options.getOperatorFactory();
		final boolean truncate = options.isTruncate();

		final int[] inputShape = ImageShapes.shapeOf(img);
		if (options.getWeights() != null) {
			ImageShapes.checkSameShape("Weights", img, options.getWeights());
		}
		if (options.getSky() != null) {
			ImageShapes.checkSameShape("Sky", img, options.getSky());
		}

		double[][][] image = ImageShapes.reshapeToOdd(img, truncate, 0);
		double[][][] weights = options.getWeights();
		double[][][] sky = options.getSky();
		if (image != img) {
			int[] shape = ImageShapes.shapeOf(image);
			listener.onEvent(DiagnosticEvent.of(DiagnosticEvent.Kind.IMAGE_RESHAPED,
					"Reshaped image from " + Arrays.toString(inputShape) + " to " + Arrays.toString(shape)));
			weights = weights == null ? null : ImageShapes.reshape(weights, shape, 0);
			sky = sky == null ? null : ImageShapes.reshape(sky, shape, 0);
		}
		final int bands = image.length, rows = image[0].length, cols = image[0][0].length;
		final int declared = options.getComponents();
		final int garbage = options.getGarbageCollectors();
		final int components = declared + garbage;
		logger.debug("Shape: ({}, {}, {}), components: {} + {}", bands, rows, cols, declared, garbage);

		// resolve constraints before any operator is built
		ConstraintSpec spec = options.getConstraintList() != null ? ConstraintSpec.perComponent(options.getConstraintList(), declared, garbage)
				: ConstraintSpec.uniform(options.getConstraints(), declared, garbage);

		double[][] data = ImageShapes.flatten(image);
		if (sky != null) {
			double[][] s = ImageShapes.flatten(sky);
			for (int b = 0; b < bands; b++) {
				for (int i = 0; i < data[b].length; i++) {
					data[b][i] -= s[b][i];
				}
			}
		}
		double[][] w = null;
		double wMax = 1;
		if (weights != null) {
			w = ImageShapes.flatten(weights);
			wMax = 0;
			for (double[] row : w) {
				for (double v : row) {
					if (v < 0 || !Double.isFinite(v)) {
						throw new IllegalArgumentException("Weights must be non-negative and finite but found " + v);
					}
					wMax = Math.max(wMax, v);
				}
			}
			if (wMax == 0) {
				throw new IllegalArgumentException("At least one weight must be positive");
			}
		}

		PsfOperators psf = null;
		if (options.getPsf() != null) {
			psf = PsfOperators.adapt(options.getPsf(), rows, cols, options.getPsfThreshold(), factory);
		} else if (options.getPsfPerBand() != null) {
			psf = PsfOperators.adaptPerBand(options.getPsfPerBand(), bands, rows, cols, options.getPsfThreshold(), factory);
		}

		// garbage collectors have no peak
		List<Peak> peaks = null;
		if (options.getPeaks() != null) {
			peaks = new ArrayList<>(options.getPeaks());
			peaks.addAll(Collections.nCopies(garbage, (Peak) null));
		}

		Random random = options.getSeed() == null ? new Random() : new Random(options.getSeed());
		FactorInitializer initializer = new FactorInitializer(random, listener);
		double[][] a0 = initializer.initSpectra(bands, components, peaks, image);
		double[][] s0 = initializer.initMorphologies(rows, cols, components, peaks, image);
		// no peak list at all: no translation
		TransferOperators transfer = peaks == null ? TransferOperators.disabled(psf, bands)
				: TransferOperators.compose(peaks, bands, rows, cols, psf, factory, options.getTranslationThreshold());

		ProximalOperator proxS = options.getProxS() != null ? options.getProxS() : sparsityProximal(options, listener);
		ProximalOperator proxA = options.getProxA() != null ? options.getProxA() : UnitSimplexProximal.INSTANCE;
		List<LinearConstraint> constraintsS = buildConstraints(spec, rows, cols, proxS, options);
		logger.debug("proxA: {}", proxA);
		logger.debug("proxS: {}", proxS);
		logger.debug("constraints on S: {}", constraintsS);

		ProximalGradientStep objective = new ProximalGradientStep(data, w, transfer, proxA, proxS);
		OptimizationProblem problem = new OptimizationProblem(a0, s0, objective, new LipschitzStepPolicy(wMax, options.getSlack()), null,
				constraintsS, options.getMaxIter(), options.getERel(), options.isTraceback());
		OptimizationResult result = options.getRuntime().run(problem);
		logger.debug("Finished after {} iterations (converged: {})", result.getIterations(), result.isConverged());

		double[][][] model = ForwardModel.model(result.getA(), result.getS(), transfer, rows, cols);
		return new DeblendResult(result.getA(), ImageShapes.unflatten(result.getS(), rows, cols), model, psf, transfer, result.getIterations(),
				result.isConverged(), result.getTrace());
	}

	private static ProximalOperator sparsityProximal(DeblendOptions options, DiagnosticListener listener) {
		Double l0 = options.getL0Threshold();
		Double l1 = options.getL1Threshold();
		if (l0 != null) {
			if (l1 != null) {
				listener.onEvent(DiagnosticEvent.of(DiagnosticEvent.Kind.L1_IGNORED, "l1 threshold ignored in favor of l0 threshold"));
			}
			return new HardThreshold(l0);
		}
		if (l1 != null) {
			return new SoftThresholdPlus(l1);
		}
		return PositiveProjection.INSTANCE;
	}

	private static List<LinearConstraint> buildConstraints(ConstraintSpec spec, int rows, int cols, ProximalOperator proxS,
			DeblendOptions options) {
		List<LinearConstraint> constraints = new ArrayList<>();
		if (spec.isEmpty()) {
			return constraints;
		}
		ConstraintOperatorAssembler assembler = new ConstraintOperatorAssembler(options.getOperatorFactory(), options.isMonotonicUseNearest());
		for (Map.Entry<ConstraintType, boolean[]> e : spec.getSeeks().entrySet()) {
			ConstraintType type = e.getKey();
			boolean[] seeks = e.getValue();
			if (type == ConstraintType.STRICT_MONOTONIC) {
				constraints.add(new LinearConstraint(type, null, strictMonotonic(rows, cols, seeks, proxS, options)));
			} else {
				RowStackedOperator op = assembler.assemble(type, rows, cols, seeks);
				constraints.add(new LinearConstraint(type, op, type.linearProximal()));
			}
		}
		return constraints;
	}

	private static ProximalOperator strictMonotonic(int rows, int cols, boolean[] seeks, ProximalOperator proxS, DeblendOptions options) {
		switch (options.getMonotonicEnforcement()) {
			case PIXELWISE:
				return StrictMonotonicProximal.build(rows, cols, seeks, proxS, options.getStrictMonotonicThreshold(), options.getOperatorFactory(),
						options.getPixelwiseEnforcer());
			case CONE:
			default:
				return ConeProjection.radialMonotonic(rows, cols, options.getOperatorFactory(), options.getConeFacetOrder(), seeks).andThen(proxS);
		}
	}
}
