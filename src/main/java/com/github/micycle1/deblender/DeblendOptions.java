package com.github.micycle1.deblender;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.micycle1.deblender.operators.OperatorFactory;
import com.github.micycle1.deblender.operators.StandardOperatorFactory;
import com.github.micycle1.deblender.optimize.AlternatingProximalRuntime;
import com.github.micycle1.deblender.optimize.LipschitzStepPolicy;
import com.github.micycle1.deblender.optimize.OptimizationProblem;
import com.github.micycle1.deblender.optimize.OptimizationRuntime;
import com.github.micycle1.deblender.prox.ConeProjection.FacetOrder;
import com.github.micycle1.deblender.prox.InwardNeighborEnforcer;
import com.github.micycle1.deblender.prox.PixelwiseMonotonicEnforcer;
import com.github.micycle1.deblender.prox.ProximalOperator;

/**
 * Settings of a {@link Deblender#deblend(double[][][], DeblendOptions)} call.
 * Build instances with {@link #builder()}; unset values take the defaults
 * documented on each builder method.
 */
public final class DeblendOptions {

	/**
	 * How the strict monotonic constraint ("m") is enforced.
	 */
	public enum MonotonicEnforcement {
		/** Exact Euclidean projection onto the monotonicity cone. */
		CONE,
		/** Pixel-by-pixel clipping to the inward neighbour, walking outwards. */
		PIXELWISE
	}

	public static final double DEFAULT_PSF_THRESHOLD = 1e-2;
	public static final double DEFAULT_TRANSLATION_THRESHOLD = 1e-8;

	private final List<Peak> peaks;
	private final int components;
	private final String constraints;
	private final List<String> constraintList;
	private final double[][][] weights;
	private final double[][] psf;
	private final double[][][] psfPerBand;
	private final double[][][] sky;
	private final Double l0Threshold;
	private final Double l1Threshold;
	private final int maxIter;
	private final double eRel;
	private final double psfThreshold;
	private final double translationThreshold;
	private final boolean monotonicUseNearest;
	private final boolean traceback;
	private final int garbageCollectors;
	private final boolean truncate;
	private final double slack;
	private final ProximalOperator proxA;
	private final ProximalOperator proxS;
	private final FacetOrder coneFacetOrder;
	private final MonotonicEnforcement monotonicEnforcement;
	private final double strictMonotonicThreshold;
	private final Long seed;
	private final DiagnosticListener listener;
	private final OperatorFactory operatorFactory;
	private final OptimizationRuntime runtime;
	private final PixelwiseMonotonicEnforcer pixelwiseEnforcer;

	private DeblendOptions(Builder b) {
		this.peaks = b.peaks == null ? null : Collections.unmodifiableList(new ArrayList<>(b.peaks));
		this.components = b.components;
		this.constraints = b.constraints;
		this.constraintList = b.constraintList == null ? null : Collections.unmodifiableList(new ArrayList<>(b.constraintList));
		this.weights = b.weights;
		this.psf = b.psf;
		this.psfPerBand = b.psfPerBand;
		this.sky = b.sky;
		this.l0Threshold = b.l0Threshold;
		this.l1Threshold = b.l1Threshold;
		this.maxIter = b.maxIter;
		this.eRel = b.eRel;
		this.psfThreshold = b.psfThreshold;
		this.translationThreshold = b.translationThreshold;
		this.monotonicUseNearest = b.monotonicUseNearest;
		this.traceback = b.traceback;
		this.garbageCollectors = b.garbageCollectors;
		this.truncate = b.truncate;
		this.slack = b.slack;
		this.proxA = b.proxA;
		this.proxS = b.proxS;
		this.coneFacetOrder = b.coneFacetOrder;
		this.monotonicEnforcement = b.monotonicEnforcement;
		this.strictMonotonicThreshold = b.strictMonotonicThreshold;
		this.seed = b.seed;
		this.listener = b.listener;
		this.operatorFactory = b.operatorFactory;
		this.runtime = b.runtime;
		this.pixelwiseEnforcer = b.pixelwiseEnforcer;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static final class Builder {

		private List<Peak> peaks;
		private int components;
		private String constraints;
		private List<String> constraintList;
		private double[][][] weights;
		private double[][] psf;
		private double[][][] psfPerBand;
		private double[][][] sky;
		private Double l0Threshold;
		private Double l1Threshold;
		private int maxIter = OptimizationProblem.DEFAULT_MAX_ITER;
		private double eRel = OptimizationProblem.DEFAULT_E_REL;
		private double psfThreshold = DEFAULT_PSF_THRESHOLD;
		private double translationThreshold = DEFAULT_TRANSLATION_THRESHOLD;
		private boolean monotonicUseNearest;
		private boolean traceback;
		private int garbageCollectors;
		private boolean truncate;
		private double slack = LipschitzStepPolicy.DEFAULT_SLACK;
		private ProximalOperator proxA;
		private ProximalOperator proxS;
		private FacetOrder coneFacetOrder = FacetOrder.LARGEST_CROSSING;
		private MonotonicEnforcement monotonicEnforcement = MonotonicEnforcement.CONE;
		private double strictMonotonicThreshold;
		private Long seed;
		private DiagnosticListener listener = new LoggingDiagnosticListener();
		private OperatorFactory operatorFactory = new StandardOperatorFactory();
		private OptimizationRuntime runtime = new AlternatingProximalRuntime();
		private PixelwiseMonotonicEnforcer pixelwiseEnforcer = new InwardNeighborEnforcer();

		private Builder() {
		}

		/** Source positions, one per declared component; null entries are allowed. */
		public Builder peaks(List<Peak> peaks) {
			this.peaks = peaks;
			return this;
		}

		/**
		 * Number of declared components when no peaks are given; every component
		 * then starts centred with a random spectrum.
		 */
		public Builder components(int components) {
			this.components = components;
			return this;
		}

		/** The same constraints for every declared component, e.g. {@code "MS"}. */
		public Builder constraints(String constraints) {
			this.constraints = constraints;
			this.constraintList = null;
			return this;
		}

		/** One constraint string per component (null for none). */
		public Builder constraints(List<String> perComponent) {
			this.constraintList = perComponent;
			this.constraints = null;
			return this;
		}

		/** Per-pixel inverse variances, same shape as the image. Default: unit weights. */
		public Builder weights(double[][][] weights) {
			this.weights = weights;
			return this;
		}

		/** One PSF kernel shared by every band. */
		public Builder psf(double[][] kernel) {
			this.psf = kernel;
			this.psfPerBand = null;
			return this;
		}

		/** One PSF kernel per band. */
		public Builder psfPerBand(double[][][] kernels) {
			this.psfPerBand = kernels;
			this.psf = null;
			return this;
		}

		/** Sky level subtracted from the image, same shape as the image. */
		public Builder sky(double[][][] sky) {
			this.sky = sky;
			return this;
		}

		/** L0 sparsity threshold on S; takes precedence over L1. */
		public Builder l0Threshold(double threshold) {
			this.l0Threshold = threshold;
			return this;
		}

		/** L1 sparsity threshold on S. */
		public Builder l1Threshold(double threshold) {
			this.l1Threshold = threshold;
			return this;
		}

		/** Default 1000. */
		public Builder maxIter(int maxIter) {
			this.maxIter = maxIter;
			return this;
		}

		/** Relative convergence tolerance, default 1e-3. */
		public Builder eRel(double eRel) {
			this.eRel = eRel;
			return this;
		}

		/** PSF kernel entries below this are dropped, default 1e-2. */
		public Builder psfThreshold(double threshold) {
			this.psfThreshold = threshold;
			return this;
		}

		/** Interpolation weights below this are dropped, default 1e-8. */
		public Builder translationThreshold(double threshold) {
			this.translationThreshold = threshold;
			return this;
		}

		/** Radial monotonicity against the nearest inward neighbour only. Default false. */
		public Builder monotonicUseNearest(boolean useNearest) {
			this.monotonicUseNearest = useNearest;
			return this;
		}

		/** Record a per-iteration trace. */
		public Builder traceback(boolean traceback) {
			this.traceback = traceback;
			return this;
		}

		/** Extra unconstrained components without peaks, default 0. */
		public Builder garbageCollectors(int count) {
			this.garbageCollectors = count;
			return this;
		}

		/** Make even dimensions odd by cropping instead of padding. */
		public Builder truncate(boolean truncate) {
			this.truncate = truncate;
			return this;
		}

		/** Fraction of the Lipschitz step, default 0.9. */
		public Builder slack(double slack) {
			this.slack = slack;
			return this;
		}

		/** Replaces the default unit-simplex proximal on A. */
		public Builder proxA(ProximalOperator proxA) {
			this.proxA = proxA;
			return this;
		}

		/** Replaces the default positivity/sparsity proximal on S. */
		public Builder proxS(ProximalOperator proxS) {
			this.proxS = proxS;
			return this;
		}

		/** Facet selection of the cone projection, default LARGEST_CROSSING. */
		public Builder coneFacetOrder(FacetOrder order) {
			this.coneFacetOrder = order;
			return this;
		}

		/** Default CONE. */
		public Builder monotonicEnforcement(MonotonicEnforcement enforcement) {
			this.monotonicEnforcement = enforcement;
			return this;
		}

		/** Allowed excess over the inward neighbour in PIXELWISE mode, default 0. */
		public Builder strictMonotonicThreshold(double threshold) {
			this.strictMonotonicThreshold = threshold;
			return this;
		}

		/** Seed of the random fallbacks; unseeded when not set. */
		public Builder seed(long seed) {
			this.seed = seed;
			return this;
		}

		/** Default: {@link LoggingDiagnosticListener}. */
		public Builder listener(DiagnosticListener listener) {
			this.listener = listener;
			return this;
		}

		public Builder operatorFactory(OperatorFactory factory) {
			this.operatorFactory = factory;
			return this;
		}

		public Builder runtime(OptimizationRuntime runtime) {
			this.runtime = runtime;
			return this;
		}

		public Builder pixelwiseEnforcer(PixelwiseMonotonicEnforcer enforcer) {
			this.pixelwiseEnforcer = enforcer;
			return this;
		}

		/**
		 * @throws IllegalArgumentException for out-of-range settings
		 */
		public DeblendOptions build() {
			if (peaks == null && components <= 0) {
				throw new IllegalArgumentException("Either peaks or a positive component count must be given");
			}
			if (peaks != null && components > 0 && components != peaks.size()) {
				throw new IllegalArgumentException("Component count " + components + " does not match the " + peaks.size() + " peaks");
			}
			if (garbageCollectors < 0) {
				throw new IllegalArgumentException("Garbage collector count must be non-negative but was " + garbageCollectors);
			}
			if (maxIter < 0) {
				throw new IllegalArgumentException("maxIter must be non-negative but was " + maxIter);
			}
			if (!(eRel >= 0)) {
				throw new IllegalArgumentException("eRel must be non-negative but was " + eRel);
			}
			if (!(psfThreshold >= 0) || !(translationThreshold >= 0) || !(strictMonotonicThreshold >= 0)) {
				throw new IllegalArgumentException("Thresholds must be non-negative");
			}
			if ((l0Threshold != null && !(l0Threshold >= 0)) || (l1Threshold != null && !(l1Threshold >= 0))) {
				throw new IllegalArgumentException("Sparsity thresholds must be non-negative");
			}
			if (!(slack > 0) || slack > 1) {
				throw new IllegalArgumentException("Slack must lie in (0, 1] but was " + slack);
			}
			if (operatorFactory == null || runtime == null || pixelwiseEnforcer == null || monotonicEnforcement == null) {
				throw new IllegalArgumentException("Operator factory, runtime, enforcer and enforcement mode must not be null");
			}
			return new DeblendOptions(this);
		}
	}

	public List<Peak> getPeaks() {
		return peaks;
	}

	/** Declared component count K. */
	public int getComponents() {
		return peaks != null ? peaks.size() : components;
	}

	public String getConstraints() {
		return constraints;
	}

	public List<String> getConstraintList() {
		return constraintList;
	}

	public double[][][] getWeights() {
		return weights;
	}

	public double[][] getPsf() {
		return psf;
	}

	public double[][][] getPsfPerBand() {
		return psfPerBand;
	}

	public double[][][] getSky() {
		return sky;
	}

	public Double getL0Threshold() {
		return l0Threshold;
	}

	public Double getL1Threshold() {
		return l1Threshold;
	}

	public int getMaxIter() {
		return maxIter;
	}

	public double getERel() {
		return eRel;
	}

	public double getPsfThreshold() {
		return psfThreshold;
	}

	public double getTranslationThreshold() {
		return translationThreshold;
	}

	public boolean isMonotonicUseNearest() {
		return monotonicUseNearest;
	}

	public boolean isTraceback() {
		return traceback;
	}

	public int getGarbageCollectors() {
		return garbageCollectors;
	}

	public boolean isTruncate() {
		return truncate;
	}

	public double getSlack() {
		return slack;
	}

	public ProximalOperator getProxA() {
		return proxA;
	}

	public ProximalOperator getProxS() {
		return proxS;
	}

	public FacetOrder getConeFacetOrder() {
		return coneFacetOrder;
	}

	public MonotonicEnforcement getMonotonicEnforcement() {
		return monotonicEnforcement;
	}

	public double getStrictMonotonicThreshold() {
		return strictMonotonicThreshold;
	}

	/** Null when unseeded. */
	public Long getSeed() {
		return seed;
	}

	public DiagnosticListener getListener() {
		return listener == null ? DiagnosticListener.NONE : listener;
	}

	public OperatorFactory getOperatorFactory() {
		return operatorFactory;
	}

	public OptimizationRuntime getRuntime() {
		return runtime;
	}

	public PixelwiseMonotonicEnforcer getPixelwiseEnforcer() {
		return pixelwiseEnforcer;
	}
}
