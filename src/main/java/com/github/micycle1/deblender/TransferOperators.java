package com.github.micycle1.deblender;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.ejml.data.DMatrixSparseCSC;

import com.github.micycle1.deblender.linalg.SparseOps;
import com.github.micycle1.deblender.operators.OperatorFactory;
import com.github.micycle1.deblender.operators.Translation;

/**
 * <p>
 * Per-component, per-band transfer operators
 * {@code Γ[k][b] = Ty[k] · PSF[b] · Tx[k]}, mapping a centred morphology to its
 * band- and position-correct contribution.
 * </p>
 *
 * <p>
 * Without a PSF every band of a component shares one {@code Ty[k] · Tx[k]}
 * instance. With translation disabled (no translation operators at all) the
 * transfer of component k in band b reduces to {@code PSF[b]}, or to the
 * identity when there is no PSF either.
 * </p>
 *
 * Instances are immutable once built.
 */
public final class TransferOperators {

	private final List<DMatrixSparseCSC> tx;
	private final List<DMatrixSparseCSC> ty;
	private final PsfOperators psf;
	private final DMatrixSparseCSC[][] gamma; // [k][b], null when translation is disabled
	private final int bands;

	private TransferOperators(List<DMatrixSparseCSC> tx, List<DMatrixSparseCSC> ty, PsfOperators psf, int bands) {
		this.tx = tx;
		this.ty = ty;
		this.psf = psf;
		this.bands = bands;
		if (tx == null) {
			gamma = null;
			return;
		}
		final int k = tx.size();
		gamma = new DMatrixSparseCSC[k][bands];
		for (int pk = 0; pk < k; pk++) {
			if (psf == null) {
				DMatrixSparseCSC g = SparseOps.compose(ty.get(pk), tx.get(pk));
				for (int b = 0; b < bands; b++) {
					gamma[pk][b] = g;
				}
			} else {
				for (int b = 0; b < bands; b++) {
					gamma[pk][b] = SparseOps.compose(ty.get(pk), psf.forBand(b), tx.get(pk));
				}
			}
		}
	}

	/**
	 * Composes from explicit translation operators.
	 *
	 * @param tx  x translation per component, or null
	 * @param ty  y translation per component, or null
	 * @param psf PSF operators, or null
	 * @throws IllegalArgumentException if exactly one of tx and ty is null, or
	 *                                  their sizes differ
	 */
	public static TransferOperators of(List<DMatrixSparseCSC> tx, List<DMatrixSparseCSC> ty, PsfOperators psf, int bands) {
		if ((tx == null) != (ty == null)) {
			throw new IllegalArgumentException("Expected Tx and Ty to both be null or neither to be null");
		}
		if (tx == null) {
			return disabled(psf, bands);
		}
		if (tx.size() != ty.size()) {
			throw new IllegalArgumentException("Tx has " + tx.size() + " operators but Ty has " + ty.size());
		}
		return new TransferOperators(Collections.unmodifiableList(new ArrayList<>(tx)), Collections.unmodifiableList(new ArrayList<>(ty)),
				psf, bands);
	}

	/** No translation; the transfer is the PSF alone (or the identity). */
	public static TransferOperators disabled(PsfOperators psf, int bands) {
		return new TransferOperators(null, null, psf, bands);
	}

	/**
	 * Builds the translation of every component from its peak offset to the image
	 * centre ({@code dx = cx - px}, {@code dy = cy - py}; zero for a missing peak)
	 * and composes the transfer operators.
	 *
	 * @param peaks     one entry per component (K declared plus G garbage
	 *                  collectors), null entries for unknown positions
	 * @param psf       PSF operators, or null
	 * @param threshold interpolation weights below this are dropped
	 */
	public static TransferOperators compose(List<Peak> peaks, int bands, int rows, int cols, PsfOperators psf, OperatorFactory factory,
			double threshold) {
		final int cx = cols / 2, cy = rows / 2;
		List<DMatrixSparseCSC> tx = new ArrayList<>(peaks.size());
		List<DMatrixSparseCSC> ty = new ArrayList<>(peaks.size());
		for (Peak peak : peaks) {
			double dx = 0, dy = 0;
			if (peak != null) {
				dx = cx - peak.x;
				dy = cy - peak.y;
			}
			Translation t = factory.translation(dx, dy, rows, cols, threshold);
			tx.add(t.tx);
			ty.add(t.ty);
		}
		return of(tx, ty, psf, bands);
	}

	public boolean isTranslationDisabled() {
		return gamma == null;
	}

	public int getBandCount() {
		return bands;
	}

	/** Component count, or -1 when translation is disabled (any count works). */
	public int getComponentCount() {
		return gamma == null ? -1 : gamma.length;
	}

	/** The composed operator, or null when translation is disabled. */
	public DMatrixSparseCSC getGamma(int k, int b) {
		return gamma == null ? null : gamma[k][b];
	}

	public List<DMatrixSparseCSC> getTx() {
		return tx;
	}

	public List<DMatrixSparseCSC> getTy() {
		return ty;
	}

	public PsfOperators getPsf() {
		return psf;
	}

	/** Γ[k][b] · s */
	public double[] apply(int k, int b, double[] s) {
		if (gamma != null) {
			return SparseOps.mult(gamma[k][b], s);
		}
		return psf == null ? s.clone() : SparseOps.mult(psf.forBand(b), s);
	}

	/** Γ[k][b]^T · r */
	public double[] applyTranspose(int k, int b, double[] r) {
		if (gamma != null) {
			return SparseOps.multTransA(gamma[k][b], r);
		}
		return psf == null ? r.clone() : SparseOps.multTransA(psf.forBand(b), r);
	}

	/** True when bands b and b-1 of component k use the same operator. */
	boolean sharesPreviousBand(int k, int b) {
		if (b == 0) {
			return false;
		}
		if (gamma != null) {
			return gamma[k][b] == gamma[k][b - 1];
		}
		return psf == null || psf.isShared();
	}
}
