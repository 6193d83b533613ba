package com.github.micycle1.deblender.operators;

import org.ejml.data.DMatrixSparseCSC;

/**
 * Result of building a translation: the x and y operators plus the sub-pixel
 * remainder of each shift (0 for whole-pixel shifts), kept for diagnostics.
 */
public final class Translation {

	public final DMatrixSparseCSC tx;
	public final DMatrixSparseCSC ty;
	public final double fractionX;
	public final double fractionY;

	public Translation(DMatrixSparseCSC tx, DMatrixSparseCSC ty, double fractionX, double fractionY) {
		this.tx = tx;
		this.ty = ty;
		this.fractionX = fractionX;
		this.fractionY = fractionY;
	}

	public boolean isWholePixel() {
		return fractionX == 0.0 && fractionY == 0.0;
	}
}
