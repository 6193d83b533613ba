package com.github.micycle1.deblender;

/**
 * The two factors of the decomposition.
 */
public enum Factor {
	/** Spectral factor, B x (K+G). */
	A,
	/** Morphology factor, (K+G) x (N*M). */
	S;

	public static Factor fromSymbol(String symbol) {
		if ("A".equals(symbol)) {
			return A;
		}
		if ("S".equals(symbol)) {
			return S;
		}
		throw new IllegalArgumentException("Expected either 'A' or 'S' as factor but received '" + symbol + "'");
	}
}
