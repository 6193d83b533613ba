package com.github.micycle1.deblender;

/**
 * Receives the {@link DiagnosticEvent}s of a deblend.
 */
@FunctionalInterface
public interface DiagnosticListener {

	/** Discards every event. */
	DiagnosticListener NONE = event -> {
	};

	void onEvent(DiagnosticEvent event);
}
