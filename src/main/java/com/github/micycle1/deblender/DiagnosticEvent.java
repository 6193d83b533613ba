package com.github.micycle1.deblender;

/**
 * A non-fatal condition met while setting up or running a deblend, reported
 * to the caller's {@link DiagnosticListener}.
 */
public final class DiagnosticEvent {

	public enum Kind {
		/** No peak for the component; its spectrum was drawn at random. */
		RANDOM_SPECTRUM,
		/** The peak pixel has no positive flux; its spectrum was drawn at random. */
		ZERO_FLUX_PEAK,
		/** No peak for the component; its morphology was drawn at random. */
		RANDOM_MORPHOLOGY,
		/** The input was padded or truncated to odd dimensions. */
		IMAGE_RESHAPED,
		/** Both sparsity thresholds were given; L1 was dropped in favour of L0. */
		L1_IGNORED
	}

	private final Kind kind;
	private final int component;
	private final String message;

	public DiagnosticEvent(Kind kind, int component, String message) {
		this.kind = kind;
		this.component = component;
		this.message = message;
	}

	public static DiagnosticEvent of(Kind kind, String message) {
		return new DiagnosticEvent(kind, -1, message);
	}

	public Kind getKind() {
		return kind;
	}

	/** Component index, or -1 when the event is not tied to a component. */
	public int getComponent() {
		return component;
	}

	public String getMessage() {
		return message;
	}

	@Override
	public String toString() {
		return kind + (component >= 0 ? "[" + component + "]" : "") + ": " + message;
	}
}
