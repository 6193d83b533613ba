package com.github.micycle1.deblender;

/**
 * Known source location in pixel coordinates: {@code x} is the column,
 * {@code y} the row. Coordinates may be fractional.
 */
public final class Peak {

	public final double x;
	public final double y;

	public Peak(double x, double y) {
		this.x = x;
		this.y = y;
	}

	public static Peak of(double x, double y) {
		return new Peak(x, y);
	}

	/** Column of the pixel containing this peak. */
	public int column() {
		return (int) x;
	}

	/** Row of the pixel containing this peak. */
	public int row() {
		return (int) y;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Peak)) {
			return false;
		}
		Peak p = (Peak) o;
		return Double.compare(x, p.x) == 0 && Double.compare(y, p.y) == 0;
	}

	@Override
	public int hashCode() {
		return 31 * Double.hashCode(x) + Double.hashCode(y);
	}

	@Override
	public String toString() {
		return "Peak(" + x + ", " + y + ")";
	}
}
