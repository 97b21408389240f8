package org.javai.cmdspec.model;

/**
 * Inclusive numeric range. Bounds are not required to be ordered at
 * construction time; {@link #isOrdered()} is checked where the range is used
 * so that a reversed range surfaces as a specification defect.
 */
public record IntRange(long min, long max) {

	public boolean isOrdered() {
		return min <= max;
	}

	public boolean contains(long value) {
		return value >= min && value <= max;
	}

	public IntRange withMax(long newMax) {
		return new IntRange(min, newMax);
	}

	@Override
	public String toString() {
		return "[" + min + ".." + max + "]";
	}
}
