package org.javai.cmdspec.model;

/**
 * Canonical string tokens for the loosely typed values found in specification
 * documents. Two values are considered equal when their tokens are equal.
 */
public final class Values {

	private Values() {}

	/**
	 * Booleans render as the router's {@code on}/{@code off} switch keywords;
	 * integral numbers render without a fractional part.
	 */
	public static String token(Object value) {
		if (value == null) {
			return null;
		}
		if (value instanceof Boolean b) {
			return b ? "on" : "off";
		}
		if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
			return Long.toString(d.longValue());
		}
		return String.valueOf(value).trim();
	}

	public static boolean same(Object left, Object right) {
		String l = token(left);
		String r = token(right);
		return l == null ? r == null : l.equals(r);
	}
}
