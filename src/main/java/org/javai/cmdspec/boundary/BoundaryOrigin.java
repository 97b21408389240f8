package org.javai.cmdspec.boundary;

/**
 * Where a concrete boundary case came from.
 */
public enum BoundaryOrigin {
	/** Declared in the command's boundary tests. */
	DECLARED,
	/** One of the four canonical cases around a range. */
	RANGE,
	/** An explicit boundary value listed on the parameter. */
	OVERRIDE,
	/** An enum member, a switch keyword or the out-of-set token. */
	ENUM,
	/** A case around a license-extended limit. */
	LICENSE_TIER,
	/** A case around the range of a variant. */
	VARIANT
}
