package org.javai.cmdspec;

/**
 * Categories of specification defects. A defect means the authoritative
 * command description is wrong; it is never patched silently.
 */
public enum DefectKind {
	BLANK_COMMAND_NAME,
	UNKNOWN_PARAMETER,
	UNKNOWN_MODEL,
	MALFORMED_RANGE,
	MALFORMED_BINDING,
	MALFORMED_SYNTAX,
	MALFORMED_CONSTRAINT,
	ENUM_VALUE_OUT_OF_DOMAIN,
	BOUNDARY_CONTRADICTS_DOMAIN,
	DUPLICATE_VARIANT,
	UNDERIVABLE_CANDIDATES,
	CONSTRAINT_PRECEDENCE,
	UNCOVERABLE_PAIR,
	FIELD_COLLISION
}
