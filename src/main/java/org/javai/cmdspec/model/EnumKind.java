package org.javai.cmdspec.model;

/**
 * Whether an enum member names a concrete setting or defers the decision to
 * runtime context (the router's {@code auto} keyword, for instance).
 */
public enum EnumKind {
	CONCRETE,
	DEFERRED
}
