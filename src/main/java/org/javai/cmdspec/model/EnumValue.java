package org.javai.cmdspec.model;

import java.util.List;

/**
 * One member of an enumerated parameter domain.
 *
 * @param value the token as written on the command line
 * @param description free text description
 * @param kind concrete or deferred
 * @param resolvesTo for deferred members, the concrete members it may resolve
 * to; empty means any concrete member
 */
public record EnumValue(String value, String description, EnumKind kind, List<String> resolvesTo) {

	public EnumValue {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("Enum value must not be blank");
		}
		kind = kind != null ? kind : EnumKind.CONCRETE;
		resolvesTo = resolvesTo != null ? List.copyOf(resolvesTo) : List.of();
	}

	public EnumValue(String value, String description) {
		this(value, description, EnumKind.CONCRETE, List.of());
	}

	public boolean isDeferred() {
		return kind == EnumKind.DEFERRED;
	}
}
