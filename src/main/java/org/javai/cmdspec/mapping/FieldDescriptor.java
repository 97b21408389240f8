package org.javai.cmdspec.mapping;

import java.util.List;

/**
 * One field of the target schema as seen from one source.
 *
 * @param name field name
 * @param type field type
 * @param allowedValues allowed values, empty when unrestricted
 * @param description free text description
 * @param source what declared the field, e.g. {@code parameter algorithm}
 */
public record FieldDescriptor(String name, FieldType type, List<String> allowedValues, String description, String source) {

	public FieldDescriptor {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Field name must not be blank");
		}
		allowedValues = allowedValues != null ? List.copyOf(allowedValues) : List.of();
	}

	public boolean isRestricted() {
		return !allowedValues.isEmpty();
	}
}
