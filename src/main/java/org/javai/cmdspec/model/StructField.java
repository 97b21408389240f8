package org.javai.cmdspec.model;

import java.util.List;

/**
 * A field declared directly on the target schema struct.
 */
public record StructField(String name, String type, String jsonTag, String description, List<String> enumValues) {

	public StructField {
		enumValues = enumValues != null ? List.copyOf(enumValues) : List.of();
	}
}
