package org.javai.cmdspec.mapping;

import java.util.List;
import java.util.Optional;

/**
 * Field mappings of every parameter of a command, plus the merged view of
 * every schema field they and the declared struct produce.
 */
public record FieldMappingTable(String command, String structName, List<FieldMapping> mappings, List<FieldDescriptor> fields) {

	public FieldMappingTable {
		mappings = mappings != null ? List.copyOf(mappings) : List.of();
		fields = fields != null ? List.copyOf(fields) : List.of();
	}

	public Optional<FieldMapping> mappingFor(String parameter) {
		return mappings.stream().filter(m -> m.parameter().equals(parameter)).findFirst();
	}

	public Optional<FieldDescriptor> field(String name) {
		return fields.stream().filter(f -> f.name().equals(name)).findFirst();
	}
}
