package org.javai.cmdspec.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How one parameter maps onto the target schema.
 * <ul>
 *   <li>{@link Scalar} - one field</li>
 *   <li>{@link Discriminated} - the selected variant decides the fields</li>
 *   <li>{@link Unmapped} - no field</li>
 * </ul>
 */
public sealed interface FieldMapping {

	String parameter();

	List<FieldDescriptor> fields();

	record Scalar(String parameter, FieldDescriptor field) implements FieldMapping {
		@Override
		public List<FieldDescriptor> fields() {
			return List.of(field);
		}
	}

	record Discriminated(String parameter, Map<String, List<FieldDescriptor>> bySelector) implements FieldMapping {
		public Discriminated {
			Map<String, List<FieldDescriptor>> copy = new LinkedHashMap<>();
			bySelector.forEach((selector, fields) -> copy.put(selector, List.copyOf(fields)));
			bySelector = Collections.unmodifiableMap(copy);
		}

		@Override
		public List<FieldDescriptor> fields() {
			List<FieldDescriptor> all = new ArrayList<>();
			bySelector.values().forEach(all::addAll);
			return all;
		}
	}

	record Unmapped(String parameter) implements FieldMapping {
		@Override
		public List<FieldDescriptor> fields() {
			return List.of();
		}
	}
}
