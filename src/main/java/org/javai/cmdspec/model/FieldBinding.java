package org.javai.cmdspec.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How a parameter or variant binds to fields of the target configuration schema.
 * <ul>
 *   <li>{@link Unbound} - no schema field</li>
 *   <li>{@link Single} - one field receives the value</li>
 *   <li>{@link PerSelector} - parameter level: the selected variant picks the field</li>
 *   <li>{@link Composite} - variant level: consecutive value tokens fill the fields in order</li>
 * </ul>
 */
public sealed interface FieldBinding {

	List<String> fieldNames();

	static FieldBinding none() {
		return Unbound.INSTANCE;
	}

	record Unbound() implements FieldBinding {
		static final Unbound INSTANCE = new Unbound();

		@Override
		public List<String> fieldNames() {
			return List.of();
		}
	}

	record Single(String field) implements FieldBinding {
		public Single {
			if (field == null || field.isBlank()) {
				throw new IllegalArgumentException("Field name must not be blank");
			}
		}

		@Override
		public List<String> fieldNames() {
			return List.of(field);
		}
	}

	record PerSelector(Map<String, String> fields) implements FieldBinding {
		public PerSelector {
			fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
		}

		@Override
		public List<String> fieldNames() {
			return List.copyOf(fields.values());
		}
	}

	record Composite(Map<String, String> fields) implements FieldBinding {
		public Composite {
			fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
		}

		@Override
		public List<String> fieldNames() {
			return List.copyOf(fields.values());
		}
	}
}
