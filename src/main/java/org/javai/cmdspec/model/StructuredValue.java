package org.javai.cmdspec.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The structured equivalent of a command text: one field map for a single
 * command line, or one per line for multiline text.
 */
public sealed interface StructuredValue {

	List<Map<String, Object>> entries();

	record SingleMapping(Map<String, Object> fields) implements StructuredValue {
		public SingleMapping {
			fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
		}

		@Override
		public List<Map<String, Object>> entries() {
			return List.of(fields);
		}
	}

	record MultiMapping(List<Map<String, Object>> entries) implements StructuredValue {
		public MultiMapping {
			entries = entries != null
					? entries.stream().map(e -> Collections.unmodifiableMap(new LinkedHashMap<>(e))).toList()
					: List.of();
		}
	}
}
