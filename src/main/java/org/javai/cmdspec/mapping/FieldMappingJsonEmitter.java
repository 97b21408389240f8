package org.javai.cmdspec.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Locale;

/**
 * Emits a JSON summary of a {@link FieldMappingTable}.
 */
public final class FieldMappingJsonEmitter {

	private static final ObjectMapper mapper = new ObjectMapper();

	private FieldMappingJsonEmitter() {}

	public static ObjectNode emit(FieldMappingTable table) {
		ObjectNode root = mapper.createObjectNode();
		root.put("command", table.command());
		if (table.structName() != null) {
			root.put("struct", table.structName());
		}

		ArrayNode parameters = root.putArray("parameters");
		table.mappings().forEach(mapping -> {
			ObjectNode m = parameters.addObject();
			m.put("parameter", mapping.parameter());
			if (mapping instanceof FieldMapping.Scalar scalar) {
				m.put("kind", "scalar");
				m.set("field", field(scalar.field()));
			}
			else if (mapping instanceof FieldMapping.Discriminated discriminated) {
				m.put("kind", "discriminated");
				ObjectNode selectors = m.putObject("selectors");
				discriminated.bySelector().forEach((selector, fields) -> {
					ArrayNode list = selectors.putArray(selector);
					fields.forEach(f -> list.add(field(f)));
				});
			}
			else {
				m.put("kind", "unmapped");
			}
		});

		ArrayNode fields = root.putArray("fields");
		table.fields().forEach(f -> fields.add(field(f)));
		return root;
	}

	private static ObjectNode field(FieldDescriptor descriptor) {
		ObjectNode node = mapper.createObjectNode();
		node.put("name", descriptor.name());
		node.put("type", descriptor.type().name().toLowerCase(Locale.ROOT));
		if (descriptor.description() != null) {
			node.put("description", descriptor.description());
		}
		if (descriptor.isRestricted()) {
			ArrayNode allowed = node.putArray("allowedValues");
			descriptor.allowedValues().forEach(allowed::add);
		}
		return node;
	}
}
