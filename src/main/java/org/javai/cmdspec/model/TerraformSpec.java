package org.javai.cmdspec.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Target schema metadata of a command.
 *
 * @param resourceName Terraform resource name
 * @param structName name of the struct the fields belong to
 * @param packageName package the struct lives in
 * @param structDefinition struct name to fields it declares
 * @param structAdditions struct name to fields added to an existing struct
 */
public record TerraformSpec(
		String resourceName,
		String structName,
		String packageName,
		Map<String, List<StructField>> structDefinition,
		Map<String, List<StructField>> structAdditions
) {

	public TerraformSpec {
		structDefinition = copy(structDefinition);
		structAdditions = copy(structAdditions);
	}

	public static TerraformSpec empty() {
		return new TerraformSpec(null, null, null, Map.of(), Map.of());
	}

	public List<StructField> declaredFields() {
		List<StructField> fields = new ArrayList<>();
		structDefinition.values().forEach(fields::addAll);
		structAdditions.values().forEach(fields::addAll);
		return fields;
	}

	private static Map<String, List<StructField>> copy(Map<String, List<StructField>> source) {
		Map<String, List<StructField>> copy = new LinkedHashMap<>();
		if (source != null) {
			source.forEach((struct, fields) -> copy.put(struct, List.copyOf(fields)));
		}
		return Collections.unmodifiableMap(copy);
	}
}
