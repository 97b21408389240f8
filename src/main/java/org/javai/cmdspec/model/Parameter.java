package org.javai.cmdspec.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One named input slot of a command.
 */
public record Parameter(
		String name,
		String description,
		ParamType type,
		boolean required,
		Object defaultValue,
		IntRange range,
		List<EnumValue> enumValues,
		List<Variant> variants,
		ModelConstraints availability,
		Map<String, ModelOverride> modelOverrides,
		FieldBinding fieldBinding,
		List<Object> boundaryOverrides,
		String pattern,
		String note
) {

	public Parameter {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Parameter name must not be blank");
		}
		type = type != null ? type : ParamType.STRING;
		enumValues = enumValues != null ? List.copyOf(enumValues) : List.of();
		variants = variants != null ? List.copyOf(variants) : List.of();
		availability = availability != null ? availability : ModelConstraints.none();
		modelOverrides = modelOverrides != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(modelOverrides))
				: Map.of();
		fieldBinding = fieldBinding != null ? fieldBinding : FieldBinding.none();
		boundaryOverrides = boundaryOverrides != null ? List.copyOf(boundaryOverrides) : List.of();
	}

	public boolean hasEnum() {
		return !enumValues.isEmpty();
	}

	public boolean hasVariants() {
		return !variants.isEmpty();
	}

	public boolean isRangeTyped() {
		return type == ParamType.INT && !hasEnum();
	}

	public Optional<EnumValue> enumValue(String token) {
		return enumValues.stream().filter(v -> v.value().equals(token)).findFirst();
	}

	public Optional<Variant> variant(String selector) {
		return variants.stream().filter(v -> v.selector().equals(selector)).findFirst();
	}

	public Optional<ModelOverride> override(String model) {
		return model == null ? Optional.empty() : Optional.ofNullable(modelOverrides.get(model));
	}
}
