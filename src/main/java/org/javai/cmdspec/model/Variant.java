package org.javai.cmdspec.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named alternative shape of a parameter, e.g. a pre-shared key given as
 * {@code text <string>} or as a raw hex string. Owned by exactly one parameter.
 *
 * @param selector name of this variant, unique within the parameter
 * @param type semantic type of the value tokens, {@code null} to inherit the parameter's
 * @param keyword leading keyword(s) on the command line, {@code null} when the value stands alone
 * @param pattern regex the value token must match, optional
 * @param range own numeric range, optional
 * @param fieldBinding schema binding of the value token(s)
 * @param fixedFields schema fields set to constant values when this variant is selected
 * @param description free text description
 */
public record Variant(
		String selector,
		ParamType type,
		String keyword,
		String pattern,
		IntRange range,
		FieldBinding fieldBinding,
		Map<String, Object> fixedFields,
		String description
) {

	public Variant {
		if (selector == null || selector.isBlank()) {
			throw new IllegalArgumentException("Variant selector must not be blank");
		}
		fieldBinding = fieldBinding != null ? fieldBinding : FieldBinding.none();
		fixedFields = fixedFields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fixedFields)) : Map.of();
	}

	public List<String> keywordTokens() {
		if (keyword == null || keyword.isBlank()) {
			return List.of();
		}
		return Arrays.asList(keyword.trim().split("\\s+"));
	}

	/**
	 * Number of value tokens following the keyword on the command line. An
	 * unbound variant takes one value when its parameter binds it, none when it
	 * is a bare keyword.
	 */
	public int valueArity(FieldBinding parameterBinding) {
		if (fieldBinding instanceof FieldBinding.Composite composite) {
			return composite.fields().size();
		}
		if (fieldBinding instanceof FieldBinding.Single) {
			return 1;
		}
		if (parameterBinding instanceof FieldBinding.Single) {
			return 1;
		}
		if (parameterBinding instanceof FieldBinding.PerSelector perSelector && perSelector.fields().containsKey(selector)) {
			return 1;
		}
		return keywordTokens().isEmpty() ? 1 : 0;
	}

	/**
	 * The schema field receiving this variant's single value, if any.
	 */
	public String valueField(FieldBinding parameterBinding) {
		if (fieldBinding instanceof FieldBinding.Single single) {
			return single.field();
		}
		if (fieldBinding instanceof FieldBinding.Unbound) {
			if (parameterBinding instanceof FieldBinding.Single single) {
				return single.field();
			}
			if (parameterBinding instanceof FieldBinding.PerSelector perSelector) {
				return perSelector.fields().get(selector);
			}
		}
		return null;
	}

	public ParamType effectiveType(ParamType parameterType) {
		if (type != null) {
			return type;
		}
		return parameterType == ParamType.VARIANT ? ParamType.STRING : parameterType;
	}
}
