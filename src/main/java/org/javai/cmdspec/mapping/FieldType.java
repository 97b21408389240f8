package org.javai.cmdspec.mapping;

import java.util.List;
import java.util.Map;
import org.javai.cmdspec.model.ParamType;

/**
 * Type of a field in the target configuration schema.
 */
public enum FieldType {
	STRING,
	INT,
	BOOL,
	LIST,
	OBJECT;

	public static FieldType of(ParamType type) {
		return switch (type) {
			case INT -> INT;
			case SWITCH -> BOOL;
			default -> STRING;
		};
	}

	/**
	 * Field type of a constant value.
	 */
	public static FieldType ofValue(Object value) {
		if (value instanceof Boolean) {
			return BOOL;
		}
		if (value instanceof Number) {
			return INT;
		}
		if (value instanceof List<?>) {
			return LIST;
		}
		if (value instanceof Map<?, ?>) {
			return OBJECT;
		}
		return STRING;
	}

	/**
	 * Field type of a declared struct field type such as {@code string},
	 * {@code *int} or {@code []string}.
	 */
	public static FieldType ofDeclared(String declared) {
		if (declared == null) {
			return STRING;
		}
		String type = declared.trim();
		if (type.startsWith("[]")) {
			return LIST;
		}
		if (type.startsWith("*")) {
			type = type.substring(1);
		}
		if (type.equals("string")) {
			return STRING;
		}
		if (type.equals("bool")) {
			return BOOL;
		}
		if (type.startsWith("int") || type.startsWith("uint")) {
			return INT;
		}
		return OBJECT;
	}
}
