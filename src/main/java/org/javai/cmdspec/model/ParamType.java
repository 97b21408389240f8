package org.javai.cmdspec.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Semantic type tag of a parameter. Each constant accepts the tags used in
 * command specification documents.
 */
public enum ParamType {
	STRING("string", "text", "name", "description"),
	INT("int", "integer", "number"),
	ENUM("enum"),
	SWITCH("switch", "on_off", "bool", "boolean"),
	IP_ADDRESS("ip", "ipv4", "ipv6", "ip_address", "address"),
	IP_RANGE("ip_range", "cidr", "network"),
	HEX("hex"),
	VARIANT("variant", "variants");

	private final List<String> tags;

	ParamType(String... tags) {
		this.tags = List.of(tags);
	}

	public String tag() {
		return tags.get(0);
	}

	public static Optional<ParamType> fromTag(String tag) {
		if (tag == null) {
			return Optional.empty();
		}
		String normalized = tag.trim().toLowerCase(Locale.ROOT).replace('-', '_');
		for (ParamType type : values()) {
			if (type.tags.contains(normalized)) {
				return Optional.of(type);
			}
		}
		return Optional.empty();
	}
}
