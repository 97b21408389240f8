package org.javai.cmdspec.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One alternative command-line form.
 *
 * @param template e.g. {@code ipsec ike keepalive use <gateway_id> on dpd <interval> [<retry>]}
 * @param fixedFields schema fields implied by choosing this form
 */
public record SyntaxForm(String template, Map<String, Object> fixedFields) {

	public SyntaxForm {
		if (template == null || template.isBlank()) {
			throw new IllegalArgumentException("Syntax template must not be blank");
		}
		fixedFields = fixedFields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fixedFields)) : Map.of();
	}

	public SyntaxForm(String template) {
		this(template, Map.of());
	}
}
