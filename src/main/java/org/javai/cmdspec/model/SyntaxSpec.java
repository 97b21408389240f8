package org.javai.cmdspec.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line syntax of a command.
 *
 * @param setForms alternative forms that configure the command
 * @param deleteForms alternative forms that remove it
 * @param keywordSynonyms canonical keyword to accepted aliases, e.g. {@code ipsec-sa -> [child-sa]}
 */
public record SyntaxSpec(List<SyntaxForm> setForms, List<SyntaxForm> deleteForms, Map<String, List<String>> keywordSynonyms) {

	public SyntaxSpec {
		setForms = setForms != null ? List.copyOf(setForms) : List.of();
		deleteForms = deleteForms != null ? List.copyOf(deleteForms) : List.of();
		Map<String, List<String>> synonyms = new LinkedHashMap<>();
		if (keywordSynonyms != null) {
			keywordSynonyms.forEach((canonical, aliases) -> synonyms.put(canonical, List.copyOf(aliases)));
		}
		keywordSynonyms = Collections.unmodifiableMap(synonyms);
	}

	public static SyntaxSpec empty() {
		return new SyntaxSpec(List.of(), List.of(), Map.of());
	}
}
