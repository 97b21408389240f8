package org.javai.cmdspec.syntax;

import java.util.Map;

/**
 * Converts between a command line and its structured field map.
 */
public interface CommandCodec {

	/**
	 * @throws CommandSyntaxException when the text matches no form of the command
	 */
	Map<String, Object> parse(String text);

	/**
	 * @throws CommandSyntaxException when no set form can render the fields
	 */
	String serialize(Map<String, Object> fields);

	/**
	 * @throws CommandSyntaxException when no delete form can render the fields
	 */
	String serializeDelete(Map<String, Object> fields);

	/**
	 * Canonical formatting of a command line, used to compare texts that differ
	 * only in whitespace or keyword synonyms.
	 */
	String normalize(String text);
}
