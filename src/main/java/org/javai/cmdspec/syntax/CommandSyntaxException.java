package org.javai.cmdspec.syntax;

/**
 * Raised when a command line cannot be parsed or a field map cannot be rendered.
 */
public class CommandSyntaxException extends RuntimeException {

	public CommandSyntaxException(String message) {
		super(message);
	}
}
