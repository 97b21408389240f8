package org.javai.cmdspec;

/**
 * Exception thrown when a command specification document cannot be read or
 * does not have the basic shape of a command specification.
 */
public class SpecLoadException extends RuntimeException {

	public SpecLoadException(String message) {
		super(message);
	}

	public SpecLoadException(String message, Throwable cause) {
		super(message, cause);
	}
}
