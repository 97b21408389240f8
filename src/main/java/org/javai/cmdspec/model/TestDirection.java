package org.javai.cmdspec.model;

/**
 * Which directions of a syntax round trip a test checks.
 */
public enum TestDirection {
	BIDIRECTIONAL,
	PARSE_ONLY,
	BUILD_ONLY;

	public boolean checksParse() {
		return this != BUILD_ONLY;
	}

	public boolean checksBuild() {
		return this != PARSE_ONLY;
	}
}
