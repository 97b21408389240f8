package org.javai.cmdspec;

import java.util.Objects;

/**
 * One malformed or internally inconsistent piece of a command specification.
 *
 * @param kind the defect category
 * @param command the command the defect was found in
 * @param subject the parameter, test or constraint the defect concerns
 * @param message human readable detail
 */
public record SpecificationDefect(DefectKind kind, String command, String subject, String message) {

	public SpecificationDefect {
		Objects.requireNonNull(kind, "kind must not be null");
	}

	@Override
	public String toString() {
		return "[%s] %s/%s: %s".formatted(kind, command, subject, message);
	}
}
