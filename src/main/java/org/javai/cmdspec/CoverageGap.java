package org.javai.cmdspec;

/**
 * A parameter that should have auto-derived boundary cases but lacks the data
 * needed to derive them.
 *
 * @param command the command name
 * @param parameter the parameter name
 * @param model the model the gap was found for, or {@code null} for the base domain
 * @param reason what is missing
 */
public record CoverageGap(String command, String parameter, String model, String reason) {

	@Override
	public String toString() {
		return "%s/%s%s: %s".formatted(command, parameter, model != null ? "@" + model : "", reason);
	}
}
