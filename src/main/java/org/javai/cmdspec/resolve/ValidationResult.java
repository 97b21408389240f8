package org.javai.cmdspec.resolve;

/**
 * Outcome of validating one input value against an effective domain.
 */
public sealed interface ValidationResult {

	static ValidationResult valid() {
		return Valid.INSTANCE;
	}

	static ValidationResult invalid(String reason) {
		return new Invalid(reason);
	}

	default boolean isValid() {
		return this instanceof Valid;
	}

	record Valid() implements ValidationResult {
		static final Valid INSTANCE = new Valid();
	}

	record Invalid(String reason) implements ValidationResult {
	}
}
