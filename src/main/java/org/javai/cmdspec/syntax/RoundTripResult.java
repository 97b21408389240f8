package org.javai.cmdspec.syntax;

import java.util.List;
import org.javai.cmdspec.model.SyntaxTest;

/**
 * Outcome of checking one syntax test on one model.
 */
public sealed interface RoundTripResult {

	SyntaxTest test();

	/**
	 * The model the test was checked for, {@code null} when it was checked model-independently.
	 */
	String model();

	default boolean passed() {
		return this instanceof Passed;
	}

	record Passed(SyntaxTest test, String model) implements RoundTripResult {
	}

	record Skipped(SyntaxTest test, String model, String reason) implements RoundTripResult {
	}

	record Failed(SyntaxTest test, String model, List<DirectionFailure> failures) implements RoundTripResult {
		public Failed {
			failures = List.copyOf(failures);
		}
	}

	/**
	 * A mismatch in one direction of the round trip.
	 */
	record DirectionFailure(Direction direction, String expected, String actual) {
	}

	enum Direction {
		PARSE,
		SERIALIZE
	}
}
