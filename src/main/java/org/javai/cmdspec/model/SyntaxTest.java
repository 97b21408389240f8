package org.javai.cmdspec.model;

import java.util.Objects;

/**
 * A declared command text and its structured equivalent.
 */
public record SyntaxTest(
		String name,
		String text,
		StructuredValue expected,
		TestDirection direction,
		ModelConstraints modelConstraints,
		String note,
		String description
) {

	public SyntaxTest {
		Objects.requireNonNull(text, "text must not be null");
		expected = expected != null ? expected : new StructuredValue.SingleMapping(null);
		direction = direction != null ? direction : TestDirection.BIDIRECTIONAL;
		modelConstraints = modelConstraints != null ? modelConstraints : ModelConstraints.none();
	}
}
