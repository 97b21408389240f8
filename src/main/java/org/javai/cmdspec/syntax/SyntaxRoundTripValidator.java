package org.javai.cmdspec.syntax;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.cmdspec.model.CommandSpec;
import org.javai.cmdspec.model.ModelConstraints;
import org.javai.cmdspec.model.SyntaxTest;
import org.javai.cmdspec.model.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks declared syntax tests against a {@link CommandCodec}.
 *
 * <p>Parsing is checked on the fields the test declares; fields the codec adds
 * beyond those are ignored. Serializing is checked on the normalized text, so
 * whitespace and keyword synonyms do not count. Multiline tests are compared
 * line by line with the entries of their structured value. Lines starting
 * with {@code no} are rendered with the delete forms. Any exception the codec
 * throws for a line is reported as a failure of that direction.
 */
public class SyntaxRoundTripValidator {

	private static final Logger logger = LoggerFactory.getLogger(SyntaxRoundTripValidator.class);

	private static final String DELETE_PREFIX = "no ";

	private final CommandCodec codec;

	public SyntaxRoundTripValidator(CommandCodec codec) {
		this.codec = Objects.requireNonNull(codec, "codec must not be null");
	}

	public RoundTripResult verify(SyntaxTest test) {
		return verify(test, null);
	}

	public RoundTripResult verify(SyntaxTest test, String model) {
		Objects.requireNonNull(test, "test must not be null");
		ModelConstraints constraints = test.modelConstraints();
		if (model != null && !constraints.appliesTo(model)) {
			return new RoundTripResult.Skipped(test, model, "test does not apply to " + model);
		}

		List<String> lines = test.text().lines().map(String::trim).filter(l -> !l.isEmpty()).toList();
		List<Map<String, Object>> entries = test.expected().entries();
		List<RoundTripResult.DirectionFailure> failures = new ArrayList<>();
		if (lines.size() != entries.size()) {
			failures.add(new RoundTripResult.DirectionFailure(RoundTripResult.Direction.PARSE,
					entries.size() + " line(s)", lines.size() + " line(s)"));
			return new RoundTripResult.Failed(test, model, failures);
		}

		for (int i = 0; i < lines.size(); i++) {
			String line = lines.get(i);
			Map<String, Object> expected = entries.get(i);
			if (test.direction().checksParse()) {
				checkParse(line, expected, failures);
			}
			if (test.direction().checksBuild()) {
				checkSerialize(line, expected, failures);
			}
		}
		if (!failures.isEmpty()) {
			logger.debug("Syntax test '{}' failed{}: {}", test.name(), model != null ? " on " + model : "", failures);
			return new RoundTripResult.Failed(test, model, failures);
		}
		return new RoundTripResult.Passed(test, model);
	}

	/**
	 * Verify every syntax and multiline test of a command. Model-scoped tests are
	 * checked once per model of the command (or per model the test names when the
	 * command lists none); other tests are checked once.
	 */
	public List<RoundTripResult> verifyAll(CommandSpec command) {
		List<RoundTripResult> results = new ArrayList<>();
		for (SyntaxTest test : command.allSyntaxTests()) {
			if (!test.modelConstraints().isModelScoped()) {
				results.add(verify(test, null));
				continue;
			}
			Set<String> models = new LinkedHashSet<>(command.applicableModels());
			if (models.isEmpty()) {
				models.addAll(test.modelConstraints().referencedModels());
			}
			for (String model : models) {
				results.add(verify(test, model));
			}
		}
		return results;
	}

	private void checkParse(String line, Map<String, Object> expected, List<RoundTripResult.DirectionFailure> failures) {
		Map<String, Object> parsed;
		try {
			parsed = codec.parse(line);
		}
		catch (RuntimeException e) {
			failures.add(new RoundTripResult.DirectionFailure(RoundTripResult.Direction.PARSE,
					String.valueOf(expected), "error: " + describe(e)));
			return;
		}
		Map<String, Object> declared = new LinkedHashMap<>();
		boolean matches = true;
		for (Map.Entry<String, Object> entry : expected.entrySet()) {
			Object actual = parsed.get(entry.getKey());
			declared.put(entry.getKey(), actual);
			if (!Values.same(entry.getValue(), actual)) {
				matches = false;
			}
		}
		if (!matches) {
			failures.add(new RoundTripResult.DirectionFailure(RoundTripResult.Direction.PARSE,
					String.valueOf(expected), String.valueOf(declared)));
		}
	}

	private void checkSerialize(String line, Map<String, Object> expected, List<RoundTripResult.DirectionFailure> failures) {
		String expectedText = line;
		try {
			expectedText = codec.normalize(line);
			String rendered = expectedText.startsWith(DELETE_PREFIX) ? codec.serializeDelete(expected) : codec.serialize(expected);
			String actual = codec.normalize(rendered);
			if (!expectedText.equals(actual)) {
				failures.add(new RoundTripResult.DirectionFailure(RoundTripResult.Direction.SERIALIZE, expectedText, actual));
			}
		}
		catch (RuntimeException e) {
			failures.add(new RoundTripResult.DirectionFailure(RoundTripResult.Direction.SERIALIZE,
					expectedText, "error: " + describe(e)));
		}
	}

	// Codec faults other than syntax errors keep their type in the report
	private static String describe(RuntimeException e) {
		return e instanceof CommandSyntaxException ? e.getMessage() : e.toString();
	}
}
