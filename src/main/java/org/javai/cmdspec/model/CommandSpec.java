package org.javai.cmdspec.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The full specification of one command family. Immutable for the duration
 * of a generation run.
 */
public record CommandSpec(
		String name,
		String description,
		String reference,
		List<String> applicableModels,
		SyntaxSpec syntax,
		TerraformSpec terraform,
		Map<String, Parameter> parameters,
		List<SyntaxTest> syntaxTests,
		List<SyntaxTest> multilineTests,
		Map<String, List<BoundaryTest>> boundaryTests,
		PairwiseSpec pairwise,
		List<String> notes,
		String implementationStatus
) {

	public CommandSpec {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Command name must not be blank");
		}
		applicableModels = applicableModels != null ? List.copyOf(applicableModels) : List.of();
		syntax = syntax != null ? syntax : SyntaxSpec.empty();
		terraform = terraform != null ? terraform : TerraformSpec.empty();
		parameters = parameters != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
				: Map.of();
		syntaxTests = syntaxTests != null ? List.copyOf(syntaxTests) : List.of();
		multilineTests = multilineTests != null ? List.copyOf(multilineTests) : List.of();
		Map<String, List<BoundaryTest>> boundaries = new LinkedHashMap<>();
		if (boundaryTests != null) {
			boundaryTests.forEach((param, tests) -> boundaries.put(param, List.copyOf(tests)));
		}
		boundaryTests = Collections.unmodifiableMap(boundaries);
		notes = notes != null ? List.copyOf(notes) : List.of();
	}

	public Optional<Parameter> parameter(String parameterName) {
		return Optional.ofNullable(parameters.get(parameterName));
	}

	public List<BoundaryTest> boundaryTestsFor(String parameterName) {
		return boundaryTests.getOrDefault(parameterName, List.of());
	}

	public List<SyntaxTest> allSyntaxTests() {
		List<SyntaxTest> all = new ArrayList<>(syntaxTests);
		all.addAll(multilineTests);
		return all;
	}

	public boolean isApplicableTo(String model) {
		return model == null || applicableModels.isEmpty() || applicableModels.contains(model);
	}
}
