package org.javai.cmdspec.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declares which parameters participate in pairwise coverage, their candidate
 * values and the constraints between them.
 */
public record PairwiseSpec(
		boolean enabled,
		List<String> parameters,
		Map<String, List<Object>> parameterValues,
		List<PairwiseConstraint> constraints
) {

	public PairwiseSpec {
		parameters = parameters != null ? List.copyOf(parameters) : List.of();
		Map<String, List<Object>> values = new LinkedHashMap<>();
		if (parameterValues != null) {
			parameterValues.forEach((name, candidates) -> values.put(name, List.copyOf(candidates)));
		}
		parameterValues = Collections.unmodifiableMap(values);
		constraints = constraints != null ? List.copyOf(constraints) : List.of();
	}
}
