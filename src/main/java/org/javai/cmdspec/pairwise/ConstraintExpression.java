package org.javai.cmdspec.pairwise;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A conjunction of clauses.
 */
public record ConstraintExpression(List<Clause> clauses) {

	public ConstraintExpression {
		if (clauses == null || clauses.isEmpty()) {
			throw new IllegalArgumentException("A constraint expression needs at least one clause");
		}
		clauses = List.copyOf(clauses);
	}

	public TriState evaluate(Function<String, String> assignment) {
		TriState result = TriState.TRUE;
		for (Clause clause : clauses) {
			result = result.and(clause.evaluate(assignment));
			if (result == TriState.FALSE) {
				return result;
			}
		}
		return result;
	}

	public Set<String> referencedParameters() {
		Set<String> names = new LinkedHashSet<>();
		clauses.forEach(c -> names.addAll(c.referencedParameters()));
		return names;
	}

	@Override
	public String toString() {
		return clauses.stream().map(Clause::toString).collect(Collectors.joining(" && "));
	}
}
