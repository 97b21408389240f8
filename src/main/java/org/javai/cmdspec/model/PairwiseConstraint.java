package org.javai.cmdspec.model;

import java.util.List;

/**
 * A constraint on pairwise combinations.
 *
 * @param condition conjunction of clauses selecting the combinations this constraint applies to
 * @param requires clauses that must hold whenever the condition holds, optional
 * @param invalidFor models on which combinations matching the condition are invalid
 * @param priority explicit precedence when a requires and an invalid-for constraint both match
 */
public record PairwiseConstraint(String condition, String requires, List<String> invalidFor, Integer priority) {

	public PairwiseConstraint {
		invalidFor = invalidFor != null ? List.copyOf(invalidFor) : List.of();
	}

	public PairwiseConstraint(String condition, String requires) {
		this(condition, requires, List.of(), null);
	}

	public boolean isRequires() {
		return requires != null && !requires.isBlank();
	}

	public boolean isInvalidFor() {
		return !invalidFor.isEmpty();
	}

	@Override
	public String toString() {
		if (isRequires()) {
			return "if " + condition + " then " + requires;
		}
		return condition + " invalid for " + invalidFor;
	}
}
