package org.javai.cmdspec.pairwise;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import org.javai.cmdspec.model.PairwiseConstraint;

/**
 * A parsed pairwise constraint.
 *
 * <p>A {@link Kind#REQUIRES} constraint forbids {@code condition && !requires}.
 * An {@link Kind#INVALID_FOR} constraint forbids {@code condition} on its models.
 *
 * @param index declaration order
 * @param kind requires or invalid-for
 * @param condition when the constraint applies
 * @param requires what must hold when it applies, {@code null} for invalid-for
 * @param invalidFor models the condition is forbidden on
 * @param priority explicit priority, higher wins, optional
 * @param source the declared constraint
 */
public record CompiledConstraint(
		int index,
		Kind kind,
		ConstraintExpression condition,
		ConstraintExpression requires,
		List<String> invalidFor,
		Integer priority,
		PairwiseConstraint source
) {

	public enum Kind {
		REQUIRES,
		INVALID_FOR
	}

	public CompiledConstraint {
		invalidFor = invalidFor != null ? List.copyOf(invalidFor) : List.of();
	}

	/**
	 * Whether this constraint is definitely violated by every completion of the assignment.
	 */
	public boolean forbids(Function<String, String> assignment) {
		TriState triggered = condition.evaluate(assignment);
		if (triggered != TriState.TRUE) {
			return false;
		}
		return kind == Kind.INVALID_FOR || requires.evaluate(assignment) == TriState.FALSE;
	}

	public boolean outranks(CompiledConstraint other) {
		return priority != null && other.priority != null && priority > other.priority;
	}

	public boolean hasDistinctPriorityFrom(CompiledConstraint other) {
		return priority != null && other.priority != null && !priority.equals(other.priority);
	}

	public Set<String> referencedParameters() {
		Set<String> names = new LinkedHashSet<>(condition.referencedParameters());
		if (requires != null) {
			names.addAll(requires.referencedParameters());
		}
		return names;
	}

	@Override
	public String toString() {
		return kind == Kind.REQUIRES
				? "if " + condition + " then " + requires
				: "not " + condition + " on " + invalidFor;
	}
}
