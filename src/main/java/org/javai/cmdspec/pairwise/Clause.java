package org.javai.cmdspec.pairwise;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One comparison in a constraint expression: {@code P == v}, {@code P != v} or
 * {@code P in [a, b]}.
 */
public record Clause(String parameter, Operator operator, List<Operand> operands) {

	public enum Operator {
		EQUALS,
		NOT_EQUALS,
		IN
	}

	public Clause {
		operands = List.copyOf(operands);
	}

	public TriState evaluate(Function<String, String> assignment) {
		String actual = assignment.apply(parameter);
		if (actual == null) {
			return TriState.UNKNOWN;
		}
		boolean unknownOperand = false;
		boolean matched = false;
		for (Operand operand : operands) {
			String expected = operand.resolve(assignment);
			if (expected == null) {
				unknownOperand = true;
			}
			else if (expected.equals(actual)) {
				matched = true;
			}
		}
		if (matched) {
			return operator == Operator.NOT_EQUALS ? TriState.FALSE : TriState.TRUE;
		}
		if (unknownOperand) {
			return TriState.UNKNOWN;
		}
		return operator == Operator.NOT_EQUALS ? TriState.TRUE : TriState.FALSE;
	}

	public Set<String> referencedParameters() {
		Set<String> names = new LinkedHashSet<>();
		names.add(parameter);
		for (Operand operand : operands) {
			if (operand instanceof Operand.Reference reference) {
				names.add(reference.parameter());
			}
		}
		return names;
	}

	@Override
	public String toString() {
		return switch (operator) {
			case EQUALS -> parameter + " == " + operands.get(0);
			case NOT_EQUALS -> parameter + " != " + operands.get(0);
			case IN -> parameter + " in " + operands.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
		};
	}
}
