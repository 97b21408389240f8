package org.javai.cmdspec.pairwise;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds a pairwise covering array for one model group.
 *
 * <p>Rows are grown greedily: the compatible uncovered pair that leaves the
 * fewest remaining choices is added first, with forward checking over the
 * unassigned parameters and a complete backtracking check that the partial row
 * still extends to a valid total row. Ties go to the pair declared first.
 * Remaining parameters are filled with the value covering the most new pairs.
 */
final class CoveringArrayBuilder {

	private static final int UNASSIGNED = -1;

	private final List<String> parameters;
	private final List<List<String>> tokens;
	private final List<CompiledConstraint> constraints;
	private final Map<String, Integer> positions = new HashMap<>();
	private final Map<String, Boolean> extendableMemo = new HashMap<>();

	record Pair(int first, int firstValue, int second, int secondValue) {
		boolean coveredBy(int[] row) {
			return row[first] == firstValue && row[second] == secondValue;
		}
	}

	record Result(List<int[]> rows, List<String> uncoverable) {
	}

	CoveringArrayBuilder(List<String> parameters, List<List<String>> tokens, List<CompiledConstraint> constraints) {
		this.parameters = List.copyOf(parameters);
		this.tokens = List.copyOf(tokens);
		this.constraints = List.copyOf(constraints);
		for (int i = 0; i < parameters.size(); i++) {
			positions.put(parameters.get(i), i);
		}
	}

	Result build() {
		int n = parameters.size();
		List<int[]> rows = new ArrayList<>();
		if (n == 0) {
			return new Result(rows, List.of());
		}
		if (n == 1) {
			for (int v = 0; v < tokens.get(0).size(); v++) {
				int[] row = new int[] {v};
				if (!violated(row)) {
					rows.add(row);
				}
			}
			return new Result(rows, List.of());
		}

		Set<Pair> uncovered = new LinkedHashSet<>();
		List<String> uncoverable = new ArrayList<>();
		for (int i = 0; i < n; i++) {
			for (int j = i + 1; j < n; j++) {
				for (int a = 0; a < tokens.get(i).size(); a++) {
					for (int b = 0; b < tokens.get(j).size(); b++) {
						Pair pair = new Pair(i, a, j, b);
						int[] partial = with(blank(), pair);
						if (violated(partial)) {
							continue;
						}
						if (extendable(partial)) {
							uncovered.add(pair);
						}
						else {
							uncoverable.add(describe(pair));
						}
					}
				}
			}
		}
		if (!uncoverable.isEmpty()) {
			return new Result(List.of(), uncoverable);
		}

		while (!uncovered.isEmpty()) {
			int[] row = blank();
			while (true) {
				Pair best = null;
				int bestFreedom = Integer.MAX_VALUE;
				for (Pair pair : uncovered) {
					if (!compatible(row, pair) || pair.coveredBy(row)) {
						continue;
					}
					int[] candidate = with(row, pair);
					int freedom = freedom(candidate);
					if (freedom >= 0 && freedom < bestFreedom && extendable(candidate)) {
						best = pair;
						bestFreedom = freedom;
					}
				}
				if (best == null) {
					break;
				}
				row = with(row, best);
			}
			fill(row, uncovered);
			if (violated(row)) {
				throw new IllegalStateException("Generated row violates a constraint: " + render(row));
			}
			int[] finished = row;
			uncovered.removeIf(pair -> pair.coveredBy(finished));
			rows.add(row);
		}
		return new Result(rows, List.of());
	}

	private void fill(int[] row, Set<Pair> uncovered) {
		for (int i = 0; i < row.length; i++) {
			if (row[i] != UNASSIGNED) {
				continue;
			}
			int bestValue = UNASSIGNED;
			int bestGain = -1;
			for (int v = 0; v < tokens.get(i).size(); v++) {
				int[] candidate = row.clone();
				candidate[i] = v;
				if (!extendable(candidate)) {
					continue;
				}
				int gain = 0;
				for (Pair pair : uncovered) {
					if ((pair.first() == i || pair.second() == i) && pair.coveredBy(candidate)) {
						gain++;
					}
				}
				if (gain > bestGain) {
					bestGain = gain;
					bestValue = v;
				}
			}
			if (bestValue == UNASSIGNED) {
				throw new IllegalStateException("No value of " + parameters.get(i) + " completes row " + render(row));
			}
			row[i] = bestValue;
		}
	}

	boolean violated(int[] row) {
		Function<String, String> assignment = lookup(row);
		for (CompiledConstraint constraint : constraints) {
			if (!constraint.forbids(assignment)) {
				continue;
			}
			if (constraint.kind() == CompiledConstraint.Kind.INVALID_FOR && overruled(constraint, assignment)) {
				continue;
			}
			return true;
		}
		return false;
	}

	// A higher priority requires-constraint that may apply decides instead of the invalid-for
	private boolean overruled(CompiledConstraint invalidFor, Function<String, String> assignment) {
		for (CompiledConstraint constraint : constraints) {
			if (constraint.kind() == CompiledConstraint.Kind.REQUIRES
					&& constraint.outranks(invalidFor)
					&& constraint.condition().evaluate(assignment) != TriState.FALSE) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Sum of the viable value counts of the unassigned parameters, or -1 when
	 * some unassigned parameter has no viable value left.
	 */
	private int freedom(int[] row) {
		if (violated(row)) {
			return -1;
		}
		int total = 0;
		for (int i = 0; i < row.length; i++) {
			if (row[i] != UNASSIGNED) {
				continue;
			}
			int viable = viableValues(row, i).size();
			if (viable == 0) {
				return -1;
			}
			total += viable;
		}
		return total;
	}

	private List<Integer> viableValues(int[] row, int position) {
		List<Integer> viable = new ArrayList<>();
		int[] candidate = row.clone();
		for (int v = 0; v < tokens.get(position).size(); v++) {
			candidate[position] = v;
			if (!violated(candidate)) {
				viable.add(v);
			}
		}
		return viable;
	}

	boolean extendable(int[] row) {
		String key = Arrays.toString(row);
		Boolean known = extendableMemo.get(key);
		if (known != null) {
			return known;
		}
		boolean result = search(row);
		extendableMemo.put(key, result);
		return result;
	}

	private boolean search(int[] row) {
		if (violated(row)) {
			return false;
		}
		int next = UNASSIGNED;
		List<Integer> nextValues = null;
		for (int i = 0; i < row.length; i++) {
			if (row[i] != UNASSIGNED) {
				continue;
			}
			List<Integer> viable = viableValues(row, i);
			if (viable.isEmpty()) {
				return false;
			}
			if (nextValues == null || viable.size() < nextValues.size()) {
				next = i;
				nextValues = viable;
			}
		}
		if (next == UNASSIGNED) {
			return true;
		}
		for (int v : nextValues) {
			int[] candidate = row.clone();
			candidate[next] = v;
			if (extendable(candidate)) {
				return true;
			}
		}
		return false;
	}

	private Function<String, String> lookup(int[] row) {
		return name -> {
			Integer position = positions.get(name);
			if (position == null || row[position] == UNASSIGNED) {
				return null;
			}
			return tokens.get(position).get(row[position]);
		};
	}

	private int[] blank() {
		int[] row = new int[parameters.size()];
		Arrays.fill(row, UNASSIGNED);
		return row;
	}

	private static boolean compatible(int[] row, Pair pair) {
		return (row[pair.first()] == UNASSIGNED || row[pair.first()] == pair.firstValue())
				&& (row[pair.second()] == UNASSIGNED || row[pair.second()] == pair.secondValue());
	}

	private static int[] with(int[] row, Pair pair) {
		int[] copy = row.clone();
		copy[pair.first()] = pair.firstValue();
		copy[pair.second()] = pair.secondValue();
		return copy;
	}

	private String describe(Pair pair) {
		return parameters.get(pair.first()) + "=" + tokens.get(pair.first()).get(pair.firstValue())
				+ ", " + parameters.get(pair.second()) + "=" + tokens.get(pair.second()).get(pair.secondValue());
	}

	private String render(int[] row) {
		StringBuilder sb = new StringBuilder("{");
		for (int i = 0; i < row.length; i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(parameters.get(i)).append('=').append(row[i] == UNASSIGNED ? "?" : tokens.get(i).get(row[i]));
		}
		return sb.append('}').toString();
	}
}
