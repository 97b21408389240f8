package org.javai.cmdspec.pairwise;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.javai.cmdspec.DefectKind;
import org.javai.cmdspec.SpecificationDefect;
import org.javai.cmdspec.SpecificationDefectException;
import org.javai.cmdspec.model.CommandSpec;
import org.javai.cmdspec.model.EnumValue;
import org.javai.cmdspec.model.PairwiseConstraint;
import org.javai.cmdspec.model.PairwiseSpec;
import org.javai.cmdspec.model.ParamType;
import org.javai.cmdspec.model.Parameter;
import org.javai.cmdspec.model.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates a pairwise test matrix for a command.
 *
 * <p>Every pair of participant values that no constraint forbids outright is
 * covered by at least one row, and no row triggers a forbidden pattern on the
 * models it is tagged with. Models are partitioned by the invalid-for
 * constraints in effect; each partition gets its own covering array and
 * identical rows are merged afterwards.
 *
 * <p>Generation is deterministic: the same specification always yields the
 * same rows in the same order.
 */
public class PairwiseMatrixGenerator {

	private static final Logger logger = LoggerFactory.getLogger(PairwiseMatrixGenerator.class);

	private static final String SUBJECT = "pairwise";

	private final ConstraintParser parser = new ConstraintParser();

	public List<Combination> generate(CommandSpec command) {
		return generate(command, command.pairwise());
	}

	/**
	 * @throws SpecificationDefectException when the pairwise section references
	 * unknown parameters or models, a constraint is malformed or ambiguous, or a
	 * required pair cannot be covered
	 */
	public List<Combination> generate(CommandSpec command, PairwiseSpec spec) {
		Objects.requireNonNull(command, "command must not be null");
		if (spec == null || !spec.enabled()) {
			return List.of();
		}
		List<SpecificationDefect> defects = new ArrayList<>();
		List<String> participants = spec.parameters();

		Map<String, List<Object>> domains = candidateDomains(command, spec, defects);
		List<CompiledConstraint> constraints = compile(command, spec, defects);
		if (!defects.isEmpty()) {
			throw new SpecificationDefectException(defects);
		}
		checkPrecedence(command, constraints, domains, defects);
		List<ModelGroup> groups = modelGroups(command, constraints, defects);
		if (!defects.isEmpty()) {
			throw new SpecificationDefectException(defects);
		}

		List<List<String>> tokens = new ArrayList<>();
		for (String participant : participants) {
			tokens.add(domains.get(participant).stream().map(Values::token).toList());
		}

		Map<List<String>, MergedRow> merged = new LinkedHashMap<>();
		for (ModelGroup group : groups) {
			List<CompiledConstraint> active = constraints.stream()
					.filter(c -> c.kind() == CompiledConstraint.Kind.REQUIRES || group.active().contains(c.index()))
					.toList();
			CoveringArrayBuilder.Result result = new CoveringArrayBuilder(participants, tokens, active).build();
			for (String pair : result.uncoverable()) {
				defects.add(new SpecificationDefect(DefectKind.UNCOVERABLE_PAIR, command.name(), SUBJECT,
						"pair (" + pair + ") has no valid combination" + group.describe()));
			}
			for (int[] row : result.rows()) {
				List<String> key = new ArrayList<>();
				Map<String, Object> values = new LinkedHashMap<>();
				for (int i = 0; i < row.length; i++) {
					key.add(tokens.get(i).get(row[i]));
					values.put(participants.get(i), domains.get(participants.get(i)).get(row[i]));
				}
				merged.computeIfAbsent(key, k -> new MergedRow(values)).add(group);
			}
		}
		if (!defects.isEmpty()) {
			throw new SpecificationDefectException(defects);
		}

		List<Combination> combinations = merged.values().stream().map(MergedRow::toCombination).toList();
		logger.debug("Generated {} pairwise combinations for {} over {} model group(s)",
				combinations.size(), command.name(), groups.size());
		return combinations;
	}

	private Map<String, List<Object>> candidateDomains(CommandSpec command, PairwiseSpec spec,
			List<SpecificationDefect> defects) {
		for (String key : spec.parameterValues().keySet()) {
			if (!spec.parameters().contains(key)) {
				defects.add(new SpecificationDefect(DefectKind.UNKNOWN_PARAMETER, command.name(), key,
						"candidate values given for a parameter that does not participate in pairwise generation"));
			}
		}
		Map<String, List<Object>> domains = new LinkedHashMap<>();
		for (String participant : spec.parameters()) {
			Parameter parameter = command.parameter(participant).orElse(null);
			if (parameter == null) {
				defects.add(new SpecificationDefect(DefectKind.UNKNOWN_PARAMETER, command.name(), participant,
						"pairwise participant is not a parameter of the command"));
				continue;
			}
			List<Object> declared = spec.parameterValues().get(participant);
			List<Object> candidates;
			if (declared != null && !declared.isEmpty()) {
				candidates = distinct(declared);
			}
			else if (parameter.hasEnum()) {
				candidates = parameter.enumValues().stream().map(EnumValue::value).map(Object.class::cast).toList();
			}
			else if (parameter.type() == ParamType.SWITCH) {
				candidates = List.of("on", "off");
			}
			else {
				defects.add(new SpecificationDefect(DefectKind.UNDERIVABLE_CANDIDATES, command.name(), participant,
						"no candidate values listed and none derivable from type " + parameter.type().tag()));
				continue;
			}
			domains.put(participant, candidates);
		}
		return domains;
	}

	private List<Object> distinct(List<Object> values) {
		Map<String, Object> byToken = new LinkedHashMap<>();
		for (Object value : values) {
			byToken.putIfAbsent(Values.token(value), value);
		}
		return new ArrayList<>(byToken.values());
	}

	private List<CompiledConstraint> compile(CommandSpec command, PairwiseSpec spec, List<SpecificationDefect> defects) {
		List<CompiledConstraint> compiled = new ArrayList<>();
		for (int i = 0; i < spec.constraints().size(); i++) {
			PairwiseConstraint constraint = spec.constraints().get(i);
			String subject = "constraint #" + (i + 1);
			boolean requires = constraint.isRequires();
			boolean invalidFor = constraint.isInvalidFor();
			if (requires && invalidFor) {
				defects.add(new SpecificationDefect(DefectKind.CONSTRAINT_PRECEDENCE, command.name(), subject,
						"declares both requires and invalid_for; split it into two constraints with priorities"));
				continue;
			}
			if (!requires && !invalidFor) {
				defects.add(new SpecificationDefect(DefectKind.MALFORMED_CONSTRAINT, command.name(), subject,
						"declares neither requires nor invalid_for"));
				continue;
			}
			try {
				ConstraintExpression condition = parser.parse(constraint.condition());
				ConstraintExpression required = requires ? parser.parse(constraint.requires()) : null;
				CompiledConstraint result = new CompiledConstraint(i,
						requires ? CompiledConstraint.Kind.REQUIRES : CompiledConstraint.Kind.INVALID_FOR,
						condition, required, constraint.invalidFor(), constraint.priority(), constraint);
				for (String name : result.referencedParameters()) {
					if (!spec.parameters().contains(name)) {
						defects.add(new SpecificationDefect(DefectKind.UNKNOWN_PARAMETER, command.name(), subject,
								"references " + name + " which does not participate in pairwise generation"));
					}
				}
				compiled.add(result);
			}
			catch (IllegalArgumentException e) {
				defects.add(new SpecificationDefect(DefectKind.MALFORMED_CONSTRAINT, command.name(), subject, e.getMessage()));
			}
		}
		return compiled;
	}

	// A requires and an invalid-for constraint that can both match the same row
	// need distinct priorities to decide which one wins
	private void checkPrecedence(CommandSpec command, List<CompiledConstraint> constraints,
			Map<String, List<Object>> domains, List<SpecificationDefect> defects) {
		for (CompiledConstraint requires : constraints) {
			if (requires.kind() != CompiledConstraint.Kind.REQUIRES) {
				continue;
			}
			for (CompiledConstraint invalidFor : constraints) {
				if (invalidFor.kind() != CompiledConstraint.Kind.INVALID_FOR || requires.hasDistinctPriorityFrom(invalidFor)) {
					continue;
				}
				if (jointlySatisfiable(requires.condition(), invalidFor.condition(), domains)) {
					defects.add(new SpecificationDefect(DefectKind.CONSTRAINT_PRECEDENCE, command.name(),
							"constraints #" + (requires.index() + 1) + " and #" + (invalidFor.index() + 1),
							"conditions '" + requires.condition() + "' and '" + invalidFor.condition()
									+ "' can match the same combination; give them distinct priorities"));
				}
			}
		}
	}

	private boolean jointlySatisfiable(ConstraintExpression left, ConstraintExpression right,
			Map<String, List<Object>> domains) {
		Set<String> names = new LinkedHashSet<>(left.referencedParameters());
		names.addAll(right.referencedParameters());
		return satisfiable(new ArrayList<>(names), 0, new LinkedHashMap<>(), left, right, domains);
	}

	private boolean satisfiable(List<String> names, int position, Map<String, String> assignment,
			ConstraintExpression left, ConstraintExpression right, Map<String, List<Object>> domains) {
		TriState state = left.evaluate(assignment::get).and(right.evaluate(assignment::get));
		if (state != TriState.UNKNOWN || position == names.size()) {
			return state == TriState.TRUE;
		}
		String name = names.get(position);
		for (Object value : domains.getOrDefault(name, List.of())) {
			assignment.put(name, Values.token(value));
			if (satisfiable(names, position + 1, assignment, left, right, domains)) {
				return true;
			}
			assignment.remove(name);
		}
		return false;
	}

	private List<ModelGroup> modelGroups(CommandSpec command, List<CompiledConstraint> constraints,
			List<SpecificationDefect> defects) {
		Set<String> named = new LinkedHashSet<>();
		for (CompiledConstraint constraint : constraints) {
			named.addAll(constraint.invalidFor());
		}
		List<String> applicable = command.applicableModels();
		Map<Set<Integer>, ModelGroup> groups = new LinkedHashMap<>();
		if (applicable.isEmpty()) {
			groups.put(Set.of(), new ModelGroup(Set.of(), new LinkedHashSet<>(), true));
			for (String model : named) {
				group(groups, activeFor(model, constraints), model);
			}
		}
		else {
			for (String model : named) {
				if (!applicable.contains(model)) {
					defects.add(new SpecificationDefect(DefectKind.UNKNOWN_MODEL, command.name(), SUBJECT,
							"invalid_for names " + model + " which is not an applicable model of the command"));
				}
			}
			for (String model : applicable) {
				group(groups, activeFor(model, constraints), model);
			}
		}
		return new ArrayList<>(groups.values());
	}

	private static void group(Map<Set<Integer>, ModelGroup> groups, Set<Integer> active, String model) {
		groups.computeIfAbsent(active, a -> new ModelGroup(a, new LinkedHashSet<>(), false)).models().add(model);
	}

	private static Set<Integer> activeFor(String model, List<CompiledConstraint> constraints) {
		Set<Integer> active = new TreeSet<>();
		for (CompiledConstraint constraint : constraints) {
			if (constraint.invalidFor().contains(model)) {
				active.add(constraint.index());
			}
		}
		return active;
	}

	private record ModelGroup(Set<Integer> active, Set<String> models, boolean otherModels) {
		String describe() {
			if (otherModels && models.isEmpty()) {
				return "";
			}
			return " on " + models;
		}
	}

	private static final class MergedRow {
		private final Map<String, Object> values;
		private final Set<String> models = new LinkedHashSet<>();
		private boolean otherModels;

		private MergedRow(Map<String, Object> values) {
			this.values = values;
		}

		void add(ModelGroup group) {
			models.addAll(group.models());
			otherModels |= group.otherModels();
		}

		Combination toCombination() {
			return new Combination(values, models, otherModels);
		}
	}
}
