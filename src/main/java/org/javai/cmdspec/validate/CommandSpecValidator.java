package org.javai.cmdspec.validate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.javai.cmdspec.DefectKind;
import org.javai.cmdspec.SpecificationDefect;
import org.javai.cmdspec.capability.DeviceCapabilityCatalog;
import org.javai.cmdspec.model.BoundaryTest;
import org.javai.cmdspec.model.CommandSpec;
import org.javai.cmdspec.model.EnumValue;
import org.javai.cmdspec.model.FieldBinding;
import org.javai.cmdspec.model.IntRange;
import org.javai.cmdspec.model.ModelOverride;
import org.javai.cmdspec.model.PairwiseConstraint;
import org.javai.cmdspec.model.PairwiseSpec;
import org.javai.cmdspec.model.Parameter;
import org.javai.cmdspec.model.SyntaxForm;
import org.javai.cmdspec.model.SyntaxTest;
import org.javai.cmdspec.model.Values;
import org.javai.cmdspec.model.Variant;
import org.javai.cmdspec.pairwise.ConstraintExpression;
import org.javai.cmdspec.pairwise.ConstraintParser;
import org.javai.cmdspec.syntax.CommandTemplate;

/**
 * Checks a loaded command specification for internal consistency before
 * anything is generated from it. Every defect is reported; checking does not
 * stop at the first one.
 */
public class CommandSpecValidator {

	private final DeviceCapabilityCatalog catalog;
	private final ConstraintParser constraintParser = new ConstraintParser();

	public CommandSpecValidator(DeviceCapabilityCatalog catalog) {
		this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
	}

	public List<SpecificationDefect> validate(CommandSpec command) {
		Objects.requireNonNull(command, "command must not be null");
		Checker checker = new Checker(command);
		checker.models("command", command.applicableModels());
		command.parameters().values().forEach(checker::parameter);
		command.boundaryTests().forEach(checker::boundaryTests);
		command.allSyntaxTests().forEach(checker::syntaxTest);
		checker.syntaxForms(command.syntax().setForms());
		checker.syntaxForms(command.syntax().deleteForms());
		if (command.pairwise() != null && command.pairwise().enabled()) {
			checker.pairwise(command.pairwise());
		}
		return checker.defects;
	}

	private final class Checker {
		private final CommandSpec command;
		private final List<SpecificationDefect> defects = new ArrayList<>();

		private Checker(CommandSpec command) {
			this.command = command;
		}

		void models(String subject, Iterable<String> models) {
			for (String model : models) {
				if (!catalog.knows(model)) {
					defect(DefectKind.UNKNOWN_MODEL, subject, "unknown model " + model);
				}
			}
		}

		void parameter(Parameter parameter) {
			String name = parameter.name();
			range(name, "base range", parameter.range());
			models(name, parameter.availability().referencedModels());
			for (Map.Entry<String, ModelOverride> entry : parameter.modelOverrides().entrySet()) {
				String model = entry.getKey();
				ModelOverride override = entry.getValue();
				models(name, List.of(model));
				range(name, "range on " + model, override.range());
				if (override.capability() != null && catalog.knows(model)
						&& catalog.baseLimit(model, override.capability()).isEmpty()
						&& catalog.licenseTable(model, override.capability()).isEmpty()) {
					defect(DefectKind.MALFORMED_RANGE, name, "capability " + override.capability() + " is unknown on " + model);
				}
				if (!override.licenseLimits().isEmpty() && override.range() == null && parameter.range() == null
						&& override.capability() == null) {
					defect(DefectKind.MALFORMED_RANGE, name, "license extension on " + model + " has no base range");
				}
			}
			if (parameter.pattern() != null) {
				pattern(name, parameter.pattern());
			}

			if (parameter.hasEnum()) {
				for (EnumValue value : parameter.enumValues()) {
					for (String target : value.resolvesTo()) {
						if (parameter.enumValue(target).filter(v -> !v.isDeferred()).isEmpty()) {
							defect(DefectKind.ENUM_VALUE_OUT_OF_DOMAIN, name,
									"deferred value " + value.value() + " resolves to " + target + " which is not a concrete member");
						}
					}
				}
				Object defaultValue = parameter.defaultValue();
				if (defaultValue != null && !parameter.hasVariants()
						&& parameter.enumValue(Values.token(defaultValue)).isEmpty()) {
					defect(DefectKind.ENUM_VALUE_OUT_OF_DOMAIN, name, "default " + Values.token(defaultValue) + " is not an allowed value");
				}
			}

			Set<String> selectors = new HashSet<>();
			for (Variant variant : parameter.variants()) {
				if (!selectors.add(variant.selector())) {
					defect(DefectKind.DUPLICATE_VARIANT, name, "variant " + variant.selector() + " is declared more than once");
				}
				range(name, "range of variant " + variant.selector(), variant.range());
				if (variant.pattern() != null) {
					pattern(name, variant.pattern());
				}
			}
			if (parameter.fieldBinding() instanceof FieldBinding.PerSelector perSelector) {
				if (!parameter.hasVariants()) {
					defect(DefectKind.MALFORMED_BINDING, name, "per-variant field binding on a parameter without variants");
				}
				else {
					for (String selector : perSelector.fields().keySet()) {
						if (!selectors.contains(selector)) {
							defect(DefectKind.MALFORMED_BINDING, name, "field binding names unknown variant " + selector);
						}
					}
				}
			}
		}

		void boundaryTests(String parameterName, List<BoundaryTest> tests) {
			Parameter parameter = command.parameters().get(parameterName);
			if (parameter == null) {
				defect(DefectKind.UNKNOWN_PARAMETER, parameterName, "boundary tests reference an unknown parameter");
				return;
			}
			for (BoundaryTest test : tests) {
				models(parameterName, test.validFor());
				models(parameterName, test.invalidFor());
				String token = Values.token(test.value());
				if (test.valid() && !test.isModelScoped() && parameter.hasEnum() && !parameter.hasVariants()
						&& parameter.enumValue(token).isEmpty()) {
					defect(DefectKind.ENUM_VALUE_OUT_OF_DOMAIN, parameterName, "declared valid value " + token + " is not an allowed value");
				}
			}
		}

		void syntaxTest(SyntaxTest test) {
			models("syntax test " + test.name(), test.modelConstraints().referencedModels());
		}

		void syntaxForms(List<SyntaxForm> forms) {
			for (SyntaxForm form : forms) {
				CommandTemplate template;
				try {
					template = CommandTemplate.compile(form.template());
				}
				catch (IllegalArgumentException e) {
					defect(DefectKind.MALFORMED_SYNTAX, form.template(), e.getMessage());
					continue;
				}
				for (String placeholder : template.placeholders()) {
					if (!command.parameters().containsKey(placeholder)) {
						defect(DefectKind.UNKNOWN_PARAMETER, placeholder, "placeholder in '" + form.template() + "' is not a parameter");
					}
				}
			}
		}

		void pairwise(PairwiseSpec pairwise) {
			for (String participant : pairwise.parameters()) {
				if (!command.parameters().containsKey(participant)) {
					defect(DefectKind.UNKNOWN_PARAMETER, participant, "pairwise participant is not a parameter");
				}
			}
			for (String key : pairwise.parameterValues().keySet()) {
				if (!pairwise.parameters().contains(key)) {
					defect(DefectKind.UNKNOWN_PARAMETER, key, "candidate values given for a non-participant");
				}
			}
			for (int i = 0; i < pairwise.constraints().size(); i++) {
				PairwiseConstraint constraint = pairwise.constraints().get(i);
				String subject = "constraint #" + (i + 1);
				models(subject, constraint.invalidFor());
				if (constraint.isRequires() && constraint.isInvalidFor()) {
					defect(DefectKind.CONSTRAINT_PRECEDENCE, subject, "declares both requires and invalid_for");
				}
				else if (!constraint.isRequires() && !constraint.isInvalidFor()) {
					defect(DefectKind.MALFORMED_CONSTRAINT, subject, "declares neither requires nor invalid_for");
				}
				expression(subject, constraint.condition(), pairwise);
				if (constraint.isRequires()) {
					expression(subject, constraint.requires(), pairwise);
				}
			}
		}

		private void expression(String subject, String text, PairwiseSpec pairwise) {
			ConstraintExpression expression;
			try {
				expression = constraintParser.parse(text);
			}
			catch (IllegalArgumentException e) {
				defect(DefectKind.MALFORMED_CONSTRAINT, subject, e.getMessage());
				return;
			}
			for (String name : expression.referencedParameters()) {
				if (!pairwise.parameters().contains(name)) {
					defect(DefectKind.UNKNOWN_PARAMETER, subject, "references " + name + " which is not a pairwise participant");
				}
			}
		}

		private void range(String subject, String what, IntRange range) {
			if (range != null && !range.isOrdered()) {
				defect(DefectKind.MALFORMED_RANGE, subject, what + " " + range + " is not ordered");
			}
		}

		private void pattern(String subject, String regex) {
			try {
				Pattern.compile(regex);
			}
			catch (PatternSyntaxException e) {
				defect(DefectKind.MALFORMED_SYNTAX, subject, "invalid pattern " + regex + ": " + e.getDescription());
			}
		}

		private void defect(DefectKind kind, String subject, String message) {
			defects.add(new SpecificationDefect(kind, command.name(), subject, message));
		}
	}
}
