package org.javai.cmdspec.boundary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.cmdspec.CoverageGap;
import org.javai.cmdspec.DefectKind;
import org.javai.cmdspec.GenerationOptions;
import org.javai.cmdspec.SpecificationDefect;
import org.javai.cmdspec.SpecificationDefectException;
import org.javai.cmdspec.capability.LicenseContext;
import org.javai.cmdspec.model.BoundaryTest;
import org.javai.cmdspec.model.CommandSpec;
import org.javai.cmdspec.model.EnumValue;
import org.javai.cmdspec.model.IntRange;
import org.javai.cmdspec.model.ParamType;
import org.javai.cmdspec.model.Parameter;
import org.javai.cmdspec.model.Values;
import org.javai.cmdspec.model.Variant;
import org.javai.cmdspec.resolve.EffectiveDomain;
import org.javai.cmdspec.resolve.ParameterResolver;
import org.javai.cmdspec.resolve.ParameterValidator;
import org.javai.cmdspec.resolve.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns declared boundary tests and resolved parameter domains into concrete
 * boundary cases.
 *
 * <p>Declared cases come first and win over derived cases for the same value,
 * model and license context. Derived cases cover the four canonical range
 * boundaries (or the parameter's explicit boundary values), every enum member
 * plus one out-of-set token, the on/off switch keywords, the ranges of
 * variants and each tier of a license-extension table.
 *
 * <p>Every defect found in the declared tests is reported together in one
 * {@link SpecificationDefectException}.
 */
public class BoundaryTestExpander {

	private static final Logger logger = LoggerFactory.getLogger(BoundaryTestExpander.class);

	private final ParameterResolver resolver;
	private final ParameterValidator validator;
	private final GenerationOptions options;

	public BoundaryTestExpander(ParameterResolver resolver, ParameterValidator validator, GenerationOptions options) {
		this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
		this.validator = Objects.requireNonNull(validator, "validator must not be null");
		this.options = options != null ? options : GenerationOptions.defaults();
	}

	public BoundaryExpansion expand(CommandSpec command, Parameter parameter, List<BoundaryTest> declared) {
		return expand(command, parameter, declared, LicenseContext.none());
	}

	/**
	 * Expand the boundary cases of one parameter.
	 *
	 * @param license license context for the declared and canonical cases; tier
	 * cases use this context with one SKU's quantity replaced
	 * @throws SpecificationDefectException when a declared test contradicts the resolved domain
	 */
	public BoundaryExpansion expand(CommandSpec command, Parameter parameter, List<BoundaryTest> declared,
			LicenseContext license) {
		Objects.requireNonNull(command, "command must not be null");
		Objects.requireNonNull(parameter, "parameter must not be null");
		LicenseContext context = license != null ? license : LicenseContext.none();
		Expansion expansion = new Expansion(command, parameter);

		for (BoundaryTest test : declared != null ? declared : List.<BoundaryTest>of()) {
			if (test.isModelScoped()) {
				expandScoped(expansion, test, context);
			}
			else {
				expandUnscoped(expansion, test, context);
			}
		}

		for (String model : autoModels(command, parameter)) {
			Resolution resolution = resolver.resolve(command, parameter, model, context);
			if (resolution instanceof Resolution.Unsupported unsupported) {
				logger.debug("No derived boundaries for {}/{} on {}: {}",
						command.name(), parameter.name(), model, unsupported.reason());
				continue;
			}
			EffectiveDomain domain = resolution.domain().orElseThrow();
			if (parameter.isRangeTyped()) {
				deriveRange(expansion, domain, model, context);
				deriveLicenseTiers(expansion, model, context);
			}
			if (parameter.hasEnum()) {
				deriveEnum(expansion, domain, model, context);
			}
			else if (parameter.type() == ParamType.SWITCH) {
				deriveSwitch(expansion, domain, model, context);
			}
			deriveVariants(expansion, domain, model, context);
		}

		if (!expansion.defects.isEmpty()) {
			throw new SpecificationDefectException(expansion.defects);
		}
		return new BoundaryExpansion(parameter.name(), new ArrayList<>(expansion.cases.values()), expansion.gaps);
	}

	private void expandUnscoped(Expansion expansion, BoundaryTest test, LicenseContext license) {
		EffectiveDomain domain = resolver.resolve(expansion.command, expansion.parameter, null, license)
				.domain()
				.orElseThrow();
		boolean checkable = expansion.parameter.modelOverrides().isEmpty();
		checkDeclared(expansion, domain, test.value(), test.valid(), checkable);
		expansion.declare(new ConcreteBoundaryCase(expansion.parameter.name(), test.value(), test.valid(), null,
				license, BoundaryOrigin.DECLARED, test.description(), test.errorContains(), domain));
	}

	private void expandScoped(Expansion expansion, BoundaryTest test, LicenseContext license) {
		Set<String> models = new LinkedHashSet<>(expansion.command.applicableModels());
		if (models.isEmpty()) {
			models.addAll(test.validFor());
			models.addAll(test.invalidFor());
		}
		for (String model : models) {
			boolean expected = test.validOn(model);
			Resolution resolution = resolver.resolve(expansion.command, expansion.parameter, model, license);
			EffectiveDomain domain = null;
			if (resolution instanceof Resolution.Unsupported unsupported) {
				if (expected) {
					expansion.defect(DefectKind.BOUNDARY_CONTRADICTS_DOMAIN, "value " + Values.token(test.value())
							+ " is declared valid on " + model + " but the parameter is unsupported there: " + unsupported.reason());
				}
				expected = false;
			}
			else {
				domain = resolution.domain().orElseThrow();
				checkDeclared(expansion, domain, test.value(), expected, true);
			}
			expansion.declare(new ConcreteBoundaryCase(expansion.parameter.name(), test.value(), expected, model,
					license, BoundaryOrigin.DECLARED, test.description(), test.errorContains(), domain));
		}
	}

	private void checkDeclared(Expansion expansion, EffectiveDomain domain, Object value, boolean expected,
			boolean checkable) {
		Parameter parameter = expansion.parameter;
		boolean actual = validator.validate(domain, value).isValid();
		String where = domain.model() != null ? " on " + domain.model() : "";
		if (parameter.hasEnum() && expected && !actual) {
			expansion.defect(DefectKind.ENUM_VALUE_OUT_OF_DOMAIN,
					"value " + Values.token(value) + " is declared valid but is not an allowed value" + where);
			return;
		}
		boolean typedDomain = parameter.hasEnum()
				|| parameter.type() == ParamType.INT
				|| parameter.type() == ParamType.ENUM
				|| parameter.type() == ParamType.SWITCH;
		if (typedDomain && checkable && !domain.isLicenseDependent() && actual != expected) {
			expansion.defect(DefectKind.BOUNDARY_CONTRADICTS_DOMAIN, "value " + Values.token(value) + " is declared "
					+ (expected ? "valid" : "invalid") + " but the domain" + where + " says otherwise");
		}
	}

	// Models that receive derived cases: the command's models, otherwise the base
	// domain plus every model the parameter overrides
	private List<String> autoModels(CommandSpec command, Parameter parameter) {
		if (!command.applicableModels().isEmpty()) {
			return command.applicableModels();
		}
		List<String> models = new ArrayList<>();
		models.add(null);
		models.addAll(parameter.modelOverrides().keySet());
		return models;
	}

	private void deriveRange(Expansion expansion, EffectiveDomain domain, String model, LicenseContext license) {
		IntRange range = domain.range();
		if (range == null) {
			expansion.gap(model, "range-typed parameter has no bounds to derive boundary cases from");
			return;
		}
		if (!expansion.parameter.boundaryOverrides().isEmpty()) {
			for (Object value : expansion.parameter.boundaryOverrides()) {
				boolean valid = validator.validate(domain, value).isValid();
				expansion.derive(value, valid, model, license, BoundaryOrigin.OVERRIDE, "explicit boundary", domain);
			}
			return;
		}
		expansion.derive(range.min() - 1, false, model, license, BoundaryOrigin.RANGE, "below minimum", domain);
		expansion.derive(range.min(), true, model, license, BoundaryOrigin.RANGE, "minimum", domain);
		expansion.derive(range.max(), true, model, license, BoundaryOrigin.RANGE, "maximum", domain);
		expansion.derive(range.max() + 1, false, model, license, BoundaryOrigin.RANGE, "above maximum", domain);
	}

	private void deriveLicenseTiers(Expansion expansion, String model, LicenseContext license) {
		if (model == null) {
			return;
		}
		Parameter parameter = expansion.parameter;
		Map<String, List<Long>> tiers = resolver.licenseTiers(parameter, model);
		boolean declared = parameter.override(model).map(o -> o.declaresLicenseExtension()).orElse(false);
		if (declared && tiers.values().stream().allMatch(List::isEmpty)) {
			expansion.gap(model, "license extension declared but no tier table is available");
			return;
		}
		for (Map.Entry<String, List<Long>> tier : tiers.entrySet()) {
			for (int quantity = 1; quantity <= tier.getValue().size(); quantity++) {
				LicenseContext tierContext = license.with(tier.getKey(), quantity);
				Resolution resolution = resolver.resolve(expansion.command, parameter, model, tierContext);
				if (!resolution.isResolved()) {
					continue;
				}
				EffectiveDomain domain = resolution.domain().orElseThrow();
				long limit = domain.range().max();
				String label = tier.getKey() + " x" + quantity;
				expansion.derive(limit - 1, true, model, tierContext, BoundaryOrigin.LICENSE_TIER, "below " + label + " limit", domain);
				expansion.derive(limit, true, model, tierContext, BoundaryOrigin.LICENSE_TIER, label + " limit", domain);
				expansion.derive(limit + 1, false, model, tierContext, BoundaryOrigin.LICENSE_TIER, "above " + label + " limit", domain);
			}
		}
	}

	private void deriveEnum(Expansion expansion, EffectiveDomain domain, String model, LicenseContext license) {
		for (EnumValue value : domain.enumValues()) {
			expansion.derive(value.value(), true, model, license, BoundaryOrigin.ENUM, value.description(), domain);
		}
		expansion.derive(outOfSetToken(domain), false, model, license, BoundaryOrigin.ENUM, "not an allowed value", domain);
	}

	private void deriveSwitch(Expansion expansion, EffectiveDomain domain, String model, LicenseContext license) {
		expansion.derive("on", true, model, license, BoundaryOrigin.ENUM, "on", domain);
		expansion.derive("off", true, model, license, BoundaryOrigin.ENUM, "off", domain);
		expansion.derive(outOfSetToken(domain), false, model, license, BoundaryOrigin.ENUM, "not on or off", domain);
	}

	private void deriveVariants(Expansion expansion, EffectiveDomain domain, String model, LicenseContext license) {
		for (Variant variant : domain.variants()) {
			IntRange range = variant.range();
			if (range == null || variant.effectiveType(domain.type()) != ParamType.INT) {
				continue;
			}
			String prefix = variant.keywordTokens().isEmpty() ? "" : String.join(" ", variant.keywordTokens()) + " ";
			String label = variant.selector() + " ";
			expansion.derive(prefix + (range.min() - 1), false, model, license, BoundaryOrigin.VARIANT, label + "below minimum", domain);
			expansion.derive(prefix + range.min(), true, model, license, BoundaryOrigin.VARIANT, label + "minimum", domain);
			expansion.derive(prefix + range.max(), true, model, license, BoundaryOrigin.VARIANT, label + "maximum", domain);
			expansion.derive(prefix + (range.max() + 1), false, model, license, BoundaryOrigin.VARIANT, label + "above maximum", domain);
		}
	}

	private String outOfSetToken(EffectiveDomain domain) {
		String token = options.outOfSetToken();
		while (validator.validate(domain, token).isValid()) {
			token = token + "-x";
		}
		return token;
	}

	private record CaseKey(String model, String token, LicenseContext license) {
	}

	private static final class Expansion {
		private final CommandSpec command;
		private final Parameter parameter;
		private final Map<CaseKey, ConcreteBoundaryCase> cases = new LinkedHashMap<>();
		private final List<CoverageGap> gaps = new ArrayList<>();
		private final List<SpecificationDefect> defects = new ArrayList<>();

		private Expansion(CommandSpec command, Parameter parameter) {
			this.command = command;
			this.parameter = parameter;
		}

		void declare(ConcreteBoundaryCase boundaryCase) {
			cases.putIfAbsent(new CaseKey(boundaryCase.model(), boundaryCase.valueToken(), boundaryCase.license()), boundaryCase);
		}

		// A declared case for the same value on the same model replaces the derived one
		void derive(Object value, boolean valid, String model, LicenseContext license, BoundaryOrigin origin,
				String description, EffectiveDomain domain) {
			String token = Values.token(value);
			cases.putIfAbsent(new CaseKey(model, token, license),
					new ConcreteBoundaryCase(parameter.name(), value, valid, model, license, origin, description, null, domain));
		}

		void gap(String model, String reason) {
			gaps.add(new CoverageGap(command.name(), parameter.name(), model, reason));
		}

		void defect(DefectKind kind, String message) {
			defects.add(new SpecificationDefect(kind, command.name(), parameter.name(), message));
		}
	}
}
