package org.javai.cmdspec.resolve;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.cmdspec.DefectKind;
import org.javai.cmdspec.SpecificationDefect;
import org.javai.cmdspec.SpecificationDefectException;
import org.javai.cmdspec.capability.DeviceCapabilityCatalog;
import org.javai.cmdspec.capability.LicenseContext;
import org.javai.cmdspec.model.CommandSpec;
import org.javai.cmdspec.model.IntRange;
import org.javai.cmdspec.model.ModelOverride;
import org.javai.cmdspec.model.Parameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the effective domain of a parameter on a model under a license context.
 *
 * <p>Range precedence is: the model override's range, then the catalog's base
 * limit for the capability the override names, then the parameter's own range.
 * A license extension table (inline on the override, otherwise the catalog's
 * table for the capability) then replaces the upper bound with the row for the
 * held quantity, clamped to the last row. When several SKUs apply the highest
 * limit wins.
 *
 * <p>Results are memoised per (parameter, model, license context). The memo is
 * safe for concurrent use; each key is computed at most once.
 */
public class ParameterResolver {

	private static final Logger logger = LoggerFactory.getLogger(ParameterResolver.class);

	private final DeviceCapabilityCatalog catalog;
	private final Map<MemoKey, Resolution> memo = new ConcurrentHashMap<>();

	public ParameterResolver(DeviceCapabilityCatalog catalog) {
		this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
	}

	public DeviceCapabilityCatalog catalog() {
		return catalog;
	}

	/**
	 * Resolve a parameter of a command. A model the command does not apply to
	 * yields {@link Resolution.Unsupported}.
	 *
	 * @throws SpecificationDefectException when the model is unknown or a range is malformed
	 */
	public Resolution resolve(CommandSpec command, Parameter parameter, String model, LicenseContext license) {
		Objects.requireNonNull(command, "command must not be null");
		checkKnownModel(command.name(), parameter, model);
		if (!command.isApplicableTo(model)) {
			return Resolution.unsupported(parameter.name(), model,
					"command " + command.name() + " is not applicable to " + model);
		}
		return resolveNamed(command.name(), parameter, model, license);
	}

	/**
	 * Resolve a parameter independently of any command.
	 *
	 * @throws SpecificationDefectException when the model is unknown or a range is malformed
	 */
	public Resolution resolve(Parameter parameter, String model, LicenseContext license) {
		return resolveNamed(null, parameter, model, license);
	}

	/**
	 * The license-extension table that applies to a parameter on a model: the
	 * override's inline table when present, otherwise the catalog table for the
	 * capability the override names. Empty when the parameter is not license extensible.
	 */
	public Map<String, List<Long>> licenseTiers(Parameter parameter, String model) {
		ModelOverride override = parameter.override(model).orElse(null);
		if (override == null) {
			return Map.of();
		}
		if (override.declaresLicenseExtension()) {
			return override.licenseLimits();
		}
		if (override.capability() != null) {
			return catalog.licenseTable(model, override.capability());
		}
		return Map.of();
	}

	private Resolution resolveNamed(String command, Parameter parameter, String model, LicenseContext license) {
		Objects.requireNonNull(parameter, "parameter must not be null");
		LicenseContext context = license != null ? license : LicenseContext.none();
		checkKnownModel(command, parameter, model);
		return memo.computeIfAbsent(new MemoKey(parameter, model, context),
				key -> compute(command, parameter, model, context));
	}

	private void checkKnownModel(String command, Parameter parameter, String model) {
		if (model != null && !catalog.knows(model)) {
			throw new SpecificationDefectException(new SpecificationDefect(DefectKind.UNKNOWN_MODEL,
					command, parameter.name(), "unknown model " + model));
		}
	}

	private Resolution compute(String command, Parameter parameter, String model, LicenseContext license) {
		IntRange range = parameter.range();
		if (range != null && !range.isOrdered()) {
			throw malformedRange(command, parameter, "base range " + range + " is not ordered");
		}
		if (model == null) {
			return Resolution.resolved(new EffectiveDomain(parameter, null, license, range, false, null));
		}
		if (!parameter.availability().appliesTo(model)) {
			return Resolution.unsupported(parameter.name(), model, "not available on " + model);
		}

		ModelOverride override = parameter.override(model).orElse(null);
		if (override != null && override.unavailable()) {
			return Resolution.unsupported(parameter.name(), model, "marked unavailable on " + model);
		}
		String requiredLicense = override != null && override.requiresLicense() != null
				? override.requiresLicense()
				: parameter.availability().requiresLicense();
		if (requiredLicense != null && !license.holds(requiredLicense)) {
			return Resolution.unsupported(parameter.name(), model, "requires license " + requiredLicense);
		}

		if (override != null) {
			if (override.range() != null) {
				if (!override.range().isOrdered()) {
					throw malformedRange(command, parameter, "range " + override.range() + " on " + model + " is not ordered");
				}
				range = override.range();
			}
			else if (override.capability() != null) {
				OptionalLong limit = catalog.baseLimit(model, override.capability());
				if (limit.isPresent()) {
					range = new IntRange(range != null ? range.min() : 1, limit.getAsLong());
				}
			}
		}

		Map<String, List<Long>> tiers = licenseTiers(parameter, model);
		String decidingLicense = null;
		long extended = Long.MIN_VALUE;
		if (!tiers.isEmpty() && range == null) {
			throw malformedRange(command, parameter, "license extension on " + model + " has no base range");
		}
		for (Map.Entry<String, List<Long>> tier : tiers.entrySet()) {
			int quantity = license.quantity(tier.getKey());
			List<Long> limits = tier.getValue();
			if (quantity == 0 || limits.isEmpty()) {
				continue;
			}
			long limit = limits.get(Math.min(quantity, limits.size()) - 1);
			if (limit > extended) {
				extended = limit;
				decidingLicense = tier.getKey();
			}
		}
		if (decidingLicense != null) {
			range = range.withMax(extended);
			if (!range.isOrdered()) {
				throw malformedRange(command, parameter, "license limit " + extended + " is below the minimum on " + model);
			}
			logger.debug("{} on {} extended to {} by {}", parameter.name(), model, range, decidingLicense);
		}

		boolean extensible = tiers.values().stream().anyMatch(limits -> !limits.isEmpty());
		return Resolution.resolved(new EffectiveDomain(parameter, model, license, range, extensible, decidingLicense));
	}

	private SpecificationDefectException malformedRange(String command, Parameter parameter, String message) {
		return new SpecificationDefectException(
				new SpecificationDefect(DefectKind.MALFORMED_RANGE, command, parameter.name(), message));
	}

	private record MemoKey(Parameter parameter, String model, LicenseContext license) {
	}
}
