package org.javai.cmdspec.resolve;

import java.util.List;
import java.util.Objects;
import org.javai.cmdspec.capability.LicenseContext;
import org.javai.cmdspec.model.EnumValue;
import org.javai.cmdspec.model.IntRange;
import org.javai.cmdspec.model.ParamType;
import org.javai.cmdspec.model.Parameter;
import org.javai.cmdspec.model.Variant;

/**
 * The concrete domain of a parameter on one model under one license context.
 *
 * @param parameter the parameter this domain was resolved for
 * @param model the model, or {@code null} for the model-independent base domain
 * @param license the license context the domain was resolved under
 * @param range effective numeric range (string length range for strings), optional
 * @param licenseExtensible whether a non-empty license-extension table applies on this model
 * @param decidingLicense SKU whose table set the upper bound, {@code null} when no license applied
 */
public record EffectiveDomain(
		Parameter parameter,
		String model,
		LicenseContext license,
		IntRange range,
		boolean licenseExtensible,
		String decidingLicense
) {

	public EffectiveDomain {
		Objects.requireNonNull(parameter, "parameter must not be null");
		license = license != null ? license : LicenseContext.none();
	}

	public ParamType type() {
		return parameter.type();
	}

	public List<EnumValue> enumValues() {
		return parameter.enumValues();
	}

	public List<Variant> variants() {
		return parameter.variants();
	}

	public Object defaultValue() {
		return parameter.defaultValue();
	}

	public String pattern() {
		return parameter.pattern();
	}

	public boolean isLicenseDependent() {
		return licenseExtensible || decidingLicense != null;
	}

	/**
	 * The concrete members a deferred member may stand for at runtime.
	 */
	public List<String> concreteMembers(EnumValue deferred) {
		if (!deferred.isDeferred()) {
			return List.of(deferred.value());
		}
		if (!deferred.resolvesTo().isEmpty()) {
			return deferred.resolvesTo();
		}
		return enumValues().stream()
				.filter(v -> !v.isDeferred())
				.map(EnumValue::value)
				.toList();
	}
}
