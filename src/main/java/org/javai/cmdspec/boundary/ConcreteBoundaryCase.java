package org.javai.cmdspec.boundary;

import java.util.Optional;
import org.javai.cmdspec.capability.LicenseContext;
import org.javai.cmdspec.model.Values;
import org.javai.cmdspec.resolve.EffectiveDomain;

/**
 * One fully resolved boundary case: a value, where it applies and whether the
 * router is expected to accept it.
 *
 * @param parameter parameter name
 * @param value the input value
 * @param expectedValid whether the value is expected to be accepted
 * @param model the model the case applies to, {@code null} when it applies uniformly
 * @param license license context the case is evaluated under
 * @param origin how the case was derived
 * @param description free text description
 * @param errorContains expected error message fragment for invalid cases, optional
 * @param domain the resolved domain, {@code null} when the parameter is unsupported on the model
 */
public record ConcreteBoundaryCase(
		String parameter,
		Object value,
		boolean expectedValid,
		String model,
		LicenseContext license,
		BoundaryOrigin origin,
		String description,
		String errorContains,
		EffectiveDomain domain
) {

	public ConcreteBoundaryCase {
		license = license != null ? license : LicenseContext.none();
	}

	public String valueToken() {
		return Values.token(value);
	}

	public Optional<EffectiveDomain> resolvedDomain() {
		return Optional.ofNullable(domain);
	}
}
