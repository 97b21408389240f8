package org.javai.cmdspec.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Model-specific override of a parameter's domain.
 *
 * @param range replacement range on this model, optional
 * @param unavailable the parameter does not exist on this model
 * @param capability name of a capability in the device catalog whose base limit
 * and license table bound this parameter, optional
 * @param licenseLimits inline license-extension table: SKU to extended upper
 * bounds for quantities 1..n
 * @param licenseExtensionDeclared the override carries a license-extension
 * table, possibly an empty one
 * @param requiresLicense license SKU that must be held on this model, optional
 * @param minFirmware minimum firmware revision on this model, optional
 */
public record ModelOverride(
		IntRange range,
		boolean unavailable,
		String capability,
		Map<String, List<Long>> licenseLimits,
		boolean licenseExtensionDeclared,
		String requiresLicense,
		String minFirmware
) {

	public ModelOverride {
		Map<String, List<Long>> copy = new LinkedHashMap<>();
		if (licenseLimits != null) {
			licenseLimits.forEach((sku, limits) -> copy.put(sku, List.copyOf(limits)));
		}
		licenseLimits = Collections.unmodifiableMap(copy);
		licenseExtensionDeclared = licenseExtensionDeclared || !licenseLimits.isEmpty();
	}

	public static ModelOverride unavailableOverride() {
		return new ModelOverride(null, true, null, Map.of(), false, null, null);
	}

	/**
	 * Whether an inline license-extension table is declared, even an empty one.
	 */
	public boolean declaresLicenseExtension() {
		return licenseExtensionDeclared;
	}
}
