package org.javai.cmdspec.capability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static capability metadata of one router model.
 *
 * @param id model identifier, e.g. {@code RTX1300}
 * @param legacy true for models that are known but no longer supported
 * @param capabilityLimits capability name to base upper limit
 * @param licenseTables capability name to license SKU to extended limits for quantities 1..n
 */
public record DeviceModel(
		String id,
		boolean legacy,
		Map<String, Long> capabilityLimits,
		Map<String, Map<String, List<Long>>> licenseTables
) {

	public DeviceModel {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("Model id must not be blank");
		}
		capabilityLimits = capabilityLimits != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(capabilityLimits))
				: Map.of();
		Map<String, Map<String, List<Long>>> tables = new LinkedHashMap<>();
		if (licenseTables != null) {
			licenseTables.forEach((capability, bySku) -> {
				Map<String, List<Long>> copy = new LinkedHashMap<>();
				bySku.forEach((sku, limits) -> copy.put(sku, List.copyOf(limits)));
				tables.put(capability, Collections.unmodifiableMap(copy));
			});
		}
		licenseTables = Collections.unmodifiableMap(tables);
	}

	public DeviceModel(String id) {
		this(id, false, Map.of(), Map.of());
	}
}
