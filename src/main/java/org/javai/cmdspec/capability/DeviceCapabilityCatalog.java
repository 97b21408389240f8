package org.javai.cmdspec.capability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Known router models, their base capability limits and license-extension
 * tables. Passed explicitly to whatever needs it; there is no global instance.
 */
public final class DeviceCapabilityCatalog {

	public static final String DEFAULT_RESOURCE = "META-INF/cmdspec/device-capabilities.yml";

	private final Map<String, DeviceModel> models;

	private DeviceCapabilityCatalog(Map<String, DeviceModel> models) {
		this.models = models;
	}

	public static DeviceCapabilityCatalog of(List<DeviceModel> models) {
		Objects.requireNonNull(models, "models must not be null");
		Map<String, DeviceModel> byId = new LinkedHashMap<>();
		for (DeviceModel model : models) {
			if (byId.putIfAbsent(model.id(), model) != null) {
				throw new IllegalArgumentException("Duplicate model id: " + model.id());
			}
		}
		return new DeviceCapabilityCatalog(Collections.unmodifiableMap(byId));
	}

	/**
	 * The catalog shipped on the classpath at {@value #DEFAULT_RESOURCE}.
	 */
	public static DeviceCapabilityCatalog defaults() {
		return new DeviceCapabilityCatalogParser()
				.parseResource(DEFAULT_RESOURCE, DeviceCapabilityCatalog.class.getClassLoader());
	}

	public boolean knows(String modelId) {
		return models.containsKey(modelId);
	}

	public Optional<DeviceModel> model(String modelId) {
		return Optional.ofNullable(models.get(modelId));
	}

	public List<String> modelIds() {
		return List.copyOf(models.keySet());
	}

	public List<String> supportedModelIds() {
		return models.values().stream().filter(m -> !m.legacy()).map(DeviceModel::id).toList();
	}

	public OptionalLong baseLimit(String modelId, String capability) {
		DeviceModel model = models.get(modelId);
		if (model == null || !model.capabilityLimits().containsKey(capability)) {
			return OptionalLong.empty();
		}
		return OptionalLong.of(model.capabilityLimits().get(capability));
	}

	public Map<String, List<Long>> licenseTable(String modelId, String capability) {
		DeviceModel model = models.get(modelId);
		if (model == null) {
			return Map.of();
		}
		return model.licenseTables().getOrDefault(capability, Map.of());
	}
}
