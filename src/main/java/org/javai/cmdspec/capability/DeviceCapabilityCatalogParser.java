package org.javai.cmdspec.capability;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.cmdspec.SpecLoadException;
import org.javai.cmdspec.load.RouterYaml;
import org.yaml.snakeyaml.Yaml;

/**
 * Parses device capability YAML into a {@link DeviceCapabilityCatalog}.
 *
 * <pre>
 * models:
 *   - id: RTX1300
 *     capabilities:
 *       ipsec_tunnels: 100
 *     licenses:
 *       ipsec_tunnels:
 *         YSL-VPN-EX2: [300, 500, 700, 900, 1100]
 *   - id: RTX810
 *     legacy: true
 * </pre>
 */
public class DeviceCapabilityCatalogParser {

	private final Yaml yaml = RouterYaml.create();

	public DeviceCapabilityCatalog parse(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return build(yaml.load(reader));
		} catch (SpecLoadException e) {
			throw e;
		} catch (Exception e) {
			throw new SpecLoadException("Failed to parse device capabilities from path: " + path, e);
		}
	}

	public DeviceCapabilityCatalog parseResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new SpecLoadException("Resource not found: " + resourcePath);
			}
			return build(yaml.load(is));
		} catch (SpecLoadException e) {
			throw e;
		} catch (Exception e) {
			throw new SpecLoadException("Failed to parse device capabilities from resource: " + resourcePath, e);
		}
	}

	public DeviceCapabilityCatalog parseString(String content) {
		try {
			return build(yaml.load(content));
		} catch (SpecLoadException e) {
			throw e;
		} catch (Exception e) {
			throw new SpecLoadException("Failed to parse device capabilities from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private DeviceCapabilityCatalog build(Object document) {
		if (!(document instanceof Map<?, ?> root) || !(root.get("models") instanceof List<?> modelList)) {
			throw new SpecLoadException("Missing required 'models' list");
		}
		List<DeviceModel> models = new ArrayList<>();
		for (Object entry : modelList) {
			if (entry instanceof String id) {
				models.add(new DeviceModel(id));
				continue;
			}
			Map<String, Object> data = (Map<String, Object>) entry;
			Object id = data.get("id");
			if (id == null) {
				throw new SpecLoadException("Model entry without 'id': " + data);
			}
			models.add(new DeviceModel(
					String.valueOf(id),
					Boolean.TRUE.equals(data.get("legacy")),
					buildLimits((Map<String, Object>) data.get("capabilities")),
					buildLicenseTables((Map<String, Object>) data.get("licenses"))
			));
		}
		return DeviceCapabilityCatalog.of(models);
	}

	private Map<String, Long> buildLimits(Map<String, Object> capabilities) {
		Map<String, Long> limits = new LinkedHashMap<>();
		if (capabilities != null) {
			capabilities.forEach((name, limit) -> limits.put(name, ((Number) limit).longValue()));
		}
		return limits;
	}

	@SuppressWarnings("unchecked")
	private Map<String, Map<String, List<Long>>> buildLicenseTables(Map<String, Object> licenses) {
		Map<String, Map<String, List<Long>>> tables = new LinkedHashMap<>();
		if (licenses == null) {
			return tables;
		}
		licenses.forEach((capability, bySku) -> {
			Map<String, List<Long>> table = new LinkedHashMap<>();
			((Map<String, Object>) bySku).forEach((sku, limits) -> table.put(sku,
					((List<Object>) limits).stream().map(n -> ((Number) n).longValue()).toList()));
			tables.put(capability, table);
		});
		return tables;
	}
}
