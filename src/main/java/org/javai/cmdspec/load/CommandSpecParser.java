package org.javai.cmdspec.load;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.cmdspec.SpecLoadException;
import org.javai.cmdspec.model.BoundaryTest;
import org.javai.cmdspec.model.CommandSpec;
import org.javai.cmdspec.model.EnumKind;
import org.javai.cmdspec.model.EnumValue;
import org.javai.cmdspec.model.FieldBinding;
import org.javai.cmdspec.model.IntRange;
import org.javai.cmdspec.model.ModelConstraints;
import org.javai.cmdspec.model.ModelOverride;
import org.javai.cmdspec.model.PairwiseConstraint;
import org.javai.cmdspec.model.PairwiseSpec;
import org.javai.cmdspec.model.ParamType;
import org.javai.cmdspec.model.Parameter;
import org.javai.cmdspec.model.StructField;
import org.javai.cmdspec.model.StructuredValue;
import org.javai.cmdspec.model.SyntaxForm;
import org.javai.cmdspec.model.SyntaxSpec;
import org.javai.cmdspec.model.SyntaxTest;
import org.javai.cmdspec.model.TerraformSpec;
import org.javai.cmdspec.model.TestDirection;
import org.javai.cmdspec.model.Variant;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for command specification YAML files.
 * Parses YAML and creates a {@link CommandSpec} instance. Only the shape of the
 * document is checked here; semantic checks belong to the validator.
 */
public class CommandSpecParser {

	private static final Set<String> CONSTRAINT_KEYS =
			Set.of("valid_for", "invalid_for", "unavailable", "requires_license", "min_firmware");

	private final Yaml yaml = RouterYaml.create();

	/**
	 * Parse a command specification from a path.
	 */
	public CommandSpec parse(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return buildSpec(yaml.load(reader));
		} catch (SpecLoadException e) {
			throw new SpecLoadException("Invalid command specification at " + path + ": " + e.getMessage(), e);
		} catch (Exception e) {
			throw new SpecLoadException("Failed to parse command specification from path: " + path, e);
		}
	}

	/**
	 * Parse a command specification from an input stream.
	 */
	public CommandSpec parse(InputStream inputStream) {
		try {
			return buildSpec(yaml.load(inputStream));
		} catch (SpecLoadException e) {
			throw e;
		} catch (Exception e) {
			throw new SpecLoadException("Failed to parse command specification from input stream", e);
		}
	}

	/**
	 * Parse a command specification from a reader.
	 */
	public CommandSpec parse(Reader reader) {
		try {
			return buildSpec(yaml.load(reader));
		} catch (SpecLoadException e) {
			throw e;
		} catch (Exception e) {
			throw new SpecLoadException("Failed to parse command specification from reader", e);
		}
	}

	/**
	 * Parse a command specification from a string.
	 */
	public CommandSpec parseString(String yamlContent) {
		try {
			return buildSpec(yaml.load(yamlContent));
		} catch (SpecLoadException e) {
			throw e;
		} catch (Exception e) {
			throw new SpecLoadException("Failed to parse command specification from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private CommandSpec buildSpec(Object document) {
		if (!(document instanceof Map<?, ?> root)) {
			throw new SpecLoadException("Document is not a mapping");
		}
		Map<String, Object> data = (Map<String, Object>) root.get("command");
		if (data == null) {
			throw new SpecLoadException("Missing required 'command' section");
		}
		String name = toString(data.get("name"));
		if (name == null || name.isBlank()) {
			throw new SpecLoadException("command.name is required");
		}

		return new CommandSpec(
				name,
				toString(data.get("description")),
				toString(data.get("reference")),
				stringList(data.get("applicable_models")),
				buildSyntax((Map<String, Object>) data.get("syntax")),
				buildTerraform((Map<String, Object>) data.get("terraform")),
				buildParameters((Map<String, Object>) data.get("parameters")),
				buildSyntaxTests((List<Map<String, Object>>) data.get("syntax_tests")),
				buildSyntaxTests((List<Map<String, Object>>) data.get("multiline_tests")),
				buildBoundaryTests((Map<String, Object>) data.get("boundary_tests")),
				buildPairwise((Map<String, Object>) data.get("pairwise")),
				stringList(data.get("notes")),
				toString(data.get("implementation_status"))
		);
	}

	@SuppressWarnings("unchecked")
	private SyntaxSpec buildSyntax(Map<String, Object> syntaxMap) {
		if (syntaxMap == null) {
			return SyntaxSpec.empty();
		}
		Map<String, List<String>> synonyms = new LinkedHashMap<>();
		Map<String, Object> synonymMap = (Map<String, Object>) syntaxMap.get("keyword_synonyms");
		if (synonymMap != null) {
			synonymMap.forEach((canonical, aliases) -> synonyms.put(canonical, stringList(aliases)));
		}
		return new SyntaxSpec(
				buildForms(syntaxMap.get("set")),
				buildForms(syntaxMap.get("delete")),
				synonyms
		);
	}

	// A form list is a single string, a list of strings, or a list of {form, sets} maps
	@SuppressWarnings("unchecked")
	private List<SyntaxForm> buildForms(Object raw) {
		if (raw == null) {
			return List.of();
		}
		if (raw instanceof String template) {
			return List.of(new SyntaxForm(template));
		}
		List<SyntaxForm> forms = new ArrayList<>();
		for (Object entry : (List<Object>) raw) {
			if (entry instanceof String template) {
				forms.add(new SyntaxForm(template));
			}
			else if (entry instanceof Map<?, ?> formMap) {
				Object template = formMap.get("form") != null ? formMap.get("form") : formMap.get("template");
				forms.add(new SyntaxForm(toString(template), (Map<String, Object>) formMap.get("sets")));
			}
			else {
				throw new SpecLoadException("Unsupported syntax form: " + entry);
			}
		}
		return forms;
	}

	@SuppressWarnings("unchecked")
	private TerraformSpec buildTerraform(Map<String, Object> terraformMap) {
		if (terraformMap == null) {
			return TerraformSpec.empty();
		}
		return new TerraformSpec(
				toString(terraformMap.get("resource_name")),
				toString(terraformMap.get("struct_name")),
				toString(terraformMap.get("package")),
				buildStructFields((Map<String, Object>) terraformMap.get("struct_definition")),
				buildStructFields((Map<String, Object>) terraformMap.get("struct_additions"))
		);
	}

	@SuppressWarnings("unchecked")
	private Map<String, List<StructField>> buildStructFields(Map<String, Object> structs) {
		Map<String, List<StructField>> result = new LinkedHashMap<>();
		if (structs == null) {
			return result;
		}
		structs.forEach((struct, fields) -> {
			List<StructField> built = new ArrayList<>();
			for (Map<String, Object> field : (List<Map<String, Object>>) fields) {
				built.add(new StructField(
						toString(field.get("name")),
						toString(field.get("type")),
						toString(field.get("json_tag")),
						toString(field.get("description")),
						stringList(field.get("enum"))
				));
			}
			result.put(struct, built);
		});
		return result;
	}

	@SuppressWarnings("unchecked")
	private Map<String, Parameter> buildParameters(Map<String, Object> parametersMap) {
		Map<String, Parameter> parameters = new LinkedHashMap<>();
		if (parametersMap == null) {
			return parameters;
		}
		for (Map.Entry<String, Object> entry : parametersMap.entrySet()) {
			Map<String, Object> paramData = entry.getValue() != null
					? (Map<String, Object>) entry.getValue()
					: Map.of();
			parameters.put(entry.getKey(), buildParameter(entry.getKey(), paramData));
		}
		return parameters;
	}

	@SuppressWarnings("unchecked")
	private Parameter buildParameter(String name, Map<String, Object> paramData) {
		List<EnumValue> enumValues = buildEnumValues((List<Object>) paramData.get("enum_values"));
		List<Variant> variants = buildVariants((List<Map<String, Object>>) paramData.get("variants"));
		IntRange range = buildRange(paramData.get("range"), name);

		String typeTag = toString(paramData.get("type"));
		ParamType type;
		if (typeTag != null) {
			type = ParamType.fromTag(typeTag)
					.orElseThrow(() -> new SpecLoadException("Unknown type '" + typeTag + "' for parameter " + name));
		}
		else if (!enumValues.isEmpty()) {
			type = ParamType.ENUM;
		}
		else if (!variants.isEmpty()) {
			type = ParamType.VARIANT;
		}
		else if (range != null) {
			type = ParamType.INT;
		}
		else {
			type = ParamType.STRING;
		}

		Map<String, Object> constraintMap = (Map<String, Object>) paramData.get("model_constraints");

		return new Parameter(
				name,
				toString(paramData.get("description")),
				type,
				Boolean.TRUE.equals(paramData.get("required")),
				paramData.get("default"),
				range,
				enumValues,
				variants,
				buildModelConstraints(constraintMap),
				buildModelOverrides(constraintMap, name),
				buildParameterBinding(paramData),
				(List<Object>) paramData.get("boundaries"),
				toString(paramData.get("pattern")),
				toString(paramData.get("note"))
		);
	}

	@SuppressWarnings("unchecked")
	private List<EnumValue> buildEnumValues(List<Object> raw) {
		if (raw == null) {
			return List.of();
		}
		List<EnumValue> values = new ArrayList<>();
		for (Object entry : raw) {
			if (!(entry instanceof Map<?, ?>)) {
				values.add(new EnumValue(toString(entry), null));
				continue;
			}
			Map<String, Object> valueData = (Map<String, Object>) entry;
			boolean deferred = "deferred".equals(valueData.get("kind")) || Boolean.TRUE.equals(valueData.get("deferred"));
			values.add(new EnumValue(
					toString(valueData.get("value")),
					toString(valueData.get("description")),
					deferred ? EnumKind.DEFERRED : EnumKind.CONCRETE,
					stringList(valueData.get("resolves_to"))
			));
		}
		return values;
	}

	@SuppressWarnings("unchecked")
	private List<Variant> buildVariants(List<Map<String, Object>> raw) {
		if (raw == null) {
			return List.of();
		}
		List<Variant> variants = new ArrayList<>();
		for (Map<String, Object> variantData : raw) {
			String keyword = toString(variantData.get("keyword") != null
					? variantData.get("keyword")
					: variantData.get("value"));
			String typeTag = toString(variantData.get("type"));
			String selector = toString(variantData.get("name"));
			if (selector == null) {
				selector = keyword != null ? keyword : typeTag;
			}
			if (selector == null) {
				throw new SpecLoadException("Variant needs a name, keyword or type: " + variantData);
			}
			String finalSelector = selector;
			ParamType type = typeTag == null ? null : ParamType.fromTag(typeTag)
					.orElseThrow(() -> new SpecLoadException("Unknown type '" + typeTag + "' for variant " + finalSelector));

			FieldBinding binding;
			if (variantData.get("terraform_fields") != null) {
				binding = new FieldBinding.Composite(stringMap((Map<String, Object>) variantData.get("terraform_fields")));
			}
			else if (variantData.get("terraform_field") != null) {
				binding = new FieldBinding.Single(toString(variantData.get("terraform_field")));
			}
			else {
				binding = FieldBinding.none();
			}

			variants.add(new Variant(
					selector,
					type,
					keyword,
					toString(variantData.get("pattern")),
					buildRange(variantData.get("range"), selector),
					binding,
					(Map<String, Object>) variantData.get("terraform_value"),
					toString(variantData.get("description"))
			));
		}
		return variants;
	}

	@SuppressWarnings("unchecked")
	private FieldBinding buildParameterBinding(Map<String, Object> paramData) {
		if (paramData.get("terraform_fields") != null) {
			return new FieldBinding.PerSelector(stringMap((Map<String, Object>) paramData.get("terraform_fields")));
		}
		if (paramData.get("terraform_field") != null) {
			return new FieldBinding.Single(toString(paramData.get("terraform_field")));
		}
		return FieldBinding.none();
	}

	private ModelConstraints buildModelConstraints(Map<String, Object> constraintMap) {
		if (constraintMap == null) {
			return ModelConstraints.none();
		}
		return new ModelConstraints(
				stringList(constraintMap.get("valid_for")),
				stringList(constraintMap.get("invalid_for")),
				stringList(constraintMap.get("unavailable")),
				toString(constraintMap.get("requires_license")),
				toString(constraintMap.get("min_firmware"))
		);
	}

	// Keys other than the reserved constraint keys name a model and carry its override
	@SuppressWarnings("unchecked")
	private Map<String, ModelOverride> buildModelOverrides(Map<String, Object> constraintMap, String parameter) {
		Map<String, ModelOverride> overrides = new LinkedHashMap<>();
		if (constraintMap == null) {
			return overrides;
		}
		for (Map.Entry<String, Object> entry : constraintMap.entrySet()) {
			if (CONSTRAINT_KEYS.contains(entry.getKey())) {
				continue;
			}
			String model = entry.getKey();
			Object value = entry.getValue();
			if (Boolean.FALSE.equals(value) || "unavailable".equals(value)) {
				overrides.put(model, ModelOverride.unavailableOverride());
			}
			else if (value instanceof List<?>) {
				overrides.put(model, new ModelOverride(buildRange(value, parameter + "@" + model),
						false, null, Map.of(), false, null, null));
			}
			else if (value instanceof Map<?, ?>) {
				Map<String, Object> overrideData = (Map<String, Object>) value;
				String licenseKey = overrideData.containsKey("license_limits") ? "license_limits" : "license_extension";
				Object licenses = overrideData.get(licenseKey);
				overrides.put(model, new ModelOverride(
						buildRange(overrideData.get("range"), parameter + "@" + model),
						Boolean.TRUE.equals(overrideData.get("unavailable")),
						toString(overrideData.get("capability")),
						buildLicenseLimits((Map<String, Object>) licenses),
						overrideData.containsKey(licenseKey),
						toString(overrideData.get("requires_license")),
						toString(overrideData.get("min_firmware"))
				));
			}
			else {
				throw new SpecLoadException("Unsupported model constraint for " + parameter + "@" + model + ": " + value);
			}
		}
		return overrides;
	}

	@SuppressWarnings("unchecked")
	private Map<String, List<Long>> buildLicenseLimits(Map<String, Object> licenses) {
		Map<String, List<Long>> limits = new LinkedHashMap<>();
		if (licenses == null) {
			return limits;
		}
		licenses.forEach((sku, values) -> limits.put(sku,
				((List<Object>) values).stream().map(v -> toLong(v, sku)).toList()));
		return limits;
	}

	@SuppressWarnings("unchecked")
	private IntRange buildRange(Object raw, String owner) {
		if (raw == null) {
			return null;
		}
		if (raw instanceof List<?> bounds) {
			if (bounds.size() != 2) {
				throw new SpecLoadException("Range of " + owner + " must have exactly two bounds: " + raw);
			}
			return new IntRange(toLong(bounds.get(0), owner), toLong(bounds.get(1), owner));
		}
		if (raw instanceof Map<?, ?>) {
			Map<String, Object> bounds = (Map<String, Object>) raw;
			return new IntRange(toLong(bounds.get("min"), owner), toLong(bounds.get("max"), owner));
		}
		throw new SpecLoadException("Unsupported range for " + owner + ": " + raw);
	}

	@SuppressWarnings("unchecked")
	private List<SyntaxTest> buildSyntaxTests(List<Map<String, Object>> raw) {
		if (raw == null) {
			return List.of();
		}
		List<SyntaxTest> tests = new ArrayList<>();
		for (Map<String, Object> testData : raw) {
			String name = toString(testData.get("name"));
			String text = toString(testData.get("rtx"));
			if (text == null) {
				throw new SpecLoadException("Syntax test '" + name + "' has no 'rtx' text");
			}
			tests.add(new SyntaxTest(
					name,
					text,
					buildStructuredValue(testData.get("terraform"), name),
					buildDirection(testData, name),
					buildModelConstraints((Map<String, Object>) testData.get("model_constraints")),
					toString(testData.get("note")),
					toString(testData.get("description"))
			));
		}
		return tests;
	}

	// The terraform value of a syntax test is a map for one line, a list of maps for several
	@SuppressWarnings("unchecked")
	private StructuredValue buildStructuredValue(Object raw, String testName) {
		if (raw == null) {
			return new StructuredValue.SingleMapping(Map.of());
		}
		if (raw instanceof Map<?, ?>) {
			return new StructuredValue.SingleMapping((Map<String, Object>) raw);
		}
		if (raw instanceof List<?> list) {
			List<Map<String, Object>> entries = new ArrayList<>();
			for (Object entry : list) {
				if (!(entry instanceof Map<?, ?>)) {
					throw new SpecLoadException("Syntax test '" + testName + "' has a non-map terraform entry: " + entry);
				}
				entries.add((Map<String, Object>) entry);
			}
			return new StructuredValue.MultiMapping(entries);
		}
		throw new SpecLoadException("Syntax test '" + testName + "' has an unsupported terraform value: " + raw);
	}

	private TestDirection buildDirection(Map<String, Object> testData, String testName) {
		boolean parseOnly = Boolean.TRUE.equals(testData.get("parse_only"));
		boolean buildOnly = Boolean.TRUE.equals(testData.get("build_only"));
		if (parseOnly && buildOnly) {
			throw new SpecLoadException("Syntax test '" + testName + "' cannot be both parse_only and build_only");
		}
		if (parseOnly) {
			return TestDirection.PARSE_ONLY;
		}
		if (buildOnly) {
			return TestDirection.BUILD_ONLY;
		}
		return Boolean.FALSE.equals(testData.get("bidirectional")) ? TestDirection.PARSE_ONLY : TestDirection.BIDIRECTIONAL;
	}

	@SuppressWarnings("unchecked")
	private Map<String, List<BoundaryTest>> buildBoundaryTests(Map<String, Object> raw) {
		Map<String, List<BoundaryTest>> result = new LinkedHashMap<>();
		if (raw == null) {
			return result;
		}
		raw.forEach((parameter, tests) -> {
			List<BoundaryTest> built = new ArrayList<>();
			for (Map<String, Object> testData : (List<Map<String, Object>>) tests) {
				built.add(new BoundaryTest(
						testData.get("value"),
						Boolean.TRUE.equals(testData.get("valid")),
						toString(testData.get("description")),
						toString(testData.get("error_contains")),
						stringList(testData.get("valid_for")),
						stringList(testData.get("invalid_for"))
				));
			}
			result.put(parameter, built);
		});
		return result;
	}

	@SuppressWarnings("unchecked")
	private PairwiseSpec buildPairwise(Map<String, Object> raw) {
		if (raw == null) {
			return null;
		}
		Map<String, List<Object>> values = new LinkedHashMap<>();
		Map<String, Object> valueMap = (Map<String, Object>) raw.get("parameter_values");
		if (valueMap != null) {
			valueMap.forEach((parameter, candidates) -> values.put(parameter, (List<Object>) candidates));
		}
		List<PairwiseConstraint> constraints = new ArrayList<>();
		List<Map<String, Object>> constraintList = (List<Map<String, Object>>) raw.get("constraints");
		if (constraintList != null) {
			for (Map<String, Object> constraintData : constraintList) {
				Object priority = constraintData.get("priority");
				constraints.add(new PairwiseConstraint(
						toString(constraintData.get("condition")),
						toString(constraintData.get("requires")),
						stringList(constraintData.get("invalid_for")),
						priority != null ? ((Number) priority).intValue() : null
				));
			}
		}
		return new PairwiseSpec(
				Boolean.TRUE.equals(raw.get("enabled")),
				stringList(raw.get("parameters")),
				values,
				constraints
		);
	}

	private Map<String, String> stringMap(Map<String, Object> raw) {
		Map<String, String> result = new LinkedHashMap<>();
		raw.forEach((key, value) -> result.put(key, toString(value)));
		return result;
	}

	private List<String> stringList(Object raw) {
		if (raw == null) {
			return List.of();
		}
		if (raw instanceof List<?> list) {
			return list.stream().map(this::toString).toList();
		}
		return List.of(toString(raw));
	}

	private long toLong(Object raw, String owner) {
		if (raw instanceof Number number) {
			return number.longValue();
		}
		try {
			return Long.parseLong(String.valueOf(raw).trim());
		} catch (NumberFormatException e) {
			throw new SpecLoadException("Expected a number for " + owner + " but got: " + raw, e);
		}
	}

	private String toString(Object obj) {
		if (obj == null) {
			return null;
		}
		return obj instanceof String ? (String) obj : String.valueOf(obj);
	}
}
