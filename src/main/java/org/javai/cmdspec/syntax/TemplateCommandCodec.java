package org.javai.cmdspec.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.cmdspec.DefectKind;
import org.javai.cmdspec.SpecificationDefect;
import org.javai.cmdspec.SpecificationDefectException;
import org.javai.cmdspec.model.CommandSpec;
import org.javai.cmdspec.model.FieldBinding;
import org.javai.cmdspec.model.ParamType;
import org.javai.cmdspec.model.Parameter;
import org.javai.cmdspec.model.SyntaxForm;
import org.javai.cmdspec.model.Values;
import org.javai.cmdspec.model.Variant;

/**
 * {@link CommandCodec} driven by the syntax forms of a command specification.
 *
 * <p>Parsing tries the set forms, then the delete forms, in declaration order
 * and backtracks through optional groups and variants. Placeholder values are
 * converted by type (integers, on/off switches to booleans) and stored under
 * the schema field their binding names, or under the parameter name when the
 * parameter is unbound. Omitted optional placeholders take their default.
 *
 * <p>Serializing picks the first form whose fixed fields match and which can
 * produce every given field. Optional groups whose values are all absent or
 * equal to their defaults are left out.
 */
public class TemplateCommandCodec implements CommandCodec {

	private final CommandSpec command;
	private final List<CompiledForm> setForms;
	private final List<CompiledForm> deleteForms;
	private final Map<String, String> canonicalKeywords = new HashMap<>();

	private record CompiledForm(SyntaxForm form, CommandTemplate template) {
	}

	private record Capture(Variant variant, List<String> values, int consumed) {
	}

	/**
	 * @throws SpecificationDefectException when a form does not compile, names an
	 * unknown parameter, or a parameter binding does not fit its parameter
	 */
	public TemplateCommandCodec(CommandSpec command) {
		this.command = Objects.requireNonNull(command, "command must not be null");
		List<SpecificationDefect> defects = new ArrayList<>();
		this.setForms = compile(command.syntax().setForms(), defects);
		this.deleteForms = compile(command.syntax().deleteForms(), defects);
		for (Parameter parameter : command.parameters().values()) {
			if (parameter.fieldBinding() instanceof FieldBinding.PerSelector && !parameter.hasVariants()) {
				defects.add(new SpecificationDefect(DefectKind.MALFORMED_BINDING, command.name(), parameter.name(),
						"per-variant field binding on a parameter without variants"));
			}
		}
		if (!defects.isEmpty()) {
			throw new SpecificationDefectException(defects);
		}
		command.syntax().keywordSynonyms().forEach((canonical, aliases) ->
				aliases.forEach(alias -> canonicalKeywords.put(alias, canonical)));
	}

	private List<CompiledForm> compile(List<SyntaxForm> forms, List<SpecificationDefect> defects) {
		List<CompiledForm> compiled = new ArrayList<>();
		for (SyntaxForm form : forms) {
			try {
				CommandTemplate template = CommandTemplate.compile(form.template());
				for (String name : template.placeholders()) {
					if (!command.parameters().containsKey(name)) {
						defects.add(new SpecificationDefect(DefectKind.UNKNOWN_PARAMETER, command.name(), name,
								"placeholder in '" + form.template() + "' is not a parameter"));
					}
				}
				compiled.add(new CompiledForm(form, template));
			}
			catch (IllegalArgumentException e) {
				defects.add(new SpecificationDefect(DefectKind.MALFORMED_SYNTAX, command.name(), form.template(), e.getMessage()));
			}
		}
		return compiled;
	}

	@Override
	public Map<String, Object> parse(String text) {
		List<String> words = words(normalize(text));
		List<CompiledForm> forms = new ArrayList<>(setForms);
		forms.addAll(deleteForms);
		for (CompiledForm form : forms) {
			Map<String, Capture> captures = match(form.template().tokens(), words, 0, new LinkedHashMap<>());
			if (captures != null) {
				return toFields(form, captures);
			}
		}
		throw new CommandSyntaxException("'" + text + "' matches no form of " + command.name());
	}

	@Override
	public String serialize(Map<String, Object> fields) {
		return render(setForms, fields, true, "set");
	}

	@Override
	public String serializeDelete(Map<String, Object> fields) {
		return render(deleteForms, fields, false, "delete");
	}

	@Override
	public String normalize(String text) {
		if (text == null) {
			return "";
		}
		List<String> words = new ArrayList<>();
		for (String word : words(text)) {
			words.add(canonicalKeywords.getOrDefault(word, word));
		}
		return String.join(" ", words);
	}

	private static List<String> words(String text) {
		String trimmed = text.trim();
		return trimmed.isEmpty() ? List.of() : Arrays.asList(trimmed.split("\\s+"));
	}

	private Map<String, Capture> match(List<TemplateToken> tokens, List<String> words, int position,
			Map<String, Capture> captures) {
		if (tokens.isEmpty()) {
			return position == words.size() ? captures : null;
		}
		TemplateToken head = tokens.get(0);
		List<TemplateToken> rest = tokens.subList(1, tokens.size());
		if (head instanceof TemplateToken.Keyword keyword) {
			if (position < words.size() && words.get(position).equals(keyword.text())) {
				return match(rest, words, position + 1, captures);
			}
			return null;
		}
		if (head instanceof TemplateToken.OptionalGroup group) {
			List<TemplateToken> expanded = new ArrayList<>(group.tokens());
			expanded.addAll(rest);
			Map<String, Capture> included = match(expanded, words, position, captures);
			return included != null ? included : match(rest, words, position, captures);
		}
		TemplateToken.Placeholder placeholder = (TemplateToken.Placeholder) head;
		Parameter parameter = command.parameters().get(placeholder.parameter());
		for (Capture capture : candidates(parameter, words, position)) {
			Map<String, Capture> next = new LinkedHashMap<>(captures);
			next.put(parameter.name(), capture);
			Map<String, Capture> result = match(rest, words, position + capture.consumed(), next);
			if (result != null) {
				return result;
			}
		}
		return null;
	}

	private List<Capture> candidates(Parameter parameter, List<String> words, int position) {
		List<Capture> candidates = new ArrayList<>();
		if (parameter.hasVariants()) {
			for (Variant variant : parameter.variants()) {
				List<String> keyword = variant.keywordTokens();
				int arity = variant.valueArity(parameter.fieldBinding());
				int end = position + keyword.size() + arity;
				if (end > words.size() || !words.subList(position, position + keyword.size()).equals(keyword)) {
					continue;
				}
				List<String> values = words.subList(position + keyword.size(), end);
				ParamType type = variant.effectiveType(parameter.type());
				if (values.stream().allMatch(v -> accepts(type, variant.pattern(), v))) {
					candidates.add(new Capture(variant, List.copyOf(values), keyword.size() + arity));
				}
			}
			return candidates;
		}
		if (position >= words.size()) {
			return candidates;
		}
		String word = words.get(position);
		boolean accepted = parameter.hasEnum()
				? parameter.enumValue(word).isPresent()
				: accepts(parameter.type(), parameter.pattern(), word);
		if (accepted) {
			candidates.add(new Capture(null, List.of(word), 1));
		}
		return candidates;
	}

	private static boolean accepts(ParamType type, String pattern, String word) {
		if (pattern != null && !word.matches(pattern)) {
			return false;
		}
		if (type == ParamType.INT) {
			try {
				Long.parseLong(word);
				return true;
			}
			catch (NumberFormatException e) {
				return false;
			}
		}
		if (type == ParamType.SWITCH) {
			return word.equals("on") || word.equals("off");
		}
		return true;
	}

	private Map<String, Object> toFields(CompiledForm form, Map<String, Capture> captures) {
		Map<String, Object> fields = new LinkedHashMap<>();
		for (String name : form.template().placeholders()) {
			Parameter parameter = command.parameters().get(name);
			Capture capture = captures.get(name);
			if (capture == null) {
				if (parameter.defaultValue() != null && !parameter.hasVariants()) {
					fields.put(fieldFor(parameter), convert(parameter, Values.token(parameter.defaultValue())));
				}
			}
			else if (capture.variant() != null) {
				assignVariant(parameter, capture, fields);
			}
			else {
				fields.put(fieldFor(parameter), convert(parameter, capture.values().get(0)));
			}
		}
		fields.putAll(form.form().fixedFields());
		return fields;
	}

	private void assignVariant(Parameter parameter, Capture capture, Map<String, Object> fields) {
		Variant variant = capture.variant();
		ParamType type = variant.effectiveType(parameter.type());
		fields.putAll(variant.fixedFields());
		if (variant.fieldBinding() instanceof FieldBinding.Composite composite) {
			int i = 0;
			for (String field : composite.fields().values()) {
				fields.put(field, convert(capture.values().get(i++), type));
			}
		}
		else if (!capture.values().isEmpty()) {
			fields.put(valueField(parameter, variant), convert(capture.values().get(0), type));
		}
		else if (variant.fixedFields().isEmpty()) {
			fields.put(parameter.name(), variant.selector());
		}
	}

	private static String fieldFor(Parameter parameter) {
		return parameter.fieldBinding() instanceof FieldBinding.Single single ? single.field() : parameter.name();
	}

	private static String valueField(Parameter parameter, Variant variant) {
		String field = variant.valueField(parameter.fieldBinding());
		return field != null ? field : parameter.name();
	}

	// Enum members of a typed parameter, such as auto on an int, stay tokens
	private static Object convert(Parameter parameter, String word) {
		if (parameter.hasEnum() && parameter.enumValue(word).isPresent() && !accepts(parameter.type(), null, word)) {
			return word;
		}
		return convert(word, parameter.type());
	}

	private static Object convert(String word, ParamType type) {
		if (type == ParamType.INT) {
			long value = Long.parseLong(word);
			return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE ? (Object) (int) value : (Object) value;
		}
		if (type == ParamType.SWITCH) {
			return word.equals("on");
		}
		return word;
	}

	private String render(List<CompiledForm> forms, Map<String, Object> fields, boolean complete, String kind) {
		if (forms.isEmpty()) {
			throw new CommandSyntaxException(command.name() + " has no " + kind + " form");
		}
		for (CompiledForm form : forms) {
			if (!fixedFieldsMatch(form.form().fixedFields(), fields)) {
				continue;
			}
			if (complete && !producible(form).containsAll(fields.keySet())) {
				continue;
			}
			List<String> out = new ArrayList<>();
			if (renderTokens(form.template().tokens(), fields, out)) {
				return String.join(" ", out);
			}
		}
		throw new CommandSyntaxException("No " + kind + " form of " + command.name() + " can render " + fields);
	}

	private static boolean fixedFieldsMatch(Map<String, Object> fixed, Map<String, Object> fields) {
		for (Map.Entry<String, Object> entry : fixed.entrySet()) {
			if (!fields.containsKey(entry.getKey()) || !Values.same(entry.getValue(), fields.get(entry.getKey()))) {
				return false;
			}
		}
		return true;
	}

	private Set<String> producible(CompiledForm form) {
		Set<String> names = new LinkedHashSet<>(form.form().fixedFields().keySet());
		for (String name : form.template().placeholders()) {
			Parameter parameter = command.parameters().get(name);
			names.add(parameter.name());
			names.add(fieldFor(parameter));
			names.addAll(parameter.fieldBinding().fieldNames());
			for (Variant variant : parameter.variants()) {
				names.addAll(variant.fixedFields().keySet());
				names.addAll(variant.fieldBinding().fieldNames());
				names.add(valueField(parameter, variant));
			}
		}
		return names;
	}

	private boolean renderTokens(List<TemplateToken> tokens, Map<String, Object> fields, List<String> out) {
		for (TemplateToken token : tokens) {
			if (token instanceof TemplateToken.Keyword keyword) {
				out.add(keyword.text());
			}
			else if (token instanceof TemplateToken.Placeholder placeholder) {
				Parameter parameter = command.parameters().get(placeholder.parameter());
				Optional<List<String>> words = renderParameter(parameter, fields);
				if (words.isEmpty() && parameter.defaultValue() != null && !parameter.hasVariants()) {
					words = Optional.of(List.of(Values.token(parameter.defaultValue())));
				}
				if (words.isEmpty()) {
					return false;
				}
				out.addAll(words.get());
			}
			else {
				TemplateToken.OptionalGroup group = (TemplateToken.OptionalGroup) token;
				if (omittable(group, fields)) {
					continue;
				}
				if (!renderTokens(group.tokens(), fields, out)) {
					return false;
				}
			}
		}
		return true;
	}

	private boolean omittable(TemplateToken.OptionalGroup group, Map<String, Object> fields) {
		Set<String> names = new LinkedHashSet<>();
		CommandTemplate.collect(group.tokens(), names);
		for (String name : names) {
			Parameter parameter = command.parameters().get(name);
			Optional<List<String>> words = renderParameter(parameter, fields);
			if (words.isEmpty()) {
				continue;
			}
			boolean isDefault = !parameter.hasVariants()
					&& parameter.defaultValue() != null
					&& Values.same(parameter.defaultValue(), words.get().get(0));
			if (!isDefault) {
				return false;
			}
		}
		return true;
	}

	private Optional<List<String>> renderParameter(Parameter parameter, Map<String, Object> fields) {
		if (!parameter.hasVariants()) {
			Object value = fields.get(fieldFor(parameter));
			return value == null ? Optional.empty() : Optional.of(List.of(Values.token(value)));
		}
		for (Variant variant : parameter.variants()) {
			if (!variant.fixedFields().isEmpty() && fixedFieldsMatch(variant.fixedFields(), fields)) {
				Optional<List<String>> words = renderVariant(parameter, variant, fields);
				if (words.isPresent()) {
					return words;
				}
			}
		}
		for (Variant variant : parameter.variants()) {
			if (variant.fixedFields().isEmpty()) {
				Optional<List<String>> words = renderVariant(parameter, variant, fields);
				if (words.isPresent()) {
					return words;
				}
			}
		}
		return Optional.empty();
	}

	private Optional<List<String>> renderVariant(Parameter parameter, Variant variant, Map<String, Object> fields) {
		List<String> words = new ArrayList<>(variant.keywordTokens());
		ParamType type = variant.effectiveType(parameter.type());
		if (variant.fieldBinding() instanceof FieldBinding.Composite composite) {
			for (String field : composite.fields().values()) {
				Object value = fields.get(field);
				if (value == null) {
					return Optional.empty();
				}
				words.add(Values.token(value));
			}
			return Optional.of(words);
		}
		if (variant.valueArity(parameter.fieldBinding()) == 0) {
			boolean selected = !variant.fixedFields().isEmpty()
					|| Values.same(fields.get(parameter.name()), variant.selector());
			return selected ? Optional.of(words) : Optional.empty();
		}
		Object value = fields.get(valueField(parameter, variant));
		if (value == null) {
			return Optional.empty();
		}
		String token = Values.token(value);
		if (variant.fixedFields().isEmpty() && !accepts(type, variant.pattern(), token)) {
			return Optional.empty();
		}
		words.add(token);
		return Optional.of(words);
	}
}
