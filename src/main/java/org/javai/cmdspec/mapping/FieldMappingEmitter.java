package org.javai.cmdspec.mapping;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.cmdspec.DefectKind;
import org.javai.cmdspec.SpecificationDefect;
import org.javai.cmdspec.SpecificationDefectException;
import org.javai.cmdspec.model.CommandSpec;
import org.javai.cmdspec.model.EnumValue;
import org.javai.cmdspec.model.FieldBinding;
import org.javai.cmdspec.model.ParamType;
import org.javai.cmdspec.model.Parameter;
import org.javai.cmdspec.model.StructField;
import org.javai.cmdspec.model.SyntaxForm;
import org.javai.cmdspec.model.Values;
import org.javai.cmdspec.model.Variant;

/**
 * Derives the target schema fields of parameters and commands.
 */
public class FieldMappingEmitter {

	/**
	 * @throws SpecificationDefectException when the parameter binding does not fit the parameter
	 */
	public FieldMapping emit(Parameter parameter) {
		return emit(null, parameter);
	}

	/**
	 * Mappings of every parameter of a command, merged with the fields of the
	 * declared struct (keyed by their JSON tag) and the fixed fields of its syntax forms. Alternative
	 * forms setting one field contribute the union of their constants. Two sources
	 * binding one field name must agree on its type, and when both restrict its
	 * values they must share at least one.
	 *
	 * @throws SpecificationDefectException listing every field collision
	 */
	public FieldMappingTable emitTable(CommandSpec command) {
		List<SpecificationDefect> defects = new ArrayList<>();
		List<FieldMapping> mappings = new ArrayList<>();
		List<FieldDescriptor> sources = new ArrayList<>();
		for (Parameter parameter : command.parameters().values()) {
			FieldMapping mapping = emit(command.name(), parameter);
			mappings.add(mapping);
			sources.addAll(mergeWithin(mapping.fields()));
		}
		for (StructField field : command.terraform().declaredFields()) {
			String name = field.jsonTag() != null ? field.jsonTag() : field.name();
			sources.add(new FieldDescriptor(name, FieldType.ofDeclared(field.type()), field.enumValues(),
					field.description(), "struct " + (command.terraform().structName() != null ? command.terraform().structName() : "definition")));
		}
		List<SyntaxForm> forms = new ArrayList<>(command.syntax().setForms());
		forms.addAll(command.syntax().deleteForms());
		List<FieldDescriptor> formFields = new ArrayList<>();
		for (SyntaxForm form : forms) {
			form.fixedFields().forEach((name, value) ->
					formFields.add(constant(name, value, "form '" + form.template() + "'")));
		}
		sources.addAll(mergeWithin(formFields));

		Map<String, FieldDescriptor> merged = new LinkedHashMap<>();
		for (FieldDescriptor field : sources) {
			FieldDescriptor existing = merged.get(field.name());
			if (existing == null) {
				merged.put(field.name(), field);
				continue;
			}
			String conflict = conflict(existing, field);
			if (conflict != null) {
				defects.add(new SpecificationDefect(DefectKind.FIELD_COLLISION, command.name(), field.name(), conflict));
				continue;
			}
			merged.put(field.name(), union(existing, field));
		}
		if (!defects.isEmpty()) {
			throw new SpecificationDefectException(defects);
		}
		return new FieldMappingTable(command.name(), command.terraform().structName(), mappings, new ArrayList<>(merged.values()));
	}

	private FieldMapping emit(String command, Parameter parameter) {
		FieldBinding binding = parameter.fieldBinding();
		if (binding instanceof FieldBinding.PerSelector && !parameter.hasVariants()) {
			throw new SpecificationDefectException(new SpecificationDefect(DefectKind.MALFORMED_BINDING, command,
					parameter.name(), "per-variant field binding on a parameter without variants"));
		}
		if (parameter.hasVariants()) {
			Map<String, List<FieldDescriptor>> bySelector = new LinkedHashMap<>();
			boolean any = false;
			for (Variant variant : parameter.variants()) {
				List<FieldDescriptor> fields = variantFields(parameter, variant);
				any |= !fields.isEmpty();
				bySelector.put(variant.selector(), fields);
			}
			return any
					? new FieldMapping.Discriminated(parameter.name(), bySelector)
					: new FieldMapping.Unmapped(parameter.name());
		}
		if (binding instanceof FieldBinding.Single single) {
			return new FieldMapping.Scalar(parameter.name(), new FieldDescriptor(single.field(),
					FieldType.of(parameter.type()), allowedValues(parameter), parameter.description(),
					"parameter " + parameter.name()));
		}
		return new FieldMapping.Unmapped(parameter.name());
	}

	private List<String> allowedValues(Parameter parameter) {
		return parameter.enumValues().stream().map(EnumValue::value).toList();
	}

	private List<FieldDescriptor> variantFields(Parameter parameter, Variant variant) {
		List<FieldDescriptor> fields = new ArrayList<>();
		String source = "parameter " + parameter.name() + " variant " + variant.selector();
		ParamType type = variant.effectiveType(parameter.type());
		if (variant.fieldBinding() instanceof FieldBinding.Composite composite) {
			composite.fields().values().forEach(field ->
					fields.add(new FieldDescriptor(field, FieldType.of(type), List.of(), variant.description(), source)));
		}
		else {
			String field = variant.valueField(parameter.fieldBinding());
			if (field != null && variant.valueArity(parameter.fieldBinding()) > 0) {
				fields.add(new FieldDescriptor(field, FieldType.of(type), List.of(), variant.description(), source));
			}
		}
		variant.fixedFields().forEach((name, value) -> fields.add(constant(name, value, source)));
		return fields;
	}

	private FieldDescriptor constant(String name, Object value, String source) {
		FieldType type = FieldType.ofValue(value);
		List<String> allowed = type == FieldType.STRING ? List.of(Values.token(value)) : List.of();
		return new FieldDescriptor(name, type, allowed, null, source);
	}

	// Variants of one parameter, and alternative forms of one command, discriminate one field
	private List<FieldDescriptor> mergeWithin(List<FieldDescriptor> fields) {
		List<FieldDescriptor> merged = new ArrayList<>();
		for (FieldDescriptor field : fields) {
			int same = -1;
			for (int i = 0; i < merged.size(); i++) {
				if (merged.get(i).name().equals(field.name()) && merged.get(i).type() == field.type()) {
					same = i;
				}
			}
			if (same >= 0) {
				merged.set(same, union(merged.get(same), field));
			}
			else {
				merged.add(field);
			}
		}
		return merged;
	}

	private String conflict(FieldDescriptor existing, FieldDescriptor field) {
		if (existing.type() != field.type()) {
			return "bound as " + existing.type() + " by " + existing.source() + " and as " + field.type() + " by " + field.source();
		}
		if (existing.isRestricted() && field.isRestricted()
				&& existing.allowedValues().stream().noneMatch(field.allowedValues()::contains)) {
			return "allowed values " + existing.allowedValues() + " of " + existing.source()
					+ " and " + field.allowedValues() + " of " + field.source() + " do not overlap";
		}
		return null;
	}

	private FieldDescriptor union(FieldDescriptor a, FieldDescriptor b) {
		List<String> allowed = List.of();
		if (a.isRestricted() && b.isRestricted()) {
			Set<String> values = new LinkedHashSet<>(a.allowedValues());
			values.addAll(b.allowedValues());
			allowed = new ArrayList<>(values);
		}
		return new FieldDescriptor(a.name(), a.type(), allowed,
				a.description() != null ? a.description() : b.description(), a.source());
	}
}
