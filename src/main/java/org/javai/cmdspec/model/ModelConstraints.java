package org.javai.cmdspec.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Model scoping for a parameter or a test.
 *
 * @param validFor models the subject is valid for; empty means no restriction
 * @param invalidFor models the subject is invalid for
 * @param unavailable models that lack the subject entirely
 * @param requiresLicense license SKU that must be held, optional
 * @param minFirmware minimum firmware revision, optional
 */
public record ModelConstraints(
		List<String> validFor,
		List<String> invalidFor,
		List<String> unavailable,
		String requiresLicense,
		String minFirmware
) {

	private static final ModelConstraints NONE = new ModelConstraints(List.of(), List.of(), List.of(), null, null);

	public ModelConstraints {
		validFor = validFor != null ? List.copyOf(validFor) : List.of();
		invalidFor = invalidFor != null ? List.copyOf(invalidFor) : List.of();
		unavailable = unavailable != null ? List.copyOf(unavailable) : List.of();
	}

	public static ModelConstraints none() {
		return NONE;
	}

	public boolean isModelScoped() {
		return !validFor.isEmpty() || !invalidFor.isEmpty() || !unavailable.isEmpty();
	}

	public boolean appliesTo(String model) {
		if (model == null) {
			return true;
		}
		if (unavailable.contains(model) || invalidFor.contains(model)) {
			return false;
		}
		return validFor.isEmpty() || validFor.contains(model);
	}

	public Set<String> referencedModels() {
		Set<String> models = new LinkedHashSet<>(validFor);
		models.addAll(invalidFor);
		models.addAll(unavailable);
		return models;
	}
}
