package org.javai.cmdspec.pairwise;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One row of a pairwise matrix: a value for every participating parameter,
 * tagged with the models it applies to.
 *
 * @param values parameter name to candidate value, in participant order
 * @param models models the row applies to
 * @param otherModels whether the row also applies to every model no invalid-for
 * constraint names; always {@code true} when the command lists no models
 */
public record Combination(Map<String, Object> values, Set<String> models, boolean otherModels) {

	public Combination {
		values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
		models = models != null ? Collections.unmodifiableSet(new LinkedHashSet<>(models)) : Set.of();
	}

	public Object value(String parameter) {
		return values.get(parameter);
	}

	public boolean isModelScoped() {
		return !otherModels;
	}
}
