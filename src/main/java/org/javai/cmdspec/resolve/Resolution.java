package org.javai.cmdspec.resolve;

import java.util.Optional;

/**
 * Outcome of resolving a parameter for a model. A parameter that does not
 * exist on a model is a normal result, not an error.
 */
public sealed interface Resolution {

	String parameter();

	String model();

	static Resolution resolved(EffectiveDomain domain) {
		return new Resolved(domain);
	}

	static Resolution unsupported(String parameter, String model, String reason) {
		return new Unsupported(parameter, model, reason);
	}

	default boolean isResolved() {
		return this instanceof Resolved;
	}

	default Optional<EffectiveDomain> domain() {
		return this instanceof Resolved resolved ? Optional.of(resolved.effectiveDomain()) : Optional.empty();
	}

	record Resolved(EffectiveDomain effectiveDomain) implements Resolution {
		@Override
		public String parameter() {
			return effectiveDomain.parameter().name();
		}

		@Override
		public String model() {
			return effectiveDomain.model();
		}
	}

	record Unsupported(String parameter, String model, String reason) implements Resolution {
	}
}
