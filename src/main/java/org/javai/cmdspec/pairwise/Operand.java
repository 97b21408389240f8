package org.javai.cmdspec.pairwise;

import java.util.function.Function;

/**
 * Right hand side of a clause: a literal token or a {@code $parameter} reference.
 */
public sealed interface Operand {

	/**
	 * @return the token this operand stands for, or {@code null} when it refers
	 * to a parameter that is not assigned yet
	 */
	String resolve(Function<String, String> assignment);

	record Literal(String token) implements Operand {
		@Override
		public String resolve(Function<String, String> assignment) {
			return token;
		}

		@Override
		public String toString() {
			return token;
		}
	}

	record Reference(String parameter) implements Operand {
		@Override
		public String resolve(Function<String, String> assignment) {
			return assignment.apply(parameter);
		}

		@Override
		public String toString() {
			return "$" + parameter;
		}
	}
}
