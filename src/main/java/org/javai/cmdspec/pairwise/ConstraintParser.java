package org.javai.cmdspec.pairwise;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses pairwise constraint expressions.
 *
 * <pre>
 * expression := clause (('&&' | 'and') clause)*
 * clause     := name ('==' | '=' | '!=') operand
 *             | name 'in' '[' operand (',' operand)* ']'
 * operand    := '$' name | token | quoted token
 * </pre>
 */
public class ConstraintParser {

	private static final Pattern CONJUNCTION = Pattern.compile("\\s*&&\\s*|\\s+and\\s+", Pattern.CASE_INSENSITIVE);
	private static final Pattern COMPARISON = Pattern.compile("([A-Za-z_][\\w-]*)\\s*(==|!=|=)\\s*([^=!\\s].*)");
	private static final Pattern MEMBERSHIP = Pattern.compile("([A-Za-z_][\\w-]*)\\s+in\\s*\\[(.*)]", Pattern.CASE_INSENSITIVE);

	/**
	 * @throws IllegalArgumentException when the expression is malformed
	 */
	public ConstraintExpression parse(String expression) {
		if (expression == null || expression.isBlank()) {
			throw new IllegalArgumentException("Constraint expression is empty");
		}
		List<Clause> clauses = new ArrayList<>();
		for (String part : CONJUNCTION.split(expression.trim(), -1)) {
			clauses.add(parseClause(part.trim(), expression));
		}
		return new ConstraintExpression(clauses);
	}

	private Clause parseClause(String text, String expression) {
		Matcher membership = MEMBERSHIP.matcher(text);
		if (membership.matches()) {
			List<Operand> operands = new ArrayList<>();
			for (String item : membership.group(2).split(",")) {
				operands.add(parseOperand(item, expression));
			}
			return new Clause(membership.group(1), Clause.Operator.IN, operands);
		}
		Matcher comparison = COMPARISON.matcher(text);
		if (comparison.matches()) {
			Clause.Operator operator = comparison.group(2).equals("!=") ? Clause.Operator.NOT_EQUALS : Clause.Operator.EQUALS;
			return new Clause(comparison.group(1), operator, List.of(parseOperand(comparison.group(3), expression)));
		}
		throw new IllegalArgumentException("Malformed clause '" + text + "' in '" + expression + "'");
	}

	private Operand parseOperand(String raw, String expression) {
		String token = raw.trim();
		if (token.length() >= 2 && (token.startsWith("\"") && token.endsWith("\"") || token.startsWith("'") && token.endsWith("'"))) {
			token = token.substring(1, token.length() - 1);
		}
		if (token.isEmpty() || token.contains(" ") && !raw.trim().startsWith("\"") && !raw.trim().startsWith("'")) {
			throw new IllegalArgumentException("Malformed operand '" + raw.trim() + "' in '" + expression + "'");
		}
		if (token.startsWith("$")) {
			String parameter = token.substring(1);
			if (parameter.isEmpty()) {
				throw new IllegalArgumentException("Empty parameter reference in '" + expression + "'");
			}
			return new Operand.Reference(parameter);
		}
		return new Operand.Literal(token);
	}
}
