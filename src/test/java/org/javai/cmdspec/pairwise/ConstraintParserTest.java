package org.javai.cmdspec.pairwise;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ConstraintParser")
class ConstraintParserTest {

	private final ConstraintParser parser = new ConstraintParser();

	@Nested
	@DisplayName("Parsing")
	class Parsing {

		@Test
		void shouldParseConjunctionOfComparisons() {
			ConstraintExpression expression = parser.parse("negotiate_strictly == on && mode == ikev1");

			assertThat(expression.clauses()).hasSize(2);
			assertThat(expression.clauses().get(0).operator()).isEqualTo(Clause.Operator.EQUALS);
			assertThat(expression.referencedParameters()).containsExactly("negotiate_strictly", "mode");
		}

		@Test
		void shouldAcceptWordConjunctionAndSingleEquals() {
			ConstraintExpression expression = parser.parse("mode = ikev2 and pfs != off");

			assertThat(expression.clauses()).extracting(Clause::operator)
					.containsExactly(Clause.Operator.EQUALS, Clause.Operator.NOT_EQUALS);
		}

		@Test
		void shouldParseMembership() {
			Clause clause = parser.parse("group in [modp1024, 'modp2048']").clauses().get(0);

			assertThat(clause.operator()).isEqualTo(Clause.Operator.IN);
			assertThat(clause.operands()).containsExactly(new Operand.Literal("modp1024"), new Operand.Literal("modp2048"));
		}

		@Test
		void shouldParseReferences() {
			Clause clause = parser.parse("peer_pfs == $pfs").clauses().get(0);

			assertThat(clause.operands()).containsExactly(new Operand.Reference("pfs"));
			assertThat(clause.referencedParameters()).containsExactly("peer_pfs", "pfs");
		}

		@Test
		void shouldStripQuotes() {
			Clause clause = parser.parse("name == \"two words\"").clauses().get(0);

			assertThat(clause.operands()).containsExactly(new Operand.Literal("two words"));
		}

		@ParameterizedTest
		@ValueSource(strings = {"", "   ", "mode", "mode ==", "== on", "mode == on &&", "peer_pfs == $", "mode == two words"})
		void shouldRejectMalformedExpressions(String expression) {
			assertThatThrownBy(() -> parser.parse(expression)).isInstanceOf(IllegalArgumentException.class);
		}
	}

	@Nested
	@DisplayName("Evaluation")
	class Evaluation {

		@Test
		void shouldBeUnknownWhileAParameterIsUnassigned() {
			ConstraintExpression expression = parser.parse("a == x && b == y");

			assertThat(expression.evaluate(Map.of("a", "x")::get)).isEqualTo(TriState.UNKNOWN);
			assertThat(expression.evaluate(Map.of("a", "z")::get)).isEqualTo(TriState.FALSE);
			assertThat(expression.evaluate(Map.of("a", "x", "b", "y")::get)).isEqualTo(TriState.TRUE);
		}

		@Test
		void shouldResolveReferencesAgainstTheAssignment() {
			ConstraintExpression expression = parser.parse("peer_pfs == $pfs");

			assertThat(expression.evaluate(Map.of("peer_pfs", "on")::get)).isEqualTo(TriState.UNKNOWN);
			assertThat(expression.evaluate(Map.of("peer_pfs", "on", "pfs", "on")::get)).isEqualTo(TriState.TRUE);
			assertThat(expression.evaluate(Map.of("peer_pfs", "off", "pfs", "on")::get)).isEqualTo(TriState.FALSE);
		}

		@Test
		void shouldEvaluateMembershipAndNegation() {
			assertThat(parser.parse("g in [a, b]").evaluate(Map.of("g", "b")::get)).isEqualTo(TriState.TRUE);
			assertThat(parser.parse("g in [a, b]").evaluate(Map.of("g", "c")::get)).isEqualTo(TriState.FALSE);
			assertThat(parser.parse("g != a").evaluate(Map.of("g", "a")::get)).isEqualTo(TriState.FALSE);
		}
	}

	@Test
	void triStateConjunctionIsFalseDominant() {
		assertThat(TriState.UNKNOWN.and(TriState.FALSE)).isEqualTo(TriState.FALSE);
		assertThat(TriState.UNKNOWN.and(TriState.TRUE)).isEqualTo(TriState.UNKNOWN);
		assertThat(TriState.TRUE.and(TriState.TRUE)).isEqualTo(TriState.TRUE);
		assertThat(TriState.FALSE.and(TriState.TRUE)).isEqualTo(TriState.FALSE);
	}
}
