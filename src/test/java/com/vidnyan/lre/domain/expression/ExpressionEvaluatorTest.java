package com.vidnyan.lre.domain.expression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionEvaluatorTest {

    private static ExpressionEvaluator evaluatorWith(Map<String, ?> variables) {
        return new ExpressionEvaluator(CaseVariables.of(variables));
    }

    private static final ExpressionEvaluator EMPTY = new ExpressionEvaluator(CaseVariables.empty());

    @Nested
    @DisplayName("comparisons")
    class Comparisons {

        @Test
        void numbersCompareByMagnitude() {
            assertEquals(true, EMPTY.evaluate("1 == 1.0"));
            assertEquals(true, EMPTY.evaluate("5 > 3"));
            assertEquals(false, EMPTY.evaluate("5 <= 3"));
            assertEquals(true, EMPTY.evaluate("-200 < -100"));
        }

        @Test
        void stringsCompareByValue() {
            assertEquals(true, EMPTY.evaluate("'abc' == 'abc'"));
            assertEquals(true, EMPTY.evaluate("'abc' < 'abd'"));
            assertEquals(true, EMPTY.evaluate("'a' != \"b\""));
        }

        @Test
        void identifiersResolveAgainstVariables() {
            ExpressionEvaluator evaluator = evaluatorWith(Map.of(
                    "dias", 10,
                    "ratio", 0.75,
                    "estado", "en concurso"));

            assertEquals(true, evaluator.evaluate("dias >= 10"));
            assertEquals(false, evaluator.evaluate("dias > 10"));
            assertEquals(true, evaluator.evaluate("ratio > 0.5"));
            assertEquals(true, evaluator.evaluate("estado == 'en concurso'"));
        }

        @Test
        void missingIdentifierResolvesToNull() {
            assertEquals(true, EMPTY.evaluate("desconocido == null"));
            assertEquals(false, EMPTY.evaluate("desconocido == 1"));
        }

        @Test
        void orderingAgainstNullCannotBeEvaluated() {
            assertNull(EMPTY.evaluate("desconocido > 3"));
        }

        @Test
        void orderingAcrossTypesCannotBeEvaluated() {
            assertNull(EMPTY.evaluate("'10' > 3"));
        }
    }

    @Nested
    @DisplayName("boolean connectives")
    class Connectives {

        @Test
        void andBindsTighterThanOr() {
            assertEquals(true, EMPTY.evaluate("true OR false AND false"));
            assertEquals(false, EMPTY.evaluate("(true OR false) AND false"));
        }

        @Test
        void notAppliesToTheNextOperand() {
            ExpressionEvaluator evaluator = evaluatorWith(Map.of("cero", 0, "depositadas", false));

            assertEquals(true, EMPTY.evaluate("NOT false"));
            assertEquals(true, EMPTY.evaluate("NOT NOT true"));
            assertEquals(true, evaluator.evaluate("NOT cero"));
            assertEquals(true, evaluator.evaluate("NOT depositadas OR false"));
        }

        @Test
        void comparisonsFoldBeforeConnectives() {
            ExpressionEvaluator evaluator = evaluatorWith(Map.of("a", 5, "b", 1));

            assertEquals(true, evaluator.evaluate("a > 3 AND b == 1"));
            assertEquals(false, evaluator.evaluate("a > 3 AND b == 2"));
            assertEquals(true, evaluator.evaluate("a < 3 OR b == 1"));
        }

        @Test
        void keywordLookalikesAreIdentifiers() {
            ExpressionEvaluator evaluator = evaluatorWith(Map.of("ANDROID", true, "NOTA", 1));

            assertEquals(true, evaluator.evaluate("ANDROID"));
            assertEquals(true, evaluator.evaluate("NOTA == 1"));
        }
    }

    @Nested
    @DisplayName("functions")
    class Functions {

        @Test
        void countSkipsNullArguments() {
            Map<String, Object> variables = new HashMap<>();
            variables.put("a", 1);
            variables.put("b", null);
            variables.put("c", 3);

            assertEquals(true, evaluatorWith(variables).evaluate("COUNT(a, b, c) >= 2"));
            assertEquals(new Value.NumberValue(BigDecimal.valueOf(2)),
                    evaluatorWith(variables).evaluateValue("COUNT(a, b, c)"));
        }

        @Test
        void countOfListIsItsSize() {
            ExpressionEvaluator evaluator = evaluatorWith(Map.of("documentos", List.of("memoria", "inventario", "balance")));

            assertEquals(true, evaluator.evaluate("COUNT(documentos) == 3"));
            assertEquals(true, EMPTY.evaluate("COUNT(ausente) == 0"));
        }

        @Test
        void minAndMaxIgnoreNulls() {
            ExpressionEvaluator evaluator = evaluatorWith(Map.of("a", 5, "b", 7, "c", 9));

            assertEquals(true, evaluator.evaluate("MAX(a, MIN(b, c)) == 7"));
            assertEquals(true, evaluator.evaluate("MIN(a, ausente) == 5"));
            assertNull(EMPTY.evaluate("MIN(ausente)"));
        }

        @Test
        void minRejectsNonNumericArguments() {
            assertNull(EMPTY.evaluate("MIN(1, 'x') > 0"));
        }

        @Test
        void sumIgnoresNonNumericArguments() {
            ExpressionEvaluator evaluator = evaluatorWith(Map.of("a", 1, "b", 3));

            assertEquals(true, evaluator.evaluate("SUM(a, b, 'x') == 4"));
        }

        @Test
        void nestedGroupsInsideArguments() {
            ExpressionEvaluator evaluator = evaluatorWith(Map.of("a", 2, "b", 8));

            assertEquals(true, evaluator.evaluate("MAX((a), SUM(a, b)) >= 10"));
        }
    }

    @Nested
    @DisplayName("failures surface as null")
    class Failures {

        @ParameterizedTest
        @ValueSource(strings = {
                "",
                "1 ==",
                "== 1",
                "(true",
                "true)",
                "a b",
                "NOT",
                "estado == 'abierto",
                "MAX(1,) > 0",
                "1 , 2",
                "FOO(1) == 1",
                "java.lang.System.exit(0)"
        })
        void malformedExpressionsEvaluateToNull(String expression) {
            assertNull(EMPTY.evaluate(expression));
        }

        @Test
        void strictEvaluationThrows() {
            assertThrows(ExpressionException.class, () -> EMPTY.evaluateValue("1 =="));
            assertThrows(ExpressionException.class, () -> EMPTY.evaluateValue("1 + 2"));
        }
    }

    @Test
    void nonBooleanResultsUseTruthiness() {
        ExpressionEvaluator evaluator = evaluatorWith(Map.of("cinco", 5, "cero", 0, "vacio", ""));

        assertEquals(true, evaluator.evaluate("cinco"));
        assertEquals(false, evaluator.evaluate("cero"));
        assertEquals(false, evaluator.evaluate("vacio"));
        assertNull(evaluator.evaluate("ausente"));
    }

    @Test
    void repeatedEvaluationIsStable() {
        ExpressionEvaluator evaluator = evaluatorWith(Map.of("a", 3, "b", Arrays.asList(1, 2)));
        String expression = "COUNT(b) == 2 AND (a > 2 OR NOT a)";

        assertEquals(evaluator.evaluate(expression), evaluator.evaluate(expression));
        assertEquals(true, evaluator.evaluate(expression));
    }
}
