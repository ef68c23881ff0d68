package io.github.cyfko.proplogic.core.parsing;

import io.github.cyfko.proplogic.core.exception.UndefinedVariableException;
import io.github.cyfko.proplogic.core.model.Expression;
import io.github.cyfko.proplogic.core.model.Expression.And;
import io.github.cyfko.proplogic.core.model.Expression.Iff;
import io.github.cyfko.proplogic.core.model.Expression.Implies;
import io.github.cyfko.proplogic.core.model.Expression.Not;
import io.github.cyfko.proplogic.core.model.Expression.Or;
import io.github.cyfko.proplogic.core.model.Expression.Var;
import io.github.cyfko.proplogic.core.model.Valuation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Truth-table tests for {@link ExpressionEvaluator}.
 *
 * @author Frank KOSSI
 * @since 1.0
 */
@DisplayName("ExpressionEvaluator Tests")
class ExpressionEvaluatorTest {

    private static final Var A = new Var("A");
    private static final Var B = new Var("B");

    private static Valuation ab(boolean a, boolean b) {
        return Valuation.of(Map.of("A", a, "B", b));
    }

    @ParameterizedTest(name = "A={0}, B={1}: and={2} or={3} implies={4} iff={5}")
    @CsvSource({
            "false, false, false, false, true,  true",
            "false, true,  false, true,  true,  false",
            "true,  false, false, true,  false, false",
            "true,  true,  true,  true,  true,  true"
    })
    @DisplayName("Binary connectives follow their truth tables")
    void testBinaryTruthTables(boolean a, boolean b, boolean and, boolean or, boolean implies, boolean iff) {
        Valuation valuation = ab(a, b);

        assertEquals(and, ExpressionEvaluator.evaluate(new And(A, B), valuation));
        assertEquals(or, ExpressionEvaluator.evaluate(new Or(A, B), valuation));
        assertEquals(implies, ExpressionEvaluator.evaluate(new Implies(A, B), valuation));
        assertEquals(!a || b, ExpressionEvaluator.evaluate(new Implies(A, B), valuation));
        assertEquals(iff, ExpressionEvaluator.evaluate(new Iff(A, B), valuation));
        assertEquals(a == b, ExpressionEvaluator.evaluate(new Iff(A, B), valuation));
    }

    @ParameterizedTest
    @CsvSource({"true, false", "false, true"})
    @DisplayName("Negation flips the value")
    void testNegation(boolean a, boolean expected) {
        assertEquals(expected, ExpressionEvaluator.evaluate(new Not(A), Valuation.of(Map.of("A", a))));
        assertEquals(a, ExpressionEvaluator.evaluate(new Not(new Not(A)), Valuation.of(Map.of("A", a))));
    }

    @Test
    @DisplayName("Nested formula: (A -> B) & A evaluates like modus ponens premises")
    void testNestedFormula() {
        Expression premises = new And(new Implies(A, B), A);

        assertTrue(premises.evaluate(ab(true, true)));
        assertFalse(premises.evaluate(ab(true, false)));
        assertFalse(premises.evaluate(ab(false, true)));
    }

    @Test
    @DisplayName("Variables missing from the valuation are reported")
    void testUndefinedVariable() {
        UndefinedVariableException exception = assertThrows(UndefinedVariableException.class,
                () -> ExpressionEvaluator.evaluate(new And(A, B), Valuation.of(Map.of("A", true))));

        assertEquals("B", exception.getVariableName());
        assertTrue(exception.getMessage().contains("'B'"));
    }

    @Test
    @DisplayName("Both operands are evaluated even when the first decides the result")
    void testNoShortCircuit() {
        Valuation onlyA = Valuation.of(Map.of("A", true));

        assertThrows(UndefinedVariableException.class, () -> ExpressionEvaluator.evaluate(new Or(A, B), onlyA));
        assertThrows(UndefinedVariableException.class,
                () -> ExpressionEvaluator.evaluate(new And(new Not(A), B), onlyA));
        assertThrows(UndefinedVariableException.class,
                () -> ExpressionEvaluator.evaluate(new Implies(new Not(A), B), onlyA));
    }

    @Test
    @DisplayName("Extra variables in the valuation are ignored")
    void testExtraVariablesIgnored() {
        Valuation valuation = Valuation.of(Map.of("A", true, "B", false, "Z", true));
        assertTrue(ExpressionEvaluator.evaluate(A, valuation));
    }

    @Test
    @DisplayName("Should reject null arguments")
    void testNullArguments() {
        assertThrows(NullPointerException.class, () -> ExpressionEvaluator.evaluate(null, Valuation.empty()));
        assertThrows(NullPointerException.class, () -> ExpressionEvaluator.evaluate(A, null));
    }
}
