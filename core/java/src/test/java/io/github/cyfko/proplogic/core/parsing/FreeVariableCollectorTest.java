package io.github.cyfko.proplogic.core.parsing;

import io.github.cyfko.proplogic.core.impl.BasicExpressionParser;
import io.github.cyfko.proplogic.core.model.Expression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SortedSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FreeVariableCollector}.
 *
 * @author Frank KOSSI
 * @since 1.0
 */
@DisplayName("FreeVariableCollector Tests")
class FreeVariableCollectorTest {

    private final BasicExpressionParser parser = new BasicExpressionParser();

    @Test
    @DisplayName("Should collect every variable once, sorted")
    void shouldCollectSortedDistinctNames() {
        SortedSet<String> names = FreeVariableCollector.collect(parser.parse("(c -> a) <-> ~(b & a) | c"));

        assertEquals(List.of("a", "b", "c"), List.copyOf(names));
    }

    @Test
    @DisplayName("Should treat names case-sensitively and sort uppercase first")
    void shouldBeCaseSensitive() {
        SortedSet<String> names = FreeVariableCollector.collect(parser.parse("b & B & a & A"));

        assertEquals(List.of("A", "B", "a", "b"), List.copyOf(names));
    }

    @Test
    @DisplayName("Should union the variables of several expressions")
    void shouldUnionAcrossExpressions() {
        List<Expression> expressions = parser.parseAll(List.of("A -> B", "A", "C | ~A"));

        assertEquals(List.of("A", "B", "C"), List.copyOf(FreeVariableCollector.collectAll(expressions)));
        assertTrue(FreeVariableCollector.collectAll(List.of()).isEmpty());
    }

    @Test
    @DisplayName("Should return an unmodifiable set")
    void shouldReturnUnmodifiableSet() {
        SortedSet<String> names = FreeVariableCollector.collect(parser.parse("A"));

        assertThrows(UnsupportedOperationException.class, () -> names.add("B"));
    }

    @Test
    @DisplayName("Expression.freeVariables delegates to the collector")
    void shouldBeExposedOnExpression() {
        Expression expression = parser.parse("Q & P");

        assertEquals(FreeVariableCollector.collect(expression), expression.freeVariables());
    }
}
