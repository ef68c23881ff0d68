package io.github.cyfko.proplogic.core;

import io.github.cyfko.proplogic.core.config.ParserPolicy;
import io.github.cyfko.proplogic.core.config.VerifierPolicy;
import io.github.cyfko.proplogic.core.exception.ComplexityLimitException;
import io.github.cyfko.proplogic.core.exception.ExpressionSyntaxException;
import io.github.cyfko.proplogic.core.exception.SyntaxErrorKind;
import io.github.cyfko.proplogic.core.model.Expression;
import io.github.cyfko.proplogic.core.model.SatisfiabilityResult;
import io.github.cyfko.proplogic.core.model.Valuation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end scenarios through {@link PropLogic}.
 *
 * @author Frank KOSSI
 * @since 1.0
 */
@DisplayName("PropLogic Facade Tests")
class PropLogicTest {

    @Test
    @DisplayName("Modus ponens: satisfiable, entailed, no counterexample")
    void modusPonens() {
        List<Expression> axioms = PropLogic.parseAll(List.of("A -> B", "A"));
        Expression proposition = PropLogic.parse("B");

        SatisfiabilityResult sat = PropLogic.isSatisfiable(axioms, 5);

        assertTrue(sat.satisfiable());
        assertTrue(sat.models().contains(Valuation.of(Map.of("A", true, "B", true))));
        assertTrue(PropLogic.entails(axioms, proposition));
        assertTrue(PropLogic.checkEntailment(axioms, proposition).isEntailed());
        assertEquals(Optional.empty(), PropLogic.findCounterexample(axioms, proposition));
    }

    @Test
    @DisplayName("A & ~A is a contradiction with no model")
    void contradiction() {
        Expression expression = PropLogic.parse("A & ~A");

        assertTrue(PropLogic.isContradiction(expression));
        assertEquals(new SatisfiabilityResult(false, List.of()), PropLogic.isSatisfiable(List.of(expression)));
    }

    @Test
    @DisplayName("A | ~A is a tautology")
    void tautology() {
        assertTrue(PropLogic.isTautology(PropLogic.parse("A | ~A")));
    }

    @Test
    @DisplayName("A does not entail A & B")
    void counterexample() {
        List<Expression> axioms = PropLogic.parseAll(List.of("A"));
        Expression proposition = PropLogic.parse("A & B");

        assertFalse(PropLogic.entails(axioms, proposition));
        assertEquals(Optional.of(Valuation.of(Map.of("A", true, "B", false))),
                PropLogic.findCounterexample(axioms, proposition));
    }

    @Test
    @DisplayName("Syntax errors surface with their kind")
    void syntaxErrors() {
        ExpressionSyntaxException unmatched = assertThrows(ExpressionSyntaxException.class, () -> PropLogic.parse("(A"));
        ExpressionSyntaxException empty = assertThrows(ExpressionSyntaxException.class, () -> PropLogic.parse(""));

        assertEquals(SyntaxErrorKind.UNMATCHED_PARENTHESIS, unmatched.getKind());
        assertEquals(SyntaxErrorKind.EMPTY_EXPRESSION, empty.getKind());
    }

    @Test
    @DisplayName("Custom components enforce their own policies")
    void customComponents() {
        String deep = "~~~~~A";

        assertNotNull(PropLogic.parse(deep));
        assertThrows(ComplexityLimitException.class,
                () -> PropLogic.parser(ParserPolicy.builder().maxNestingDepth(3).build()).parse(deep));

        Expression twoVariables = PropLogic.parse("A | B");
        assertThrows(ComplexityLimitException.class,
                () -> PropLogic.verifier(VerifierPolicy.builder().maxVariables(1).build()).isTautology(twoVariables));
    }
}
