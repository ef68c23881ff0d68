package io.github.cyfko.proplogic.core;

import io.github.cyfko.proplogic.core.api.ExpressionParser;
import io.github.cyfko.proplogic.core.api.LogicVerifier;
import io.github.cyfko.proplogic.core.config.ParserPolicy;
import io.github.cyfko.proplogic.core.config.VerifierPolicy;
import io.github.cyfko.proplogic.core.exception.ComplexityLimitException;
import io.github.cyfko.proplogic.core.exception.ExpressionSyntaxException;
import io.github.cyfko.proplogic.core.impl.BasicExpressionParser;
import io.github.cyfko.proplogic.core.impl.EnumerativeVerifier;
import io.github.cyfko.proplogic.core.model.EntailmentResult;
import io.github.cyfko.proplogic.core.model.Expression;
import io.github.cyfko.proplogic.core.model.SatisfiabilityResult;
import io.github.cyfko.proplogic.core.model.Valuation;

import java.util.List;
import java.util.Optional;

/**
 * High-level facade over parsing and verification with the default policies.
 * <p>
 * Callers that need other limits create their own components through {@link #parser(ParserPolicy)}
 * and {@link #verifier(VerifierPolicy)}.
 * </p>
 *
 * <p><strong>Complete Usage Example:</strong></p>
 * <pre>{@code
 * List<Expression> axioms = PropLogic.parseAll(List.of("A -> B", "A"));
 * Expression proposition = PropLogic.parse("B");
 *
 * SatisfiabilityResult sat = PropLogic.isSatisfiable(axioms, 5);
 * boolean holds = PropLogic.entails(axioms, proposition);                 // true
 * Optional<Valuation> ce = PropLogic.findCounterexample(axioms, proposition); // empty
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link ExpressionSyntaxException} - malformed formula</li>
 *   <li>{@link ComplexityLimitException} - formula or query beyond the default limits</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class PropLogic {

    private static final ExpressionParser DEFAULT_PARSER = new BasicExpressionParser();
    private static final LogicVerifier DEFAULT_VERIFIER = new EnumerativeVerifier();

    private PropLogic() {}

    /**
     * @param policy parser limits
     * @return a parser enforcing them
     */
    public static ExpressionParser parser(ParserPolicy policy) {
        return new BasicExpressionParser(policy);
    }

    /**
     * @param policy verifier bounds
     * @return a verifier enforcing them
     */
    public static LogicVerifier verifier(VerifierPolicy policy) {
        return new EnumerativeVerifier(policy);
    }

    public static Expression parse(String text) {
        return DEFAULT_PARSER.parse(text);
    }

    public static List<Expression> parseAll(List<String> texts) {
        return DEFAULT_PARSER.parseAll(texts);
    }

    public static SatisfiabilityResult isSatisfiable(List<Expression> axioms) {
        return DEFAULT_VERIFIER.isSatisfiable(axioms);
    }

    public static SatisfiabilityResult isSatisfiable(List<Expression> axioms, int maxModels) {
        return DEFAULT_VERIFIER.isSatisfiable(axioms, maxModels);
    }

    public static boolean entails(List<Expression> axioms, Expression proposition) {
        return DEFAULT_VERIFIER.entails(axioms, proposition);
    }

    public static EntailmentResult checkEntailment(List<Expression> axioms, Expression proposition) {
        return DEFAULT_VERIFIER.checkEntailment(axioms, proposition);
    }

    public static boolean isTautology(Expression expression) {
        return DEFAULT_VERIFIER.isTautology(expression);
    }

    public static boolean isContradiction(Expression expression) {
        return DEFAULT_VERIFIER.isContradiction(expression);
    }

    public static Optional<Valuation> findCounterexample(List<Expression> axioms, Expression proposition) {
        return DEFAULT_VERIFIER.findCounterexample(axioms, proposition);
    }
}
