package io.github.cyfko.proplogic.core.api;

import io.github.cyfko.proplogic.core.exception.ComplexityLimitException;
import io.github.cyfko.proplogic.core.model.EntailmentResult;
import io.github.cyfko.proplogic.core.model.Expression;
import io.github.cyfko.proplogic.core.model.SatisfiabilityResult;
import io.github.cyfko.proplogic.core.model.Valuation;

import java.util.List;
import java.util.Optional;

/**
 * Classical decision procedures over propositional formulas.
 * <p>
 * Every query considers the lexicographically sorted union of the free variables of the
 * formulas involved, and reports valuations over exactly those variables. Results that name a
 * valuation ("the first model", "the first counterexample") refer to the canonical enumeration
 * order, so they are the same on every run. Input trees are never modified.
 * </p>
 *
 * <pre>{@code
 * LogicVerifier verifier = new EnumerativeVerifier();
 * List<Expression> axioms = parser.parseAll(List.of("A -> B", "A"));
 *
 * verifier.isSatisfiable(axioms, 5);                 // satisfiable, models [{A=true, B=true}]
 * verifier.entails(axioms, parser.parse("B"));       // true
 * verifier.isTautology(parser.parse("A | ~A"));      // true
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public interface LogicVerifier {

    /**
     * Looks for valuations satisfying every axiom, stopping once {@code maxModels} are found.
     *
     * @param axioms    the formulas to satisfy together
     * @param maxModels maximum number of models to collect, positive
     * @return whether a model exists, with the models found in canonical order
     * @throws IllegalArgumentException if maxModels is not positive
     * @throws ComplexityLimitException if the axioms have too many variables
     */
    SatisfiabilityResult isSatisfiable(List<Expression> axioms, int maxModels);

    /**
     * Same as {@link #isSatisfiable(List, int)} with the verifier's default model cap.
     */
    SatisfiabilityResult isSatisfiable(List<Expression> axioms);

    /**
     * Decides entailment and reports how the decision was reached.
     *
     * @param axioms      the premises
     * @param proposition the conclusion
     * @return vacuous when the axioms are unsatisfiable, otherwise entailed or refuted
     * @throws ComplexityLimitException if the query has too many variables
     */
    EntailmentResult checkEntailment(List<Expression> axioms, Expression proposition);

    /**
     * @return {@code true} iff every valuation satisfying all axioms satisfies the proposition,
     *         in particular whenever the axioms are unsatisfiable
     */
    default boolean entails(List<Expression> axioms, Expression proposition) {
        return checkEntailment(axioms, proposition).isEntailed();
    }

    /**
     * @return {@code true} iff the expression is true under every valuation of its variables
     */
    boolean isTautology(Expression expression);

    /**
     * @return {@code true} iff the expression is false under every valuation of its variables
     */
    boolean isContradiction(Expression expression);

    /**
     * Finds the first valuation, in canonical order, satisfying every axiom and falsifying the
     * proposition.
     *
     * @return the counterexample, empty iff the axioms entail the proposition
     */
    Optional<Valuation> findCounterexample(List<Expression> axioms, Expression proposition);
}
