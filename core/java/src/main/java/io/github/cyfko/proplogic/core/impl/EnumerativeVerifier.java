package io.github.cyfko.proplogic.core.impl;

import io.github.cyfko.proplogic.core.api.LogicVerifier;
import io.github.cyfko.proplogic.core.config.VerifierPolicy;
import io.github.cyfko.proplogic.core.enumeration.ValuationEnumerator;
import io.github.cyfko.proplogic.core.exception.ComplexityLimitException;
import io.github.cyfko.proplogic.core.model.EntailmentResult;
import io.github.cyfko.proplogic.core.model.Expression;
import io.github.cyfko.proplogic.core.model.SatisfiabilityResult;
import io.github.cyfko.proplogic.core.model.Valuation;
import io.github.cyfko.proplogic.core.parsing.FreeVariableCollector;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.logging.Logger;

/**
 * {@link LogicVerifier} deciding every question by exhaustive enumeration of truth assignments.
 *
 * <h2>Algorithm</h2>
 * <p>
 * Each query collects the sorted union of the free variables of its formulas, enumerates the
 * 2<sup>v</sup> valuations over them in canonical order with a {@link ValuationEnumerator},
 * and evaluates the formulas under each one. Searches for a model or a counterexample stop at
 * the first hit (or at the model cap); proofs of absence visit every valuation.
 * </p>
 *
 * <h2>Cost</h2>
 * <ul>
 *   <li><strong>Time</strong>: O(2<sup>v</sup> &middot; e), e being the total size of the formulas</li>
 *   <li><strong>Space</strong>: one valuation at a time, plus the collected models</li>
 * </ul>
 * <p>
 * Queries with more than {@link VerifierPolicy#maxVariables()} variables are rejected with
 * {@link ComplexityLimitException} before any enumeration starts.
 * </p>
 *
 * <h2>Entailment</h2>
 * <p>
 * Satisfiability of the axioms is checked first (one model suffices). Unsatisfiable axioms
 * entail every proposition: that case is returned as {@link EntailmentResult#vacuous()}.
 * Otherwise a single enumeration over the variables of the axioms and the proposition looks
 * for a counterexample.
 * </p>
 *
 * <p>Instances hold no mutable state and are thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class EnumerativeVerifier implements LogicVerifier {

    private static final Logger log = Logger.getLogger(EnumerativeVerifier.class.getName());

    private final VerifierPolicy verifierPolicy;

    /**
     * Verifier using {@link VerifierPolicy#defaults()}.
     */
    public EnumerativeVerifier() {
        this(VerifierPolicy.defaults());
    }

    /**
     * @param verifierPolicy the bounds to enforce
     * @throws IllegalArgumentException if the policy is null
     */
    public EnumerativeVerifier(VerifierPolicy verifierPolicy) {
        if (verifierPolicy == null) {
            throw new IllegalArgumentException("Verifier policy is required");
        }
        this.verifierPolicy = verifierPolicy;
    }

    public VerifierPolicy getVerifierPolicy() {
        return verifierPolicy;
    }

    @Override
    public SatisfiabilityResult isSatisfiable(List<Expression> axioms) {
        return isSatisfiable(axioms, verifierPolicy.defaultMaxModels());
    }

    @Override
    public SatisfiabilityResult isSatisfiable(List<Expression> axioms, int maxModels) {
        Objects.requireNonNull(axioms, "axioms");
        if (maxModels <= 0) {
            throw new IllegalArgumentException("maxModels must be positive, got: " + maxModels);
        }

        ValuationEnumerator enumerator = enumeratorFor(axioms, "satisfiability");
        List<Valuation> models = new ArrayList<>();
        for (Valuation valuation : enumerator) {
            if (satisfiesAll(axioms, valuation)) {
                models.add(valuation);
                if (models.size() >= maxModels) {
                    break;
                }
            }
        }

        log.fine(() -> String.format("Satisfiability: %d model(s) collected (cap %d)", models.size(), maxModels));
        return SatisfiabilityResult.of(models);
    }

    @Override
    public EntailmentResult checkEntailment(List<Expression> axioms, Expression proposition) {
        Objects.requireNonNull(axioms, "axioms");
        Objects.requireNonNull(proposition, "proposition");

        if (!isSatisfiable(axioms, 1).satisfiable()) {
            log.fine("Entailment: axioms are unsatisfiable, entailment holds vacuously (ex falso quodlibet)");
            return EntailmentResult.vacuous();
        }

        return searchCounterexample(axioms, proposition)
                .map(EntailmentResult::refutedBy)
                .orElseGet(EntailmentResult::entailed);
    }

    @Override
    public Optional<Valuation> findCounterexample(List<Expression> axioms, Expression proposition) {
        Objects.requireNonNull(axioms, "axioms");
        Objects.requireNonNull(proposition, "proposition");
        return searchCounterexample(axioms, proposition);
    }

    @Override
    public boolean isTautology(Expression expression) {
        Objects.requireNonNull(expression, "expression");
        for (Valuation valuation : enumeratorFor(List.of(expression), "tautology")) {
            if (!expression.evaluate(valuation)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean isContradiction(Expression expression) {
        Objects.requireNonNull(expression, "expression");
        for (Valuation valuation : enumeratorFor(List.of(expression), "contradiction")) {
            if (expression.evaluate(valuation)) {
                return false;
            }
        }
        return true;
    }

    private Optional<Valuation> searchCounterexample(List<Expression> axioms, Expression proposition) {
        List<Expression> involved = new ArrayList<>(axioms.size() + 1);
        involved.addAll(axioms);
        involved.add(proposition);

        for (Valuation valuation : enumeratorFor(involved, "counterexample")) {
            if (satisfiesAll(axioms, valuation) && !proposition.evaluate(valuation)) {
                log.fine(() -> "Counterexample found: " + valuation);
                return Optional.of(valuation);
            }
        }
        return Optional.empty();
    }

    private ValuationEnumerator enumeratorFor(List<Expression> expressions, String query) {
        SortedSet<String> variables = FreeVariableCollector.collectAll(expressions);
        if (variables.size() > verifierPolicy.maxVariables()) {
            throw new ComplexityLimitException(String.format(
                    "Too many variables (%d, max: %d). Policy applied: %s",
                    variables.size(), verifierPolicy.maxVariables(), verifierPolicy.policyName()));
        }

        ValuationEnumerator enumerator = new ValuationEnumerator(List.copyOf(variables));

        log.fine(() -> String.format("Enumerating %d valuation(s) over %s for %s query",
                enumerator.size(), enumerator.variables(), query));
        return enumerator;
    }

    private static boolean satisfiesAll(List<Expression> axioms, Valuation valuation) {
        for (Expression axiom : axioms) {
            if (!axiom.evaluate(valuation)) {
                return false;
            }
        }
        return true;
    }
}
