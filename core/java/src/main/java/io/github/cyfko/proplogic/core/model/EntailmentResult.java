package io.github.cyfko.proplogic.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an entailment check, stating how the decision was reached.
 * <p>
 * Three outcomes are possible:
 * </p>
 * <ul>
 *   <li><strong>vacuous</strong>: the axioms have no model, so they entail every proposition</li>
 *   <li><strong>entailed</strong>: every model of the axioms satisfies the proposition</li>
 *   <li><strong>refuted</strong>: a counterexample satisfies the axioms and falsifies the proposition</li>
 * </ul>
 *
 * <p>Instances are immutable and created via {@link #vacuous()}, {@link #entailed()} and
 * {@link #refutedBy(Valuation)}.</p>
 *
 * <pre>{@code
 * EntailmentResult result = verifier.checkEntailment(axioms, proposition);
 * if (!result.isEntailed()) {
 *     System.out.println("Counterexample: " + result.getCounterexample().orElseThrow());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class EntailmentResult {

    private static final EntailmentResult VACUOUS = new EntailmentResult(true, true, null);
    private static final EntailmentResult ENTAILED = new EntailmentResult(true, false, null);

    private final boolean entailed;
    private final boolean vacuous;
    private final Valuation counterexample;

    private EntailmentResult(boolean entailed, boolean vacuous, Valuation counterexample) {
        this.entailed = entailed;
        this.vacuous = vacuous;
        this.counterexample = counterexample;
    }

    /**
     * @return the result for unsatisfiable axioms (ex falso quodlibet)
     */
    public static EntailmentResult vacuous() {
        return VACUOUS;
    }

    /**
     * @return the result for satisfiable axioms whose every model satisfies the proposition
     */
    public static EntailmentResult entailed() {
        return ENTAILED;
    }

    /**
     * @param counterexample a valuation satisfying the axioms and falsifying the proposition
     * @return the negative result carrying that valuation
     */
    public static EntailmentResult refutedBy(Valuation counterexample) {
        return new EntailmentResult(false, false, Objects.requireNonNull(counterexample, "counterexample"));
    }

    public boolean isEntailed() {
        return entailed;
    }

    /**
     * @return {@code true} if entailment holds only because the axioms are unsatisfiable
     */
    public boolean isVacuous() {
        return vacuous;
    }

    /**
     * @return the first counterexample in canonical order, empty when entailment holds
     */
    public Optional<Valuation> getCounterexample() {
        return Optional.ofNullable(counterexample);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntailmentResult other)) return false;
        return entailed == other.entailed && vacuous == other.vacuous
                && Objects.equals(counterexample, other.counterexample);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entailed, vacuous, counterexample);
    }

    @Override
    public String toString() {
        if (vacuous) return "EntailmentResult[entailed=true, vacuous=true]";
        return entailed ? "EntailmentResult[entailed=true]"
                : "EntailmentResult[entailed=false, counterexample=" + counterexample + "]";
    }
}
