package io.github.cyfko.proplogic.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a satisfiability query.
 * <p>
 * {@code models} holds the satisfying valuations found, in canonical enumeration order, up to
 * the requested cap. The set is satisfiable exactly when at least one model was found.
 * </p>
 *
 * @param satisfiable {@code true} if some valuation satisfies every axiom
 * @param models      satisfying valuations, at most the requested cap, empty when unsatisfiable
 * @author Frank KOSSI
 * @since 1.0
 */
public record SatisfiabilityResult(boolean satisfiable, List<Valuation> models) {

    public SatisfiabilityResult {
        Objects.requireNonNull(models, "models");
        models = List.copyOf(models);
        if (satisfiable == models.isEmpty()) {
            throw new IllegalArgumentException(
                    "A satisfiable result needs at least one model, an unsatisfiable one none");
        }
    }

    public static SatisfiabilityResult unsatisfiable() {
        return new SatisfiabilityResult(false, List.of());
    }

    public static SatisfiabilityResult of(List<Valuation> models) {
        return new SatisfiabilityResult(!models.isEmpty(), models);
    }
}
