package io.github.cyfko.proplogic.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SatisfiabilityResult} and {@link EntailmentResult}.
 *
 * @author Frank KOSSI
 * @since 1.0
 */
@DisplayName("Result Types Tests")
class ResultTest {

    private static final Valuation MODEL = Valuation.of(List.of("A", "B"), new boolean[]{true, false});

    @Test
    @DisplayName("Satisfiability follows the presence of models")
    void satisfiabilityFollowsModels() {
        assertTrue(SatisfiabilityResult.of(List.of(MODEL)).satisfiable());
        assertFalse(SatisfiabilityResult.of(List.of()).satisfiable());
        assertEquals(SatisfiabilityResult.unsatisfiable(), SatisfiabilityResult.of(List.of()));
    }

    @Test
    @DisplayName("Inconsistent satisfiability results are rejected")
    void inconsistentResultsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SatisfiabilityResult(true, List.of()));
        assertThrows(IllegalArgumentException.class, () -> new SatisfiabilityResult(false, List.of(MODEL)));
        assertThrows(NullPointerException.class, () -> new SatisfiabilityResult(false, null));
    }

    @Test
    @DisplayName("Models are copied")
    void modelsAreCopied() {
        List<Valuation> models = new ArrayList<>(List.of(MODEL));
        SatisfiabilityResult result = SatisfiabilityResult.of(models);

        models.clear();

        assertEquals(List.of(MODEL), result.models());
        assertThrows(UnsupportedOperationException.class, () -> result.models().add(MODEL));
    }

    @Test
    @DisplayName("Entailment outcomes")
    void entailmentOutcomes() {
        EntailmentResult vacuous = EntailmentResult.vacuous();
        EntailmentResult entailed = EntailmentResult.entailed();
        EntailmentResult refuted = EntailmentResult.refutedBy(MODEL);

        assertTrue(vacuous.isEntailed());
        assertTrue(vacuous.isVacuous());
        assertEquals(Optional.empty(), vacuous.getCounterexample());

        assertTrue(entailed.isEntailed());
        assertFalse(entailed.isVacuous());
        assertEquals(Optional.empty(), entailed.getCounterexample());

        assertFalse(refuted.isEntailed());
        assertFalse(refuted.isVacuous());
        assertEquals(Optional.of(MODEL), refuted.getCounterexample());
        assertEquals("EntailmentResult[entailed=false, counterexample={A=true, B=false}]", refuted.toString());
    }

    @Test
    @DisplayName("Entailment results compare by value")
    void entailmentEquality() {
        assertEquals(EntailmentResult.refutedBy(MODEL), EntailmentResult.refutedBy(Valuation.of(Map.of("B", false, "A", true))));
        assertEquals(EntailmentResult.refutedBy(MODEL).hashCode(), EntailmentResult.refutedBy(MODEL).hashCode());
        assertNotEquals(EntailmentResult.vacuous(), EntailmentResult.entailed());
        assertThrows(NullPointerException.class, () -> EntailmentResult.refutedBy(null));
    }
}
