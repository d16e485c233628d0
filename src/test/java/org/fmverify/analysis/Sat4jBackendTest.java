package org.fmverify.analysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.sat4j.specs.ISolver;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class Sat4jBackendTest {

    private final Sat4jBackend backend = new Sat4jBackend();

    @Test
    @DisplayName("Formula soddisfacibile senza assunzioni")
    void testSatisfiable() {
        List<List<Integer>> clauses = List.of(List.of(1), List.of(-1, 2));

        assertThat(backend.solve(2, clauses, new int[0], 1000)).isEqualTo(SatOutcome.SAT);
    }

    @Test
    @DisplayName("Le assunzioni in conflitto con le clausole producono UNSAT")
    void testAssumptionConflict() {
        List<List<Integer>> clauses = List.of(List.of(1), List.of(-1, 2));

        assertThat(backend.solve(2, clauses, new int[]{-2}, 1000)).isEqualTo(SatOutcome.UNSAT);
    }

    @Test
    @DisplayName("Clausole unitarie contraddittorie: UNSAT già in caricamento")
    void testContradictionOnLoad() {
        List<List<Integer>> clauses = List.of(List.of(1), List.of(-1));

        assertThat(backend.solve(1, clauses, new int[0], 1000)).isEqualTo(SatOutcome.UNSAT);
    }

    @Test
    @DisplayName("Il solver è riutilizzabile: query successive indipendenti")
    void testIndependentQueries() {
        List<List<Integer>> clauses = List.of(List.of(1, 2));

        assertThat(backend.solve(2, clauses, new int[]{-1, -2}, 1000)).isEqualTo(SatOutcome.UNSAT);
        assertThat(backend.solve(2, clauses, new int[]{-1}, 1000)).isEqualTo(SatOutcome.SAT);
    }

    @Test
    @DisplayName("Varianti non istanziabili: SolverUnavailableException")
    void testUnavailableBackend() {
        Sat4jBackend broken = new Sat4jBackend(List.of(Sat4jBackend.Variant.DEFAULT)) {
            @Override
            protected ISolver create(Variant variant) {
                throw new IllegalStateException("libreria assente");
            }
        };

        assertThatThrownBy(broken::checkAvailable)
                .isInstanceOf(SolverUnavailableException.class)
                .hasRootCauseMessage("libreria assente");
    }

    @Test
    @DisplayName("Serve almeno una variante")
    void testEmptyVariants() {
        assertThatThrownBy(() -> new Sat4jBackend(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
