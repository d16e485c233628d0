package org.fmverify.analysis;

import org.fmverify.io.HierarchicalTextParser;
import org.fmverify.model.FeatureModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.when;

/**
 * Comportamento dell'analizzatore con esiti del backend pilotati.
 */
@ExtendWith(MockitoExtension.class)
class DefectAnalyzerBackendTest {

    @Mock
    private SolverBackend backend;

    private FeatureModel model;

    @BeforeEach
    void setUp() throws Exception {
        model = new HierarchicalTextParser().parse("""
                namespace T
                features
                    InternalAuditSystem
                        optional
                            a
                            b
                constraints
                """).model();
    }

    @Test
    @DisplayName("Timeout sul check di vuotezza: stato UNKNOWN e nessun difetto")
    void testUnknownVoidCheck() {
        when(backend.solve(anyInt(), anyList(), any(int[].class), anyLong())).thenReturn(SatOutcome.UNKNOWN);

        try (DefectAnalyzer analyzer = new DefectAnalyzer(backend, AnalysisOptions.defaults().withThreads(1))) {
            AnalysisResult result = analyzer.analyze(model);

            assertThat(result.getStatus()).isEqualTo(AnalysisResult.Status.UNKNOWN);
            assertThat(result.satLabel()).isEqualTo("UNKNOWN");
            assertThat(result.getDeadFeatures()).isEmpty();
            assertThat(result.hasDefects()).isFalse();
            assertThat(result.getStatistics().getUnknownCount()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Query per-feature in timeout finiscono tra le indeterminate, non tra i difetti")
    void testUnknownPerFeatureQueries() {
        when(backend.solve(anyInt(), anyList(), any(int[].class), anyLong())).thenAnswer(invocation -> {
            int[] assumptions = invocation.getArgument(2);
            return assumptions.length == 0 ? SatOutcome.SAT : SatOutcome.UNKNOWN;
        });

        try (DefectAnalyzer analyzer = new DefectAnalyzer(backend, AnalysisOptions.defaults().withThreads(2))) {
            AnalysisResult result = analyzer.analyze(model);

            assertThat(result.getStatus()).isEqualTo(AnalysisResult.Status.CONSISTENT);
            assertThat(result.getDeadFeatures()).isEmpty();
            assertThat(result.getFalseOptionalFeatures()).isEmpty();
            assertThat(result.getUndeterminedFeatures()).containsExactly("InternalAuditSystem", "a", "b");
            assertThat(result.defectsText()).isEqualTo("None");
        }
    }

    @Test
    @DisplayName("Backend non disponibile: l'eccezione raggiunge il chiamante")
    void testSolverUnavailablePropagates() {
        when(backend.solve(anyInt(), anyList(), any(int[].class), anyLong()))
                .thenThrow(new SolverUnavailableException("nessun solver", null));

        try (DefectAnalyzer analyzer = new DefectAnalyzer(backend, AnalysisOptions.defaults().withThreads(1))) {
            assertThatThrownBy(() -> analyzer.analyze(model))
                    .isInstanceOf(SolverUnavailableException.class)
                    .hasMessageContaining("nessun solver");
        }
    }

    @Test
    @DisplayName("Errore inatteso del backend: la query fallisce con IllegalStateException")
    void testUnexpectedBackendFailure() {
        when(backend.solve(anyInt(), anyList(), any(int[].class), anyLong()))
                .thenThrow(new ArithmeticException("boom"));

        try (DefectAnalyzer analyzer = new DefectAnalyzer(backend, AnalysisOptions.defaults().withThreads(1))) {
            assertThatThrownBy(() -> analyzer.analyze(model))
                    .isInstanceOf(IllegalStateException.class)
                    .hasCauseInstanceOf(ArithmeticException.class);
        }
    }

    @Test
    @DisplayName("Costruzione con argomenti null rifiutata")
    void testNullArguments() {
        assertThatThrownBy(() -> new DefectAnalyzer(null, AnalysisOptions.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DefectAnalyzer(backend, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
