package org.fmverify.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DiagnosticsTest {

    @Test
    @DisplayName("Conteggi per motivo nell'ordine di prima registrazione")
    void testCounts() {
        Diagnostics diagnostics = new Diagnostics();
        diagnostics.record("SKIP_ITEM_NO_VALID_ANSWERS", "K1");
        diagnostics.record("REFERENCE_ERROR", "riga 4");
        diagnostics.record("SKIP_ITEM_NO_VALID_ANSWERS", "K2");

        assertThat(diagnostics.reasons()).containsExactly("SKIP_ITEM_NO_VALID_ANSWERS", "REFERENCE_ERROR");
        assertThat(diagnostics.count("SKIP_ITEM_NO_VALID_ANSWERS")).isEqualTo(2);
        assertThat(diagnostics.count("ASSENTE")).isZero();
        assertThat(diagnostics.examples("ASSENTE")).isEmpty();
        assertThat(diagnostics.total()).isEqualTo(3);
        assertThat(diagnostics.summaryLine()).isEqualTo("SKIP_ITEM_NO_VALID_ANSWERS=2; REFERENCE_ERROR=1");
    }

    @Test
    @DisplayName("Il report testuale limita gli esempi ma non i conteggi")
    void testRenderLimitsExamples() {
        Diagnostics diagnostics = new Diagnostics();
        for (int i = 0; i < 5; i++) {
            diagnostics.record("DROP", "esempio " + i);
        }

        String report = diagnostics.render("BUILD", 2);

        assertThat(report).startsWith("=== BUILD ===\n");
        assertThat(report).contains("- DROP: 5", "esempio 1", "... (+3 altri)", "Totale: 5");
        assertThat(report).doesNotContain("esempio 2");
    }

    @Test
    @DisplayName("Report vuoto e unione di report")
    void testEmptyAndMerge() {
        Diagnostics first = new Diagnostics();
        assertThat(first.render("VUOTO", 10)).contains("Nessun elemento scartato.");

        Diagnostics second = new Diagnostics();
        second.record("A", "x");
        first.mergeFrom(second);

        assertThat(first.isEmpty()).isFalse();
        assertThat(first.examples("A")).containsExactly("x");
    }

    @Test
    @DisplayName("Motivo vuoto rifiutato")
    void testBlankReason() {
        assertThatThrownBy(() -> new Diagnostics().record(" ", "x")).isInstanceOf(IllegalArgumentException.class);
    }
}
