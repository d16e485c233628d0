package org.fmverify.harness;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AccuracyReportTest {

    @Test
    @DisplayName("Metriche da TP, FN, FP e TN")
    void testMetrics() {
        AccuracyReport report = new AccuracyReport();
        report.addPair(DetectionClass.OK);
        report.addPair(DetectionClass.OK);
        report.addPair(DetectionClass.OK);
        report.addPair(DetectionClass.DETECTOR_MISS);
        report.addPair(DetectionClass.MISSING_INJECTION);
        report.addCleanModel(true);
        report.addCleanModel(false);
        report.addCleanModel(false);
        report.addFailure("UNMATCHED_CLEAN:x.uvl");

        assertThat(report.truePositives()).isEqualTo(3);
        assertThat(report.falseNegatives()).isEqualTo(1);
        assertThat(report.falsePositives()).isEqualTo(1);
        assertThat(report.trueNegatives()).isEqualTo(2);
        assertThat(report.count(DetectionClass.MISSING_INJECTION)).isEqualTo(1);
        assertThat(report.precision()).isEqualTo(0.75);
        assertThat(report.recall()).isEqualTo(0.75);
        assertThat(report.accuracy()).isCloseTo(5.0 / 7.0, within(1e-9));
        assertThat(report.f1()).isCloseTo(0.75, within(1e-9));
        assertThat(report.getFailures()).containsExactly("UNMATCHED_CLEAN:x.uvl");
    }

    @Test
    @DisplayName("Report vuoto: metriche a zero senza divisioni per zero")
    void testEmptyReport() {
        AccuracyReport report = new AccuracyReport();

        assertThat(report.precision()).isZero();
        assertThat(report.recall()).isZero();
        assertThat(report.accuracy()).isZero();
        assertThat(report.f1()).isZero();
    }

    @Test
    @DisplayName("Righe della tabella delle metriche")
    void testRows() {
        AccuracyReport report = new AccuracyReport();
        report.addPair(DetectionClass.OK);
        report.addCleanModel(false);

        List<List<String>> rows = report.toRows();

        assertThat(rows.get(0)).containsExactly("MISSING_INJECTION", "0");
        assertThat(rows).contains(List.of("OK", "1"), List.of("TN", "1"),
                List.of("Precision", "1.0000"), List.of("Accuracy", "1.0000"));
        assertThat(rows.get(rows.size() - 1)).containsExactly("Failures", "0");
    }
}
