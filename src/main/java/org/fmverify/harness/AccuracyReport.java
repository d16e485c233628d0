package org.fmverify.harness;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REPORT DI ACCURATEZZA - Aggregazione delle classificazioni del rilevatore
 *
 * TP = coppie OK, FN = coppie DETECTOR_MISS, FP = modelli puliti con difetti segnalati,
 * TN = modelli puliti senza difetti. I fallimenti restano separati e non entrano nelle metriche.
 */
public class AccuracyReport {

    private final Map<DetectionClass, Integer> classCounts = new EnumMap<>(DetectionClass.class);
    private int falsePositives = 0;
    private int trueNegatives = 0;
    private final List<String> failures = new ArrayList<>();

    public AccuracyReport() {
        for (DetectionClass detectionClass : DetectionClass.values()) {
            classCounts.put(detectionClass, 0);
        }
    }

    //region REGISTRAZIONE

    public void addPair(DetectionClass detectionClass) {
        classCounts.merge(detectionClass, 1, Integer::sum);
    }

    /**
     * Registra l'esito del rilevatore su un modello pulito.
     *
     * @param defectsReported true se il rilevatore ha segnalato almeno un difetto
     */
    public void addCleanModel(boolean defectsReported) {
        if (defectsReported) {
            falsePositives++;
        } else {
            trueNegatives++;
        }
    }

    public void addFailure(String description) {
        failures.add(description);
    }

    //endregion

    //region METRICHE

    public int count(DetectionClass detectionClass) {
        return classCounts.get(detectionClass);
    }

    public int truePositives() {
        return count(DetectionClass.OK);
    }

    public int falseNegatives() {
        return count(DetectionClass.DETECTOR_MISS);
    }

    public int falsePositives() {
        return falsePositives;
    }

    public int trueNegatives() {
        return trueNegatives;
    }

    public List<String> getFailures() {
        return List.copyOf(failures);
    }

    public double precision() {
        return ratio(truePositives(), truePositives() + falsePositives);
    }

    public double recall() {
        return ratio(truePositives(), truePositives() + falseNegatives());
    }

    public double accuracy() {
        int total = truePositives() + trueNegatives + falsePositives + falseNegatives();
        return ratio(truePositives() + trueNegatives, total);
    }

    public double f1() {
        double p = precision();
        double r = recall();
        return p + r == 0.0 ? 0.0 : 2 * p * r / (p + r);
    }

    private static double ratio(int numerator, int denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }

    //endregion

    /**
     * Righe (metrica, valore) per la tabella delle metriche.
     */
    public List<List<String>> toRows() {
        List<List<String>> rows = new ArrayList<>();
        for (DetectionClass detectionClass : DetectionClass.values()) {
            rows.add(List.of(detectionClass.name(), String.valueOf(count(detectionClass))));
        }
        rows.add(List.of("TP", String.valueOf(truePositives())));
        rows.add(List.of("FN", String.valueOf(falseNegatives())));
        rows.add(List.of("FP", String.valueOf(falsePositives)));
        rows.add(List.of("TN", String.valueOf(trueNegatives)));
        rows.add(List.of("Precision", format(precision())));
        rows.add(List.of("Recall", format(recall())));
        rows.add(List.of("Accuracy", format(accuracy())));
        rows.add(List.of("F1", format(f1())));
        rows.add(List.of("Failures", String.valueOf(failures.size())));
        return rows;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "TP=%d FN=%d FP=%d TN=%d | precision=%.4f recall=%.4f accuracy=%.4f F1=%.4f | fallimenti=%d",
                truePositives(), falseNegatives(), falsePositives, trueNegatives,
                precision(), recall(), accuracy(), f1(), failures.size());
    }
}
