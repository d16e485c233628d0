package org.fmverify.harness;

import org.fmverify.analysis.AnalysisResult;
import org.fmverify.analysis.RootResolver;
import org.fmverify.model.Constraint;
import org.fmverify.model.FeatureModel;
import org.fmverify.model.Literal;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * CONFRONTO PULITO/INIETTATO - Classificazione dell'accuratezza del rilevatore
 *
 * NewFacts = implicazioni iniettate − pulite, RemovedFacts = pulite − iniettate.
 * Le aspettative derivano dai NewFacts con lhs = radice: rhs negativo → feature morta attesa,
 * rhs positivo → false-optional atteso, qualunque sia il gruppo del bersaglio. Un bersaglio che non
 * è figlio di un gruppo OPTIONAL non può essere segnalato come false-optional e porta a DETECTOR_MISS.
 *
 * Se il modello iniettato è VOID le aspettative per-feature non si applicano.
 */
public class InjectionComparator {

    private static final Logger LOGGER = Logger.getLogger(InjectionComparator.class.getName());

    /**
     * Confronta una coppia e ne assegna la classe.
     *
     * @param clean modello pulito
     * @param injected modello iniettato
     * @param injectedResult analisi del modello iniettato
     * @param oracle record dell'oracolo, null se assente
     */
    public ComparisonResult compare(FeatureModel clean, FeatureModel injected, AnalysisResult injectedResult,
                                    OracleRecord oracle) {
        Set<Constraint> cleanFacts = new LinkedHashSet<>(clean.getImplications());
        Set<Constraint> injectedFacts = new LinkedHashSet<>(injected.getImplications());

        Set<Constraint> newFacts = new LinkedHashSet<>(injectedFacts);
        newFacts.removeAll(cleanFacts);
        Set<Constraint> removedFacts = new LinkedHashSet<>(cleanFacts);
        removedFacts.removeAll(injectedFacts);

        String root = RootResolver.resolve(injected).root();
        Set<String> expectedDead = new TreeSet<>();
        Set<String> expectedFalseOptional = new TreeSet<>();
        for (Constraint fact : newFacts) {
            Literal lhs = fact.getLhs();
            Literal rhs = fact.getRhs();
            if (!lhs.isPositive() || !lhs.getFeature().equals(root)) {
                continue;
            }
            if (rhs.isPositive()) {
                expectedFalseOptional.add(rhs.getFeature());
            } else {
                expectedDead.add(rhs.getFeature());
            }
        }

        List<String> missed = new ArrayList<>();
        if (!injectedResult.isVoid()) {
            expectedDead.stream()
                    .filter(f -> !injectedResult.getDeadFeatures().contains(f))
                    .forEach(f -> missed.add("DF:" + f));
            expectedFalseOptional.stream()
                    .filter(f -> !injectedResult.getFalseOptionalFeatures().contains(f))
                    .forEach(f -> missed.add("FO:" + f));
        }

        DetectionClass detectionClass = classify(newFacts, injected, injectedResult, missed);
        Boolean oracleConsistent = oracle == null ? null : checkOracle(oracle, injected, injectedResult);

        LOGGER.fine("Confronto " + injected.getNamespace() + ": " + detectionClass
                + " (nuovi=" + newFacts.size() + ", rimossi=" + removedFacts.size() + ")");

        return new ComparisonResult(detectionClass, newFacts, removedFacts, expectedDead,
                expectedFalseOptional, missed, oracleConsistent);
    }

    private static DetectionClass classify(Set<Constraint> newFacts, FeatureModel injected,
                                           AnalysisResult injectedResult, List<String> missed) {
        if (newFacts.isEmpty()) {
            return DetectionClass.MISSING_INJECTION;
        }
        for (Constraint fact : newFacts) {
            if (!injected.hasFeature(fact.getRhs().getFeature())) {
                return DetectionClass.INVALID_TARGET;
            }
        }
        if (!injectedResult.hasDefects() || !missed.isEmpty()) {
            return DetectionClass.DETECTOR_MISS;
        }
        return DetectionClass.OK;
    }

    /**
     * L'oracolo è coerente quando le sue feature esistono e le rilevazioni attese sono presenti
     * (un modello VOID le copre tutte).
     */
    private static boolean checkOracle(OracleRecord oracle, FeatureModel injected, AnalysisResult result) {
        if (!injected.hasFeature(oracle.deadFeature())
                || !injected.hasFeature(oracle.falseOptionalFeature())
                || !injected.hasFeature(oracle.redundantFeature())) {
            return false;
        }
        if (result.isVoid()) {
            return true;
        }
        boolean deadOk = result.getDeadFeatures().contains(oracle.deadFeature());
        boolean falseOptionalOk = result.getFalseOptionalFeatures().contains(oracle.falseOptionalFeature());
        return deadOk && falseOptionalOk;
    }
}
