package org.fmverify.harness;

import org.fmverify.model.Constraint;

import java.util.List;
import java.util.Set;

/**
 * Esito del confronto di una coppia.
 *
 * @param detectionClass classe assegnata
 * @param newFacts implicazioni presenti solo nel modello iniettato
 * @param removedFacts implicazioni presenti solo nel modello pulito
 * @param expectedDead feature che l'iniezione rende morte
 * @param expectedFalseOptional bersagli di {@code root => f} attesi come false-optional
 * @param missed rilevazioni attese ma assenti, come etichette DF:x / FO:x
 * @param oracleConsistent esito del controllo incrociato con l'oracolo, null senza record
 */
public record ComparisonResult(DetectionClass detectionClass,
                               Set<Constraint> newFacts,
                               Set<Constraint> removedFacts,
                               Set<String> expectedDead,
                               Set<String> expectedFalseOptional,
                               List<String> missed,
                               Boolean oracleConsistent) {

    public boolean isOk() {
        return detectionClass == DetectionClass.OK;
    }
}
