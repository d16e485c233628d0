package org.fmverify.model;

/**
 * Riferimento a una feature inesistente, padre mancante o struttura dei gruppi incoerente
 * durante la costruzione programmatica di un {@link FeatureModel}.
 */
public class ModelReferenceException extends ModelException {

    public ModelReferenceException(String message) {
        super(message);
    }
}
