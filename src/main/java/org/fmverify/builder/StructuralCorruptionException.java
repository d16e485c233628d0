package org.fmverify.builder;

import org.fmverify.model.ModelException;

/**
 * Mappatura item key / nome feature dell'item non univoca: dati corrotti.
 * Fatale per la costruzione del modello, mai riparata automaticamente.
 */
public class StructuralCorruptionException extends ModelException {

    public StructuralCorruptionException(String message) {
        super(message);
    }
}
