package org.fmverify.model;

/**
 * Radice della gerarchia di eccezioni controllate per errori a livello di modello o file.
 * Ogni sottoclasse è fatale solo per il modello coinvolto: il batch prosegue.
 */
public class ModelException extends Exception {

    public ModelException(String message) {
        super(message);
    }

    public ModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
