package org.fmverify.analysis;

import org.fmverify.io.ModelParseException;

/**
 * Nessuna radice determinabile: manca quella canonica, non esiste una radice strutturale
 * e il chiamante non ha fornito una radice esplicita di ripiego.
 */
public class RootResolutionException extends ModelParseException {

    public RootResolutionException(String message) {
        super(message);
    }
}
