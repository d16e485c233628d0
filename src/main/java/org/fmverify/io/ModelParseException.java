package org.fmverify.io;

import org.fmverify.model.ModelException;

/**
 * Errore di parsing di un file di modello: fatale per il file, il batch prosegue.
 */
public class ModelParseException extends ModelException {

    private final int lineNumber;

    public ModelParseException(String message) {
        super(message);
        this.lineNumber = -1;
    }

    public ModelParseException(String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = -1;
    }

    /**
     * @param lineNumber numero di riga (1-based) in cui è stato rilevato l'errore
     */
    public ModelParseException(int lineNumber, String message) {
        super("Riga " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    /**
     * @return numero di riga dell'errore, -1 se non associato a una riga
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
