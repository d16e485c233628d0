package org.fmverify.builder;

import org.fmverify.model.ModelException;

import java.util.List;

/**
 * Colonne obbligatorie assenti nella tabella di input.
 */
public class MissingRequiredFieldException extends ModelException {

    private final List<String> missingColumns;

    public MissingRequiredFieldException(String source, List<String> missingColumns) {
        super("Colonne obbligatorie mancanti" + (source == null ? "" : " (" + source + ")") + ": " + missingColumns);
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
