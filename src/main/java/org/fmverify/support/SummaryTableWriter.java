package org.fmverify.support;

import org.fmverify.model.FeatureModel;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * TABELLA RIASSUNTIVA - Una riga per file elaborato
 *
 * Colonne: file di ingresso, file di uscita, feature, gruppi, vincoli, errore.
 * Una riga di successo ha l'errore vuoto; una riga di fallimento ha i conteggi vuoti.
 */
public class SummaryTableWriter {

    private final String inputColumn;
    private final String outputColumn;
    private final List<List<String>> rows = new ArrayList<>();

    public SummaryTableWriter(String inputColumn, String outputColumn) {
        this.inputColumn = inputColumn;
        this.outputColumn = outputColumn;
    }

    public void addSuccess(Path input, Path output, FeatureModel model) {
        rows.add(List.of(input.toString(), output.toString(),
                String.valueOf(model.featureCount()),
                String.valueOf(model.groupCount()),
                String.valueOf(model.constraintCount()),
                ""));
    }

    public void addFailure(Path input, Path output, Exception error) {
        rows.add(List.of(input.toString(), output == null ? "" : output.toString(), "", "", "",
                error.getClass().getSimpleName() + ": " + error.getMessage()));
    }

    public int size() {
        return rows.size();
    }

    public List<String> header() {
        return List.of(inputColumn, outputColumn, "features", "groups", "constraints", "error");
    }

    public void write(Path file) throws IOException {
        CsvSupport.write(file, header(), rows);
    }
}
