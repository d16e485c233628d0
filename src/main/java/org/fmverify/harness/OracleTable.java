package org.fmverify.harness;

import org.fmverify.support.CsvSupport;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persistenza dell'oracolo come tabella CSV piatta, una riga per modello iniettato.
 */
public final class OracleTable {

    public static final String FILE_NAME = "oracle.csv";

    public static final String COL_FILE_NAME = "File_Name";
    public static final String COL_SOURCE_FILE = "Source_File";
    public static final String COL_DEAD = "DF1_DeadFeature";
    public static final String COL_FALSE_OPTIONAL = "FO_FalseOptional";
    public static final String COL_REDUNDANT = "RE_Redundancy";

    public static final List<String> HEADER = List.of(COL_FILE_NAME, COL_SOURCE_FILE, COL_DEAD, COL_FALSE_OPTIONAL, COL_REDUNDANT);

    private OracleTable() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static void write(Path file, List<OracleRecord> records) throws IOException {
        List<List<String>> rows = new ArrayList<>(records.size());
        for (OracleRecord record : records) {
            rows.add(List.of(record.fileName(), record.sourceFile(), record.deadFeature(),
                    record.falseOptionalFeature(), record.redundantFeature()));
        }
        CsvSupport.write(file, HEADER, rows);
    }

    /**
     * @throws IOException se il file non è leggibile o manca una colonna
     */
    public static List<OracleRecord> read(Path file) throws IOException {
        CsvSupport.Table table = CsvSupport.read(file);
        int[] indexes = new int[HEADER.size()];
        for (int i = 0; i < HEADER.size(); i++) {
            indexes[i] = table.indexOf(HEADER.get(i));
            if (indexes[i] < 0) {
                throw new IOException("Colonna mancante nell'oracolo " + file.getFileName() + ": " + HEADER.get(i));
            }
        }

        List<OracleRecord> records = new ArrayList<>();
        for (List<String> row : table.rows()) {
            records.add(new OracleRecord(
                    CsvSupport.Table.cell(row, indexes[0]),
                    CsvSupport.Table.cell(row, indexes[1]),
                    CsvSupport.Table.cell(row, indexes[2]),
                    CsvSupport.Table.cell(row, indexes[3]),
                    CsvSupport.Table.cell(row, indexes[4])));
        }
        return records;
    }

    /**
     * Cerca il record del file iniettato, per nome esatto o per chiave di modello.
     */
    public static Optional<OracleRecord> find(List<OracleRecord> records, Path injectedFile) {
        String name = injectedFile.getFileName().toString();
        for (OracleRecord record : records) {
            if (name.equals(record.fileName())) {
                return Optional.of(record);
            }
        }
        String key = ModelKeys.deriveKey(name);
        return records.stream()
                .filter(r -> r.fileName() != null && !r.fileName().isBlank())
                .filter(r -> key.equals(ModelKeys.deriveKey(r.fileName())))
                .findFirst();
    }
}
