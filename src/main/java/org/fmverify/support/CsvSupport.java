package org.fmverify.support;

import java.io.BufferedReader;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Lettura e scrittura di tabelle CSV con separatore virgola e campi tra doppi apici.
 */
public final class CsvSupport {

    private CsvSupport() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Tabella letta da file: intestazione e righe, già separate in campi.
     */
    public record Table(List<String> header, List<List<String>> rows) {

        /**
         * Indice della colonna (confronto case-insensitive, spazi rimossi), -1 se assente.
         */
        public int indexOf(String column) {
            for (int i = 0; i < header.size(); i++) {
                if (header.get(i).trim().equalsIgnoreCase(column)) return i;
            }
            return -1;
        }

        /**
         * Valore di una cella, null se la riga è più corta.
         */
        public static String cell(List<String> row, int index) {
            return index >= 0 && index < row.size() ? row.get(index) : null;
        }
    }

    /**
     * Legge un file CSV. Le righe vuote vengono ignorate; un eventuale BOM iniziale è rimosso.
     *
     * @throws IOException se il file non è leggibile o è privo di intestazione
     */
    public static Table read(Path file) throws IOException {
        List<String> header = null;
        List<List<String>> rows = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) continue;
                if (header == null) {
                    if (line.charAt(0) == '\uFEFF') line = line.substring(1);
                    header = splitLine(line);
                } else {
                    rows.add(splitLine(line));
                }
            }
        }

        if (header == null) {
            throw new IOException("File CSV senza intestazione: " + file);
        }
        return new Table(header, rows);
    }

    /**
     * Divide una riga nei suoi campi rispettando i doppi apici ("" è un apice letterale).
     */
    public static List<String> splitLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }

    /**
     * Racchiude il valore tra apici quando contiene separatori, apici o a capo.
     */
    public static String escape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    /**
     * Scrive una tabella completa sovrascrivendo il file di destinazione.
     */
    public static void write(Path file, List<String> header, List<List<String>> rows) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        try (FileWriter writer = new FileWriter(file.toFile(), StandardCharsets.UTF_8)) {
            writer.write(joinRow(header));
            writer.write("\n");
            for (List<String> row : rows) {
                writer.write(joinRow(row));
                writer.write("\n");
            }
        }
    }

    private static String joinRow(List<String> values) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(escape(values.get(i)));
        }
        return sb.toString();
    }
}
