package org.fmverify.support;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Ricerca dei file di modello e gestione delle estensioni composte (.kr.pl).
 */
public final class ModelFiles {

    public static final String HIERARCHICAL_EXTENSION = ".uvl";
    public static final String FACT_EXTENSION = ".kr.pl";
    public static final String CSV_EXTENSION = ".csv";

    private ModelFiles() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Trova ricorsivamente i file con una delle estensioni indicate, ordinati per percorso.
     */
    public static List<Path> findRecursive(Path dir, String... extensions) throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> hasExtension(p, extensions))
                    .sorted(Comparator.comparing(Path::toString))
                    .toList();
        }
    }

    /**
     * Trova i file con estensione indicata nella sola directory, ordinati per nome.
     */
    public static List<Path> findFlat(Path dir, String extension) throws IOException {
        try (Stream<Path> list = Files.list(dir)) {
            return list.filter(Files::isRegularFile)
                    .filter(p -> hasExtension(p, extension))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        }
    }

    public static boolean hasExtension(Path file, String... extensions) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (name.endsWith(extension)) return true;
        }
        return false;
    }

    public static boolean isFactFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(FACT_EXTENSION) || name.endsWith(".pl");
    }

    /**
     * Nome del file senza estensione; ".kr.pl" è trattata come estensione unica.
     */
    public static String stem(Path file) {
        String name = file.getFileName().toString();
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(FACT_EXTENSION)) {
            return name.substring(0, name.length() - FACT_EXTENSION.length());
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
