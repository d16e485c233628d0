package org.fmverify.harness;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * CHIAVI DI MODELLO - Abbinamento euristico tra modelli puliti e iniettati
 *
 * La chiave è il nome del file ridotto alla sua parte identificativa: estensioni,
 * prefissi di versione del generatore ed etichette di stato vengono rimossi,
 * le sequenze di separatori collassate in "_".
 *
 * Funzioni pure: nessun accesso al file system.
 */
public final class ModelKeys {

    /** Estensioni rimosse, la più lunga per prima */
    static final List<String> EXTENSIONS = List.of(".kr.pl", ".pl", ".uvl", ".txt");

    /** Etichette di stato ignorate ovunque compaiano */
    static final Set<String> LABEL_TOKENS = Set.of("clean", "original", "injected", "defective", "mutated", "scientific");

    private static final Pattern VERSION_TOKEN = Pattern.compile("v\\d+");
    private static final Pattern SEPARATORS = Pattern.compile("[_\\-. ]+");

    private ModelKeys() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region DERIVAZIONE CHIAVE

    /**
     * Deriva la chiave di abbinamento da un nome di file.
     *
     * Esempi: "scientific_v5_Model-A_injected.uvl" e "model_a.uvl" producono entrambi "model_a";
     * "clean.uvl" e "clean_injected.uvl" producono entrambi "clean".
     *
     * @param fileName nome del file (eventuali directory vengono ignorate)
     * @return chiave normalizzata, mai vuota per un nome non vuoto
     */
    public static String deriveKey(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("Nome file non può essere null o vuoto");
        }

        String name = Path.of(fileName.trim()).getFileName().toString().toLowerCase(Locale.ROOT);
        name = stripExtensions(name);

        String[] tokens = SEPARATORS.split(name);
        List<String> kept = new ArrayList<>();
        String firstLabel = null;
        for (String token : tokens) {
            if (token.isEmpty()) {
                continue;
            }
            if (LABEL_TOKENS.contains(token)) {
                if (firstLabel == null) firstLabel = token;
                continue;
            }
            // Versione del generatore: solo in testa, prima del nome vero e proprio
            if (kept.isEmpty() && VERSION_TOKEN.matcher(token).matches()) {
                continue;
            }
            kept.add(token);
        }

        if (kept.isEmpty()) {
            // Nome composto solo da etichette: vale la prima, così "clean" e "clean_injected" si abbinano
            if (firstLabel != null) {
                return firstLabel;
            }
            return trimSeparators(SEPARATORS.matcher(name).replaceAll("_"));
        }
        return String.join("_", kept);
    }

    public static String deriveKey(Path file) {
        return deriveKey(file.getFileName().toString());
    }

    private static String stripExtensions(String name) {
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (String extension : EXTENSIONS) {
                if (name.endsWith(extension) && name.length() > extension.length()) {
                    name = name.substring(0, name.length() - extension.length());
                    stripped = true;
                    break;
                }
            }
        }
        return name;
    }

    private static String trimSeparators(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '_') start++;
        while (end > start && value.charAt(end - 1) == '_') end--;
        return value.substring(start, end);
    }

    //endregion

    //region ABBINAMENTO

    /**
     * Coppia (pulito, iniettato) con la stessa chiave.
     */
    public record ModelPair(String key, Path cleanFile, Path injectedFile) {}

    /**
     * Esito dell'abbinamento. Le chiavi ambigue (più file per lato) non vengono mai
     * risolte arbitrariamente: finiscono in {@code ambiguousKeys}.
     */
    public record PairingResult(List<ModelPair> pairs,
                                List<Path> unmatchedClean,
                                List<Path> unmatchedInjected,
                                Map<String, List<Path>> ambiguousKeys) {

        public boolean hasIssues() {
            return !unmatchedClean.isEmpty() || !unmatchedInjected.isEmpty() || !ambiguousKeys.isEmpty();
        }
    }

    /**
     * Abbina i file puliti a quelli iniettati per chiave.
     */
    public static PairingResult pair(List<Path> cleanFiles, List<Path> injectedFiles) {
        Map<String, List<Path>> cleanByKey = groupByKey(cleanFiles);
        Map<String, List<Path>> injectedByKey = groupByKey(injectedFiles);

        List<ModelPair> pairs = new ArrayList<>();
        List<Path> unmatchedClean = new ArrayList<>();
        List<Path> unmatchedInjected = new ArrayList<>();
        Map<String, List<Path>> ambiguous = new TreeMap<>();

        for (Map.Entry<String, List<Path>> entry : cleanByKey.entrySet()) {
            String key = entry.getKey();
            List<Path> clean = entry.getValue();
            List<Path> injected = injectedByKey.getOrDefault(key, List.of());

            if (clean.size() > 1 || injected.size() > 1) {
                List<Path> all = new ArrayList<>(clean);
                all.addAll(injected);
                ambiguous.put(key, List.copyOf(all));
            } else if (injected.isEmpty()) {
                unmatchedClean.add(clean.get(0));
            } else {
                pairs.add(new ModelPair(key, clean.get(0), injected.get(0)));
            }
        }

        for (Map.Entry<String, List<Path>> entry : injectedByKey.entrySet()) {
            if (cleanByKey.containsKey(entry.getKey())) {
                continue;
            }
            if (entry.getValue().size() > 1) {
                ambiguous.put(entry.getKey(), List.copyOf(entry.getValue()));
            } else {
                unmatchedInjected.add(entry.getValue().get(0));
            }
        }

        return new PairingResult(List.copyOf(pairs), List.copyOf(unmatchedClean),
                List.copyOf(unmatchedInjected), ambiguous);
    }

    private static Map<String, List<Path>> groupByKey(List<Path> files) {
        Map<String, List<Path>> byKey = new TreeMap<>();
        for (Path file : files) {
            byKey.computeIfAbsent(deriveKey(file), k -> new ArrayList<>()).add(file);
        }
        return byKey;
    }

    //endregion
}
