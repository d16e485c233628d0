package org.fmverify.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REPORT DIAGNOSTICO - Raccolta ordinata di condizioni recuperabili
 *
 * Accumula, per ciascun motivo (es. SKIP_ITEM_NO_VALID_ANSWERS, REFERENCE_ERROR),
 * gli esempi concreti che lo hanno causato. Usato da builder, parser e harness per
 * registrare tutto ciò che viene scartato senza interrompere l'elaborazione.
 *
 * Il rendering testuale limita gli esempi stampati per motivo, mentre i conteggi
 * restano sempre completi.
 */
public class Diagnostics {

    /** Numero massimo di esempi stampati per motivo nel report testuale */
    public static final int DEFAULT_MAX_EXAMPLES = 20;

    /** Motivo -> esempi, in ordine di prima registrazione */
    private final Map<String, List<String>> entries = new LinkedHashMap<>();

    /**
     * Registra un'occorrenza del motivo indicato.
     *
     * @param reason codice del motivo (non null)
     * @param example descrizione concreta dell'elemento scartato
     */
    public void record(String reason, String example) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Motivo diagnostico non può essere null o vuoto");
        }
        entries.computeIfAbsent(reason, k -> new ArrayList<>()).add(example);
    }

    /**
     * Accoda tutte le voci di un altro report mantenendo l'ordine.
     */
    public void mergeFrom(Diagnostics other) {
        for (Map.Entry<String, List<String>> entry : other.entries.entrySet()) {
            for (String example : entry.getValue()) {
                record(entry.getKey(), example);
            }
        }
    }

    public int count(String reason) {
        List<String> examples = entries.get(reason);
        return examples == null ? 0 : examples.size();
    }

    public int total() {
        return entries.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Set<String> reasons() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public List<String> examples(String reason) {
        List<String> examples = entries.get(reason);
        return examples == null ? List.of() : Collections.unmodifiableList(examples);
    }

    /**
     * Riassunto compatto su una riga: "MOTIVO=n; MOTIVO=n".
     */
    public String summaryLine() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, List<String>> entry : entries.entrySet()) {
            if (sb.length() > 0) sb.append("; ");
            sb.append(entry.getKey()).append('=').append(entry.getValue().size());
        }
        return sb.toString();
    }

    /**
     * Genera il report testuale con al più maxExamples esempi per motivo.
     *
     * @param title intestazione del report
     * @param maxExamples limite esempi stampati per motivo
     * @return report multilinea
     */
    public String render(String title, int maxExamples) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== ").append(title).append(" ===\n");

        if (entries.isEmpty()) {
            sb.append("Nessun elemento scartato.\n");
            return sb.toString();
        }

        for (Map.Entry<String, List<String>> entry : entries.entrySet()) {
            List<String> examples = entry.getValue();
            sb.append("- ").append(entry.getKey()).append(": ").append(examples.size()).append('\n');
            examples.stream().limit(maxExamples).forEach(ex -> sb.append("  • ").append(ex).append('\n'));
            if (examples.size() > maxExamples) {
                sb.append("  ... (+").append(examples.size() - maxExamples).append(" altri)\n");
            }
        }
        sb.append("Totale: ").append(total()).append('\n');
        return sb.toString();
    }

    @Override
    public String toString() {
        return render("DIAGNOSTICA", DEFAULT_MAX_EXAMPLES);
    }
}
