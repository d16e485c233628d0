package org.fmverify.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * RISULTATO DI ANALISI - Esito immutabile dell'analisi dei difetti di un modello
 *
 * COMPONENTI:
 * • Stato: CONSISTENT, VOID (nessuna configurazione valida) o UNKNOWN (check di vuotezza in timeout)
 * • Difetti: feature morte, false-optional, clausole ridondanti (null se controllo non eseguito)
 * • Feature indeterminate: query per-feature concluse in timeout
 * • Nota sulla radice, quando non è quella canonica
 */
public class AnalysisResult {

    /**
     * Stato complessivo del modello analizzato.
     */
    public enum Status {
        CONSISTENT,
        VOID,
        UNKNOWN
    }

    //region ATTRIBUTI

    private final Status status;
    private final String root;
    private final String rootNote;
    private final int featureCount;
    private final int clauseCount;
    private final List<String> deadFeatures;
    private final List<String> falseOptionalFeatures;
    private final List<String> undeterminedFeatures;

    /**
     * Origini delle clausole ridondanti; null quando il controllo è disattivato o saltato.
     */
    private final List<String> redundantClauses;
    private final String redundancyNote;
    private final AnalysisStatistics statistics;

    //endregion

    AnalysisResult(Status status, String root, String rootNote, int featureCount, int clauseCount,
                   List<String> deadFeatures, List<String> falseOptionalFeatures, List<String> undeterminedFeatures,
                   List<String> redundantClauses, String redundancyNote, AnalysisStatistics statistics) {
        if (status == Status.VOID && (!deadFeatures.isEmpty() || !falseOptionalFeatures.isEmpty())) {
            throw new IllegalArgumentException("Un modello VOID non riporta difetti per-feature");
        }
        this.status = status;
        this.root = root;
        this.rootNote = rootNote;
        this.featureCount = featureCount;
        this.clauseCount = clauseCount;
        this.deadFeatures = List.copyOf(deadFeatures);
        this.falseOptionalFeatures = List.copyOf(falseOptionalFeatures);
        this.undeterminedFeatures = List.copyOf(undeterminedFeatures);
        this.redundantClauses = redundantClauses == null ? null : List.copyOf(redundantClauses);
        this.redundancyNote = redundancyNote;
        this.statistics = statistics;
    }

    //region ACCESSO

    public Status getStatus() {
        return status;
    }

    public boolean isVoid() {
        return status == Status.VOID;
    }

    public String getRoot() {
        return root;
    }

    public String getRootNote() {
        return rootNote;
    }

    public int getFeatureCount() {
        return featureCount;
    }

    public int getClauseCount() {
        return clauseCount;
    }

    public List<String> getDeadFeatures() {
        return deadFeatures;
    }

    public List<String> getFalseOptionalFeatures() {
        return falseOptionalFeatures;
    }

    public List<String> getUndeterminedFeatures() {
        return undeterminedFeatures;
    }

    public List<String> getRedundantClauses() {
        return redundantClauses;
    }

    public String getRedundancyNote() {
        return redundancyNote;
    }

    public AnalysisStatistics getStatistics() {
        return statistics;
    }

    //endregion

    //region RENDERING DIFETTI

    /**
     * Etichette dei difetti: VOID_MODEL oppure DF:x, FO:x e RE_CLAUSES:n (solo se il controllo è stato eseguito).
     */
    public List<String> defectLabels() {
        List<String> labels = new ArrayList<>();
        if (status == Status.VOID) {
            labels.add("VOID_MODEL");
            return labels;
        }
        deadFeatures.forEach(f -> labels.add("DF:" + f));
        falseOptionalFeatures.forEach(f -> labels.add("FO:" + f));
        if (redundantClauses != null) {
            labels.add("RE_CLAUSES:" + redundantClauses.size());
        }
        return labels;
    }

    /**
     * Vero se il rilevatore segnala almeno un difetto. Le note diagnostiche non contano.
     */
    public boolean hasDefects() {
        return status == Status.VOID
                || !deadFeatures.isEmpty()
                || !falseOptionalFeatures.isEmpty()
                || (redundantClauses != null && !redundantClauses.isEmpty());
    }

    /**
     * Colonna Defects del report: etichette e nota radice separate da "; ", "None" se vuota.
     */
    public String defectsText() {
        List<String> parts = defectLabels();
        if (rootNote != null) {
            parts.add(rootNote);
        }
        return parts.isEmpty() ? "None" : String.join("; ", parts);
    }

    /**
     * Esito SAT sintetico per il report: SAT, UNSAT o UNKNOWN.
     */
    public String satLabel() {
        return switch (status) {
            case CONSISTENT -> "SAT";
            case VOID -> "UNSAT";
            case UNKNOWN -> "UNKNOWN";
        };
    }

    //endregion

    @Override
    public String toString() {
        return String.format("AnalysisResult[%s, radice=%s, NF=%d, clausole=%d, morte=%d, falseOptional=%d, indeterminate=%d]",
                status, root, featureCount, clauseCount, deadFeatures.size(),
                falseOptionalFeatures.size(), undeterminedFeatures.size());
    }
}
