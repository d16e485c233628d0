package org.fmverify.cnf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * FORMULA CNF DEL FEATURE MODEL - Clausole numeriche con tabella delle variabili
 *
 * INVARIANTI:
 * - una variabile per feature, numerate 1..n sui nomi ordinati (biiezione nome ↔ indice)
 * - ogni clausola ha un'origine leggibile ("root", "edge:c->p", "alternative:p", ...)
 * - clausole e mapping immutabili dopo la costruzione
 *
 * Conserva anche la radice e i figli dei gruppi OPTIONAL, candidati al controllo false-optional.
 */
public class CNFFormula {

    private static final Logger LOGGER = Logger.getLogger(CNFFormula.class.getName());

    //region STRUTTURE DATI CORE

    /**
     * Clausole in formato numerico: positivo = variabile vera, negativo = variabile falsa.
     */
    private final List<List<Integer>> clauses;

    /**
     * Origine di ciascuna clausola, allineata per indice a {@link #clauses}.
     */
    private final List<String> origins;

    /**
     * Mapping nome feature → ID numerico (ordine = ordine degli ID).
     */
    private final Map<String, Integer> variableMapping;

    private final List<String> namesById;
    private final String root;
    private final List<String> optionalChildren;

    //endregion

    CNFFormula(Map<String, Integer> variableMapping, List<List<Integer>> clauses, List<String> origins,
               String root, List<String> optionalChildren) {
        if (clauses.size() != origins.size()) {
            throw new IllegalArgumentException("Clausole e origini non allineate: " + clauses.size() + " vs " + origins.size());
        }
        this.variableMapping = Collections.unmodifiableMap(new LinkedHashMap<>(variableMapping));
        List<List<Integer>> copy = new ArrayList<>(clauses.size());
        for (List<Integer> clause : clauses) {
            copy.add(List.copyOf(clause));
        }
        this.clauses = Collections.unmodifiableList(copy);
        this.origins = List.copyOf(origins);
        this.root = root;
        this.optionalChildren = List.copyOf(optionalChildren);

        List<String> names = new ArrayList<>(variableMapping.size() + 1);
        names.add(null);
        names.addAll(variableMapping.keySet());
        this.namesById = Collections.unmodifiableList(names);

        logStatistics();
    }

    //region INTERFACCIA PUBBLICA

    public List<List<Integer>> getClauses() {
        return clauses;
    }

    public List<Integer> getClause(int index) {
        return clauses.get(index);
    }

    public String getOrigin(int index) {
        return origins.get(index);
    }

    public List<String> getOrigins() {
        return origins;
    }

    public int getVariableCount() {
        return variableMapping.size();
    }

    public int getClausesCount() {
        return clauses.size();
    }

    public Map<String, Integer> getVariableMapping() {
        return variableMapping;
    }

    public Set<String> getVariableNames() {
        return variableMapping.keySet();
    }

    /**
     * @return ID della variabile associata alla feature
     * @throws IllegalArgumentException se la feature non appartiene alla formula
     */
    public int variableOf(String feature) {
        Integer id = variableMapping.get(feature);
        if (id == null) {
            throw new IllegalArgumentException("Feature sconosciuta nella formula: " + feature);
        }
        return id;
    }

    public String nameOf(int variable) {
        int id = Math.abs(variable);
        if (id < 1 || id >= namesById.size()) {
            throw new IllegalArgumentException("Variabile fuori intervallo: " + variable);
        }
        return namesById.get(id);
    }

    public String getRoot() {
        return root;
    }

    public List<String> getOptionalChildren() {
        return optionalChildren;
    }

    /**
     * Rende leggibile una clausola usando i nomi delle feature.
     */
    public String describeClause(int index) {
        StringBuilder sb = new StringBuilder("(");
        List<Integer> clause = clauses.get(index);
        for (int i = 0; i < clause.size(); i++) {
            if (i > 0) sb.append(" | ");
            int literal = clause.get(i);
            sb.append(literal < 0 ? "!" : "").append(nameOf(literal));
        }
        return sb.append(')').toString();
    }

    @Override
    public String toString() {
        return String.format("CNFFormula{clausole=%d, variabili=%d, radice=%s}", clauses.size(), getVariableCount(), root);
    }

    //endregion

    private void logStatistics() {
        if (!LOGGER.isLoggable(Level.FINE)) return;

        int totalLiterals = clauses.stream().mapToInt(List::size).sum();
        double avgClauseLength = clauses.isEmpty() ? 0.0 : (double) totalLiterals / clauses.size();
        long unitClauses = clauses.stream().filter(clause -> clause.size() == 1).count();

        LOGGER.fine(String.format("Formula CNF: %d clausole, %d variabili, %.1f letterali/clausola, %d unitarie",
                clauses.size(), getVariableCount(), avgClauseLength, unitClauses));
    }
}
