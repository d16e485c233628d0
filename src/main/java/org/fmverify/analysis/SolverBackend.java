package org.fmverify.analysis;

import java.util.List;

/**
 * Capacità esterna di decisione SAT.
 *
 * Ogni chiamata a {@link #solve} è un'unità di lavoro indipendente: l'implementazione non
 * deve condividere stato tra chiamate, che possono arrivare in parallelo da più thread.
 */
public interface SolverBackend {

    /**
     * @return nome leggibile del backend
     */
    String name();

    /**
     * Verifica che almeno un solver sia istanziabile.
     *
     * @throws SolverUnavailableException se nessun solver è disponibile
     */
    void checkAvailable();

    /**
     * Decide la soddisfacibilità delle clausole sotto le assunzioni date.
     *
     * @param variableCount numero di variabili (ID 1..n)
     * @param clauses clausole in formato numerico
     * @param assumptions letterali assunti veri per questa sola chiamata
     * @param timeoutMs tempo massimo in millisecondi
     * @return SAT, UNSAT oppure UNKNOWN allo scadere del tempo
     * @throws SolverUnavailableException se il solver non è istanziabile
     */
    SatOutcome solve(int variableCount, List<List<Integer>> clauses, int[] assumptions, long timeoutMs);
}
