package org.fmverify.analysis;

/**
 * Nessun backend SAT istanziabile: errore fatale per l'intera esecuzione.
 * Non viene mai sostituito da un esito SAT o UNSAT.
 */
public class SolverUnavailableException extends RuntimeException {

    public SolverUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
