package org.fmverify.analysis;

/**
 * Esito di una singola interrogazione SAT. UNKNOWN (timeout) non coincide mai con SAT o UNSAT.
 */
public enum SatOutcome {
    SAT,
    UNSAT,
    UNKNOWN
}
