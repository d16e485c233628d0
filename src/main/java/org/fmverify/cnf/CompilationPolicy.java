package org.fmverify.cnf;

/**
 * Politica di compilazione dei vincoli diversi dall'implicazione.
 */
public enum CompilationPolicy {

    /** Solo struttura e implicazioni: equivalenze e vincoli unitari restano documentali */
    IMPLICATIONS_ONLY,

    /** Equivalenze e vincoli unitari compilati in clausole */
    FULL
}
