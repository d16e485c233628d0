package org.fmverify.harness;

/**
 * Classificazione di una coppia (pulito, iniettato), valutata in quest'ordine.
 */
public enum DetectionClass {

    /** Nessun fatto di implicazione nuovo nel modello iniettato */
    MISSING_INJECTION,

    /** Un fatto nuovo punta a una feature assente dal modello iniettato */
    INVALID_TARGET,

    /** Il rilevatore non segnala difetti, o manca una rilevazione attesa */
    DETECTOR_MISS,

    OK
}
