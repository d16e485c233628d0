package org.fmverify.analysis;

/**
 * STATISTICHE DI ANALISI - Contatori delle interrogazioni SAT di un modello
 *
 * Il timer parte alla creazione e si ferma una sola volta con {@link #stopTimer()}.
 */
public class AnalysisStatistics {

    //region CONTATORI

    private int queries = 0;
    private int satCount = 0;
    private int unsatCount = 0;
    private int unknownCount = 0;

    //endregion

    //region TIMING

    private final long startTime;
    private long elapsedMs = 0;
    private boolean timerStopped = false;

    //endregion

    public AnalysisStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Registra l'esito di una interrogazione.
     */
    public synchronized void record(SatOutcome outcome) {
        queries++;
        switch (outcome) {
            case SAT -> satCount++;
            case UNSAT -> unsatCount++;
            case UNKNOWN -> unknownCount++;
        }
    }

    public synchronized void stopTimer() {
        if (!timerStopped) {
            elapsedMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    public synchronized int getQueries() {
        return queries;
    }

    public synchronized int getSatCount() {
        return satCount;
    }

    public synchronized int getUnsatCount() {
        return unsatCount;
    }

    public synchronized int getUnknownCount() {
        return unknownCount;
    }

    /**
     * @return millisecondi trascorsi, anche se il timer è ancora attivo
     */
    public synchronized long getElapsedMs() {
        return timerStopped ? elapsedMs : System.currentTimeMillis() - startTime;
    }

    @Override
    public synchronized String toString() {
        return String.format("Query: %d (SAT %d, UNSAT %d, UNKNOWN %d) in %d ms",
                queries, satCount, unsatCount, unknownCount, getElapsedMs());
    }
}
