package org.fmverify.analysis;

import org.fmverify.cnf.CompilationPolicy;

/**
 * OPZIONI DI ANALISI - Value object immutabile per il {@link DefectAnalyzer}
 *
 * Le modifiche producono una nuova istanza tramite i metodi with*.
 */
public final class AnalysisOptions {

    //region COSTANTI DI DEFAULT

    public static final long DEFAULT_TIMEOUT_MS = 10_000L;
    public static final int DEFAULT_MAX_REDUNDANCY_CLAUSES = 2000;

    //endregion

    private final long timeoutMs;
    private final int threads;
    private final CompilationPolicy policy;
    private final boolean redundancyCheck;
    private final int maxRedundancyClauses;

    private AnalysisOptions(long timeoutMs, int threads, CompilationPolicy policy,
                            boolean redundancyCheck, int maxRedundancyClauses) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("Timeout deve essere positivo: " + timeoutMs);
        }
        if (threads <= 0) {
            throw new IllegalArgumentException("Numero di thread deve essere positivo: " + threads);
        }
        if (maxRedundancyClauses < 0) {
            throw new IllegalArgumentException("Limite clausole non può essere negativo: " + maxRedundancyClauses);
        }
        if (policy == null) {
            throw new IllegalArgumentException("Politica di compilazione non può essere null");
        }
        this.timeoutMs = timeoutMs;
        this.threads = threads;
        this.policy = policy;
        this.redundancyCheck = redundancyCheck;
        this.maxRedundancyClauses = maxRedundancyClauses;
    }

    /**
     * Opzioni di riferimento: timeout 10 s, un thread per processore, solo implicazioni,
     * controllo ridondanza disattivato.
     */
    public static AnalysisOptions defaults() {
        return new AnalysisOptions(DEFAULT_TIMEOUT_MS, Runtime.getRuntime().availableProcessors(),
                CompilationPolicy.IMPLICATIONS_ONLY, false, DEFAULT_MAX_REDUNDANCY_CLAUSES);
    }

    public AnalysisOptions withTimeoutMs(long value) {
        return new AnalysisOptions(value, threads, policy, redundancyCheck, maxRedundancyClauses);
    }

    public AnalysisOptions withThreads(int value) {
        return new AnalysisOptions(timeoutMs, value, policy, redundancyCheck, maxRedundancyClauses);
    }

    public AnalysisOptions withPolicy(CompilationPolicy value) {
        return new AnalysisOptions(timeoutMs, threads, value, redundancyCheck, maxRedundancyClauses);
    }

    public AnalysisOptions withRedundancyCheck(boolean value) {
        return new AnalysisOptions(timeoutMs, threads, policy, value, maxRedundancyClauses);
    }

    public AnalysisOptions withMaxRedundancyClauses(int value) {
        return new AnalysisOptions(timeoutMs, threads, policy, redundancyCheck, value);
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public int getThreads() {
        return threads;
    }

    public CompilationPolicy getPolicy() {
        return policy;
    }

    public boolean isRedundancyCheck() {
        return redundancyCheck;
    }

    public int getMaxRedundancyClauses() {
        return maxRedundancyClauses;
    }

    @Override
    public String toString() {
        return String.format("AnalysisOptions[timeout=%dms, thread=%d, policy=%s, ridondanza=%s, maxClausole=%d]",
                timeoutMs, threads, policy, redundancyCheck, maxRedundancyClauses);
    }
}
