package org.fmverify.analysis;

import org.fmverify.cnf.CNFEncoder;
import org.fmverify.cnf.CNFFormula;
import org.fmverify.model.FeatureModel;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ANALIZZATORE DI DIFETTI - Controlli SAT su un feature model
 *
 * PIPELINE:
 * 1. risoluzione radice e codifica CNF
 * 2. check di vuotezza (nessuna assunzione): UNSAT → VOID, UNKNOWN → UNKNOWN, fine
 * 3. feature morte: per ogni feature, assunzione f; UNSAT → morta
 * 4. false-optional: per ogni figlio di gruppo OPTIONAL, assunzione ¬f; UNSAT → false-optional
 * 5. clausole ridondanti (opzionale, entro un limite di clausole)
 *
 * Ogni query è un'unità indipendente eseguita sul pool di thread con timeout limitato.
 * Un timeout produce UNKNOWN e la feature finisce tra le indeterminate.
 */
public class DefectAnalyzer implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(DefectAnalyzer.class.getName());

    /** Margine concesso al pool oltre il timeout interno del solver */
    private static final long GRACE_MS = 1_000L;

    private final SolverBackend backend;
    private final AnalysisOptions options;
    private final CNFEncoder encoder;
    private final ExecutorService executor;

    public DefectAnalyzer(SolverBackend backend, AnalysisOptions options) {
        if (backend == null) {
            throw new IllegalArgumentException("Backend SAT non può essere null");
        }
        if (options == null) {
            throw new IllegalArgumentException("Opzioni di analisi non possono essere null");
        }
        this.backend = backend;
        this.options = options;
        this.encoder = new CNFEncoder(options.getPolicy());
        this.executor = Executors.newFixedThreadPool(options.getThreads());
    }

    public AnalysisOptions getOptions() {
        return options;
    }

    //region INTERFACCIA PUBBLICA

    public AnalysisResult analyze(FeatureModel model) {
        return analyze(model, null);
    }

    /**
     * Analizza il modello.
     *
     * @param model modello validato
     * @param parserRootNote nota sulla radice prodotta dal parser, null se assente
     * @return risultato dell'analisi
     * @throws SolverUnavailableException se il backend non è istanziabile
     */
    public AnalysisResult analyze(FeatureModel model, String parserRootNote) {
        RootResolver.Resolution resolution = RootResolver.resolve(model);
        String rootNote = parserRootNote != null ? parserRootNote : resolution.note();
        String root = resolution.root();

        CNFFormula formula = encoder.encode(model, root);
        AnalysisStatistics statistics = new AnalysisStatistics();
        LOGGER.fine("Analisi di " + model.getNamespace() + ": " + formula.getVariableCount()
                + " variabili, " + formula.getClausesCount() + " clausole");

        // FASE 1: check di vuotezza
        SatOutcome voidOutcome = runQueries(formula, List.of(new Query("void", null, new int[0])), statistics).get(0);
        if (voidOutcome != SatOutcome.SAT) {
            statistics.stopTimer();
            AnalysisResult.Status status = voidOutcome == SatOutcome.UNSAT
                    ? AnalysisResult.Status.VOID
                    : AnalysisResult.Status.UNKNOWN;
            LOGGER.info("Modello " + model.getNamespace() + ": " + status);
            return new AnalysisResult(status, root, rootNote, formula.getVariableCount(), formula.getClausesCount(),
                    List.of(), List.of(), List.of(), null, null, statistics);
        }

        List<String> undetermined = new ArrayList<>();

        // FASE 2: feature morte
        List<String> features = new ArrayList<>(formula.getVariableNames());
        List<Query> deadQueries = features.stream()
                .map(f -> new Query("dead:" + f, null, new int[]{formula.variableOf(f)}))
                .toList();
        List<String> dead = collectUnsat(features, runQueries(formula, deadQueries, statistics), undetermined);

        // FASE 3: false-optional
        List<String> optionalChildren = formula.getOptionalChildren();
        List<Query> foQueries = optionalChildren.stream()
                .map(f -> new Query("false-optional:" + f, null, new int[]{-formula.variableOf(f)}))
                .toList();
        List<String> falseOptional = collectUnsat(optionalChildren, runQueries(formula, foQueries, statistics), undetermined);

        // FASE 4: clausole ridondanti
        List<String> redundant = null;
        String redundancyNote = null;
        if (options.isRedundancyCheck()) {
            if (formula.getClausesCount() > options.getMaxRedundancyClauses()) {
                redundancyNote = "RE_SKIPPED:clauses=" + formula.getClausesCount() + ">" + options.getMaxRedundancyClauses();
                LOGGER.warning("Controllo ridondanza saltato: " + redundancyNote);
            } else {
                redundant = new ArrayList<>();
                redundancyNote = checkRedundancy(formula, statistics, redundant);
            }
        }

        statistics.stopTimer();
        LOGGER.info(String.format("Modello %s: %d morte, %d false-optional, %d indeterminate (%s)",
                model.getNamespace(), dead.size(), falseOptional.size(), undetermined.size(), statistics));

        return new AnalysisResult(AnalysisResult.Status.CONSISTENT, root, rootNote, formula.getVariableCount(),
                formula.getClausesCount(), dead, falseOptional, undetermined, redundant, redundancyNote, statistics);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    //endregion

    //region ESECUZIONE QUERY

    /**
     * Interrogazione SAT: clausola esclusa (null = nessuna) e assunzioni.
     */
    private record Query(String label, Integer excludedClause, int[] assumptions) {}

    private List<SatOutcome> runQueries(CNFFormula formula, List<Query> queries, AnalysisStatistics statistics) {
        if (queries.isEmpty()) {
            return List.of();
        }

        List<Callable<SatOutcome>> tasks = new ArrayList<>(queries.size());
        for (Query query : queries) {
            List<List<Integer>> clauses = query.excludedClause() == null
                    ? formula.getClauses()
                    : withoutClause(formula.getClauses(), query.excludedClause());
            tasks.add(() -> backend.solve(formula.getVariableCount(), clauses, query.assumptions(), options.getTimeoutMs()));
        }

        // Limite complessivo: un timeout per ogni "giro" del pool più un margine
        long rounds = (queries.size() + options.getThreads() - 1) / options.getThreads();
        long waitMs = rounds * (options.getTimeoutMs() + GRACE_MS);

        List<Future<SatOutcome>> futures;
        try {
            futures = executor.invokeAll(tasks, waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Analisi interrotta", e);
        }

        List<SatOutcome> outcomes = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            SatOutcome outcome = resolve(futures.get(i), queries.get(i));
            statistics.record(outcome);
            outcomes.add(outcome);
        }
        return outcomes;
    }

    private SatOutcome resolve(Future<SatOutcome> future, Query query) {
        try {
            return future.get();
        } catch (CancellationException e) {
            LOGGER.fine("Query cancellata per timeout: " + query.label());
            return SatOutcome.UNKNOWN;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SolverUnavailableException unavailable) {
                throw unavailable;
            }
            LOGGER.log(Level.SEVERE, "Query SAT fallita: " + query.label(), cause);
            throw new IllegalStateException("Query SAT fallita: " + query.label(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Analisi interrotta", e);
        }
    }

    private static List<String> collectUnsat(List<String> features, List<SatOutcome> outcomes, List<String> undetermined) {
        List<String> unsat = new ArrayList<>();
        for (int i = 0; i < features.size(); i++) {
            switch (outcomes.get(i)) {
                case UNSAT -> unsat.add(features.get(i));
                case UNKNOWN -> {
                    if (!undetermined.contains(features.get(i))) {
                        undetermined.add(features.get(i));
                    }
                }
                case SAT -> { }
            }
        }
        return unsat;
    }

    //endregion

    //region RIDONDANZA

    /**
     * Clausola i ridondante se le altre clausole più la negazione dei suoi letterali sono UNSAT.
     *
     * @return nota sulle query in timeout, null se tutte concluse
     */
    private String checkRedundancy(CNFFormula formula, AnalysisStatistics statistics, List<String> redundant) {
        List<Query> queries = new ArrayList<>(formula.getClausesCount());
        for (int i = 0; i < formula.getClausesCount(); i++) {
            int[] negated = formula.getClause(i).stream().mapToInt(lit -> -lit).toArray();
            queries.add(new Query("redundant:" + formula.getOrigin(i), i, negated));
        }

        List<SatOutcome> outcomes = runQueries(formula, queries, statistics);
        int unknown = 0;
        for (int i = 0; i < outcomes.size(); i++) {
            switch (outcomes.get(i)) {
                case UNSAT -> {
                    redundant.add(formula.getOrigin(i));
                    LOGGER.fine("Clausola ridondante " + formula.getOrigin(i) + ": " + formula.describeClause(i));
                }
                case UNKNOWN -> unknown++;
                case SAT -> { }
            }
        }
        return unknown == 0 ? null : "RE_UNDETERMINED:" + unknown;
    }

    private static List<List<Integer>> withoutClause(List<List<Integer>> clauses, int excluded) {
        List<List<Integer>> result = new ArrayList<>(clauses.size() - 1);
        for (int i = 0; i < clauses.size(); i++) {
            if (i != excluded) {
                result.add(clauses.get(i));
            }
        }
        return result;
    }

    //endregion
}
