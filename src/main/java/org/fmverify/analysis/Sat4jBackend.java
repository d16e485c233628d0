package org.fmverify.analysis;

import org.sat4j.core.VecInt;
import org.sat4j.minisat.SolverFactory;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.ISolver;
import org.sat4j.specs.TimeoutException;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Backend SAT basato su Sat4j: un solver nuovo per ogni interrogazione.
 *
 * Le varianti vengono provate nell'ordine configurato; se nessuna è istanziabile
 * viene sollevata {@link SolverUnavailableException}.
 */
public class Sat4jBackend implements SolverBackend {

    private static final Logger LOGGER = Logger.getLogger(Sat4jBackend.class.getName());

    /**
     * Configurazioni Sat4j disponibili.
     */
    public enum Variant {
        DEFAULT,
        LIGHT
    }

    private final List<Variant> candidates;

    public Sat4jBackend() {
        this(List.of(Variant.DEFAULT, Variant.LIGHT));
    }

    public Sat4jBackend(List<Variant> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("Serve almeno una variante Sat4j");
        }
        this.candidates = List.copyOf(candidates);
    }

    @Override
    public String name() {
        return "Sat4j" + candidates;
    }

    @Override
    public void checkAvailable() {
        ISolver solver = newSolver();
        solver.reset();
    }

    @Override
    public SatOutcome solve(int variableCount, List<List<Integer>> clauses, int[] assumptions, long timeoutMs) {
        Objects.requireNonNull(clauses, "Clausole non possono essere null");
        ISolver solver = newSolver();

        try {
            solver.newVar(variableCount);
            solver.setExpectedNumberOfClauses(clauses.size());
            // Sat4j accetta un timeout minimo di 1 ms
            solver.setTimeoutMs(Math.max(1L, timeoutMs));

            for (List<Integer> clause : clauses) {
                solver.addClause(new VecInt(clause.stream().mapToInt(Integer::intValue).toArray()));
            }

            return solver.isSatisfiable(new VecInt(assumptions)) ? SatOutcome.SAT : SatOutcome.UNSAT;

        } catch (ContradictionException e) {
            // Contraddizione già in fase di caricamento delle clausole
            return SatOutcome.UNSAT;
        } catch (TimeoutException e) {
            LOGGER.fine("Timeout Sat4j dopo " + timeoutMs + " ms");
            return SatOutcome.UNKNOWN;
        } finally {
            solver.reset();
        }
    }

    private ISolver newSolver() {
        RuntimeException lastError = null;
        for (Variant variant : candidates) {
            try {
                return create(variant);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Variante Sat4j non disponibile: " + variant, e);
                lastError = e;
            }
        }
        throw new SolverUnavailableException("Nessun backend SAT disponibile tra " + candidates, lastError);
    }

    /**
     * Crea il solver della variante indicata.
     */
    protected ISolver create(Variant variant) {
        return switch (variant) {
            case DEFAULT -> SolverFactory.newDefault();
            case LIGHT -> SolverFactory.newLight();
        };
    }
}
