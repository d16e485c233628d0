package org.fmverify.cnf;

import org.fmverify.model.Constraint;
import org.fmverify.model.Feature;
import org.fmverify.model.FeatureModel;
import org.fmverify.model.Group;
import org.fmverify.model.Literal;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * CODIFICATORE CNF - Dal feature model alla formula proposizionale in CNF
 *
 * CLAUSOLE GENERATE:
 * - radice: clausola unitaria (r)
 * - ogni arco strutturale distinto: (¬figlio ∨ padre), qualunque sia il gruppo
 * - MANDATORY: (¬padre ∨ figlio) per ciascun figlio
 * - ALTERNATIVE: (¬padre ∨ c1 ∨ … ∨ cn) più (¬ci ∨ ¬cj) per ogni coppia i &lt; j
 * - OR: (¬padre ∨ c1 ∨ … ∨ cn), senza esclusività
 * - IMPLICATION A => B: (¬A ∨ B) rispettando le polarità
 * - EQUIVALENCE_OR e UNIT: solo con {@link CompilationPolicy#FULL}
 * - RAW: mai compilati
 *
 * I letterali duplicati in una clausola sono rimossi; le clausole tautologiche sono scartate.
 */
public class CNFEncoder {

    private static final Logger LOGGER = Logger.getLogger(CNFEncoder.class.getName());

    private final CompilationPolicy policy;

    public CNFEncoder() {
        this(CompilationPolicy.IMPLICATIONS_ONLY);
    }

    public CNFEncoder(CompilationPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "Politica di compilazione non può essere null");
    }

    public CompilationPolicy getPolicy() {
        return policy;
    }

    /**
     * Codifica il modello selezionando la radice indicata.
     *
     * @param model modello validato
     * @param root feature da forzare vera, deve appartenere al modello
     * @return formula con tabella variabili e origini delle clausole
     */
    public CNFFormula encode(FeatureModel model, String root) {
        if (!model.hasFeature(root)) {
            throw new IllegalArgumentException("Radice non presente nel modello: " + root);
        }

        ClauseCollector collector = new ClauseCollector(model);
        LOGGER.fine("Codifica CNF di " + model.featureCount() + " feature, radice " + root);

        collector.add("root:" + root, collector.lit(Literal.positive(root)));

        // Archi strutturali, ciascuno una sola volta
        Set<String> edges = new HashSet<>();
        for (Feature feature : model.getFeatures().values()) {
            if (!feature.isRoot()) {
                addEdge(collector, edges, feature.getName(), feature.getParent());
            }
        }
        for (Group group : model.getGroups()) {
            for (String child : group.getChildren()) {
                addEdge(collector, edges, child, group.getParent());
            }
        }

        for (Group group : model.getGroups()) {
            encodeGroup(collector, group);
        }

        int skipped = 0;
        for (Constraint constraint : model.getConstraints()) {
            if (!encodeConstraint(collector, constraint)) skipped++;
        }
        if (skipped > 0) {
            LOGGER.fine("Vincoli non compilati (" + policy + "): " + skipped);
        }

        return new CNFFormula(collector.mapping, collector.clauses, collector.origins, root,
                new ArrayList<>(new TreeSet<>(model.getOptionalChildren())));
    }

    private void addEdge(ClauseCollector collector, Set<String> edges, String child, String parent) {
        if (edges.add(child + "->" + parent)) {
            collector.add("edge:" + child + "->" + parent,
                    -collector.var(child), collector.var(parent));
        }
    }

    private void encodeGroup(ClauseCollector collector, Group group) {
        String parent = group.getParent();
        int p = collector.var(parent);
        List<String> children = group.getChildren();

        switch (group.getKind()) {
            case MANDATORY -> {
                for (String child : children) {
                    collector.add("mandatory:" + parent + "->" + child, -p, collector.var(child));
                }
            }
            case OPTIONAL -> {
                // solo archi strutturali
            }
            case ALTERNATIVE -> {
                collector.add("alternative:" + parent, atLeastOne(collector, p, children));
                for (int i = 0; i < children.size(); i++) {
                    for (int j = i + 1; j < children.size(); j++) {
                        collector.add("alternative-excl:" + children.get(i) + "," + children.get(j),
                                -collector.var(children.get(i)), -collector.var(children.get(j)));
                    }
                }
            }
            case OR -> collector.add("or:" + parent, atLeastOne(collector, p, children));
        }
    }

    private int[] atLeastOne(ClauseCollector collector, int parent, List<String> children) {
        int[] clause = new int[children.size() + 1];
        clause[0] = -parent;
        for (int i = 0; i < children.size(); i++) {
            clause[i + 1] = collector.var(children.get(i));
        }
        return clause;
    }

    /**
     * @return false se il vincolo non produce clausole con la politica corrente
     */
    private boolean encodeConstraint(ClauseCollector collector, Constraint constraint) {
        return switch (constraint.getType()) {
            case IMPLICATION -> {
                collector.add("imp:" + constraint.toHierarchicalText(),
                        -collector.lit(constraint.getLhs()), collector.lit(constraint.getRhs()));
                yield true;
            }
            case EQUIVALENCE_OR -> {
                if (policy != CompilationPolicy.FULL) yield false;
                int lhs = collector.lit(constraint.getLhs());
                List<Literal> disjuncts = constraint.getDisjuncts();
                int[] forward = new int[disjuncts.size() + 1];
                forward[0] = -lhs;
                for (int i = 0; i < disjuncts.size(); i++) {
                    forward[i + 1] = collector.lit(disjuncts.get(i));
                }
                collector.add("equiv:" + constraint.getLhs() + "=>or", forward);
                for (Literal disjunct : disjuncts) {
                    collector.add("equiv:" + disjunct + "=>" + constraint.getLhs(), -collector.lit(disjunct), lhs);
                }
                yield true;
            }
            case UNIT -> {
                if (policy != CompilationPolicy.FULL) yield false;
                collector.add("unit:" + constraint.getLhs(), collector.lit(constraint.getLhs()));
                yield true;
            }
            case RAW -> false;
        };
    }

    /**
     * Accumulatore di clausole con mapping variabili sui nomi ordinati.
     */
    private static final class ClauseCollector {
        final Map<String, Integer> mapping = new LinkedHashMap<>();
        final List<List<Integer>> clauses = new ArrayList<>();
        final List<String> origins = new ArrayList<>();

        ClauseCollector(FeatureModel model) {
            int id = 1;
            for (String name : new TreeSet<>(model.getFeatureNames())) {
                mapping.put(name, id++);
            }
        }

        int var(String feature) {
            Integer id = mapping.get(feature);
            if (id == null) {
                throw new IllegalStateException("Feature non mappata: " + feature);
            }
            return id;
        }

        int lit(Literal literal) {
            int v = var(literal.getFeature());
            return literal.isPositive() ? v : -v;
        }

        void add(String origin, int... literals) {
            Set<Integer> unique = new LinkedHashSet<>();
            for (int literal : literals) {
                if (unique.contains(-literal)) {
                    LOGGER.finest("Clausola tautologica scartata: " + origin);
                    return;
                }
                unique.add(literal);
            }
            clauses.add(new ArrayList<>(unique));
            origins.add(origin);
        }
    }
}
