package org.fmverify.io;

import org.fmverify.analysis.RootResolver;
import org.fmverify.model.Constraint;
import org.fmverify.model.FeatureModel;
import org.fmverify.model.GroupKind;
import org.fmverify.model.Literal;
import org.fmverify.model.ModelReferenceException;
import org.fmverify.support.Diagnostics;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PARSER FATTI RELAZIONALI - Ricostruzione del modello da fatti feature/p/group/imp
 *
 * Il formato è elaborato riga per riga: ogni riga non vuota è un commento ({@code %})
 * oppure un singolo fatto terminato da punto. L'insieme dei predicati è chiuso:
 * un predicato o una tipologia di gruppo sconosciuti sono errori di parsing.
 *
 * RISOLUZIONE:
 * 1. archi, gruppi e vincoli che referenziano feature non dichiarate sono scartati (REFERENCE_ERROR)
 * 2. la radice è risolta con {@link RootResolver}
 * 3. sono mantenute solo le feature raggiungibili dalla radice tramite archi e gruppi;
 *    le altre vengono scartate e registrate con il motivo
 * 4. i fatti equiv_or sono ricomposti in un'unica equivalenza per lato sinistro
 */
public class RelationalFactParser {

    private static final Logger LOGGER = Logger.getLogger(RelationalFactParser.class.getName());

    public static final String REFERENCE_ERROR = "REFERENCE_ERROR";

    private static final Pattern FACT = Pattern.compile("^([a-z_]+)\\((.*)\\)\\s*\\.$");
    private static final Pattern NAMESPACE = Pattern.compile("^%\\s*namespace:\\s*(\\S+)\\s*$");
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z0-9_]+$");

    private final String fallbackRoot;

    public RelationalFactParser() {
        this(null);
    }

    /**
     * @param fallbackRoot radice esplicita usata solo se né la radice canonica né una radice strutturale esistono
     */
    public RelationalFactParser(String fallbackRoot) {
        this.fallbackRoot = fallbackRoot;
    }

    public ParsedModel parse(Path file) throws IOException, ModelParseException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public ParsedModel parse(String text) throws ModelParseException {
        FactSet facts = readFacts(text);
        return resolve(facts);
    }

    //region LETTURA FATTI

    private FactSet readFacts(String text) throws ModelParseException {
        FactSet facts = new FactSet();
        String[] lines = text.split("\r?\n", -1);

        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i].trim();
            if (line.isEmpty()) continue;

            if (line.startsWith("%")) {
                Matcher ns = NAMESPACE.matcher(line);
                if (ns.matches()) facts.namespace = ns.group(1);
                continue;
            }

            Matcher m = FACT.matcher(line);
            if (!m.matches()) {
                throw new ModelParseException(lineNumber, "fatto malformato: '" + line + "'");
            }

            try {
                readFact(facts, m.group(1), m.group(2), lineNumber);
            } catch (IllegalArgumentException e) {
                throw new ModelParseException(lineNumber, e.getMessage() + " in '" + line + "'");
            }
        }
        return facts;
    }

    private void readFact(FactSet facts, String predicate, String body, int lineNumber) throws ModelParseException {
        switch (predicate) {
            case "feature" -> {
                String name = identifier(body);
                if (!facts.features.add(name)) {
                    facts.diagnostics.record("DUPLICATE_FACT", "riga " + lineNumber + ": feature(" + name + ")");
                }
            }
            case "abstract" -> facts.abstracts.add(identifier(body));
            case "p" -> {
                List<String> args = arguments(body, 2);
                facts.edges.add(new AbstractMap.SimpleImmutableEntry<>(identifier(args.get(0)), identifier(args.get(1))));
            }
            case "group" -> {
                List<String> args = arguments(body, 3);
                String list = args.get(2).trim();
                if (!list.startsWith("[") || !list.endsWith("]")) {
                    throw new IllegalArgumentException("lista figli non valida");
                }
                String inner = list.substring(1, list.length() - 1).trim();
                List<String> children = new ArrayList<>();
                if (!inner.isEmpty()) {
                    for (String child : inner.split(",")) children.add(identifier(child));
                }
                facts.groups.add(new RawGroup(identifier(args.get(0)), GroupKind.fromKeyword(args.get(1)), children, lineNumber));
            }
            case "imp" -> {
                List<String> args = arguments(body, 2);
                facts.constraints.add(new RawConstraint(lineNumber,
                        Constraint.implication(Literal.parseFact(args.get(0)), Literal.parseFact(args.get(1))), null));
            }
            case "equiv_or" -> {
                List<String> args = arguments(body, 2);
                Literal lhs = Literal.parseFact(args.get(0));
                Literal disjunct = Literal.parseFact(args.get(1));
                List<Literal> existing = facts.equivalences.get(lhs);
                if (existing == null) {
                    existing = new ArrayList<>();
                    facts.equivalences.put(lhs, existing);
                    facts.constraints.add(new RawConstraint(lineNumber, null, lhs));
                }
                existing.add(disjunct);
            }
            case "unit" -> facts.constraints.add(new RawConstraint(lineNumber, Constraint.unit(Literal.parseFact(body)), null));
            case "constraint_raw" -> facts.constraints.add(new RawConstraint(lineNumber, Constraint.raw(unquote(body)), null));
            default -> throw new ModelParseException(lineNumber, "predicato sconosciuto: " + predicate);
        }
    }

    //endregion

    //region RISOLUZIONE

    private ParsedModel resolve(FactSet facts) throws ModelParseException {
        Diagnostics diagnostics = facts.diagnostics;
        Set<String> known = facts.features;
        if (known.isEmpty()) {
            throw new ModelParseException("Nessun fatto feature/1 presente");
        }

        for (String name : facts.abstracts) {
            if (!known.contains(name)) diagnostics.record(REFERENCE_ERROR, "abstract(" + name + ")");
        }

        // Archi con estremi noti
        List<Map.Entry<String, String>> edges = new ArrayList<>();
        for (Map.Entry<String, String> edge : facts.edges) {
            if (known.contains(edge.getKey()) && known.contains(edge.getValue())) {
                edges.add(edge);
            } else {
                diagnostics.record(REFERENCE_ERROR, "p(" + edge.getKey() + "," + edge.getValue() + ")");
            }
        }

        RootResolver.Resolution resolution = RootResolver.resolve(known, edges, fallbackRoot);
        String root = resolution.root();

        Map<String, String> parentOf = new HashMap<>();
        for (Map.Entry<String, String> edge : edges) {
            String child = edge.getKey();
            if (child.equals(root)) {
                diagnostics.record("ROOT_WITH_PARENT", "p(" + child + "," + edge.getValue() + ")");
            } else if (parentOf.containsKey(child) && !parentOf.get(child).equals(edge.getValue())) {
                diagnostics.record("CONFLICTING_PARENT", "p(" + child + "," + edge.getValue() + ") ignorato, padre già " + parentOf.get(child));
            } else {
                parentOf.put(child, edge.getValue());
            }
        }

        List<RawGroup> groups = resolveGroups(facts, root, parentOf, diagnostics);
        Set<String> grouped = new HashSet<>();
        groups.forEach(g -> grouped.addAll(g.children));

        Set<String> kept = reachableFeatures(known, root, parentOf, grouped, diagnostics);

        FeatureModel.Builder builder = new FeatureModel.Builder(facts.namespace);
        for (String name : known) {
            if (kept.contains(name)) {
                builder.addFeature(name, facts.abstracts.contains(name), name.equals(root) ? null : parentOf.get(name));
            }
        }
        for (RawGroup group : groups) {
            if (!kept.contains(group.parent)) continue;
            List<String> children = group.children.stream().filter(kept::contains).toList();
            if (!children.isEmpty()) builder.addGroup(group.parent, group.kind, children);
        }
        for (RawConstraint raw : facts.constraints) {
            Constraint constraint = raw.constraint != null
                    ? raw.constraint
                    : Constraint.equivalenceOr(raw.equivalenceLhs, facts.equivalences.get(raw.equivalenceLhs));
            List<String> missing = constraint.referencedFeatures().stream().filter(n -> !kept.contains(n)).toList();
            if (missing.isEmpty()) {
                builder.addConstraint(constraint);
            } else {
                diagnostics.record(REFERENCE_ERROR, "riga " + raw.lineNumber + ": '" + constraint + "' referenzia " + missing);
            }
        }

        try {
            FeatureModel model = builder.build();
            if (!diagnostics.isEmpty()) {
                LOGGER.warning("Fatti scartati durante il parsing: " + diagnostics.summaryLine());
            }
            return new ParsedModel(model, diagnostics, resolution.note());
        } catch (ModelReferenceException e) {
            throw new ModelParseException("Struttura del modello non valida: " + e.getMessage(), e);
        }
    }

    private List<RawGroup> resolveGroups(FactSet facts, String root, Map<String, String> parentOf, Diagnostics diagnostics) {
        Set<String> known = facts.features;
        Set<String> assigned = new HashSet<>();
        List<RawGroup> result = new ArrayList<>();

        for (RawGroup group : facts.groups) {
            if (!known.contains(group.parent)) {
                diagnostics.record(REFERENCE_ERROR, "riga " + group.lineNumber + ": gruppo con padre " + group.parent);
                continue;
            }
            List<String> children = new ArrayList<>();
            for (String child : group.children) {
                if (!known.contains(child)) {
                    diagnostics.record(REFERENCE_ERROR, "riga " + group.lineNumber + ": figlio " + child + " di " + group.parent);
                    continue;
                }
                if (child.equals(root)) {
                    diagnostics.record("ROOT_WITH_PARENT", "riga " + group.lineNumber + ": " + child + " in gruppo di " + group.parent);
                    continue;
                }
                String parent = parentOf.get(child);
                if (parent == null) {
                    // Padre ricavato dal gruppo in assenza dell'arco p/2
                    parentOf.put(child, group.parent);
                } else if (!parent.equals(group.parent)) {
                    diagnostics.record("GROUP_PARENT_MISMATCH", "riga " + group.lineNumber + ": " + child
                            + " nel gruppo di " + group.parent + " ma figlio di " + parent);
                    continue;
                }
                if (!assigned.add(child)) {
                    diagnostics.record("CHILD_IN_MULTIPLE_GROUPS", "riga " + group.lineNumber + ": " + child);
                    continue;
                }
                children.add(child);
            }
            if (!children.isEmpty()) {
                result.add(new RawGroup(group.parent, group.kind, children, group.lineNumber));
            }
        }
        return result;
    }

    /**
     * Punto fisso: una feature è mantenuta se il padre è mantenuto e appartiene a un suo gruppo.
     */
    private Set<String> reachableFeatures(Set<String> known, String root, Map<String, String> parentOf,
                                          Set<String> grouped, Diagnostics diagnostics) {
        Set<String> kept = new LinkedHashSet<>();
        kept.add(root);

        boolean changed = true;
        while (changed) {
            changed = false;
            for (String name : known) {
                if (kept.contains(name)) continue;
                String parent = parentOf.get(name);
                if (parent != null && kept.contains(parent) && grouped.contains(name)) {
                    kept.add(name);
                    changed = true;
                }
            }
        }

        for (String name : known) {
            if (kept.contains(name)) continue;
            String parent = parentOf.get(name);
            if (parent == null) {
                diagnostics.record("ORPHAN_FEATURE", name);
            } else if (!grouped.contains(name)) {
                diagnostics.record("UNGROUPED_FEATURE", name + " (padre " + parent + ")");
            } else {
                diagnostics.record("UNREACHABLE_FEATURE", name + " (padre " + parent + " scartato)");
            }
        }
        return kept;
    }

    //endregion

    //region SUPPORTO

    private static String identifier(String text) {
        String t = text.trim();
        if (!IDENTIFIER.matcher(t).matches()) {
            throw new IllegalArgumentException("identificatore non valido: '" + t + "'");
        }
        return t;
    }

    /**
     * Divide gli argomenti di primo livello rispettando parentesi, liste e apici.
     */
    static List<String> arguments(String body, int expected) {
        List<String> args = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;

        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == '\\' && i + 1 < body.length()) {
                    current.append(body.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '\'', '"' -> {
                    quote = c;
                    current.append(c);
                }
                case '(', '[' -> {
                    depth++;
                    current.append(c);
                }
                case ')', ']' -> {
                    depth--;
                    current.append(c);
                }
                case ',' -> {
                    if (depth == 0) {
                        args.add(current.toString().trim());
                        current.setLength(0);
                    } else {
                        current.append(c);
                    }
                }
                default -> current.append(c);
            }
        }
        args.add(current.toString().trim());

        if (args.size() != expected) {
            throw new IllegalArgumentException("attesi " + expected + " argomenti, trovati " + args.size());
        }
        return args;
    }

    private static String unquote(String body) {
        String t = body.trim();
        if (t.length() < 2 || (t.charAt(0) != '\'' && t.charAt(0) != '"') || t.charAt(t.length() - 1) != t.charAt(0)) {
            throw new IllegalArgumentException("testo tra apici atteso");
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i < t.length() - 1; i++) {
            char c = t.charAt(i);
            if (c == '\\' && i + 1 < t.length() - 1) {
                sb.append(t.charAt(++i));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static final class FactSet {
        String namespace;
        final Set<String> features = new LinkedHashSet<>();
        final Set<String> abstracts = new HashSet<>();
        final List<Map.Entry<String, String>> edges = new ArrayList<>();
        final List<RawGroup> groups = new ArrayList<>();
        final List<RawConstraint> constraints = new ArrayList<>();
        final Map<Literal, List<Literal>> equivalences = new LinkedHashMap<>();
        final Diagnostics diagnostics = new Diagnostics();
    }

    private record RawGroup(String parent, GroupKind kind, List<String> children, int lineNumber) {}

    /**
     * Vincolo letto: completo, oppure segnaposto di un'equivalenza da ricomporre.
     */
    private record RawConstraint(int lineNumber, Constraint constraint, Literal equivalenceLhs) {}

    //endregion
}
