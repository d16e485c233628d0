package org.fmverify.io;

import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.fmverify.model.Constraint;
import org.fmverify.model.FeatureModel;
import org.fmverify.model.GroupKind;
import org.fmverify.model.ModelReferenceException;
import org.fmverify.support.Diagnostics;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PARSER FORMATO GERARCHICO - Ricostruzione del modello dal testo indentato
 *
 * SEZIONI: {@code namespace <id>}, {@code features}, {@code constraints}.
 *
 * ALBERO: una pila di frame (feature o keyword di gruppo) con la relativa indentazione.
 * Ogni riga chiude i frame indentati almeno quanto lei, poi si aggancia al frame in cima:
 * - una keyword di gruppo deve stare sotto una feature
 * - una feature deve stare sotto una keyword di gruppo, tranne la prima (radice)
 *
 * VINCOLI: ogni riga è interpretata dalla grammatica ANTLR e classificata. I vincoli che
 * referenziano feature non dichiarate vengono scartati e registrati come REFERENCE_ERROR; le righe
 * che la grammatica non accetta restano come vincoli RAW e vengono registrate come UNPARSED_CONSTRAINT.
 */
public class HierarchicalTextParser {

    private static final Logger LOGGER = Logger.getLogger(HierarchicalTextParser.class.getName());

    public static final String REFERENCE_ERROR = "REFERENCE_ERROR";
    public static final String UNPARSED_CONSTRAINT = "UNPARSED_CONSTRAINT";

    private static final Pattern FEATURE_LINE =
            Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)(\\s*\\{\\s*abstract(\\s+true)?\\s*})?$");

    private enum Section { HEADER, FEATURES, CONSTRAINTS }

    public ParsedModel parse(Path file) throws IOException, ModelParseException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * Interpreta il testo completo di un modello.
     *
     * @throws ModelParseException per righe malformate, strutture incoerenti o vincoli non sintattici
     */
    public ParsedModel parse(String text) throws ModelParseException {
        ParseState state = new ParseState();
        String[] lines = text.split("\r?\n", -1);

        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String content = stripComment(lines[i].replace("\t", "    "));
            if (content.isBlank()) continue;

            int indent = leadingSpaces(content);
            String token = content.trim();

            if (indent == 0) {
                handleTopLevel(state, token, lineNumber);
                continue;
            }

            switch (state.section) {
                case FEATURES -> handleFeatureLine(state, token, indent, lineNumber);
                case CONSTRAINTS -> handleConstraintLine(state, token, lineNumber);
                case HEADER -> throw new ModelParseException(lineNumber, "contenuto fuori da qualsiasi sezione: '" + token + "'");
            }
        }

        return buildModel(state);
    }

    //region SEZIONI

    private void handleTopLevel(ParseState state, String token, int lineNumber) throws ModelParseException {
        if (token.equals("features")) {
            state.section = Section.FEATURES;
            state.frames.clear();
        } else if (token.equals("constraints")) {
            state.section = Section.CONSTRAINTS;
        } else if (token.startsWith("namespace ") || token.equals("namespace")) {
            String ns = token.substring("namespace".length()).trim();
            if (ns.isEmpty()) {
                throw new ModelParseException(lineNumber, "namespace senza identificatore");
            }
            state.namespace = ns;
        } else {
            throw new ModelParseException(lineNumber, "riga non riconosciuta: '" + token + "'");
        }
    }

    private void handleFeatureLine(ParseState state, String token, int indent, int lineNumber) throws ModelParseException {
        // Chiude i frame non più aperti
        while (!state.frames.isEmpty() && state.frames.peek().indent >= indent) {
            state.frames.pop();
        }
        Frame top = state.frames.peek();

        if (GroupKind.isKeyword(token)) {
            if (top == null || top.groupIndex >= 0) {
                throw new ModelParseException(lineNumber, "keyword di gruppo '" + token + "' non sotto una feature");
            }
            state.groups.add(new PendingGroup(top.name, GroupKind.fromKeyword(token)));
            state.frames.push(new Frame(indent, top.name, state.groups.size() - 1));
            return;
        }

        Matcher m = FEATURE_LINE.matcher(token);
        if (!m.matches()) {
            throw new ModelParseException(lineNumber, "riga di feature malformata: '" + token + "'");
        }
        String name = m.group(1);
        boolean isAbstract = m.group(2) != null;

        if (state.features.containsKey(name)) {
            throw new ModelParseException(lineNumber, "feature dichiarata più volte: " + name);
        }

        String parent;
        if (top == null) {
            if (state.root != null) {
                throw new ModelParseException(lineNumber, "seconda feature di primo livello '" + name
                        + "', radice già definita: " + state.root);
            }
            state.root = name;
            parent = null;
        } else if (top.groupIndex < 0) {
            throw new ModelParseException(lineNumber, "feature '" + name + "' fuori da una keyword di gruppo");
        } else {
            PendingGroup group = state.groups.get(top.groupIndex);
            group.children.add(name);
            parent = group.parent;
        }

        state.features.put(name, new PendingFeature(isAbstract, parent));
        state.frames.push(new Frame(indent, name, -1));
    }

    private void handleConstraintLine(ParseState state, String token, int lineNumber) {
        try {
            ConstraintExpression expr = ConstraintExpressionBuilder.parse(token);
            state.constraints.add(new PendingConstraint(lineNumber, ConstraintClassifier.classify(expr, token)));
        } catch (ParseCancellationException e) {
            // Forma non riconosciuta dalla grammatica: conservata come testo opaco
            state.diagnostics.record(UNPARSED_CONSTRAINT, "riga " + lineNumber + ": '" + token + "'");
            state.constraints.add(new PendingConstraint(lineNumber, Constraint.raw(token)));
        }
    }

    //endregion

    //region COSTRUZIONE MODELLO

    private ParsedModel buildModel(ParseState state) throws ModelParseException {
        if (state.root == null) {
            throw new ModelParseException("Nessuna feature dichiarata nella sezione features");
        }

        Diagnostics diagnostics = state.diagnostics;
        FeatureModel.Builder builder = new FeatureModel.Builder(state.namespace);

        for (Map.Entry<String, PendingFeature> entry : state.features.entrySet()) {
            builder.addFeature(entry.getKey(), entry.getValue().isAbstract, entry.getValue().parent);
        }
        for (PendingGroup group : state.groups) {
            // Keyword senza figli: nessun vincolo strutturale
            if (!group.children.isEmpty()) {
                builder.addGroup(group.parent, group.kind, group.children);
            }
        }
        for (PendingConstraint pending : state.constraints) {
            List<String> missing = pending.constraint.referencedFeatures().stream()
                    .filter(n -> !state.features.containsKey(n)).toList();
            if (missing.isEmpty()) {
                builder.addConstraint(pending.constraint);
            } else {
                diagnostics.record(REFERENCE_ERROR, "riga " + pending.lineNumber + ": '" + pending.constraint
                        + "' referenzia " + missing);
            }
        }

        try {
            FeatureModel model = builder.build();
            if (!diagnostics.isEmpty()) {
                LOGGER.warning("Vincoli scartati o non interpretati durante il parsing: " + diagnostics.summaryLine());
            }
            return new ParsedModel(model, diagnostics, null);
        } catch (ModelReferenceException e) {
            throw new ModelParseException("Struttura del modello non valida: " + e.getMessage(), e);
        }
    }

    //endregion

    //region SUPPORTO

    static String stripComment(String line) {
        int cut = line.length();
        int slashes = line.indexOf("//");
        if (slashes >= 0) cut = slashes;
        int hash = line.indexOf('#');
        if (hash >= 0 && hash < cut) cut = hash;
        return line.substring(0, cut);
    }

    private static int leadingSpaces(String line) {
        int count = 0;
        while (count < line.length() && line.charAt(count) == ' ') count++;
        return count;
    }

    private static final class ParseState {
        Section section = Section.HEADER;
        String namespace;
        String root;
        final Map<String, PendingFeature> features = new LinkedHashMap<>();
        final List<PendingGroup> groups = new ArrayList<>();
        final List<PendingConstraint> constraints = new ArrayList<>();
        final Deque<Frame> frames = new ArrayDeque<>();
        final Diagnostics diagnostics = new Diagnostics();
    }

    /**
     * Frame della pila: feature (groupIndex = -1) oppure keyword di gruppo.
     */
    private record Frame(int indent, String name, int groupIndex) {}

    private record PendingFeature(boolean isAbstract, String parent) {}

    private record PendingConstraint(int lineNumber, Constraint constraint) {}

    private static final class PendingGroup {
        final String parent;
        final GroupKind kind;
        final List<String> children = new ArrayList<>();

        PendingGroup(String parent, GroupKind kind) {
            this.parent = parent;
            this.kind = kind;
        }
    }

    //endregion
}
