package org.fmverify.builder;

import org.fmverify.model.Constraint;
import org.fmverify.model.FeatureModel;
import org.fmverify.model.GroupKind;
import org.fmverify.model.Literal;
import org.fmverify.model.ModelException;
import org.fmverify.model.ModelReferenceException;
import org.fmverify.support.Diagnostics;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.logging.Logger;

import static org.fmverify.model.AuditVocabulary.*;

/**
 * COSTRUTTORE DEL MODELLO - Dalle righe tabellari validate al feature model di audit
 *
 * PIPELINE:
 * 1. Universo dei rami dalle righe grezze (prima della deduplicazione)
 * 2. Deduplicazione del contenuto per (categoria, item key, item, risposta)
 * 3. Controllo fatale: item key e nome feature dell'item in corrispondenza biunivoca
 * 4. Scheletro: radice, capacità, tipi audit, entità auditate, ambito
 * 5. Categorie, item e nodi risposte, con scarti registrati nel report
 * 6. Blocco opzionale: piani audit ed eventuale visita correlata
 * 7. Vincoli: flag di capacità, tipi pianificati, regole di ambito
 *
 * A parità di input il modello prodotto è sempre identico: tutte le dimensioni sono
 * ordinate e gli item seguono l'ordine di prima comparsa.
 */
public class ModelBuilder {

    private static final Logger LOGGER = Logger.getLogger(ModelBuilder.class.getName());

    /** Numero massimo di chiavi in conflitto riportate per direzione */
    public static final int MAX_CONFLICT_EXAMPLES = 10;

    private final String namespace;
    private final boolean requireAnswers;

    public ModelBuilder() {
        this(DEFAULT_NAMESPACE, true);
    }

    /**
     * @param namespace namespace del modello prodotto
     * @param requireAnswers se false gli item senza risposte valide sono costruiti come foglie
     */
    public ModelBuilder(String namespace, boolean requireAnswers) {
        this.namespace = namespace == null || namespace.isBlank() ? DEFAULT_NAMESPACE : namespace;
        this.requireAnswers = requireAnswers;
    }

    //region INGRESSO DA FILE

    /**
     * Costruisce il modello da un file CSV di righe e da un file opzionale di regole di ambito.
     *
     * @param rowsFile CSV delle righe di contenuto
     * @param scopeRulesFile CSV delle regole, null se assente
     */
    public BuildResult buildFromCsv(Path rowsFile, Path scopeRulesFile) throws IOException, ModelException {
        TabularCsvReader reader = new TabularCsvReader();
        Diagnostics report = new Diagnostics();

        List<TabularRow> rows = reader.readRows(rowsFile);
        List<ScopeRule> rules = scopeRulesFile != null && Files.exists(scopeRulesFile)
                ? reader.readScopeRules(scopeRulesFile, report)
                : List.of();

        return build(rows, rules, report);
    }

    //endregion

    //region COSTRUZIONE

    public BuildResult build(List<TabularRow> rows, List<ScopeRule> rules)
            throws StructuralCorruptionException, ModelReferenceException {
        return build(rows, rules, new Diagnostics());
    }

    /**
     * Costruisce il modello accodando gli scarti al report fornito.
     *
     * @throws StructuralCorruptionException se la mappatura item key / item non è univoca
     */
    public BuildResult build(List<TabularRow> rows, List<ScopeRule> rules, Diagnostics report)
            throws StructuralCorruptionException, ModelReferenceException {
        Objects.requireNonNull(rows, "Righe di input non possono essere null");
        LOGGER.fine("Avvio costruzione modello da " + rows.size() + " righe");

        // (A) Universo rami indipendente dalla deduplicazione
        Set<String> branchUniverse = sortedDistinct(rows, TabularRow::getBranchFeatureCode);

        // (B) Deduplicazione del solo contenuto strutturale
        List<TabularRow> content = deduplicateContent(rows);
        LOGGER.fine("Righe di contenuto dopo deduplicazione: " + content.size());

        // (C) Conflitti fatali sul contenuto
        detectMappingConflicts(content);

        BuildState state = new BuildState(report, namespace);
        emitSkeleton(state, content, branchUniverse);
        emitCategories(state, content);
        emitOptionalBlock(state, content);
        emitConstraints(state, rows, rules == null ? List.of() : rules);

        FeatureModel model = state.model.build();
        LOGGER.info("Modello costruito: " + model.featureCount() + " feature, " + model.groupCount()
                + " gruppi, " + model.constraintCount() + " vincoli, " + report.total() + " scarti");
        return new BuildResult(model, report);
    }

    /**
     * Mantiene la prima occorrenza di ogni combinazione (categoria, item key, item, risposta).
     */
    static List<TabularRow> deduplicateContent(List<TabularRow> rows) {
        Map<String, TabularRow> unique = new LinkedHashMap<>();
        for (TabularRow row : rows) {
            unique.putIfAbsent(row.contentKey(), row);
        }
        return new ArrayList<>(unique.values());
    }

    /**
     * Verifica che item key e nome feature dell'item siano in corrispondenza biunivoca.
     */
    static void detectMappingConflicts(List<TabularRow> content) throws StructuralCorruptionException {
        Map<String, Set<String>> featuresByKey = new TreeMap<>();
        Map<String, Set<String>> keysByFeature = new TreeMap<>();

        for (TabularRow row : content) {
            if (row.getItemKey() == null || row.getItemFeatureName() == null) continue;
            featuresByKey.computeIfAbsent(row.getItemKey(), k -> new HashSet<>()).add(row.getItemFeatureName());
            keysByFeature.computeIfAbsent(row.getItemFeatureName(), k -> new HashSet<>()).add(row.getItemKey());
        }

        List<String> badKeys = featuresByKey.entrySet().stream()
                .filter(e -> e.getValue().size() > 1).map(Map.Entry::getKey).toList();
        List<String> badFeatures = keysByFeature.entrySet().stream()
                .filter(e -> e.getValue().size() > 1).map(Map.Entry::getKey).toList();

        if (badKeys.isEmpty() && badFeatures.isEmpty()) return;

        StringBuilder msg = new StringBuilder("Conflitti di mappatura degli item (dati corrotti):");
        if (!badKeys.isEmpty()) {
            msg.append("\n- ITEM_KEY con più ITEM_FEATURE_NAME: ")
                    .append(badKeys.subList(0, Math.min(MAX_CONFLICT_EXAMPLES, badKeys.size())));
        }
        if (!badFeatures.isEmpty()) {
            msg.append("\n- ITEM_FEATURE_NAME con più ITEM_KEY: ")
                    .append(badFeatures.subList(0, Math.min(MAX_CONFLICT_EXAMPLES, badFeatures.size())));
        }
        throw new StructuralCorruptionException(msg.toString());
    }

    //endregion

    //region SCHELETRO

    private void emitSkeleton(BuildState state, List<TabularRow> content, Set<String> branchUniverse) {
        state.model.addFeature(CANONICAL_ROOT, true, null);
        state.taken.add(CANONICAL_ROOT);
        List<String> rootMandatory = new ArrayList<>();

        // Capacità dei rami
        state.addSkeleton(BRANCH_CAPABILITIES, CANONICAL_ROOT);
        rootMandatory.add(BRANCH_CAPABILITIES);
        List<String> flags = new ArrayList<>();
        for (String flag : CAPABILITY_FLAGS) {
            if (state.tryAdd(flag, false, BRANCH_CAPABILITIES, "FLAG=" + flag)) flags.add(flag);
        }
        state.model.addGroup(BRANCH_CAPABILITIES, GroupKind.OPTIONAL, flags);

        // Tipi di audit
        Set<String> auditTypes = sortedDistinct(content, TabularRow::getAuditTypeCode);
        if (!auditTypes.isEmpty()) {
            state.addSkeleton(AUDIT_TYPE, CANONICAL_ROOT);
            rootMandatory.add(AUDIT_TYPE);
            state.addLeafGroup(AUDIT_TYPE, GroupKind.ALTERNATIVE, auditTypes, "AUDIT_TYPE");
        }

        // Entità auditate: universo grezzo dei rami
        if (!branchUniverse.isEmpty()) {
            state.addSkeleton(AUDITED_ENTITY, CANONICAL_ROOT);
            rootMandatory.add(AUDITED_ENTITY);
            state.branches.addAll(state.addLeafGroup(AUDITED_ENTITY, GroupKind.ALTERNATIVE, branchUniverse, "BRANCH"));
        }

        state.addSkeleton(AUDIT_SCOPE, CANONICAL_ROOT);
        rootMandatory.add(AUDIT_SCOPE);

        state.model.addGroup(CANONICAL_ROOT, GroupKind.MANDATORY, rootMandatory);
    }

    //endregion

    //region CATEGORIE, ITEM E RISPOSTE

    private void emitCategories(BuildState state, List<TabularRow> content) {
        Set<String> categories = sortedDistinct(content, TabularRow::getCategoryCode);

        for (String category : categories) {
            List<TabularRow> categoryRows = content.stream()
                    .filter(r -> category.equals(r.getCategoryCode())).toList();

            // Item validi: chiave e nome presenti, prima comparsa
            Map<String, String> validItems = new LinkedHashMap<>();
            for (TabularRow row : categoryRows) {
                if (row.getItemKey() != null && row.getItemFeatureName() != null) {
                    validItems.putIfAbsent(row.getItemKey(), row.getItemFeatureName());
                }
            }

            if (validItems.isEmpty()) {
                state.report.record("SKIP_CATEGORY_NO_VALID_ITEMS",
                        "CATEGORY=" + category + " (tutte le righe senza ITEM_KEY/ITEM_FEATURE_NAME)");
                continue;
            }
            if (state.taken.contains(category)) {
                state.report.record("SKIP_DUPLICATE_FEATURE_NAME", "CATEGORY=" + category);
                continue;
            }

            CategoryBlock block = buildCategoryBlock(state, category, categoryRows, validItems);
            if (block.items.isEmpty()) {
                state.report.record("SKIP_CATEGORY_NO_BUILT_ITEMS", "CATEGORY=" + category);
                continue;
            }
            commitCategory(state, block);
        }

        if (!state.categories.isEmpty()) {
            state.model.addGroup(AUDIT_SCOPE, GroupKind.OR, state.categories);
        }
    }

    private CategoryBlock buildCategoryBlock(BuildState state, String category, List<TabularRow> categoryRows,
                                             Map<String, String> validItems) {
        CategoryBlock block = new CategoryBlock(category);
        Set<String> staged = new HashSet<>();
        staged.add(category);

        for (Map.Entry<String, String> item : validItems.entrySet()) {
            String itemKey = item.getKey();
            String itemFeature = item.getValue();
            String itemContext = "CATEGORY=" + category + " ITEM_KEY=" + itemKey + " ITEM_FEATURE_NAME=" + itemFeature;

            if (state.taken.contains(itemFeature) || staged.contains(itemFeature)) {
                state.report.record("SKIP_DUPLICATE_FEATURE_NAME", itemContext);
                continue;
            }

            Set<String> choices = new TreeSet<>();
            for (TabularRow row : categoryRows) {
                if (itemKey.equals(row.getItemKey()) && row.getAnswerFeatureName() != null) {
                    choices.add(row.getAnswerFeatureName());
                }
            }

            String answersNode = ANSWERS_PREFIX + itemKey;
            List<String> answers = new ArrayList<>();
            if (!choices.isEmpty()) {
                if (state.taken.contains(answersNode) || staged.contains(answersNode)) {
                    state.report.record("SKIP_DUPLICATE_FEATURE_NAME", itemContext + " NODE=" + answersNode);
                } else {
                    Set<String> local = new HashSet<>(staged);
                    local.add(itemFeature);
                    local.add(answersNode);
                    for (String answer : choices) {
                        if (state.taken.contains(answer) || local.contains(answer)) {
                            state.report.record("SKIP_DUPLICATE_FEATURE_NAME", itemContext + " ANSWER=" + answer);
                            continue;
                        }
                        local.add(answer);
                        answers.add(answer);
                    }
                }
            }

            if (answers.isEmpty()) {
                if (requireAnswers) {
                    state.report.record("SKIP_ITEM_NO_VALID_ANSWERS", itemContext);
                    continue;
                }
                state.report.record("WARN_ITEM_NO_VALID_ANSWERS_BUILT_ITEM_ONLY", itemContext);
                block.items.add(new ItemBlock(itemKey, itemFeature, null, List.of()));
                staged.add(itemFeature);
            } else {
                block.items.add(new ItemBlock(itemKey, itemFeature, answersNode, answers));
                staged.add(itemFeature);
                staged.add(answersNode);
                staged.addAll(answers);
            }
        }
        return block;
    }

    private void commitCategory(BuildState state, CategoryBlock block) {
        state.model.addFeature(block.category, true, AUDIT_SCOPE);
        state.taken.add(block.category);
        state.categories.add(block.category);

        List<String> itemNames = new ArrayList<>();
        for (ItemBlock item : block.items) {
            state.model.addFeature(item.feature, true, block.category);
            state.taken.add(item.feature);
            state.itemFeatureByKey.put(item.key, item.feature);
            itemNames.add(item.feature);

            if (item.answersNode != null) {
                state.model.addFeature(item.answersNode, true, item.feature);
                state.taken.add(item.answersNode);
                state.model.addGroup(item.feature, GroupKind.MANDATORY, List.of(item.answersNode));
                for (String answer : item.answers) {
                    state.model.addFeature(answer, false, item.answersNode);
                    state.taken.add(answer);
                }
                state.model.addGroup(item.answersNode, GroupKind.ALTERNATIVE, item.answers);
            }
        }
        state.model.addGroup(block.category, GroupKind.MANDATORY, itemNames);
    }

    //endregion

    //region BLOCCO OPZIONALE

    private void emitOptionalBlock(BuildState state, List<TabularRow> content) {
        List<String> rootOptional = new ArrayList<>();

        Set<String> plans = sortedDistinct(content, TabularRow::getAuditPlanCode);
        if (!plans.isEmpty() && !state.taken.contains(AUDIT_PLAN)) {
            state.addSkeleton(AUDIT_PLAN, CANONICAL_ROOT);
            List<String> emitted = state.addLeafGroup(AUDIT_PLAN, GroupKind.ALTERNATIVE, plans, "AUDIT_PLAN");
            if (emitted.isEmpty()) {
                // nessun piano sopravvissuto: il contenitore resta foglia
                LOGGER.warning("Tutti i codici piano sono duplicati di feature esistenti");
            }
            rootOptional.add(AUDIT_PLAN);
        }

        if (state.tryAdd(RELATED_VISIT, true, CANONICAL_ROOT, "CONTAINER=" + RELATED_VISIT)) {
            rootOptional.add(RELATED_VISIT);
        }

        if (!rootOptional.isEmpty()) {
            state.model.addGroup(CANONICAL_ROOT, GroupKind.OPTIONAL, rootOptional);
        }
    }

    //endregion

    //region VINCOLI

    private void emitConstraints(BuildState state, List<TabularRow> rawRows, List<ScopeRule> rules) {
        // Flag di capacità: equivalenza con la disgiunzione dei rami che li possiedono
        for (String flag : CAPABILITY_FLAGS) {
            if (!state.taken.contains(flag)) continue;

            Set<String> branchesOn = new TreeSet<>();
            for (TabularRow row : rawRows) {
                String branch = row.getBranchFeatureCode();
                if (branch != null && row.getCapabilityFlag(flag) == 1 && state.branches.contains(branch)) {
                    branchesOn.add(branch);
                }
            }

            if (branchesOn.isEmpty()) {
                state.addConstraint(Constraint.unit(Literal.negative(flag)));
            } else {
                state.addConstraint(Constraint.equivalenceOr(Literal.positive(flag),
                        branchesOn.stream().map(Literal::positive).toList()));
            }
        }

        if (state.taken.contains(PLANNED_TYPE)) {
            if (state.taken.contains(AUDIT_PLAN)) {
                emitBidirectional(state, PLANNED_TYPE, AUDIT_PLAN);
            } else {
                state.report.record("SKIP_RULE_MISSING_TARGET", PLANNED_TYPE + " => " + AUDIT_PLAN);
            }
        }

        if (state.taken.contains(RE_EVALUATE_TYPE) && state.taken.contains(RELATED_VISIT)) {
            emitBidirectional(state, RE_EVALUATE_TYPE, RELATED_VISIT);
        }

        for (ScopeRule rule : rules) {
            applyScopeRule(state, rule);
        }
    }

    /**
     * Emette {@code source => target} e {@code !source => !target}.
     */
    private void emitBidirectional(BuildState state, String source, String target) {
        state.addConstraint(Constraint.implication(Literal.positive(source), Literal.positive(target)));
        state.addConstraint(Constraint.implication(Literal.negative(source), Literal.negative(target)));
    }

    private void applyScopeRule(BuildState state, ScopeRule rule) {
        if (!rule.getAction().isEnforcing()) {
            state.report.record("IGNORE_SCOPE_RULE_ACTION", rule.toString());
            return;
        }

        String flag = rule.getCapabilityFlag();
        String target = resolveScopeTarget(state, rule);

        if (target == null || !CAPABILITY_FLAGS.contains(flag) || !state.taken.contains(flag)) {
            state.report.record("DROP_SCOPE_RULE_UNKNOWN_ENDPOINT", rule.toString());
            return;
        }

        // require e forbid producono lo stesso legame bidirezionale tra bersaglio e flag
        boolean added = state.addConstraint(Constraint.implication(Literal.positive(target), Literal.positive(flag)));
        added |= state.addConstraint(Constraint.implication(Literal.negative(flag), Literal.negative(target)));
        if (!added) {
            state.report.record("SKIP_DUPLICATE_SCOPE_RULE", rule.toString());
        }
    }

    /**
     * Risolve il bersaglio di una regola. Gli item possono essere indicati per nome feature o per item key.
     *
     * @return nome della feature bersaglio, null se sconosciuto
     */
    private String resolveScopeTarget(BuildState state, ScopeRule rule) {
        String code = rule.getTargetCode();
        ScopeRule.TargetType type = rule.getTargetType();

        if (type == null) {
            if (state.taken.contains(code)) return code;
            return state.itemFeatureByKey.get(code);
        }

        return switch (type) {
            case CATEGORY -> state.categories.contains(code) ? code : null;
            case ITEM -> state.itemFeatureByKey.containsValue(code) ? code : state.itemFeatureByKey.get(code);
        };
    }

    //endregion

    //region SUPPORTO

    private static Set<String> sortedDistinct(List<TabularRow> rows, Function<TabularRow, String> column) {
        Set<String> values = new TreeSet<>();
        for (TabularRow row : rows) {
            String value = column.apply(row);
            if (value != null) values.add(value);
        }
        return values;
    }

    /**
     * Stato mutabile di una singola costruzione.
     */
    private static final class BuildState {
        final FeatureModel.Builder model;
        final Diagnostics report;
        final Set<String> taken = new HashSet<>();
        final Set<String> branches = new LinkedHashSet<>();
        final List<String> categories = new ArrayList<>();
        final Map<String, String> itemFeatureByKey = new HashMap<>();
        final Set<Constraint> constraints = new LinkedHashSet<>();

        BuildState(Diagnostics report, String namespace) {
            this.report = report;
            this.model = new FeatureModel.Builder(namespace);
        }

        void addSkeleton(String name, String parent) {
            model.addFeature(name, true, parent);
            taken.add(name);
        }

        boolean tryAdd(String name, boolean isAbstract, String parent, String context) {
            if (taken.contains(name)) {
                report.record("SKIP_DUPLICATE_FEATURE_NAME", context);
                return false;
            }
            model.addFeature(name, isAbstract, parent);
            taken.add(name);
            return true;
        }

        /**
         * Aggiunge un gruppo di foglie concrete; i nomi già usati sono scartati.
         *
         * @return foglie effettivamente emesse
         */
        List<String> addLeafGroup(String parent, GroupKind kind, Set<String> leaves, String label) {
            List<String> emitted = new ArrayList<>();
            for (String leaf : leaves) {
                if (tryAdd(leaf, false, parent, label + "=" + leaf)) emitted.add(leaf);
            }
            if (!emitted.isEmpty()) {
                model.addGroup(parent, kind, emitted);
            }
            return emitted;
        }

        boolean addConstraint(Constraint constraint) {
            if (!constraints.add(constraint)) return false;
            model.addConstraint(constraint);
            return true;
        }
    }

    private static final class CategoryBlock {
        final String category;
        final List<ItemBlock> items = new ArrayList<>();

        CategoryBlock(String category) {
            this.category = category;
        }
    }

    private record ItemBlock(String key, String feature, String answersNode, List<String> answers) {}

    //endregion
}
