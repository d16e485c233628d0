package org.fmverify.builder;

import org.fmverify.support.CsvSupport;
import org.fmverify.support.Diagnostics;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * LETTORE CONTRATTO TABELLARE - Caricamento righe e regole di ambito da CSV
 *
 * Le intestazioni sono confrontate senza distinzione di maiuscole. Le colonne obbligatorie
 * delle righe di contenuto sono verificate prima di leggere qualsiasi riga: se ne manca
 * anche una sola la costruzione del modello non può partire.
 */
public class TabularCsvReader {

    private static final Logger LOGGER = Logger.getLogger(TabularCsvReader.class.getName());

    public static final String CATEGORY_CODE = "CATEGORY_CODE";
    public static final String ITEM_KEY = "ITEM_KEY";
    public static final String ITEM_FEATURE_NAME = "ITEM_FEATURE_NAME";
    public static final String ANSWER_FEATURE_NAME = "ANSWER_FEATURE_NAME";
    public static final String BRANCH_FEATURE_CODE = "BRANCH_FEATURE_CODE";
    public static final String AUDIT_TYPE_CODE = "AUDIT_TYPE_CODE";
    public static final String AUDIT_PLAN_CODE = "AUDIT_PLAN_CODE";
    public static final String ISO_ACTIVE = "ISO_ACTIVE";
    public static final String MICRO_ACTIVE = "MICRO_ACTIVE";
    public static final String PATH_ACTIVE = "PATH_ACTIVE";

    public static final List<String> REQUIRED_COLUMNS = List.of(
            CATEGORY_CODE, ITEM_KEY, ITEM_FEATURE_NAME, ANSWER_FEATURE_NAME, BRANCH_FEATURE_CODE);

    public static final String CAPABILITY_FLAG = "CAPABILITY_FLAG";
    public static final String TARGET_TYPE = "TARGET_TYPE";
    public static final String TARGET_CODE = "TARGET_CODE";
    public static final String ACTION = "ACTION";

    public static final List<String> REQUIRED_RULE_COLUMNS = List.of(CAPABILITY_FLAG, TARGET_CODE, ACTION);

    /**
     * Legge le righe di contenuto di un modello.
     *
     * @param file file CSV con intestazione
     * @return righe nell'ordine del file
     * @throws MissingRequiredFieldException se manca una colonna obbligatoria
     * @throws IOException se il file non è leggibile
     */
    public List<TabularRow> readRows(Path file) throws IOException, MissingRequiredFieldException {
        CsvSupport.Table table = CsvSupport.read(file);
        requireColumns(table, REQUIRED_COLUMNS, file.getFileName().toString());

        int category = table.indexOf(CATEGORY_CODE);
        int itemKey = table.indexOf(ITEM_KEY);
        int itemFeature = table.indexOf(ITEM_FEATURE_NAME);
        int answer = table.indexOf(ANSWER_FEATURE_NAME);
        int branch = table.indexOf(BRANCH_FEATURE_CODE);
        int auditType = table.indexOf(AUDIT_TYPE_CODE);
        int auditPlan = table.indexOf(AUDIT_PLAN_CODE);
        int iso = table.indexOf(ISO_ACTIVE);
        int micro = table.indexOf(MICRO_ACTIVE);
        int path = table.indexOf(PATH_ACTIVE);

        List<TabularRow> rows = new ArrayList<>(table.rows().size());
        for (List<String> r : table.rows()) {
            rows.add(new TabularRow(
                    CsvSupport.Table.cell(r, category),
                    CsvSupport.Table.cell(r, itemKey),
                    CsvSupport.Table.cell(r, itemFeature),
                    CsvSupport.Table.cell(r, answer),
                    CsvSupport.Table.cell(r, branch),
                    CsvSupport.Table.cell(r, auditType),
                    CsvSupport.Table.cell(r, auditPlan),
                    parseFlag(CsvSupport.Table.cell(r, iso)),
                    parseFlag(CsvSupport.Table.cell(r, micro)),
                    parseFlag(CsvSupport.Table.cell(r, path))));
        }

        LOGGER.fine("Lette " + rows.size() + " righe da " + file);
        return rows;
    }

    /**
     * Legge la tabella delle regole di ambito. Le righe incomplete o con tipo bersaglio/azione
     * sconosciuti sono registrate nel report e scartate.
     *
     * @param file file CSV delle regole
     * @param report report su cui registrare gli scarti
     * @return regole valide nell'ordine del file
     */
    public List<ScopeRule> readScopeRules(Path file, Diagnostics report) throws IOException, MissingRequiredFieldException {
        CsvSupport.Table table = CsvSupport.read(file);
        requireColumns(table, REQUIRED_RULE_COLUMNS, file.getFileName().toString());

        int flag = table.indexOf(CAPABILITY_FLAG);
        int type = table.indexOf(TARGET_TYPE);
        int code = table.indexOf(TARGET_CODE);
        int action = table.indexOf(ACTION);

        List<ScopeRule> rules = new ArrayList<>();
        for (List<String> r : table.rows()) {
            String flagValue = TabularRow.clean(CsvSupport.Table.cell(r, flag));
            String typeValue = TabularRow.clean(CsvSupport.Table.cell(r, type));
            String codeValue = TabularRow.clean(CsvSupport.Table.cell(r, code));
            String actionValue = TabularRow.clean(CsvSupport.Table.cell(r, action));

            if (flagValue == null || codeValue == null || actionValue == null) {
                report.record("DROP_SCOPE_RULE_INCOMPLETE", String.join(",", r));
                continue;
            }

            try {
                ScopeRule.TargetType targetType = typeValue == null ? null : ScopeRule.TargetType.fromText(typeValue);
                rules.add(new ScopeRule(flagValue, targetType, codeValue, ScopeRule.Action.fromText(actionValue)));
            } catch (IllegalArgumentException e) {
                report.record("DROP_SCOPE_RULE_UNKNOWN_TAG", e.getMessage() + " [" + String.join(",", r) + "]");
            }
        }

        LOGGER.fine("Lette " + rules.size() + " regole di ambito da " + file);
        return rules;
    }

    private void requireColumns(CsvSupport.Table table, List<String> required, String source)
            throws MissingRequiredFieldException {
        List<String> missing = required.stream().filter(c -> table.indexOf(c) < 0).toList();
        if (!missing.isEmpty()) {
            throw new MissingRequiredFieldException(source, missing);
        }
    }

    /**
     * Interpreta un flag 0/1 tollerando la forma decimale ("1.0"). Valori non numerici valgono 0.
     */
    static int parseFlag(String value) {
        String v = TabularRow.clean(value);
        if (v == null) return 0;
        try {
            return Double.parseDouble(v) == 1.0 ? 1 : 0;
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
