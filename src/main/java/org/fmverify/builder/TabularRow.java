package org.fmverify.builder;

/**
 * Riga del contratto tabellare: una combinazione (categoria, item, risposta) osservata
 * su un ramo, con codici opzionali di tipo/piano audit e flag di capacità del ramo.
 *
 * I campi testuali mancanti sono null. I flag valgono 0 o 1.
 */
public final class TabularRow {

    private final String categoryCode;
    private final String itemKey;
    private final String itemFeatureName;
    private final String answerFeatureName;
    private final String branchFeatureCode;
    private final String auditTypeCode;
    private final String auditPlanCode;
    private final int isoActive;
    private final int microActive;
    private final int pathActive;

    public TabularRow(String categoryCode, String itemKey, String itemFeatureName, String answerFeatureName,
                      String branchFeatureCode, String auditTypeCode, String auditPlanCode,
                      int isoActive, int microActive, int pathActive) {
        this.categoryCode = clean(categoryCode);
        this.itemKey = clean(itemKey);
        this.itemFeatureName = clean(itemFeatureName);
        this.answerFeatureName = clean(answerFeatureName);
        this.branchFeatureCode = clean(branchFeatureCode);
        this.auditTypeCode = clean(auditTypeCode);
        this.auditPlanCode = clean(auditPlanCode);
        this.isoActive = isoActive == 1 ? 1 : 0;
        this.microActive = microActive == 1 ? 1 : 0;
        this.pathActive = pathActive == 1 ? 1 : 0;
    }

    /**
     * Riga di solo contenuto, senza codici audit né flag.
     */
    public static TabularRow content(String categoryCode, String itemKey, String itemFeatureName,
                                     String answerFeatureName, String branchFeatureCode) {
        return new TabularRow(categoryCode, itemKey, itemFeatureName, answerFeatureName, branchFeatureCode,
                null, null, 0, 0, 0);
    }

    /**
     * Normalizza i valori assenti: blank, "nan" e "none" diventano null.
     */
    static String clean(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        if (trimmed.isEmpty() || trimmed.equalsIgnoreCase("nan") || trimmed.equalsIgnoreCase("none")) {
            return null;
        }
        return trimmed;
    }

    public String getCategoryCode() {
        return categoryCode;
    }

    public String getItemKey() {
        return itemKey;
    }

    public String getItemFeatureName() {
        return itemFeatureName;
    }

    public String getAnswerFeatureName() {
        return answerFeatureName;
    }

    public String getBranchFeatureCode() {
        return branchFeatureCode;
    }

    public String getAuditTypeCode() {
        return auditTypeCode;
    }

    public String getAuditPlanCode() {
        return auditPlanCode;
    }

    /**
     * Valore del flag di capacità indicato (iso_active, micro_active, path_active).
     */
    public int getCapabilityFlag(String flag) {
        return switch (flag) {
            case "iso_active" -> isoActive;
            case "micro_active" -> microActive;
            case "path_active" -> pathActive;
            default -> throw new IllegalArgumentException("Flag di capacità sconosciuto: " + flag);
        };
    }

    /**
     * Chiave di deduplicazione del contenuto: il ramo non partecipa.
     */
    String contentKey() {
        return categoryCode + "\u0000" + itemKey + "\u0000" + itemFeatureName + "\u0000" + answerFeatureName;
    }

    @Override
    public String toString() {
        return "CATEGORY=" + categoryCode + " ITEM_KEY=" + itemKey + " ITEM_FEATURE_NAME=" + itemFeatureName
                + " ANSWER=" + answerFeatureName + " BRANCH=" + branchFeatureCode;
    }
}
