package org.fmverify.model;

import java.util.List;

/**
 * Nomi fissi dello scheletro del modello di audit interno.
 */
public final class AuditVocabulary {

    /** Radice canonica: se presente tra le feature viene sempre usata come radice */
    public static final String CANONICAL_ROOT = "InternalAuditSystem";
    public static final String DEFAULT_NAMESPACE = "MedicareAuditStructure";

    public static final String BRANCH_CAPABILITIES = "BranchCapabilities";
    public static final String AUDIT_TYPE = "AuditType";
    public static final String AUDITED_ENTITY = "AuditedEntity";
    public static final String AUDIT_SCOPE = "AuditScope";
    public static final String AUDIT_PLAN = "AuditPlan";
    public static final String RELATED_VISIT = "RelatedVisit";

    /** Prefisso del nodo che raccoglie le risposte di un item */
    public static final String ANSWERS_PREFIX = "Answers__";

    public static final String ISO_ACTIVE = "iso_active";
    public static final String MICRO_ACTIVE = "micro_active";
    public static final String PATH_ACTIVE = "path_active";

    /** Flag di capacità dei rami, nell'ordine di emissione */
    public static final List<String> CAPABILITY_FLAGS = List.of(ISO_ACTIVE, MICRO_ACTIVE, PATH_ACTIVE);

    /** Codici di tipo audit che attivano vincoli bidirezionali */
    public static final String PLANNED_TYPE = "planned";
    public static final String RE_EVALUATE_TYPE = "re_evaluate";

    private AuditVocabulary() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }
}
