package org.fmverify.builder;

import java.util.Locale;
import java.util.Objects;

/**
 * Regola di ambito: lega l'occorrenza di una categoria o di un item a un flag di capacità.
 */
public final class ScopeRule {

    /**
     * Tipologia del bersaglio della regola.
     */
    public enum TargetType {
        CATEGORY,
        ITEM;

        public static TargetType fromText(String text) {
            String t = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
            return switch (t) {
                case "category" -> CATEGORY;
                case "item" -> ITEM;
                default -> throw new IllegalArgumentException("Tipo bersaglio sconosciuto: " + text);
            };
        }
    }

    /**
     * Azione della regola. Solo REQUIRE e FORBID producono vincoli.
     */
    public enum Action {
        REQUIRE,
        FORBID,
        ALLOW,
        PERMIT,
        NONE;

        public static Action fromText(String text) {
            String t = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
            return switch (t) {
                case "require" -> REQUIRE;
                case "forbid" -> FORBID;
                case "allow" -> ALLOW;
                case "permit" -> PERMIT;
                case "none" -> NONE;
                default -> throw new IllegalArgumentException("Azione sconosciuta: " + text);
            };
        }

        public boolean isEnforcing() {
            return this == REQUIRE || this == FORBID;
        }
    }

    private final String capabilityFlag;
    private final TargetType targetType;
    private final String targetCode;
    private final Action action;

    /**
     * @param targetType tipologia del bersaglio, null se la tabella non la specifica
     */
    public ScopeRule(String capabilityFlag, TargetType targetType, String targetCode, Action action) {
        this.capabilityFlag = Objects.requireNonNull(capabilityFlag, "Flag di capacità richiesto").trim().toLowerCase(Locale.ROOT);
        this.targetType = targetType;
        this.targetCode = Objects.requireNonNull(targetCode, "Codice bersaglio richiesto").trim();
        this.action = Objects.requireNonNull(action, "Azione richiesta");
    }

    public String getCapabilityFlag() {
        return capabilityFlag;
    }

    public TargetType getTargetType() {
        return targetType;
    }

    public String getTargetCode() {
        return targetCode;
    }

    public Action getAction() {
        return action;
    }

    @Override
    public String toString() {
        return "FLAG=" + capabilityFlag + " TARGET=" + (targetType == null ? "?" : targetType.name().toLowerCase(Locale.ROOT))
                + ":" + targetCode + " ACTION=" + action.name().toLowerCase(Locale.ROOT);
    }
}
