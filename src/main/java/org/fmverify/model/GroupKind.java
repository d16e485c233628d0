package org.fmverify.model;

import java.util.Locale;

/**
 * Tipologie chiuse di gruppo strutturale del feature model.
 *
 * Ogni tipologia ha la propria keyword nel formato gerarchico e nei fatti relazionali.
 * Una keyword sconosciuta non viene mai ignorata: {@link #fromKeyword(String)} la rifiuta.
 */
public enum GroupKind {
    MANDATORY("mandatory"),
    OPTIONAL("optional"),
    ALTERNATIVE("alternative"),
    OR("or");

    private final String keyword;

    GroupKind(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Risolve una keyword (case-insensitive) nella tipologia corrispondente.
     *
     * @param keyword keyword testuale
     * @return tipologia di gruppo
     * @throws IllegalArgumentException se la keyword non appartiene all'insieme chiuso
     */
    public static GroupKind fromKeyword(String keyword) {
        if (keyword != null) {
            String normalized = keyword.trim().toLowerCase(Locale.ROOT);
            for (GroupKind kind : values()) {
                if (kind.keyword.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Tipologia di gruppo sconosciuta: " + keyword);
    }

    /**
     * Verifica se il token è una keyword di gruppo, senza sollevare eccezioni.
     */
    public static boolean isKeyword(String token) {
        if (token == null) return false;
        for (GroupKind kind : values()) {
            if (kind.keyword.equals(token)) return true;
        }
        return false;
    }
}
