package org.fmverify.model;

import java.util.Objects;

/**
 * Letterale di vincolo: nome di feature con polarità.
 *
 * Forme testuali:
 * - gerarchica: {@code x} / {@code !x}
 * - fatti relazionali: {@code x} / {@code not(x)}
 */
public final class Literal implements Comparable<Literal> {

    private final String feature;
    private final boolean positive;

    private Literal(String feature, boolean positive) {
        if (feature == null || feature.isBlank()) {
            throw new IllegalArgumentException("Nome feature del letterale non può essere null o vuoto");
        }
        this.feature = feature;
        this.positive = positive;
    }

    public static Literal positive(String feature) {
        return new Literal(feature, true);
    }

    public static Literal negative(String feature) {
        return new Literal(feature, false);
    }

    public static Literal of(String feature, boolean positive) {
        return new Literal(feature, positive);
    }

    public String getFeature() {
        return feature;
    }

    public boolean isPositive() {
        return positive;
    }

    public Literal negate() {
        return new Literal(feature, !positive);
    }

    public String toHierarchicalText() {
        return positive ? feature : "!" + feature;
    }

    public String toFactText() {
        return positive ? feature : "not(" + feature + ")";
    }

    /**
     * Interpreta un letterale in forma di fatto ({@code x} oppure {@code not(x)}).
     *
     * @throws IllegalArgumentException se il testo non è un letterale valido
     */
    public static Literal parseFact(String text) {
        String t = text == null ? "" : text.trim();
        if (t.startsWith("not(") && t.endsWith(")")) {
            return negative(t.substring(4, t.length() - 1).trim());
        }
        if (t.isEmpty() || t.contains("(") || t.contains(")") || t.contains(",")) {
            throw new IllegalArgumentException("Letterale non valido: '" + text + "'");
        }
        return positive(t);
    }

    @Override
    public int compareTo(Literal other) {
        int byName = feature.compareTo(other.feature);
        return byName != 0 ? byName : Boolean.compare(other.positive, positive);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Literal)) return false;
        Literal other = (Literal) o;
        return positive == other.positive && feature.equals(other.feature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(feature, positive);
    }

    @Override
    public String toString() {
        return toHierarchicalText();
    }
}
