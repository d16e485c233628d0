package org.fmverify.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * VINCOLO CROSS-TREE - Unione etichettata chiusa delle forme di vincolo supportate
 *
 * TIPOLOGIE:
 * - IMPLICATION: lhs => rhs, entrambi letterali con polarità
 * - EQUIVALENCE_OR: lhs <=> (r1 | r2 | ...), insieme ordinato di letterali a destra
 * - UNIT: singolo letterale imposto (es. !flag per una capacità che nessun ramo possiede)
 * - RAW: vincolo sintatticamente valido di altra forma, conservato come testo opaco
 *
 * I vincoli RAW non vengono mai compilati in clausole.
 */
public final class Constraint {

    /**
     * Tipologia del vincolo.
     */
    public enum Type {
        IMPLICATION,
        EQUIVALENCE_OR,
        UNIT,
        RAW
    }

    private final Type type;
    private final Literal lhs;
    private final List<Literal> rhs;
    private final String rawText;

    private Constraint(Type type, Literal lhs, List<Literal> rhs, String rawText) {
        this.type = type;
        this.lhs = lhs;
        this.rhs = rhs;
        this.rawText = rawText;
    }

    //region FACTORY

    public static Constraint implication(Literal lhs, Literal rhs) {
        Objects.requireNonNull(lhs, "Lato sinistro dell'implicazione non può essere null");
        Objects.requireNonNull(rhs, "Lato destro dell'implicazione non può essere null");
        return new Constraint(Type.IMPLICATION, lhs, List.of(rhs), null);
    }

    public static Constraint equivalenceOr(Literal lhs, List<Literal> disjuncts) {
        Objects.requireNonNull(lhs, "Lato sinistro dell'equivalenza non può essere null");
        if (disjuncts == null || disjuncts.isEmpty()) {
            throw new IllegalArgumentException("Equivalenza richiede almeno un disgiunto a destra");
        }
        List<Literal> unique = new ArrayList<>(new LinkedHashSet<>(disjuncts));
        return new Constraint(Type.EQUIVALENCE_OR, lhs, Collections.unmodifiableList(unique), null);
    }

    public static Constraint unit(Literal literal) {
        Objects.requireNonNull(literal, "Letterale unitario non può essere null");
        return new Constraint(Type.UNIT, literal, List.of(), null);
    }

    public static Constraint raw(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Testo del vincolo raw non può essere vuoto");
        }
        return new Constraint(Type.RAW, null, List.of(), text.trim());
    }

    //endregion

    //region ACCESSO

    public Type getType() {
        return type;
    }

    /**
     * @return lato sinistro (IMPLICATION, EQUIVALENCE_OR) o letterale imposto (UNIT); null per RAW
     */
    public Literal getLhs() {
        return lhs;
    }

    /**
     * @return letterale destro di un'implicazione
     * @throws IllegalStateException se il vincolo non è un'implicazione
     */
    public Literal getRhs() {
        if (type != Type.IMPLICATION) {
            throw new IllegalStateException("getRhs() disponibile solo per IMPLICATION, tipo attuale: " + type);
        }
        return rhs.get(0);
    }

    /**
     * @return disgiunti a destra (EQUIVALENCE_OR), singolo elemento (IMPLICATION), vuota altrimenti
     */
    public List<Literal> getDisjuncts() {
        return rhs;
    }

    public String getRawText() {
        return rawText;
    }

    public boolean isImplication() {
        return type == Type.IMPLICATION;
    }

    /**
     * Nomi delle feature referenziate, nell'ordine di comparsa. Vuoto per RAW.
     */
    public Set<String> referencedFeatures() {
        Set<String> names = new LinkedHashSet<>();
        if (lhs != null) names.add(lhs.getFeature());
        for (Literal literal : rhs) {
            names.add(literal.getFeature());
        }
        return names;
    }

    //endregion

    /**
     * Forma testuale nel formato gerarchico.
     */
    public String toHierarchicalText() {
        return switch (type) {
            case IMPLICATION -> lhs.toHierarchicalText() + " => " + rhs.get(0).toHierarchicalText();
            case EQUIVALENCE_OR -> {
                StringBuilder sb = new StringBuilder(lhs.toHierarchicalText()).append(" <=> (");
                for (int i = 0; i < rhs.size(); i++) {
                    if (i > 0) sb.append(" | ");
                    sb.append(rhs.get(i).toHierarchicalText());
                }
                yield sb.append(')').toString();
            }
            case UNIT -> lhs.toHierarchicalText();
            case RAW -> rawText;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Constraint)) return false;
        Constraint other = (Constraint) o;
        return type == other.type && Objects.equals(lhs, other.lhs)
                && rhs.equals(other.rhs) && Objects.equals(rawText, other.rawText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, lhs, rhs, rawText);
    }

    @Override
    public String toString() {
        return toHierarchicalText();
    }
}
