package org.fmverify.io;

import java.util.ArrayList;
import java.util.List;

/**
 * Albero sintattico di una riga di vincolo, prodotto dal visitor ANTLR.
 *
 * Conserva la forma scritta (implicazioni e biimplicazioni non vengono eliminate):
 * la classificazione in {@link org.fmverify.model.Constraint} dipende dalla forma.
 */
public class ConstraintExpression {

    /**
     * Tipi di nodo dell'albero.
     */
    public enum Type {
        ATOM,       // Feature: A
        NOT,        // Negazione: !A
        AND,        // Congiunzione: A & B
        OR,         // Disgiunzione: A | B
        IMPLIES,    // Implicazione: A => B
        IFF         // Biimplicazione: A <=> B
    }

    /** Tipo del nodo corrente */
    public final Type type;

    /** Nome della feature (solo per nodi ATOM) */
    public final String atom;

    /** Operando singolo (solo per nodi NOT) */
    public final ConstraintExpression operand;

    /** Operandi (AND, OR, IMPLIES, IFF) */
    public final List<ConstraintExpression> operands;

    private ConstraintExpression(Type type, String atom, ConstraintExpression operand, List<ConstraintExpression> operands) {
        this.type = type;
        this.atom = atom;
        this.operand = operand;
        this.operands = operands;
    }

    public static ConstraintExpression atom(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome feature non può essere null o vuoto");
        }
        return new ConstraintExpression(Type.ATOM, name.trim(), null, List.of());
    }

    public static ConstraintExpression not(ConstraintExpression operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
        return new ConstraintExpression(Type.NOT, null, operand, List.of());
    }

    /**
     * Nodo n-ario. IMPLIES e IFF richiedono esattamente due operandi.
     */
    public static ConstraintExpression of(Type type, List<ConstraintExpression> operands) {
        if (type == Type.ATOM || type == Type.NOT) {
            throw new IllegalArgumentException("Tipo " + type + " non ammesso per nodi con più operandi");
        }
        if (operands == null || operands.size() < 2) {
            throw new IllegalArgumentException("Servono almeno due operandi per " + type);
        }
        if ((type == Type.IMPLIES || type == Type.IFF) && operands.size() != 2) {
            throw new IllegalArgumentException(type + " richiede esattamente due operandi");
        }
        return new ConstraintExpression(type, null, null, List.copyOf(new ArrayList<>(operands)));
    }

    /**
     * Vero per un atomo o per la negazione di un atomo.
     */
    public boolean isLiteral() {
        return type == Type.ATOM || (type == Type.NOT && operand.type == Type.ATOM);
    }

    @Override
    public String toString() {
        return switch (type) {
            case ATOM -> atom;
            case NOT -> operand.type == Type.ATOM ? "!" + operand : "!(" + operand + ")";
            case AND -> join(" & ");
            case OR -> join(" | ");
            case IMPLIES -> join(" => ");
            case IFF -> join(" <=> ");
        };
    }

    private String join(String separator) {
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) result.append(separator);
            ConstraintExpression op = operands.get(i);
            if (op.type == Type.ATOM || op.type == Type.NOT) {
                result.append(op);
            } else {
                // Parentesi per precedenza operatori
                result.append('(').append(op).append(')');
            }
        }
        return result.toString();
    }
}
