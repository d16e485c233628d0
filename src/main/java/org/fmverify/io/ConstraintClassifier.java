package org.fmverify.io;

import org.fmverify.model.Constraint;
import org.fmverify.model.Literal;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifica un'espressione di vincolo nelle forme note del modello.
 *
 * - letterale => letterale: IMPLICATION
 * - letterale <=> letterale oppure letterale <=> (l1 | l2 | ...): EQUIVALENCE_OR
 * - letterale isolato: UNIT
 * - qualsiasi altra forma: RAW, con il testo originale
 */
public final class ConstraintClassifier {

    private ConstraintClassifier() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static Constraint classify(ConstraintExpression expr, String originalText) {
        if (expr.isLiteral()) {
            return Constraint.unit(toLiteral(expr));
        }

        switch (expr.type) {
            case IMPLIES -> {
                ConstraintExpression lhs = expr.operands.get(0);
                ConstraintExpression rhs = expr.operands.get(1);
                if (lhs.isLiteral() && rhs.isLiteral()) {
                    return Constraint.implication(toLiteral(lhs), toLiteral(rhs));
                }
            }
            case IFF -> {
                ConstraintExpression lhs = expr.operands.get(0);
                List<Literal> disjuncts = disjunctionOfLiterals(expr.operands.get(1));
                if (lhs.isLiteral() && disjuncts != null) {
                    return Constraint.equivalenceOr(toLiteral(lhs), disjuncts);
                }
            }
            default -> {
                // AND, OR e negazioni composte non hanno forma dedicata
            }
        }
        return Constraint.raw(originalText);
    }

    private static List<Literal> disjunctionOfLiterals(ConstraintExpression expr) {
        if (expr.isLiteral()) {
            return List.of(toLiteral(expr));
        }
        if (expr.type != ConstraintExpression.Type.OR) {
            return null;
        }
        List<Literal> result = new ArrayList<>();
        for (ConstraintExpression op : expr.operands) {
            if (!op.isLiteral()) return null;
            result.add(toLiteral(op));
        }
        return result;
    }

    private static Literal toLiteral(ConstraintExpression expr) {
        return expr.type == ConstraintExpression.Type.ATOM
                ? Literal.positive(expr.atom)
                : Literal.negative(expr.operand.atom);
    }
}
