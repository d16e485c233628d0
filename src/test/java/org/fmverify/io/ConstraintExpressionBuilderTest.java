package org.fmverify.io;

import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.fmverify.model.Constraint;
import org.fmverify.model.Literal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ConstraintExpressionBuilderTest {

    private static Constraint classify(String text) {
        return ConstraintClassifier.classify(ConstraintExpressionBuilder.parse(text), text);
    }

    @Test
    @DisplayName("Precedenza degli operatori: & lega più di |, | più di =>")
    void testPrecedence() {
        ConstraintExpression expr = ConstraintExpressionBuilder.parse("a | b & c => d");

        assertThat(expr.type).isEqualTo(ConstraintExpression.Type.IMPLIES);
        assertThat(expr.operands.get(0).type).isEqualTo(ConstraintExpression.Type.OR);
        assertThat(expr.operands.get(0).operands.get(1).type).isEqualTo(ConstraintExpression.Type.AND);
        assertThat(expr.toString()).isEqualTo("(a | (b & c)) => d");
    }

    @Test
    @DisplayName("L'implicazione associa a destra")
    void testImplicationRightAssociative() {
        ConstraintExpression expr = ConstraintExpressionBuilder.parse("a => b => c");

        assertThat(expr.operands.get(0).atom).isEqualTo("a");
        assertThat(expr.operands.get(1).type).isEqualTo(ConstraintExpression.Type.IMPLIES);
    }

    @Test
    @DisplayName("Disgiunzioni annidate appiattite in un unico nodo")
    void testFlattening() {
        ConstraintExpression expr = ConstraintExpressionBuilder.parse("a | (b | c)");

        assertThat(expr.type).isEqualTo(ConstraintExpression.Type.OR);
        assertThat(expr.operands).hasSize(3);
    }

    @Test
    @DisplayName("Sintassi non valida interrompe il parsing")
    void testSyntaxError() {
        assertThatThrownBy(() -> ConstraintExpressionBuilder.parse("a => => b"))
                .isInstanceOf(ParseCancellationException.class);
        assertThatThrownBy(() -> ConstraintExpressionBuilder.parse("a $ b"))
                .isInstanceOf(ParseCancellationException.class);
    }

    @Test
    @DisplayName("Classificazione nelle forme note")
    void testClassification() {
        assertThat(classify("a => !b")).isEqualTo(Constraint.implication(Literal.positive("a"), Literal.negative("b")));
        assertThat(classify("!a")).isEqualTo(Constraint.unit(Literal.negative("a")));

        Constraint equivalence = classify("flag <=> (x | !y)");
        assertThat(equivalence.getType()).isEqualTo(Constraint.Type.EQUIVALENCE_OR);
        assertThat(equivalence.getLhs()).isEqualTo(Literal.positive("flag"));
        assertThat(equivalence.getDisjuncts()).containsExactly(Literal.positive("x"), Literal.negative("y"));

        assertThat(classify("a <=> b").getDisjuncts()).containsExactly(Literal.positive("b"));
    }

    @Test
    @DisplayName("Forme composte restano vincoli RAW con il testo originale")
    void testRawConstraints() {
        Constraint conjunction = classify("a & b => c");
        assertThat(conjunction.getType()).isEqualTo(Constraint.Type.RAW);
        assertThat(conjunction.getRawText()).isEqualTo("a & b => c");
        assertThat(conjunction.referencedFeatures()).isEmpty();

        assertThat(classify("!(a | b)").getType()).isEqualTo(Constraint.Type.RAW);
        assertThat(classify("a <=> (b & c)").getType()).isEqualTo(Constraint.Type.RAW);
    }
}
