package org.fmverify.io;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.fmverify.antlr.FeatureConstraintBaseVisitor;
import org.fmverify.antlr.FeatureConstraintLexer;
import org.fmverify.antlr.FeatureConstraintParser;
import org.fmverify.antlr.FeatureConstraintParser.AndContext;
import org.fmverify.antlr.FeatureConstraintParser.ConstraintLineContext;
import org.fmverify.antlr.FeatureConstraintParser.IdContext;
import org.fmverify.antlr.FeatureConstraintParser.IffContext;
import org.fmverify.antlr.FeatureConstraintParser.ImpliesContext;
import org.fmverify.antlr.FeatureConstraintParser.NotContext;
import org.fmverify.antlr.FeatureConstraintParser.OrContext;
import org.fmverify.antlr.FeatureConstraintParser.ParContext;
import org.fmverify.antlr.FeatureConstraintParser.VarContext;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * VISITOR VINCOLI - Conversione da albero sintattico ANTLR a {@link ConstraintExpression}
 *
 * OPERATORI (precedenza crescente):
 * - Biimplicazione (<=>): catene A <=> B <=> C annidate a sinistra
 * - Implicazione (=>): associativa a destra
 * - Disgiunzione (|) e congiunzione (&): n-arie, appiattite
 * - Negazione (!): unaria
 *
 * A differenza della conversione CNF, implicazioni e biimplicazioni sono conservate:
 * la forma scritta serve a classificare il vincolo.
 */
public class ConstraintExpressionBuilder extends FeatureConstraintBaseVisitor<ConstraintExpression> {

    private static final Logger LOGGER = Logger.getLogger(ConstraintExpressionBuilder.class.getName());

    /**
     * Interpreta una riga di vincolo.
     *
     * @param text testo del vincolo
     * @return albero dell'espressione
     * @throws ParseCancellationException al primo errore lessicale o sintattico
     */
    public static ConstraintExpression parse(String text) {
        FeatureConstraintLexer lexer = new FeatureConstraintLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(FailFastErrorListener.INSTANCE);

        FeatureConstraintParser parser = new FeatureConstraintParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(FailFastErrorListener.INSTANCE);

        return new ConstraintExpressionBuilder().visit(parser.constraintLine());
    }

    @Override
    public ConstraintExpression visitConstraintLine(ConstraintLineContext ctx) {
        return visit(ctx.biconditional());
    }

    @Override
    public ConstraintExpression visitIff(IffContext ctx) {
        ConstraintExpression result = visit(ctx.implication(0));
        for (int i = 1; i < ctx.implication().size(); i++) {
            result = ConstraintExpression.of(ConstraintExpression.Type.IFF, List.of(result, visit(ctx.implication(i))));
        }
        return result;
    }

    @Override
    public ConstraintExpression visitImplies(ImpliesContext ctx) {
        ConstraintExpression left = visit(ctx.disjunction());
        if (ctx.implication() == null) {
            return left;
        }
        return ConstraintExpression.of(ConstraintExpression.Type.IMPLIES, List.of(left, visit(ctx.implication())));
    }

    @Override
    public ConstraintExpression visitOr(OrContext ctx) {
        return collect(ConstraintExpression.Type.OR, ctx.conjunction().stream().map(this::visit).toList());
    }

    @Override
    public ConstraintExpression visitAnd(AndContext ctx) {
        return collect(ConstraintExpression.Type.AND, ctx.negation().stream().map(this::visit).toList());
    }

    @Override
    public ConstraintExpression visitNot(NotContext ctx) {
        return ConstraintExpression.not(visit(ctx.negation()));
    }

    @Override
    public ConstraintExpression visitVar(VarContext ctx) {
        return visit(ctx.atom());
    }

    @Override
    public ConstraintExpression visitPar(ParContext ctx) {
        return visit(ctx.biconditional());
    }

    @Override
    public ConstraintExpression visitId(IdContext ctx) {
        return ConstraintExpression.atom(ctx.IDENTIFIER().getText());
    }

    /**
     * Costruisce un nodo n-ario appiattendo gli operandi dello stesso tipo.
     */
    private ConstraintExpression collect(ConstraintExpression.Type type, List<ConstraintExpression> parts) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        List<ConstraintExpression> flat = new ArrayList<>();
        for (ConstraintExpression part : parts) {
            if (part.type == type) {
                flat.addAll(part.operands);
            } else {
                flat.add(part);
            }
        }
        LOGGER.finest("Nodo " + type + " con " + flat.size() + " operandi");
        return ConstraintExpression.of(type, flat);
    }

    /**
     * Interrompe il parsing al primo errore, riportando la colonna.
     */
    private static final class FailFastErrorListener extends BaseErrorListener {
        static final FailFastErrorListener INSTANCE = new FailFastErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
                                String msg, RecognitionException e) {
            throw new ParseCancellationException("colonna " + (charPositionInLine + 1) + ": " + msg);
        }
    }
}
