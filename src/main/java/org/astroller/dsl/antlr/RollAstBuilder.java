package org.astroller.dsl.antlr;

import org.antlr.v4.runtime.Token;
import org.astroller.dsl.BinaryOp;
import org.astroller.dsl.Constant;
import org.astroller.dsl.DiceTerm;
import org.astroller.dsl.ListExpansion;
import org.astroller.dsl.Modifier;
import org.astroller.dsl.RollExpression;
import org.astroller.dsl.RollSemanticException;
import org.astroller.dsl.ScalarExpression;
import org.astroller.dsl.Sequence;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ANTLR visitor that converts the parse tree to the evaluation tree.
 *
 * The grammar structure:
 * - roll: listExpression (COMMA listExpression)* EOF
 * - listExpression: REPEAT listExpression | expression
 * - expression: parenthesized | multiplicative | additive | dice | constant
 *
 * Value checks (positive counts and sides, modifier counts within the dice
 * count, scalar arithmetic operands) happen here, so an invalid roll fails
 * before any dice are rolled.
 *
 * Parentheses, repeat counts and arithmetic operations each add one level
 * of nesting; rolls nested deeper than {@link #MAX_DEPTH} are rejected.
 */
public class RollAstBuilder extends RollBaseVisitor<RollExpression> {

    public static final int MAX_DEPTH = 256;

    private static final Pattern DICE_PATTERN = Pattern.compile("(\\d*)[dD](\\d+|[fF])");
    private static final Pattern MODIFIER_PATTERN = Pattern.compile("([kKdD][hHlL])(\\d+)");

    private int depth;

    // ========================================
    // ENTRY POINT
    // ========================================

    @Override
    public RollExpression visitRoll(RollParser.RollContext ctx) {
        List<RollExpression> items = new ArrayList<>();
        for (RollParser.ListExpressionContext item : ctx.listExpression()) {
            items.add(visit(item));
        }
        if (items.size() == 1) {
            return items.get(0);
        }
        return new Sequence(items);
    }

    // ========================================
    // LIST EXPANSION
    // ========================================

    @Override
    public RollExpression visitRepeatedExpression(RollParser.RepeatedExpressionContext ctx) {
        int count = parseInt(ctx.REPEAT().getText().trim(), "Repeat count");
        return nested(() -> new ListExpansion(count, visit(ctx.listExpression())));
    }

    @Override
    public RollExpression visitSingleExpression(RollParser.SingleExpressionContext ctx) {
        return visit(ctx.expression());
    }

    // ========================================
    // ARITHMETIC
    // ========================================

    @Override
    public RollExpression visitParenthesizedExpression(RollParser.ParenthesizedExpressionContext ctx) {
        // Parentheses only group; a list inside them is rejected by the operand check
        return nested(() -> visit(ctx.listExpression()));
    }

    @Override
    public RollExpression visitMultiplicativeExpression(RollParser.MultiplicativeExpressionContext ctx) {
        return binary(ctx.left, ctx.op, ctx.right);
    }

    @Override
    public RollExpression visitAdditiveExpression(RollParser.AdditiveExpressionContext ctx) {
        return binary(ctx.left, ctx.op, ctx.right);
    }

    private BinaryOp binary(RollParser.ExpressionContext left, Token op, RollParser.ExpressionContext right) {
        return nested(() -> new BinaryOp(
                BinaryOp.Operator.fromSymbol(op.getText()),
                operand(left),
                operand(right)));
    }

    private <T> T nested(Supplier<T> body) {
        if (depth >= MAX_DEPTH) {
            throw new RollSemanticException("Roll is nested deeper than " + MAX_DEPTH + " levels");
        }
        depth++;
        try {
            return body.get();
        } finally {
            depth--;
        }
    }

    private ScalarExpression operand(RollParser.ExpressionContext ctx) {
        RollExpression expression = visit(ctx);
        if (expression instanceof ScalarExpression scalar) {
            return scalar;
        }
        throw new RollSemanticException(
                "List expansion cannot be used as an arithmetic operand: " + expression.toNotation());
    }

    // ========================================
    // DICE & CONSTANTS
    // ========================================

    @Override
    public RollExpression visitDiceExpression(RollParser.DiceExpressionContext ctx) {
        DiceTerm dice = diceTerm(ctx.DICE().getText());
        if (ctx.modifier() == null) {
            return dice;
        }

        String text = ctx.modifier().MODIFIER().getText();
        Matcher matcher = MODIFIER_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new RollSemanticException("Invalid dice modifier: " + text);
        }
        Modifier.Kind kind = Modifier.Kind.fromCode(matcher.group(1));
        int count = parseInt(matcher.group(2), "Modifier count");
        return new Modifier(kind, count, dice);
    }

    private DiceTerm diceTerm(String text) {
        Matcher matcher = DICE_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new RollSemanticException("Invalid dice term: " + text);
        }
        // "d20" rolls a single die
        int count = matcher.group(1).isEmpty() ? 1 : parseInt(matcher.group(1), "Dice count");
        String sides = matcher.group(2);
        if (sides.equalsIgnoreCase("f")) {
            return DiceTerm.fudge(count);
        }
        return DiceTerm.of(count, parseInt(sides, "Dice sides"));
    }

    @Override
    public RollExpression visitConstantExpression(RollParser.ConstantExpressionContext ctx) {
        String text = (ctx.MINUS() != null ? "-" : "") + ctx.INTEGER().getText();
        try {
            return new Constant(Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw new RollSemanticException("Integer constant out of range: " + text, e);
        }
    }

    private static int parseInt(String text, String what) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new RollSemanticException(what + " out of range: " + text, e);
        }
    }
}
