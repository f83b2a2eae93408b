package org.astroller.dsl;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.astroller.dsl.antlr.RollAstBuilder;
import org.astroller.dsl.antlr.RollLexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Dice-notation parser using the ANTLR-generated lexer and parser.
 *
 * Parsing happens in two steps:
 * - {@link #parseTree(String)}: text to concrete parse tree (syntax errors)
 * - {@link #transform(org.astroller.dsl.antlr.RollParser.RollContext)}: parse
 * tree to evaluation tree (semantic errors)
 *
 * {@link #parse(String)} runs both.
 */
public final class RollParser {

    private static final Logger log = LoggerFactory.getLogger(RollParser.class);

    private RollParser() {
        // Static utility class
    }

    /**
     * Parses a roll string into an evaluation tree.
     *
     * Examples:
     * - 1d20
     * - 2d20 kh1 + 8
     * - 2 2d20 kh1 + 8
     * - 4d6 dl1, 3 1d4
     *
     * @param rollString The roll string
     * @return The evaluation tree
     * @throws RollSyntaxException   if the text does not match the grammar
     * @throws RollSemanticException if the text carries out-of-range values
     */
    public static RollExpression parse(String rollString) {
        RollExpression expression = transform(parseTree(rollString));
        log.debug("Parsed '{}' as {}", rollString, expression.toNotation());
        return expression;
    }

    /**
     * Parses a roll string into the concrete ANTLR parse tree.
     *
     * @param rollString The roll string
     * @return The parse tree rooted at the {@code roll} rule
     * @throws RollSyntaxException   if the text does not match the grammar
     * @throws RollSemanticException if parentheses and repeat counts nest deeper
     *                               than {@link RollAstBuilder#MAX_DEPTH}
     */
    public static org.astroller.dsl.antlr.RollParser.RollContext parseTree(String rollString) {
        RollLexer lexer = new RollLexer(CharStreams.fromString(rollString));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new ErrorListener());

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();
        checkNesting(tokens.getTokens());

        org.astroller.dsl.antlr.RollParser parser = new org.astroller.dsl.antlr.RollParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new ErrorListener());

        return parser.roll();
    }

    /**
     * Transforms a parse tree into a validated evaluation tree.
     *
     * @param tree The parse tree produced by {@link #parseTree(String)}
     * @return The evaluation tree
     * @throws RollSemanticException if the tree carries out-of-range values
     */
    public static RollExpression transform(org.astroller.dsl.antlr.RollParser.RollContext tree) {
        return new RollAstBuilder().visit(tree);
    }

    /**
     * Rejects deep nesting from the tokens alone, since the generated parser
     * recurses once per parenthesis and repeat count.
     */
    private static void checkNesting(List<Token> tokens) {
        Deque<Integer> open = new ArrayDeque<>();
        int depth = 0;
        for (Token token : tokens) {
            switch (token.getType()) {
                case RollLexer.LPAREN -> {
                    open.push(depth);
                    depth++;
                }
                case RollLexer.RPAREN -> depth = open.isEmpty() ? 0 : open.pop();
                case RollLexer.REPEAT -> depth++;
                case RollLexer.COMMA -> depth = open.isEmpty() ? 0 : depth;
                default -> {
                }
            }
            if (depth > RollAstBuilder.MAX_DEPTH) {
                throw new RollSemanticException("Roll is nested deeper than " + RollAstBuilder.MAX_DEPTH
                        + " levels at line " + token.getLine() + ":" + token.getCharPositionInLine());
            }
        }
    }

    /**
     * Error listener that converts ANTLR errors to RollSyntaxException.
     */
    private static class ErrorListener extends BaseErrorListener {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int line, int charPositionInLine, String msg,
                RecognitionException e) {
            throw new RollSyntaxException(msg, line, charPositionInLine);
        }
    }
}
