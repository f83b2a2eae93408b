package org.astroller.engine.result;

import org.astroller.dsl.ScalarExpression;

/**
 * Result of a {@link ScalarExpression}: a single integer value plus the text
 * of each trace layer.
 */
public sealed interface ScalarResult extends ResultNode
        permits ConstantResult, DiceTermResult, ModifierResult, BinaryOpResult {

    @Override
    ScalarExpression expression();

    long value();

    /**
     * @return The expression with raw rolls in place of dice, e.g. "([13, 8] + 8)"
     */
    String rollsText();

    /**
     * @return The expression with values in place of operands, e.g. "13 + 8"
     */
    String reducedText();

    @Override
    default String valueText() {
        return Long.toString(value());
    }
}
