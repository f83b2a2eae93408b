package org.astroller.engine.result;

import org.astroller.dsl.RollExpression;

import java.util.List;

/**
 * Result of evaluating one {@link RollExpression}. The result tree mirrors the
 * evaluation tree node for node and is never modified after construction.
 *
 * Type hierarchy:
 * ResultNode
 * ├── ScalarResult (ConstantResult, DiceTermResult, ModifierResult, BinaryOpResult)
 * ├── ListExpansionResult
 * └── SequenceResult
 */
public sealed interface ResultNode
        permits ScalarResult, ListExpansionResult, SequenceResult {

    /**
     * @return The expression this node is the result of
     */
    RollExpression expression();

    /**
     * @return Child results, in the order of the expression's children
     */
    List<ResultNode> children();

    /**
     * @return Raw die outcomes in roll order; empty when no dice were rolled at this node
     */
    default List<Roll> rolls() {
        return List.of();
    }

    /**
     * @return The value formatted for display, e.g. "21" or "[21, 26]"
     */
    String valueText();

    /**
     * Renders the computation trace of this result.
     */
    default String render() {
        return ResultRenderer.render(this);
    }
}
