package org.astroller.dsl;

/**
 * Sealed interface representing a node of the evaluation tree built from a
 * parsed roll string. Nodes are immutable and may be evaluated any number
 * of times.
 *
 * Type hierarchy:
 * RollExpression
 * ├── ScalarExpression (Constant, DiceTerm, Modifier, BinaryOp)
 * ├── ListExpansion (count + repeated body)
 * └── Sequence (comma-separated top-level rolls)
 */
public sealed interface RollExpression
        permits ScalarExpression, ListExpansion, Sequence {

    /**
     * @return The expression rendered back into dice notation
     */
    String toNotation();

    <T> T accept(RollExpressionVisitor<T> visitor);
}
