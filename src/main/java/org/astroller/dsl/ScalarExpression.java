package org.astroller.dsl;

/**
 * An expression that evaluates to a single integer. Only scalar
 * expressions may appear as arithmetic operands.
 */
public sealed interface ScalarExpression extends RollExpression
        permits Constant, DiceTerm, Modifier, BinaryOp {
}
