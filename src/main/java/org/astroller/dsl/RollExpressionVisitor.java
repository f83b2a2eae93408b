package org.astroller.dsl;

/**
 * Visitor over every {@link RollExpression} variant. Adding a variant adds a
 * method here, which forces the evaluator to handle it.
 *
 * @param <T> The visit result type
 */
public interface RollExpressionVisitor<T> {

    T visitConstant(Constant constant);

    T visitDiceTerm(DiceTerm diceTerm);

    T visitModifier(Modifier modifier);

    T visitBinaryOp(BinaryOp binaryOp);

    T visitListExpansion(ListExpansion listExpansion);

    T visitSequence(Sequence sequence);
}
