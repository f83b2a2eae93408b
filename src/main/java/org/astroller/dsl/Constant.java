package org.astroller.dsl;

/**
 * Integer literal, e.g. 8 or -3.
 *
 * @param value The literal value
 */
public record Constant(long value) implements ScalarExpression {

    @Override
    public String toNotation() {
        return Long.toString(value);
    }

    @Override
    public <T> T accept(RollExpressionVisitor<T> visitor) {
        return visitor.visitConstant(this);
    }
}
