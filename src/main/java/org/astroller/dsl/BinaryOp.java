package org.astroller.dsl;

import java.util.Objects;

/**
 * Binary arithmetic: left op right (e.g. 2d20 kh1 + 8, 3d6 * 2)
 */
public record BinaryOp(
        Operator operator,
        ScalarExpression left,
        ScalarExpression right) implements ScalarExpression {

    public enum Operator {
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Operator fromSymbol(String symbol) {
            for (Operator operator : values()) {
                if (operator.symbol.equals(symbol)) {
                    return operator;
                }
            }
            throw new IllegalArgumentException("Unknown binary operator: " + symbol);
        }
    }

    public BinaryOp {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    @Override
    public String toNotation() {
        return "(" + left.toNotation() + " " + operator.symbol() + " " + right.toNotation() + ")";
    }

    @Override
    public <T> T accept(RollExpressionVisitor<T> visitor) {
        return visitor.visitBinaryOp(this);
    }
}
