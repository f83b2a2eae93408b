package org.astroller.engine.result;

import org.astroller.dsl.BinaryOp;

import java.util.List;
import java.util.Objects;

public record BinaryOpResult(
        BinaryOp expression,
        ScalarResult left,
        ScalarResult right,
        long value) implements ScalarResult {

    public BinaryOpResult {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Objects.requireNonNull(left, "Left result cannot be null");
        Objects.requireNonNull(right, "Right result cannot be null");
    }

    @Override
    public List<ResultNode> children() {
        return List.of(left, right);
    }

    @Override
    public String rollsText() {
        return "(" + left.rollsText() + " " + symbol() + " " + right.rollsText() + ")";
    }

    @Override
    public String reducedText() {
        return operandText(left) + " " + symbol() + " " + operandText(right);
    }

    private String symbol() {
        return expression.operator().symbol();
    }

    private static String operandText(ScalarResult operand) {
        if (operand instanceof BinaryOpResult nested) {
            return "(" + nested.reducedText() + ")";
        }
        return operand.valueText();
    }
}
