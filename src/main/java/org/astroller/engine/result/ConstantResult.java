package org.astroller.engine.result;

import org.astroller.dsl.Constant;

import java.util.List;

public record ConstantResult(Constant expression) implements ScalarResult {

    @Override
    public long value() {
        return expression.value();
    }

    @Override
    public List<ResultNode> children() {
        return List.of();
    }

    @Override
    public String rollsText() {
        return valueText();
    }

    @Override
    public String reducedText() {
        return valueText();
    }
}
