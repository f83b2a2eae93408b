package org.astroller.engine.result;

import org.astroller.dsl.Sequence;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public record SequenceResult(
        Sequence expression,
        List<ResultNode> items) implements ResultNode {

    public SequenceResult {
        Objects.requireNonNull(expression, "Expression cannot be null");
        items = List.copyOf(items);
        if (items.size() != expression.items().size()) {
            throw new IllegalArgumentException(
                    "Sequence of " + expression.items().size() + " rolls got " + items.size() + " results");
        }
    }

    @Override
    public List<ResultNode> children() {
        return items;
    }

    @Override
    public String valueText() {
        return items.stream().map(ResultNode::valueText).collect(Collectors.joining(", ", "[", "]"));
    }
}
