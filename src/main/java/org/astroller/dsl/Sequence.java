package org.astroller.dsl;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Comma-separated rolls evaluated independently, left to right.
 *
 * Example: 2d6, 3 1d4
 */
public record Sequence(List<RollExpression> items) implements RollExpression {

    public Sequence {
        items = List.copyOf(items);
        if (items.size() < 2) {
            throw new RollSemanticException("A sequence needs at least two rolls, got " + items.size());
        }
        for (RollExpression item : items) {
            if (item instanceof Sequence) {
                throw new RollSemanticException("Sequences cannot be nested: " + item.toNotation());
            }
        }
    }

    @Override
    public String toNotation() {
        return items.stream().map(RollExpression::toNotation).collect(Collectors.joining(", "));
    }

    @Override
    public <T> T accept(RollExpressionVisitor<T> visitor) {
        return visitor.visitSequence(this);
    }
}
