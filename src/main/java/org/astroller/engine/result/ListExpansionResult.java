package org.astroller.engine.result;

import org.astroller.dsl.ListExpansion;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One result subtree per repetition of a list expansion.
 */
public record ListExpansionResult(
        ListExpansion expression,
        List<ResultNode> repetitions) implements ResultNode {

    public ListExpansionResult {
        Objects.requireNonNull(expression, "Expression cannot be null");
        repetitions = List.copyOf(repetitions);
        if (repetitions.size() != expression.count()) {
            throw new IllegalArgumentException(
                    expression.toNotation() + " needs " + expression.count()
                            + " repetitions, got " + repetitions.size());
        }
    }

    /**
     * @return The value of each repetition
     * @throws IllegalStateException if the repeated body is itself a list
     */
    public List<Long> scalarValues() {
        List<Long> values = new ArrayList<>(repetitions.size());
        for (ResultNode repetition : repetitions) {
            if (!(repetition instanceof ScalarResult scalar)) {
                throw new IllegalStateException("Repetitions of " + expression.toNotation() + " are not scalar");
            }
            values.add(scalar.value());
        }
        return values;
    }

    @Override
    public List<ResultNode> children() {
        return repetitions;
    }

    @Override
    public String valueText() {
        return repetitions.stream().map(ResultNode::valueText).collect(Collectors.joining(", ", "[", "]"));
    }
}
