package org.astroller.dsl;

import java.util.Objects;

/**
 * Evaluates {@code body} independently {@code count} times, producing a list
 * instead of a single value. The body may itself be a list expansion.
 *
 * Example: 2 2d20 kh1 + 8
 */
public record ListExpansion(int count, RollExpression body) implements RollExpression {

    /**
     * Most times a body may be evaluated, counting nested expansions
     * multiplied together.
     */
    public static final int MAX_REPETITIONS = 1_000;

    public ListExpansion {
        Objects.requireNonNull(body, "Body cannot be null");
        if (count < 1) {
            throw new RollSemanticException("Repeat count must be positive, got " + count);
        }
        if (body instanceof Sequence) {
            throw new RollSemanticException("A sequence cannot be repeated: " + body.toNotation());
        }
        long total = (long) count * repetitionsOf(body);
        if (total > MAX_REPETITIONS) {
            throw new RollSemanticException(
                    "Repeat counts must multiply to at most " + MAX_REPETITIONS + ", got " + total);
        }
    }

    /**
     * @return How many times the innermost body is evaluated, e.g. 6 for "2 3 1d6"
     */
    public long totalRepetitions() {
        return (long) count * repetitionsOf(body);
    }

    private static long repetitionsOf(RollExpression body) {
        return body instanceof ListExpansion inner ? inner.totalRepetitions() : 1;
    }

    @Override
    public String toNotation() {
        return count + " " + body.toNotation();
    }

    @Override
    public <T> T accept(RollExpressionVisitor<T> visitor) {
        return visitor.visitListExpansion(this);
    }
}
