package org.astroller.engine.result;

import org.astroller.dsl.DiceTerm;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Raw rolls of a dice term; the value is their sum.
 */
public record DiceTermResult(DiceTerm expression, List<Roll> rolls) implements ScalarResult {

    public DiceTermResult {
        Objects.requireNonNull(expression, "Expression cannot be null");
        rolls = List.copyOf(rolls);
        if (rolls.size() != expression.count()) {
            throw new IllegalArgumentException(
                    expression.toNotation() + " needs " + expression.count() + " rolls, got " + rolls.size());
        }
    }

    @Override
    public long value() {
        long sum = 0;
        for (Roll roll : rolls) {
            sum += roll.value();
        }
        return sum;
    }

    @Override
    public List<ResultNode> children() {
        return List.of();
    }

    @Override
    public String rollsText() {
        return formatRolls(rolls);
    }

    @Override
    public String reducedText() {
        return valueText();
    }

    static String formatRolls(List<Roll> rolls) {
        return rolls.stream().map(Roll::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
