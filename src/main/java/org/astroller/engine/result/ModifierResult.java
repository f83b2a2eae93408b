package org.astroller.engine.result;

import org.astroller.dsl.Modifier;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Result of a keep/drop modifier. The dice result keeps every roll in its
 * original order; {@code keptIndices} says which of them count.
 *
 * @param expression  The modifier
 * @param dice        The unfiltered dice result
 * @param keptIndices Positions in {@code dice.rolls()} of the kept rolls, ascending
 */
public record ModifierResult(
        Modifier expression,
        DiceTermResult dice,
        List<Integer> keptIndices) implements ScalarResult {

    public ModifierResult {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Objects.requireNonNull(dice, "Dice result cannot be null");
        List<Integer> sorted = new ArrayList<>(keptIndices);
        sorted.sort(null);
        keptIndices = List.copyOf(sorted);

        int rollCount = dice.rolls().size();
        if (new HashSet<>(keptIndices).size() != keptIndices.size()) {
            throw new IllegalArgumentException("Kept roll indices must be distinct: " + keptIndices);
        }
        for (int index : keptIndices) {
            if (index < 0 || index >= rollCount) {
                throw new IllegalArgumentException(
                        "Kept roll index " + index + " outside [0, " + rollCount + ")");
            }
        }
        int expected = expression.kind().keep() ? expression.count() : rollCount - expression.count();
        if (keptIndices.size() != expected) {
            throw new IllegalArgumentException(
                    expression.toNotation() + " keeps " + expected + " rolls, got " + keptIndices.size());
        }
    }

    /**
     * @return The kept rolls in original roll order
     */
    public List<Roll> keptRolls() {
        List<Roll> kept = new ArrayList<>(keptIndices.size());
        for (int index : keptIndices) {
            kept.add(dice.rolls().get(index));
        }
        return kept;
    }

    @Override
    public long value() {
        long sum = 0;
        for (Roll roll : keptRolls()) {
            sum += roll.value();
        }
        return sum;
    }

    @Override
    public List<Roll> rolls() {
        return dice.rolls();
    }

    @Override
    public List<ResultNode> children() {
        return List.of(dice);
    }

    @Override
    public String rollsText() {
        return dice.rollsText();
    }

    @Override
    public String reducedText() {
        return valueText();
    }
}
