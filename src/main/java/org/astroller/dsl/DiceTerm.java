package org.astroller.dsl;

/**
 * Rolls {@code count} independent dice.
 *
 * Examples: 2d20, d6 (one die), 4dF (fudge dice over -1..1)
 *
 * @param count Number of dice, at least 1
 * @param sides Number of faces, at least 1; 3 for fudge dice
 * @param fudge Whether the dice are fudge dice
 */
public record DiceTerm(int count, int sides, boolean fudge) implements ScalarExpression {

    public static final int FUDGE_SIDES = 3;

    /**
     * Most dice a single term may roll.
     */
    public static final int MAX_COUNT = 1_000;

    public DiceTerm {
        if (count < 1) {
            throw new RollSemanticException("Number of dice must be positive, got " + count);
        }
        if (count > MAX_COUNT) {
            throw new RollSemanticException("Number of dice must be at most " + MAX_COUNT + ", got " + count);
        }
        if (sides < 1) {
            throw new RollSemanticException("Number of sides must be positive, got " + sides);
        }
        if (fudge && sides != FUDGE_SIDES) {
            throw new RollSemanticException("Fudge dice have " + FUDGE_SIDES + " sides, got " + sides);
        }
    }

    public static DiceTerm of(int count, int sides) {
        return new DiceTerm(count, sides, false);
    }

    public static DiceTerm fudge(int count) {
        return new DiceTerm(count, FUDGE_SIDES, true);
    }

    /**
     * @return The smallest face value
     */
    public int lowerBound() {
        return fudge ? -1 : 1;
    }

    /**
     * @return The largest face value
     */
    public int upperBound() {
        return fudge ? 1 : sides;
    }

    @Override
    public String toNotation() {
        return count + "d" + (fudge ? "F" : Integer.toString(sides));
    }

    @Override
    public <T> T accept(RollExpressionVisitor<T> visitor) {
        return visitor.visitDiceTerm(this);
    }
}
