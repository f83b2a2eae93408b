package org.astroller.engine.result;

/**
 * One die outcome.
 *
 * @param value The face rolled
 * @param sides The number of faces of the die (3 for a fudge die)
 */
public record Roll(int value, int sides) {

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
