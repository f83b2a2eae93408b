package org.astroller.engine.execution;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Test double that hands out a fixed sequence of rolls and records the
 * bounds of every draw.
 */
public final class ScriptedRandomSource implements RandomSource {

    private final Deque<Integer> values = new ArrayDeque<>();
    private final List<int[]> draws = new ArrayList<>();

    public ScriptedRandomSource(int... values) {
        for (int value : values) {
            this.values.add(value);
        }
    }

    @Override
    public int nextInt(int lowerInclusive, int upperInclusive) {
        draws.add(new int[] {lowerInclusive, upperInclusive});
        if (values.isEmpty()) {
            throw new IllegalStateException("No scripted roll left for draw " + draws.size());
        }
        return values.removeFirst();
    }

    /**
     * @return The [lower, upper] bounds of each draw made so far
     */
    public List<int[]> draws() {
        return draws;
    }

    public int remaining() {
        return values.size();
    }
}
