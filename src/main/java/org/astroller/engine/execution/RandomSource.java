package org.astroller.engine.execution;

import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of die outcomes, passed explicitly to the {@link Evaluator}.
 *
 * Implementations need not be thread-safe; concurrent evaluations must each
 * use their own source, or {@link #threadLocal()}.
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * @return A uniformly distributed integer in {@code [lowerInclusive, upperInclusive]}
     */
    int nextInt(int lowerInclusive, int upperInclusive);

    /**
     * Source backed by {@link ThreadLocalRandom}; safe to share between threads.
     */
    static RandomSource threadLocal() {
        return (lower, upper) -> (int) ThreadLocalRandom.current().nextLong(lower, upper + 1L);
    }

    /**
     * Reproducible source: the same seed gives the same rolls.
     */
    static RandomSource seeded(long seed) {
        return of(new Random(seed));
    }

    static RandomSource of(Random random) {
        Objects.requireNonNull(random, "Random cannot be null");
        return (lower, upper) -> lower + random.nextInt(upper - lower + 1);
    }
}
