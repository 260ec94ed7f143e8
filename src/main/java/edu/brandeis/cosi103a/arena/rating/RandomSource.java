package edu.brandeis.cosi103a.arena.rating;

import java.util.Random;

/**
 * Source of uniform random choices. Tests supply scripted sequences.
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * Returns a uniformly distributed value in {@code [0, bound)}.
     */
    int nextInt(int bound);

    static RandomSource from(Random random) {
        return random::nextInt;
    }
}
