package edu.brandeis.cosi103a.arena.rating;

import java.util.Objects;

/**
 * Two competitors selected for a comparison. Order is the A/B presentation order.
 */
public record CompetitorPair(String first, String second) {

    public CompetitorPair {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
    }

    /**
     * True if this pair names the same two competitors as {@code a} and {@code b}, in either order.
     */
    public boolean sameCompetitors(String a, String b) {
        return (first.equals(a) && second.equals(b)) || (first.equals(b) && second.equals(a));
    }

    public CompetitorPair reversed() {
        return new CompetitorPair(second, first);
    }
}
