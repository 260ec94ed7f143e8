package edu.brandeis.cosi103a.arena.rating;

/**
 * Elo arithmetic for multi-category comparisons.
 * The confidence interval is a heuristic (K / sqrt(vote mass)), not a derived Elo bound.
 */
public final class EloRatingCalculator {

    /** Two-sided 95% normal quantile. */
    static final double Z_95 = 1.96;

    private EloRatingCalculator() {}

    /**
     * Expected score of a competitor rated {@code ratingA} against one rated {@code ratingB}.
     */
    public static double expectedScore(double ratingA, double ratingB) {
        return 1.0 / (1.0 + Math.pow(10.0, (ratingB - ratingA) / 400.0));
    }

    /**
     * A's fractional win in [0, 1]: the weighted category scores divided by the actual weight sum.
     */
    public static double normalizedScore(ComparisonOutcome outcome, CategoryWeights weights) {
        double total = 0.0;
        for (Category category : Category.values()) {
            total += weights.weight(category) * outcome.judgement(category).scoreForA();
        }
        return total / weights.sum();
    }

    /**
     * Heuristic 95% confidence interval for a rating backed by the given vote mass.
     */
    public static ConfidenceInterval confidenceInterval(double rating, double voteMass, double kFactor) {
        if (voteMass == 0.0) {
            return new ConfidenceInterval(rating, rating);
        }
        double stdDev = kFactor / Math.sqrt(voteMass);
        double margin = Z_95 * stdDev;
        return new ConfidenceInterval(rating - margin, rating + margin);
    }
}
