package edu.brandeis.cosi103a.arena.rating;

import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Elo ratings for arena competitors, rebuilt by replaying the vote log and updated in place
 * as new votes arrive. Also selects fairly matched pairs for the next comparison.
 *
 * <p>Not thread-safe. Callers sharing an engine must serialize every call.
 */
public class RatingEngine {

    private static final Logger log = LoggerFactory.getLogger(RatingEngine.class);

    public static final double DEFAULT_K_FACTOR = 32.0;
    public static final double DEFAULT_INITIAL_RATING = 1500.0;
    public static final double DEFAULT_FAIR_MATCH_STEP = 10.0;

    private final CategoryWeights weights;
    private final double kFactor;
    private final RatingStore store;
    private final FairPairFinder pairFinder;

    /**
     * Engine with default weights, K-factor 32 and initial rating 1500.
     */
    public RatingEngine() {
        this(CategoryWeights.DEFAULTS, DEFAULT_K_FACTOR, DEFAULT_INITIAL_RATING);
    }

    public RatingEngine(CategoryWeights weights, double kFactor, double initialRating) {
        this(weights, kFactor, initialRating, RandomSource.from(new Random()));
    }

    /**
     * @param weights       category weights, already validated by {@link CategoryWeights}
     * @param kFactor       maximum rating swing per comparison
     * @param initialRating rating given to a competitor on first reference
     * @param random        randomness for pair selection
     */
    public RatingEngine(CategoryWeights weights, double kFactor, double initialRating, RandomSource random) {
        this.weights = Objects.requireNonNull(weights, "weights");
        if (!(kFactor > 0.0) || !Double.isFinite(kFactor)) {
            throw new IllegalArgumentException("K-factor must be positive, got " + kFactor);
        }
        this.kFactor = kFactor;
        this.store = new RatingStore(initialRating);
        this.pairFinder = new FairPairFinder(store, random);
        log.info("RatingEngine initialized with k_factor={}, initial_rating={}", kFactor, initialRating);
    }

    /**
     * Discards all ratings and vote mass, then applies each outcome in order.
     */
    public void replay(List<ComparisonOutcome> history) {
        Objects.requireNonNull(history, "history");
        store.clear();
        for (ComparisonOutcome outcome : history) {
            update(outcome);
        }
        log.info("Ratings computed from {} comparisons for {} competitors", history.size(), store.size());
    }

    /**
     * Applies one comparison outcome to both competitors' ratings and vote mass.
     *
     * @throws IllegalArgumentException if both sides are the same competitor
     */
    public void update(ComparisonOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        String a = outcome.competitorA();
        String b = outcome.competitorB();
        if (a.equals(b)) {
            throw new IllegalArgumentException("Self-comparison is not allowed: " + a);
        }

        double score = EloRatingCalculator.normalizedScore(outcome, weights);
        double ratingA = store.ratingOf(a);
        double ratingB = store.ratingOf(b);

        double expectedA = EloRatingCalculator.expectedScore(ratingA, ratingB);
        double expectedB = 1.0 - expectedA;

        store.setRating(a, ratingA + kFactor * (score - expectedA));
        store.setRating(b, ratingB + kFactor * ((1.0 - score) - expectedB));
        store.addVoteMass(a, score);
        store.addVoteMass(b, 1.0 - score);

        log.debug("Updated ratings: {} ({} -> {}), {} ({} -> {})",
            a, ratingA, store.ratingOf(a), b, ratingB, store.ratingOf(b));
    }

    /**
     * Selects a fairly matched pair; see {@link FairPairFinder#find}.
     */
    public Optional<CompetitorPair> findFairPair(Set<String> poolA, Set<String> poolB,
                                                 Set<CompetitorPair> excludePairs, double step) {
        return pairFinder.find(poolA, poolB, excludePairs, step);
    }

    /**
     * Selects a fairly matched pair from one pool, with no exclusions and the default step.
     */
    public Optional<CompetitorPair> findFairPair(Set<String> pool) {
        return findFairPair(pool, pool, Set.of(), DEFAULT_FAIR_MATCH_STEP);
    }

    /**
     * Rating, vote mass and confidence interval for every competitor on record.
     */
    public Map<String, RatingStats> stats() {
        ImmutableMap.Builder<String, RatingStats> stats = ImmutableMap.builder();
        for (Map.Entry<String, Double> entry : store.ratings().entrySet()) {
            String competitor = entry.getKey();
            double rating = entry.getValue();
            double mass = store.voteMassOf(competitor);
            stats.put(competitor, new RatingStats(
                rating, EloRatingCalculator.confidenceInterval(rating, mass, kFactor), mass));
        }
        return stats.build();
    }

    /**
     * Current rating of a competitor, registering it with the initial rating if unseen.
     */
    public double rating(String competitor) {
        return store.ratingOf(Objects.requireNonNull(competitor, "competitor"));
    }

    /**
     * Immutable snapshot of all ratings on record.
     */
    public Map<String, Double> ratings() {
        return store.ratings();
    }

    public double expectedScore(double ratingA, double ratingB) {
        return EloRatingCalculator.expectedScore(ratingA, ratingB);
    }

    public CategoryWeights weights() {
        return weights;
    }

    public double kFactor() {
        return kFactor;
    }

    public double initialRating() {
        return store.initialRating();
    }
}
