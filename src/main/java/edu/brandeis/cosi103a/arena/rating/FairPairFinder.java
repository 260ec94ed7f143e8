package edu.brandeis.cosi103a.arena.rating;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Randomized search for a closely rated pair of competitors.
 *
 * <p>A random A-side competitor is drawn, then a fairness window around its rating grows
 * from zero in fixed steps until some B-side candidate falls inside it. The smallest window
 * that yields a candidate wins, so the result is a reasonably close pair rather than the
 * globally closest one. The number of A-side draws is bounded.
 */
public class FairPairFinder {

    private static final Logger log = LoggerFactory.getLogger(FairPairFinder.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 100;

    private final RatingStore store;
    private final RandomSource random;
    private final int maxAttempts;

    public FairPairFinder(RatingStore store, RandomSource random) {
        this(store, random, DEFAULT_MAX_ATTEMPTS);
    }

    public FairPairFinder(RatingStore store, RandomSource random, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.store = Objects.requireNonNull(store, "store");
        this.random = Objects.requireNonNull(random, "random");
        this.maxAttempts = maxAttempts;
    }

    /**
     * Finds a pair {@code (a, b)} with {@code a} from {@code poolA}, {@code b} from {@code poolB},
     * {@code a != b}, and neither order present in {@code excludePairs}.
     *
     * @param poolA        A-side candidates
     * @param poolB        B-side candidates; may overlap or equal {@code poolA}
     * @param excludePairs pairs that must not be returned, matched in either order
     * @param step         growth of the fairness window per iteration, in rating points
     * @return the pair, or empty when the pools are empty or the attempt budget runs out
     */
    public Optional<CompetitorPair> find(Set<String> poolA, Set<String> poolB,
                                         Set<CompetitorPair> excludePairs, double step) {
        Objects.requireNonNull(poolA, "poolA");
        Objects.requireNonNull(poolB, "poolB");
        Objects.requireNonNull(excludePairs, "excludePairs");
        if (!(step > 0.0) || !Double.isFinite(step)) {
            throw new IllegalArgumentException("Fair match step must be positive, got " + step);
        }
        if (poolA.isEmpty() || poolB.isEmpty()) {
            log.warn("Empty candidate pool (A: {}, B: {}), no pair selected", poolA.size(), poolB.size());
            return Optional.empty();
        }

        List<String> candidatesA = sorted(poolA);
        List<String> candidatesB = sorted(poolB);

        Optional<CompetitorPair> pair = store.isEmpty()
            ? findWithoutHistory(candidatesA, candidatesB, excludePairs)
            : findWithinWindow(candidatesA, candidatesB, excludePairs, step);

        if (pair.isPresent()) {
            log.info("Selected fair pair: {} vs {}", pair.get().first(), pair.get().second());
        } else {
            log.warn("No valid pair found after {} attempts", maxAttempts);
        }
        return pair;
    }

    // Fairness is vacuous without any ratings, so any admissible partner will do.
    private Optional<CompetitorPair> findWithoutHistory(List<String> candidatesA, List<String> candidatesB,
                                                        Set<CompetitorPair> excludePairs) {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            String a = pick(candidatesA);
            List<String> partners = new ArrayList<>();
            for (String b : candidatesB) {
                if (!b.equals(a) && !isExcluded(a, b, excludePairs)) {
                    partners.add(b);
                }
            }
            if (!partners.isEmpty()) {
                return Optional.of(new CompetitorPair(a, pick(partners)));
            }
        }
        return Optional.empty();
    }

    private Optional<CompetitorPair> findWithinWindow(List<String> candidatesA, List<String> candidatesB,
                                                      Set<CompetitorPair> excludePairs, double step) {
        // Register every candidate so the bound below covers their ratings too
        candidatesA.forEach(store::ratingOf);
        candidatesB.forEach(store::ratingOf);
        double maxRating = store.maxRating().orElseThrow();
        double minRating = store.minRating().orElseThrow();

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            String a = pick(candidatesA);
            double base = store.ratingOf(a);

            double maxPossibleDiff = Math.max(maxRating - base, base - minRating);
            long windowSteps = (long) Math.ceil(maxPossibleDiff / step);

            // Window 0 first, for competitors sharing identical ratings
            for (long i = 0; i <= windowSteps; i++) {
                double window = i * step;
                List<String> eligible = new ArrayList<>();
                for (String b : candidatesB) {
                    if (!b.equals(a)
                            && Math.abs(store.ratingOf(b) - base) <= window
                            && !isExcluded(a, b, excludePairs)) {
                        eligible.add(b);
                    }
                }
                if (!eligible.isEmpty()) {
                    return Optional.of(new CompetitorPair(a, pick(eligible)));
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isExcluded(String a, String b, Set<CompetitorPair> excludePairs) {
        return excludePairs.contains(new CompetitorPair(a, b)) || excludePairs.contains(new CompetitorPair(b, a));
    }

    private String pick(List<String> candidates) {
        return candidates.get(random.nextInt(candidates.size()));
    }

    private static List<String> sorted(Collection<String> pool) {
        List<String> list = new ArrayList<>(pool);
        list.sort(null);
        return list;
    }
}
