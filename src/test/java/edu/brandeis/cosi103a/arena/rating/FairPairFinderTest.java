package edu.brandeis.cosi103a.arena.rating;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FairPairFinder, using scripted random sources where the pick matters.
 */
class FairPairFinderTest {

    private static final RandomSource FIRST = bound -> 0;
    private static final RandomSource LAST = bound -> bound - 1;

    private RatingStore store;

    @BeforeEach
    void setUp() {
        store = new RatingStore(1500.0);
    }

    @Test
    void picksFromSmallestWindowThatYieldsCandidates() {
        store.setRating("A", 1500.0);
        store.setRating("B", 1600.0);
        store.setRating("C", 1400.0);

        // Both B and C first appear at window 100; the sorted list is [B, C]
        Optional<CompetitorPair> first = new FairPairFinder(store, FIRST)
            .find(Set.of("A"), Set.of("B", "C"), Set.of(), 10.0);
        Optional<CompetitorPair> last = new FairPairFinder(store, LAST)
            .find(Set.of("A"), Set.of("B", "C"), Set.of(), 10.0);

        assertEquals(Optional.of(new CompetitorPair("A", "B")), first);
        assertEquals(Optional.of(new CompetitorPair("A", "C")), last);
    }

    @Test
    void identicalRatings_matchAtWindowZero() {
        store.setRating("A", 1500.0);
        store.setRating("B", 1505.0);
        store.setRating("C", 1500.0);
        store.setRating("D", 1700.0);

        for (RandomSource random : List.of(FIRST, LAST)) {
            Optional<CompetitorPair> pair = new FairPairFinder(store, random)
                .find(Set.of("A"), Set.of("B", "C", "D"), Set.of(), 10.0);
            assertEquals(Optional.of(new CompetitorPair("A", "C")), pair,
                "Only C shares A's rating exactly");
        }
    }

    @Test
    void closerCandidateWinsOverFartherOne() {
        store.setRating("A", 1500.0);
        store.setRating("near", 1512.0);
        store.setRating("far", 1700.0);

        Optional<CompetitorPair> pair = new FairPairFinder(store, LAST)
            .find(Set.of("A"), Set.of("far", "near"), Set.of(), 10.0);

        assertEquals(Optional.of(new CompetitorPair("A", "near")), pair);
    }

    @Test
    void excludedPair_isNeverReturnedInEitherOrder() {
        store.setRating("A", 1500.0);
        store.setRating("B", 1500.0);

        FairPairFinder finder = new FairPairFinder(store, RandomSource.from(new Random(3)));

        assertTrue(finder.find(Set.of("A", "B"), Set.of("A", "B"),
            Set.of(new CompetitorPair("B", "A")), 10.0).isEmpty());
        assertTrue(finder.find(Set.of("A", "B"), Set.of("A", "B"),
            Set.of(new CompetitorPair("A", "B")), 10.0).isEmpty());
    }

    @Test
    void exclusionSkipsToNextClosestCandidate() {
        store.setRating("A", 1500.0);
        store.setRating("B", 1500.0);
        store.setRating("C", 1550.0);

        Optional<CompetitorPair> pair = new FairPairFinder(store, FIRST)
            .find(Set.of("A"), Set.of("B", "C"), Set.of(new CompetitorPair("A", "B")), 10.0);

        assertEquals(Optional.of(new CompetitorPair("A", "C")), pair);
    }

    @Test
    void singleCompetitor_neverPairedWithItself() {
        store.setRating("X", 1500.0);

        Optional<CompetitorPair> pair = new FairPairFinder(store, FIRST)
            .find(Set.of("X"), Set.of("X"), Set.of(), 10.0);

        assertTrue(pair.isEmpty());
    }

    @Test
    void emptyPool_returnsEmpty() {
        store.setRating("A", 1500.0);
        FairPairFinder finder = new FairPairFinder(store, FIRST);

        assertTrue(finder.find(Set.of(), Set.of("A"), Set.of(), 10.0).isEmpty());
        assertTrue(finder.find(Set.of("A"), Set.of(), Set.of(), 10.0).isEmpty());
    }

    @Test
    void invalidStep_isRejected() {
        FairPairFinder finder = new FairPairFinder(store, FIRST);

        assertThrows(IllegalArgumentException.class,
            () -> finder.find(Set.of("A"), Set.of("B"), Set.of(), 0.0));
        assertThrows(IllegalArgumentException.class,
            () -> finder.find(Set.of("A"), Set.of("B"), Set.of(), -5.0));
        assertThrows(IllegalArgumentException.class,
            () -> finder.find(Set.of("A"), Set.of("B"), Set.of(), Double.NaN));
    }

    @Test
    void nullPool_isRejected() {
        FairPairFinder finder = new FairPairFinder(store, FIRST);
        assertThrows(NullPointerException.class, () -> finder.find(null, Set.of("B"), Set.of(), 10.0));
    }

    @Test
    void coldStart_returnsDistinctPairWithoutRegisteringRatings() {
        Optional<CompetitorPair> pair = new FairPairFinder(store, RandomSource.from(new Random(11)))
            .find(Set.of("A", "B"), Set.of("A", "B"), Set.of(), 10.0);

        assertTrue(pair.isPresent());
        assertNotEquals(pair.get().first(), pair.get().second());
        assertTrue(store.isEmpty(), "Cold start leaves the store untouched");
    }

    @Test
    void coldStart_honorsExclusions() {
        Optional<CompetitorPair> pair = new FairPairFinder(store, FIRST)
            .find(Set.of("A"), Set.of("B", "C"), Set.of(new CompetitorPair("B", "A")), 10.0);

        assertEquals(Optional.of(new CompetitorPair("A", "C")), pair);
    }

    @Test
    void unseenCandidates_areRegisteredAtInitialRating() {
        store.setRating("A", 1500.0);

        Optional<CompetitorPair> pair = new FairPairFinder(store, FIRST)
            .find(Set.of("A"), Set.of("newcomer"), Set.of(), 10.0);

        assertEquals(Optional.of(new CompetitorPair("A", "newcomer")), pair);
        assertTrue(store.contains("newcomer"));
        assertEquals(1500.0, store.ratingOf("newcomer"));
    }

    @Test
    void attemptBudget_boundsNumberOfDraws() {
        store.setRating("A", 1500.0);
        store.setRating("B", 1500.0);
        AtomicInteger draws = new AtomicInteger();
        RandomSource counting = bound -> {
            draws.incrementAndGet();
            return 0;
        };

        Optional<CompetitorPair> pair = new FairPairFinder(store, counting, 3)
            .find(Set.of("A"), Set.of("B"), Set.of(new CompetitorPair("A", "B")), 10.0);

        assertTrue(pair.isEmpty());
        assertEquals(3, draws.get(), "One A-side draw per attempt");
    }

    @Test
    void maxAttemptsBelowOne_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FairPairFinder(store, FIRST, 0));
    }

    @Test
    void randomizedPools_neverViolateConstraints() {
        Random setup = new Random(42);
        List<String> competitors = List.of("c0", "c1", "c2", "c3", "c4", "c5", "c6", "c7");
        for (String competitor : competitors) {
            store.setRating(competitor, 1300.0 + setup.nextInt(400));
        }
        FairPairFinder finder = new FairPairFinder(store, RandomSource.from(new Random(99)));

        for (int round = 0; round < 200; round++) {
            Set<String> poolA = randomSubset(competitors, setup);
            Set<String> poolB = randomSubset(competitors, setup);
            Set<CompetitorPair> excluded = new HashSet<>();
            for (int i = 0; i < 4; i++) {
                excluded.add(new CompetitorPair(
                    competitors.get(setup.nextInt(competitors.size())),
                    competitors.get(setup.nextInt(competitors.size()))));
            }

            Optional<CompetitorPair> pair = finder.find(poolA, poolB, excluded, 5.0);

            if (pair.isPresent()) {
                CompetitorPair p = pair.get();
                assertTrue(poolA.contains(p.first()), "First comes from pool A");
                assertTrue(poolB.contains(p.second()), "Second comes from pool B");
                assertNotEquals(p.first(), p.second());
                assertFalse(excluded.contains(p), "Excluded pair returned");
                assertFalse(excluded.contains(p.reversed()), "Reversed excluded pair returned");
            }
        }
    }

    private static Set<String> randomSubset(List<String> competitors, Random random) {
        List<String> subset = new ArrayList<>();
        for (String competitor : competitors) {
            if (random.nextBoolean()) {
                subset.add(competitor);
            }
        }
        if (subset.isEmpty()) {
            subset.add(competitors.get(0));
        }
        return new HashSet<>(subset);
    }
}
