package edu.brandeis.cosi103a.arena.rating;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RatingStoreTest {

    @Test
    void ratingOf_registersUnseenCompetitor() {
        RatingStore store = new RatingStore(1500.0);
        assertTrue(store.isEmpty());

        assertEquals(1500.0, store.ratingOf("A"));

        assertTrue(store.contains("A"));
        assertEquals(1, store.size());
        assertEquals(0.0, store.voteMassOf("A"));
    }

    @Test
    void minAndMax_trackRatingsOnRecord() {
        RatingStore store = new RatingStore(1500.0);
        assertTrue(store.minRating().isEmpty());

        store.setRating("A", 1450.0);
        store.setRating("B", 1620.0);
        store.ratingOf("C");

        assertEquals(1450.0, store.minRating().getAsDouble());
        assertEquals(1620.0, store.maxRating().getAsDouble());
    }

    @Test
    void ratings_isSnapshotInFirstReferenceOrder() {
        RatingStore store = new RatingStore(1500.0);
        store.ratingOf("b");
        store.ratingOf("a");
        Map<String, Double> snapshot = store.ratings();

        store.setRating("a", 1600.0);

        assertEquals(List.of("b", "a"), List.copyOf(snapshot.keySet()));
        assertEquals(1500.0, snapshot.get("a"));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("c", 1.0));
    }

    @Test
    void clear_dropsRatingsAndVoteMass() {
        RatingStore store = new RatingStore(1500.0);
        store.setRating("A", 1600.0);
        store.addVoteMass("A", 0.75);
        store.addVoteMass("A", 0.5);
        assertEquals(1.25, store.voteMassOf("A"));

        store.clear();

        assertTrue(store.isEmpty());
        assertEquals(0.0, store.voteMassOf("A"));
    }

    @Test
    void nonFiniteInitialRating_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RatingStore(Double.POSITIVE_INFINITY));
    }
}
