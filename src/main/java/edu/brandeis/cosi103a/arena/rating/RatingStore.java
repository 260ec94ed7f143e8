package edu.brandeis.cosi103a.arena.rating;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Current rating and cumulative vote mass per competitor.
 * A competitor gets the initial rating the first time it is referenced and keeps an entry
 * until {@link #clear()}.
 */
public class RatingStore {
    private final double initialRating;
    private final Map<String, Double> ratings = new LinkedHashMap<>();
    private final Map<String, Double> voteMass = new LinkedHashMap<>();

    public RatingStore(double initialRating) {
        if (!Double.isFinite(initialRating)) {
            throw new IllegalArgumentException("Initial rating must be finite, got " + initialRating);
        }
        this.initialRating = initialRating;
    }

    public double initialRating() {
        return initialRating;
    }

    /**
     * Rating of the competitor, registering it with the initial rating if unseen.
     */
    public double ratingOf(String competitor) {
        return ratings.computeIfAbsent(competitor, id -> initialRating);
    }

    public boolean contains(String competitor) {
        return ratings.containsKey(competitor);
    }

    public boolean isEmpty() {
        return ratings.isEmpty();
    }

    public int size() {
        return ratings.size();
    }

    void setRating(String competitor, double rating) {
        ratings.put(competitor, rating);
    }

    void addVoteMass(String competitor, double mass) {
        voteMass.merge(competitor, mass, Double::sum);
    }

    public double voteMassOf(String competitor) {
        return voteMass.getOrDefault(competitor, 0.0);
    }

    public OptionalDouble minRating() {
        return ratings.values().stream().mapToDouble(Double::doubleValue).min();
    }

    public OptionalDouble maxRating() {
        return ratings.values().stream().mapToDouble(Double::doubleValue).max();
    }

    /**
     * Immutable snapshot of all ratings on record, in first-reference order.
     */
    public Map<String, Double> ratings() {
        return ImmutableMap.copyOf(ratings);
    }

    public void clear() {
        ratings.clear();
        voteMass.clear();
    }
}
