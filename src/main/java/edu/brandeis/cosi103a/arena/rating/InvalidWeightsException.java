package edu.brandeis.cosi103a.arena.rating;

/**
 * Thrown when category weights are out of range or do not sum to one.
 */
public class InvalidWeightsException extends IllegalArgumentException {
    public InvalidWeightsException(String message) {
        super(message);
    }
}
