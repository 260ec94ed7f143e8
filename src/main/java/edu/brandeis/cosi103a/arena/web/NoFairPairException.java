package edu.brandeis.cosi103a.arena.web;

/**
 * Thrown when no paper in the registry yields a fair pair of reviewers.
 */
public class NoFairPairException extends RuntimeException {
    public NoFairPairException(String message) {
        super(message);
    }
}
