package edu.brandeis.cosi103a.arena.web;

/**
 * Thrown when a request names an arena session that does not exist or has ended.
 */
public class SessionNotFoundException extends RuntimeException {
    public SessionNotFoundException(String message) {
        super(message);
    }
}
