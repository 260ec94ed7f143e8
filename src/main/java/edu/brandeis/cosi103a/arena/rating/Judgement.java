package edu.brandeis.cosi103a.arena.rating;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A human's verdict for one category of a comparison.
 *
 * <p>Labels are the strings shown on the arena's radio buttons and stored in the vote log.
 * Both-bad scores the same as a tie.
 */
public enum Judgement {
    A_BETTER("👈  A is better", 1.0),
    B_BETTER("👉  B is better", 0.0),
    TIE("🤝  Tie", 0.5),
    BOTH_BAD("👎  Both are bad", 0.5);

    private final String label;
    private final double scoreForA;

    Judgement(String label, double scoreForA) {
        this.label = label;
        this.scoreForA = scoreForA;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Raw score from A's perspective: 1 for a win, 0 for a loss, 0.5 otherwise.
     */
    public double scoreForA() {
        return scoreForA;
    }

    /**
     * Parses a judgement from its label or its constant name.
     *
     * @throws IllegalArgumentException if the value is not one of the four judgements
     */
    @JsonCreator
    public static Judgement fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Judgement must not be null");
        }
        for (Judgement judgement : values()) {
            if (judgement.label.equals(value) || judgement.name().equals(value)) {
                return judgement;
            }
        }
        throw new IllegalArgumentException("Unknown judgement: " + value);
    }
}
