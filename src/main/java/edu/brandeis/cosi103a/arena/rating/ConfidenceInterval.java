package edu.brandeis.cosi103a.arena.rating;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Closed rating interval {@code [lower, upper]}.
 */
public record ConfidenceInterval(
    @JsonProperty("lower") double lower,
    @JsonProperty("upper") double upper
) {
    public double width() {
        return upper - lower;
    }

    public boolean contains(double value) {
        return lower <= value && value <= upper;
    }
}
