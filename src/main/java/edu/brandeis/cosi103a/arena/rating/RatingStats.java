package edu.brandeis.cosi103a.arena.rating;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Leaderboard figures for one competitor.
 *
 * @param rating             current Elo rating
 * @param confidenceInterval heuristic 95% interval around the rating
 * @param voteMass           cumulative weighted win share
 */
public record RatingStats(
    @JsonProperty("rating") double rating,
    @JsonProperty("ci95") ConfidenceInterval confidenceInterval,
    @JsonProperty("votes") double voteMass
) {}
