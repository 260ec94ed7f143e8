package edu.brandeis.cosi103a.arena.leaderboard;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One leaderboard row, rounded for display.
 */
public record LeaderboardEntry(
    @JsonProperty("rank") int rank,
    @JsonProperty("competitor") String competitor,
    @JsonProperty("score") double score,
    @JsonProperty("ciLower") double ciLower,
    @JsonProperty("ciUpper") double ciUpper,
    @JsonProperty("votes") double votes
) {}
