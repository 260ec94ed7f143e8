package edu.brandeis.cosi103a.arena.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response to a vote: the reviewers behind the reviews just judged, and the next comparison.
 */
public record VoteResult(
    @JsonProperty("reviewerA") String reviewerA,
    @JsonProperty("reviewerB") String reviewerB,
    @JsonProperty("next") ComparisonView next
) {}
