package edu.brandeis.cosi103a.arena.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.arena.rating.Judgement;
import jakarta.validation.constraints.NotNull;

/**
 * DTO for a visitor's judgement of the comparison on screen.
 */
public record VoteRequest(
    @JsonProperty("technical_quality") @NotNull Judgement technicalQuality,
    @JsonProperty("constructiveness") @NotNull Judgement constructiveness,
    @JsonProperty("clarity") @NotNull Judgement clarity,
    @JsonProperty("overall_quality") @NotNull Judgement overallQuality
) {}
