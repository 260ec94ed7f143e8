package edu.brandeis.cosi103a.arena.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What the visitor sees: a paper and two anonymous reviews of it.
 */
public record ComparisonView(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("paperPosition") int paperPosition,
    @JsonProperty("paperId") String paperId,
    @JsonProperty("paperTitle") String paperTitle,
    @JsonProperty("pdfPath") String pdfPath,
    @JsonProperty("reviewA") String reviewA,
    @JsonProperty("reviewB") String reviewB,
    @JsonProperty("votesCast") int votesCast
) {}
