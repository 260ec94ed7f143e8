package edu.brandeis.cosi103a.arena.votes;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import edu.brandeis.cosi103a.arena.rating.ComparisonOutcome;
import edu.brandeis.cosi103a.arena.rating.Judgement;

import java.time.Instant;

/**
 * One stored arena vote: who was compared on which paper, the four category judgements,
 * the review texts shown, and when the vote was cast.
 */
public record Vote(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("paper_id") String paperId,
    @JsonProperty("reviewer_a") String reviewerA,
    @JsonProperty("reviewer_b") String reviewerB,
    @JsonProperty("technical_quality") Judgement technicalQuality,
    @JsonProperty("constructiveness") Judgement constructiveness,
    @JsonProperty("clarity") Judgement clarity,
    @JsonProperty("overall_quality") Judgement overallQuality,
    @JsonProperty("review_a") String reviewA,
    @JsonProperty("review_b") String reviewB,
    @JsonProperty("vote_time") @JsonDeserialize(using = VoteTimeDeserializer.class) Instant voteTime
) {
    public Vote {
        if (reviewerA == null || reviewerB == null) {
            throw new IllegalArgumentException("Vote must name both reviewers");
        }
        if (technicalQuality == null || constructiveness == null || clarity == null || overallQuality == null) {
            throw new IllegalArgumentException("Vote must carry a judgement for every category");
        }
        if (voteTime == null) {
            voteTime = Instant.now();
        }
    }

    /**
     * The part of the vote the rating engine consumes.
     */
    public ComparisonOutcome toOutcome() {
        return ComparisonOutcome.of(reviewerA, reviewerB,
            technicalQuality, constructiveness, clarity, overallQuality);
    }
}
