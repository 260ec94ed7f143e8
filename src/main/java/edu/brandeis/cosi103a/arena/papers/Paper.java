package edu.brandeis.cosi103a.arena.papers;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * A paper under review and the reviews each competitor produced for it.
 *
 * @param paperId unique paper identifier
 * @param title   paper title
 * @param pdfPath path of the PDF, relative to the arena's PDF folder
 * @param reviews reviewer id to that reviewer's reviews, in file order
 */
public record Paper(
    String paperId,
    String title,
    String pdfPath,
    ImmutableMap<String, ImmutableList<String>> reviews
) {

    /**
     * Reviewers with at least one non-blank review, in file order.
     * This is the candidate pool for fair-pair selection on this paper.
     */
    public List<String> validReviewerIds() {
        ImmutableList.Builder<String> ids = ImmutableList.builder();
        for (Map.Entry<String, ImmutableList<String>> entry : reviews.entrySet()) {
            if (entry.getValue().stream().anyMatch(review -> !review.isBlank())) {
                ids.add(entry.getKey());
            }
        }
        return ids.build();
    }

    /**
     * Non-blank reviews written by the given reviewer; empty if the reviewer is unknown.
     */
    public List<String> validReviews(String reviewerId) {
        ImmutableList<String> all = reviews.getOrDefault(reviewerId, ImmutableList.of());
        return all.stream().filter(review -> !review.isBlank()).collect(ImmutableList.toImmutableList());
    }
}
