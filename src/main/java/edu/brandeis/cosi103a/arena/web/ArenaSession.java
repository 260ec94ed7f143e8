package edu.brandeis.cosi103a.arena.web;

import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory state of one visitor's arena session: the comparison on screen and the review
 * pairs already voted on for the current paper. Not persisted.
 */
public class ArenaSession {

    /**
     * The comparison currently shown. Reviewer ids stay hidden from the visitor until they vote.
     */
    public record Comparison(
        int paperPosition,
        String paperId,
        String paperTitle,
        String pdfPath,
        String reviewerA,
        String reviewerB,
        String reviewA,
        String reviewB
    ) {}

    private final String id;
    private final Instant startTime;
    private final String ipAddress;
    private final String userAgent;
    private final Set<Set<String>> votedReviewPairs = new HashSet<>();
    private Comparison current;
    private Instant endTime;
    private int votesCast;

    public ArenaSession(String id, Instant startTime, String ipAddress, String userAgent) {
        this.id = id;
        this.startTime = startTime;
        this.ipAddress = ipAddress;
        this.userAgent = userAgent;
    }

    public String id() {
        return id;
    }

    public Instant startTime() {
        return startTime;
    }

    public Optional<Instant> endTime() {
        return Optional.ofNullable(endTime);
    }

    public String ipAddress() {
        return ipAddress;
    }

    public String userAgent() {
        return userAgent;
    }

    public int votesCast() {
        return votesCast;
    }

    public Optional<Comparison> current() {
        return Optional.ofNullable(current);
    }

    void show(Comparison comparison) {
        this.current = comparison;
    }

    /**
     * Shows a comparison on a newly selected paper, forgetting the previous paper's voted pairs.
     */
    void showNewPaper(Comparison comparison) {
        votedReviewPairs.clear();
        this.current = comparison;
    }

    // A review pair counts as voted regardless of which side each review was shown on
    void recordVote(String reviewA, String reviewB) {
        votedReviewPairs.add(pairKey(reviewA, reviewB));
        votesCast++;
    }

    boolean hasVotedOn(String reviewA, String reviewB) {
        return votedReviewPairs.contains(pairKey(reviewA, reviewB));
    }

    private static Set<String> pairKey(String reviewA, String reviewB) {
        return reviewA.equals(reviewB) ? Set.of(reviewA) : Set.of(reviewA, reviewB);
    }

    void end(Instant time) {
        this.endTime = time;
    }
}
