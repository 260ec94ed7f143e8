package edu.brandeis.cosi103a.arena.web;

import edu.brandeis.cosi103a.arena.leaderboard.Leaderboard;
import edu.brandeis.cosi103a.arena.papers.Paper;
import edu.brandeis.cosi103a.arena.papers.PaperRegistry;
import edu.brandeis.cosi103a.arena.rating.ComparisonOutcome;
import edu.brandeis.cosi103a.arena.rating.CompetitorPair;
import edu.brandeis.cosi103a.arena.rating.RandomSource;
import edu.brandeis.cosi103a.arena.rating.RatingEngine;
import edu.brandeis.cosi103a.arena.votes.Vote;
import edu.brandeis.cosi103a.arena.votes.VoteLog;
import edu.brandeis.cosi103a.arena.web.dto.ComparisonView;
import edu.brandeis.cosi103a.arena.web.dto.VoteRequest;
import edu.brandeis.cosi103a.arena.web.dto.VoteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs arena sessions against one shared rating engine.
 *
 * <p>The engine is rebuilt from the vote log when the service starts. Every engine call goes
 * through {@code engineLock}, since interleaved updates to the same competitor lose updates.
 */
@Service
public class ArenaService {

    private static final Logger log = LoggerFactory.getLogger(ArenaService.class);

    static final String LEADERBOARD_TOPIC = "/topic/leaderboard";

    /** Fair-pair draws tried on the current paper after a vote before moving on. */
    static final int MAX_REVIEW_ATTEMPTS = 10;

    private final Map<String, ArenaSession> sessions = new ConcurrentHashMap<>();
    private final Object engineLock = new Object();
    private final PaperRegistry paperRegistry;
    private final VoteLog voteLog;
    private final RatingEngine engine;
    private final SimpMessagingTemplate messagingTemplate;
    private final RandomSource random;
    private final double fairMatchStep;

    public ArenaService(
            PaperRegistry paperRegistry,
            VoteLog voteLog,
            RatingEngine engine,
            SimpMessagingTemplate messagingTemplate,
            RandomSource random,
            @Value("${arena.fair-match-step:10.0}") double fairMatchStep) {
        this.paperRegistry = paperRegistry;
        this.voteLog = voteLog;
        this.engine = engine;
        this.messagingTemplate = messagingTemplate;
        this.random = random;
        this.fairMatchStep = fairMatchStep;

        List<ComparisonOutcome> history = voteLog.getAllVotes().stream()
            .map(Vote::toOutcome)
            .toList();
        synchronized (engineLock) {
            engine.replay(history);
        }
    }

    /**
     * Starts a session on a randomly sampled paper.
     *
     * @throws NoFairPairException if the registry is empty or no paper has a fair pair of reviewers
     */
    public ComparisonView startSession(String ipAddress, String userAgent) {
        if (paperRegistry.paperCount() == 0) {
            throw new NoFairPairException("Paper list is empty.");
        }
        ArenaSession session = new ArenaSession(UUID.randomUUID().toString(), Instant.now(), ipAddress, userAgent);
        synchronized (session) {
            selectPaper(session, paperRegistry.samplePosition(random));
            sessions.put(session.id(), session);
            log.info("Session {} started from {}", session.id(), ipAddress);
            return view(session);
        }
    }

    public ComparisonView getComparison(String sessionId) {
        ArenaSession session = requireSession(sessionId);
        synchronized (session) {
            return view(session);
        }
    }

    public ComparisonView nextPaper(String sessionId) {
        ArenaSession session = requireSession(sessionId);
        synchronized (session) {
            selectPaper(session, paperRegistry.nextPosition(currentOf(session).paperPosition()));
            return view(session);
        }
    }

    public ComparisonView previousPaper(String sessionId) {
        ArenaSession session = requireSession(sessionId);
        synchronized (session) {
            selectPaper(session, paperRegistry.previousPosition(currentOf(session).paperPosition()));
            return view(session);
        }
    }

    /**
     * Records the visitor's judgement of the comparison on screen, updates ratings and moves on
     * to a review pair the visitor has not judged yet.
     *
     * <p>The vote reaches the vote log before the engine sees it, and both happen under the
     * engine lock so the log records votes in the order they were applied.
     */
    public VoteResult submitVote(String sessionId, VoteRequest request) {
        ArenaSession session = requireSession(sessionId);
        VoteResult result;
        synchronized (session) {
            ArenaSession.Comparison current = currentOf(session);
            Vote vote = new Vote(
                session.id(),
                current.paperId(),
                current.reviewerA(),
                current.reviewerB(),
                request.technicalQuality(),
                request.constructiveness(),
                request.clarity(),
                request.overallQuality(),
                current.reviewA(),
                current.reviewB(),
                Instant.now());

            // Log order must equal engine order
            synchronized (engineLock) {
                voteLog.storeVote(vote);
                engine.update(vote.toOutcome());
            }
            session.recordVote(current.reviewA(), current.reviewB());
            log.info("Added vote and updated ratings: {} vs {} on paper {}",
                current.reviewerA(), current.reviewerB(), current.paperId());

            sampleNextComparison(session, current.paperPosition());
            result = new VoteResult(current.reviewerA(), current.reviewerB(), view(session));
        }
        broadcastLeaderboard();
        return result;
    }

    /**
     * Ends a session and forgets its state.
     */
    public void endSession(String sessionId) {
        ArenaSession session = sessions.remove(sessionId);
        if (session == null) {
            throw new SessionNotFoundException("Session not found: " + sessionId);
        }
        synchronized (session) {
            session.end(Instant.now());
            log.info("Session {} ended after {} votes ({}s)", session.id(), session.votesCast(),
                Duration.between(session.startTime(), session.endTime().orElseThrow()).toSeconds());
        }
    }

    public Leaderboard leaderboard() {
        synchronized (engineLock) {
            return Leaderboard.from(engine.stats());
        }
    }

    public Optional<ArenaSession> getSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Picks the first paper, from {@code startPosition} onwards and wrapping around, whose
     * reviewers yield a fair pair.
     */
    private void selectPaper(ArenaSession session, int startPosition) {
        int paperCount = paperRegistry.paperCount();
        for (int attempt = 0; attempt < paperCount; attempt++) {
            int position = Math.floorMod(startPosition + attempt, paperCount);
            Paper paper = paperRegistry.paperAt(position);

            Optional<CompetitorPair> pair = findFairPair(paper, Set.of());
            if (pair.isEmpty()) {
                log.warn("No fair pair found for paper {} at position {}, trying position {}",
                    paper.paperId(), position, position + 1);
                continue;
            }

            String reviewerA = pair.get().first();
            String reviewerB = pair.get().second();
            session.showNewPaper(new ArenaSession.Comparison(
                position, paper.paperId(), paper.title(), paper.pdfPath(),
                reviewerA, reviewerB, pickReview(paper, reviewerA), pickReview(paper, reviewerB)));
            log.info("Selected fair pair {} and {} for paper {} at position {}",
                reviewerA, reviewerB, paper.paperId(), position);
            return;
        }
        throw new NoFairPairException("No paper with a fair pair of reviewers found in the entire registry.");
    }

    /**
     * Shows a not yet judged review pair on the same paper, or moves to the next paper once
     * the attempts run out.
     */
    private void sampleNextComparison(ArenaSession session, int position) {
        Paper paper = paperRegistry.paperAt(position);
        Set<CompetitorPair> exhausted = new HashSet<>();

        for (int attempt = 1; attempt <= MAX_REVIEW_ATTEMPTS; attempt++) {
            Optional<CompetitorPair> pair = findFairPair(paper, exhausted);
            if (pair.isEmpty()) {
                log.debug("No fair pair for paper {} on attempt {}/{}", paper.paperId(), attempt, MAX_REVIEW_ATTEMPTS);
                continue;
            }

            String reviewerA = pair.get().first();
            String reviewerB = pair.get().second();
            Optional<List<String>> reviews = sampleUnvotedReviews(session, paper, reviewerA, reviewerB);
            if (reviews.isPresent()) {
                session.show(new ArenaSession.Comparison(
                    position, paper.paperId(), paper.title(), paper.pdfPath(),
                    reviewerA, reviewerB, reviews.get().get(0), reviews.get().get(1)));
                log.info("New reviews sampled from {} and {} for paper {} after {} attempts",
                    reviewerA, reviewerB, paper.paperId(), attempt);
                return;
            }
            exhausted.add(pair.get());
        }

        log.warn("Exhausted review pairs for paper {} at position {}, moving to the next paper",
            paper.paperId(), position);
        selectPaper(session, paperRegistry.nextPosition(position));
    }

    private Optional<List<String>> sampleUnvotedReviews(ArenaSession session, Paper paper,
                                                        String reviewerA, String reviewerB) {
        List<List<String>> available = new ArrayList<>();
        for (String reviewA : paper.validReviews(reviewerA)) {
            for (String reviewB : paper.validReviews(reviewerB)) {
                if (!session.hasVotedOn(reviewA, reviewB)) {
                    available.add(List.of(reviewA, reviewB));
                }
            }
        }
        if (available.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(available.get(random.nextInt(available.size())));
    }

    private Optional<CompetitorPair> findFairPair(Paper paper, Set<CompetitorPair> exclude) {
        Set<String> pool = new LinkedHashSet<>(paper.validReviewerIds());
        synchronized (engineLock) {
            return engine.findFairPair(pool, pool, exclude, fairMatchStep);
        }
    }

    private String pickReview(Paper paper, String reviewerId) {
        List<String> reviews = paper.validReviews(reviewerId);
        return reviews.get(random.nextInt(reviews.size()));
    }

    private ArenaSession requireSession(String sessionId) {
        ArenaSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException("Session not found: " + sessionId);
        }
        return session;
    }

    private static ArenaSession.Comparison currentOf(ArenaSession session) {
        return session.current()
            .orElseThrow(() -> new IllegalStateException("Session " + session.id() + " has no comparison on screen"));
    }

    private static ComparisonView view(ArenaSession session) {
        ArenaSession.Comparison c = currentOf(session);
        return new ComparisonView(session.id(), c.paperPosition(), c.paperId(), c.paperTitle(), c.pdfPath(),
            c.reviewA(), c.reviewB(), session.votesCast());
    }

    /**
     * Sends the current leaderboard to all WebSocket subscribers.
     */
    private void broadcastLeaderboard() {
        try {
            messagingTemplate.convertAndSend(LEADERBOARD_TOPIC, leaderboard());
        } catch (Exception e) {
            // A failed broadcast must not fail the vote, which is already stored
            log.warn("Failed to send leaderboard update: {}", e.getMessage());
        }
    }
}
