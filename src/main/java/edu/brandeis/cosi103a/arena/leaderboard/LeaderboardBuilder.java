package edu.brandeis.cosi103a.arena.leaderboard;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.brandeis.cosi103a.arena.config.ObjectMapperFactory;
import edu.brandeis.cosi103a.arena.rating.CategoryWeights;
import edu.brandeis.cosi103a.arena.rating.ComparisonOutcome;
import edu.brandeis.cosi103a.arena.rating.EloRatingCalculator;
import edu.brandeis.cosi103a.arena.rating.RatingEngine;
import edu.brandeis.cosi103a.arena.votes.JsonlVoteLog;
import edu.brandeis.cosi103a.arena.votes.Vote;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * CLI tool that replays a JSONL vote log and writes the resulting leaderboard together with
 * the rating history after every vote.
 */
public final class LeaderboardBuilder {

    private static final ObjectMapper MAPPER = ObjectMapperFactory.create().enable(SerializationFeature.INDENT_OUTPUT);

    private LeaderboardBuilder() {}

    /**
     * Build leaderboard.json from a vote log.
     *
     * @param votesFile  JSONL vote log
     * @param outputFile where to write the leaderboard
     * @param engine     engine to replay into; its previous state is discarded
     * @return the final leaderboard
     */
    public static Leaderboard buildLeaderboard(Path votesFile, Path outputFile, RatingEngine engine) {
        if (!Files.exists(votesFile)) {
            throw new IllegalArgumentException("Vote log not found: " + votesFile);
        }

        List<Vote> votes = new JsonlVoteLog(votesFile, MAPPER).getAllVotes();

        // Replay vote by vote so each event carries the ratings right after it
        engine.replay(List.of());
        ArrayNode events = MAPPER.createArrayNode();
        int seq = 0;
        for (Vote vote : votes) {
            ComparisonOutcome outcome = vote.toOutcome();
            engine.update(outcome);

            ObjectNode event = MAPPER.createObjectNode();
            event.put("seq", seq++);
            event.put("paperId", vote.paperId());
            event.put("reviewerA", vote.reviewerA());
            event.put("reviewerB", vote.reviewerB());
            event.put("scoreA", Leaderboard.round2(EloRatingCalculator.normalizedScore(outcome, engine.weights())));
            event.put("voteTime", vote.voteTime().toString());

            ObjectNode ratingsNode = MAPPER.createObjectNode();
            for (Map.Entry<String, Double> entry : engine.ratings().entrySet()) {
                ratingsNode.put(entry.getKey(), Leaderboard.round2(entry.getValue()));
            }
            event.set("ratings", ratingsNode);
            events.add(event);
        }

        Leaderboard leaderboard = Leaderboard.from(engine.stats());

        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode scoring = MAPPER.createObjectNode();
        scoring.put("model", "elo");
        scoring.put("kFactor", engine.kFactor());
        scoring.put("initial", engine.initialRating());
        scoring.set("weights", MAPPER.valueToTree(engine.weights()));
        root.set("scoring", scoring);
        root.set("leaderboard", MAPPER.valueToTree(leaderboard));
        root.set("events", events);

        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(outputFile.toFile(), root);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write leaderboard", e);
        }
        return leaderboard;
    }

    public static void main(String[] args) {
        String votesFile = null;
        String outputFile = null;
        double kFactor = RatingEngine.DEFAULT_K_FACTOR;
        double initialRating = RatingEngine.DEFAULT_INITIAL_RATING;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--votes" -> votesFile = requireValue(args, ++i, "--votes");
                case "--output" -> outputFile = requireValue(args, ++i, "--output");
                case "--k-factor" -> kFactor = Double.parseDouble(requireValue(args, ++i, "--k-factor"));
                case "--initial-rating" -> initialRating = Double.parseDouble(requireValue(args, ++i, "--initial-rating"));
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }

        if (votesFile == null) {
            throw new IllegalArgumentException("--votes argument is required");
        }

        Path votesPath = Path.of(votesFile);
        Path outputPath = outputFile != null
            ? Path.of(outputFile)
            : votesPath.toAbsolutePath().resolveSibling("leaderboard.json");

        RatingEngine engine = new RatingEngine(CategoryWeights.DEFAULTS, kFactor, initialRating);
        Leaderboard leaderboard = buildLeaderboard(votesPath, outputPath, engine);

        System.out.println("leaderboard.json written to " + outputPath
            + " (" + leaderboard.totalCompetitors() + " competitors, "
            + leaderboard.totalVotes() + " votes)");
        for (LeaderboardEntry entry : leaderboard.entries()) {
            System.out.printf("  %2d. %-35s %8.2f  (%.2f, %.2f)  %.2f%n",
                entry.rank(), entry.competitor(), entry.score(), entry.ciLower(), entry.ciUpper(), entry.votes());
        }
    }

    private static String requireValue(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return args[index];
    }
}
