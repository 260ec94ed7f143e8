package edu.brandeis.cosi103a.arena.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.arena.config.ObjectMapperFactory;
import edu.brandeis.cosi103a.arena.papers.PaperRegistry;
import edu.brandeis.cosi103a.arena.rating.CategoryWeights;
import edu.brandeis.cosi103a.arena.rating.RandomSource;
import edu.brandeis.cosi103a.arena.rating.RatingEngine;
import edu.brandeis.cosi103a.arena.votes.JsonlVoteLog;
import edu.brandeis.cosi103a.arena.votes.VoteLog;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.util.Random;

/**
 * Main application class for the review arena.
 * Serves arena sessions, vote submission and the live leaderboard.
 */
@SpringBootApplication
public class ArenaApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArenaApplication.class, args);
    }

    @Bean
    public ObjectMapper objectMapper() {
        return ObjectMapperFactory.create();
    }

    @Bean
    public PaperRegistry paperRegistry(@Value("${arena.papers-file:./arena_data/papers.jsonl}") String papersFile) {
        return PaperRegistry.fromJsonl(Path.of(papersFile));
    }

    @Bean
    public VoteLog voteLog(@Value("${arena.votes-file:./arena_data/arena_votes.jsonl}") String votesFile,
                           ObjectMapper objectMapper) {
        return new JsonlVoteLog(Path.of(votesFile), objectMapper);
    }

    @Bean
    public CategoryWeights categoryWeights(
            @Value("${arena.weights.technical-quality:0.2}") double technicalQuality,
            @Value("${arena.weights.constructiveness:0.2}") double constructiveness,
            @Value("${arena.weights.clarity:0.2}") double clarity,
            @Value("${arena.weights.overall-quality:0.4}") double overallQuality) {
        return new CategoryWeights(technicalQuality, constructiveness, clarity, overallQuality);
    }

    @Bean
    public RandomSource arenaRandom() {
        return RandomSource.from(new Random());
    }

    @Bean
    public RatingEngine ratingEngine(
            CategoryWeights weights,
            RandomSource arenaRandom,
            @Value("${arena.k-factor:32.0}") double kFactor,
            @Value("${arena.initial-rating:1500.0}") double initialRating) {
        return new RatingEngine(weights, kFactor, initialRating, arenaRandom);
    }
}
