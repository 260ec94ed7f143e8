package edu.brandeis.cosi103a.arena.votes;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.arena.config.ObjectMapperFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Vote log kept as a JSON Lines file, one vote object per line.
 */
public class JsonlVoteLog implements VoteLog {

    private static final Logger log = LoggerFactory.getLogger(JsonlVoteLog.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonlVoteLog(Path file) {
        this(file, ObjectMapperFactory.create());
    }

    public JsonlVoteLog(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
        initStorage();
    }

    private void initStorage() {
        try {
            if (Files.exists(file)) {
                log.info("Using existing JSONL vote log: {}", file);
                return;
            }
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.createFile(file);
            log.info("Created new JSONL vote log: {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize vote log " + file, e);
        }
    }

    @Override
    public synchronized void storeVote(Vote vote) {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.APPEND)) {
            writer.write(objectMapper.writeValueAsString(vote));
            writer.newLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store vote in " + file, e);
        }
        log.info("Vote stored in JSONL: session {}, {} vs {}", vote.sessionId(), vote.reviewerA(), vote.reviewerB());
    }

    @Override
    public synchronized List<Vote> getAllVotes() {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read votes from " + file, e);
        }
        List<Vote> votes = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty()) {
                continue;
            }
            try {
                votes.add(objectMapper.readValue(line, Vote.class));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException("Malformed vote on line " + (i + 1) + " of " + file, e);
            }
        }
        log.info("Retrieved {} votes from {}", votes.size(), file);
        return votes;
    }

    public Path file() {
        return file;
    }
}
