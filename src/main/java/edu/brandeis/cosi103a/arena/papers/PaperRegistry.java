package edu.brandeis.cosi103a.arena.papers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.brandeis.cosi103a.arena.config.ObjectMapperFactory;
import edu.brandeis.cosi103a.arena.rating.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered list of papers shown in the arena, addressed by position.
 */
public class PaperRegistry {

    private static final Logger log = LoggerFactory.getLogger(PaperRegistry.class);

    private static final Set<String> PAPER_FIELDS = Set.of("paper_id", "title", "pdf_path");

    private final List<Paper> papers;

    public PaperRegistry(List<Paper> papers) {
        this.papers = ImmutableList.copyOf(papers);
        log.info("Initialized PaperRegistry with {} papers", this.papers.size());
    }

    /**
     * Loads papers from a JSON Lines file. Besides {@code paper_id}, {@code title} and
     * {@code pdf_path}, every array-valued field is a reviewer id mapped to its reviews.
     */
    public static PaperRegistry fromJsonl(Path file) {
        ObjectMapper mapper = ObjectMapperFactory.create();
        ImmutableList.Builder<Paper> papers = ImmutableList.builder();
        try {
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i).strip();
                if (line.isEmpty()) {
                    continue;
                }
                papers.add(parsePaper(mapper.readTree(line), i + 1));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load papers from " + file, e);
        }
        PaperRegistry registry = new PaperRegistry(papers.build());
        log.info("Loaded {} papers from {}", registry.paperCount(), file);
        return registry;
    }

    private static Paper parsePaper(JsonNode node, int lineNumber) {
        for (String field : PAPER_FIELDS) {
            if (!node.hasNonNull(field)) {
                throw new IllegalArgumentException("Paper on line " + lineNumber + " is missing " + field);
            }
        }
        ImmutableMap.Builder<String, ImmutableList<String>> reviews = ImmutableMap.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (PAPER_FIELDS.contains(field.getKey()) || !field.getValue().isArray()) {
                continue;
            }
            ImmutableList.Builder<String> texts = ImmutableList.builder();
            for (JsonNode review : field.getValue()) {
                texts.add(review.asText());
            }
            reviews.put(field.getKey(), texts.build());
        }
        return new Paper(
            node.get("paper_id").asText(),
            node.get("title").asText(),
            node.get("pdf_path").asText(),
            reviews.build());
    }

    public List<Paper> papers() {
        return papers;
    }

    public int paperCount() {
        return papers.size();
    }

    /**
     * Paper at the given position; positions wrap around the registry.
     */
    public Paper paperAt(int position) {
        checkNotEmpty();
        return papers.get(Math.floorMod(position, papers.size()));
    }

    public int nextPosition(int position) {
        checkNotEmpty();
        return position + 1 < papers.size() ? position + 1 : 0;
    }

    public int previousPosition(int position) {
        checkNotEmpty();
        return position > 0 ? position - 1 : papers.size() - 1;
    }

    public int samplePosition(RandomSource random) {
        checkNotEmpty();
        return random.nextInt(papers.size());
    }

    private void checkNotEmpty() {
        if (papers.isEmpty()) {
            throw new IllegalStateException("Paper list is empty.");
        }
    }
}
