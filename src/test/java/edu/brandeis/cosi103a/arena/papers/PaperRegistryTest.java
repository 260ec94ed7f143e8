package edu.brandeis.cosi103a.arena.papers;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PaperRegistryTest {

    @TempDir
    Path tempDir;

    private Path writePapers(String content) throws IOException {
        Path file = tempDir.resolve("papers.jsonl");
        Files.writeString(file, content);
        return file;
    }

    @Test
    void fromJsonl_mapsArrayFieldsToReviewers() throws IOException {
        Path file = writePapers("""
            {"paper_id":"p1","title":"Attention","pdf_path":"p1.pdf","year":2017,"human_reviewer":["solid work",""],"barebones":["", "  "],"liang_etal":["needs ablations"]}
            {"paper_id":"p2","title":"Second","pdf_path":"p2.pdf","human_reviewer":["ok"]}
            """);

        PaperRegistry registry = PaperRegistry.fromJsonl(file);

        assertEquals(2, registry.paperCount());
        Paper first = registry.paperAt(0);
        assertEquals("p1", first.paperId());
        assertEquals("Attention", first.title());
        assertEquals("p1.pdf", first.pdfPath());
        assertEquals(List.of("human_reviewer", "barebones", "liang_etal"), List.copyOf(first.reviews().keySet()),
            "Non-array fields are not reviewers");
        assertEquals(List.of("human_reviewer", "liang_etal"), first.validReviewerIds(),
            "Reviewers with only blank reviews are not candidates");
        assertEquals(List.of("solid work"), first.validReviews("human_reviewer"));
        assertTrue(first.validReviews("unknown").isEmpty());
    }

    @Test
    void fromJsonl_missingRequiredField_isRejected() throws IOException {
        Path file = writePapers("{\"paper_id\":\"p1\",\"pdf_path\":\"p1.pdf\",\"human\":[\"x\"]}\n");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> PaperRegistry.fromJsonl(file));
        assertTrue(e.getMessage().contains("title"));
    }

    @Test
    void positions_wrapAround() throws IOException {
        PaperRegistry registry = PaperRegistry.fromJsonl(writePapers("""
            {"paper_id":"p1","title":"One","pdf_path":"p1.pdf"}
            {"paper_id":"p2","title":"Two","pdf_path":"p2.pdf"}
            {"paper_id":"p3","title":"Three","pdf_path":"p3.pdf"}
            """));

        assertEquals(1, registry.nextPosition(0));
        assertEquals(0, registry.nextPosition(2));
        assertEquals(2, registry.previousPosition(0));
        assertEquals(0, registry.previousPosition(1));
        assertEquals("p3", registry.paperAt(-1).paperId());
        assertEquals("p1", registry.paperAt(3).paperId());
        assertEquals(2, registry.samplePosition(bound -> bound - 1));
    }

    @Test
    void emptyRegistry_failsOnAccess() {
        PaperRegistry registry = new PaperRegistry(List.of());

        assertEquals(0, registry.paperCount());
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> registry.paperAt(0));
        assertEquals("Paper list is empty.", e.getMessage());
        assertThrows(IllegalStateException.class, () -> registry.samplePosition(bound -> 0));
    }
}
