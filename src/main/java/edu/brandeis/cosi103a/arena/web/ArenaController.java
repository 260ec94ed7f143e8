package edu.brandeis.cosi103a.arena.web;

import edu.brandeis.cosi103a.arena.leaderboard.Leaderboard;
import edu.brandeis.cosi103a.arena.web.dto.ComparisonView;
import edu.brandeis.cosi103a.arena.web.dto.VoteRequest;
import edu.brandeis.cosi103a.arena.web.dto.VoteResult;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for arena sessions, votes and the leaderboard.
 */
@RestController
@RequestMapping("/api/arena")
public class ArenaController {

    private final ArenaService arenaService;

    public ArenaController(ArenaService arenaService) {
        this.arenaService = arenaService;
    }

    /**
     * Starts a session and returns its first comparison.
     */
    @PostMapping("/sessions")
    public ResponseEntity<ComparisonView> startSession(
            HttpServletRequest request,
            @RequestHeader(value = "User-Agent", required = false) String userAgent) {
        ComparisonView view = arenaService.startSession(request.getRemoteAddr(), userAgent);
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    /**
     * Returns the comparison currently shown in a session.
     */
    @GetMapping("/sessions/{sessionId}")
    public ComparisonView getComparison(@PathVariable String sessionId) {
        return arenaService.getComparison(sessionId);
    }

    @PostMapping("/sessions/{sessionId}/next")
    public ComparisonView nextPaper(@PathVariable String sessionId) {
        return arenaService.nextPaper(sessionId);
    }

    @PostMapping("/sessions/{sessionId}/previous")
    public ComparisonView previousPaper(@PathVariable String sessionId) {
        return arenaService.previousPaper(sessionId);
    }

    /**
     * Submits the visitor's judgement of the current comparison.
     */
    @PostMapping("/sessions/{sessionId}/votes")
    public VoteResult submitVote(@PathVariable String sessionId, @Valid @RequestBody VoteRequest request) {
        return arenaService.submitVote(sessionId, request);
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> endSession(@PathVariable String sessionId) {
        arenaService.endSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/leaderboard")
    public Leaderboard leaderboard() {
        return arenaService.leaderboard();
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(SessionNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler({NoFairPairException.class, IllegalStateException.class})
    public ResponseEntity<Map<String, String>> handleUnavailable(RuntimeException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(ex.getMessage())));
    }
}
