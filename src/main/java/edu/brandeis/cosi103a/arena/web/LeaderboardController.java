package edu.brandeis.cosi103a.arena.web;

import edu.brandeis.cosi103a.arena.leaderboard.Leaderboard;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.SendTo;
import org.springframework.stereotype.Controller;

/**
 * WebSocket controller for live leaderboard updates.
 * Clients subscribe to /topic/leaderboard; every accepted vote pushes a fresh leaderboard.
 */
@Controller
public class LeaderboardController {

    private final ArenaService arenaService;

    public LeaderboardController(ArenaService arenaService) {
        this.arenaService = arenaService;
    }

    /**
     * Replies to a subscription request with the current leaderboard.
     */
    @MessageMapping("/leaderboard/subscribe")
    @SendTo(ArenaService.LEADERBOARD_TOPIC)
    public Leaderboard subscribeLeaderboard() {
        return arenaService.leaderboard();
    }
}
