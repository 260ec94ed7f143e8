package edu.brandeis.cosi103a.arena.votes;

import java.util.List;

/**
 * Durable, append-only store of arena votes.
 */
public interface VoteLog {

    /**
     * Appends a vote. Returns only once the vote is durably recorded.
     */
    void storeVote(Vote vote);

    /**
     * All stored votes in the order they were appended.
     */
    List<Vote> getAllVotes();
}
