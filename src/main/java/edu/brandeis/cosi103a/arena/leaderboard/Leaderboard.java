package edu.brandeis.cosi103a.arena.leaderboard;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.arena.rating.RatingStats;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Ranked view of the engine's rating statistics.
 *
 * @param totalCompetitors competitors with a rating on record
 * @param totalVotes       sum of vote mass over all competitors
 * @param entries          rows ordered by score, highest first
 */
public record Leaderboard(
    @JsonProperty("totalCompetitors") int totalCompetitors,
    @JsonProperty("totalVotes") double totalVotes,
    @JsonProperty("entries") List<LeaderboardEntry> entries
) {

    /**
     * Ranks competitors by rating, breaking ties by competitor id.
     */
    public static Leaderboard from(Map<String, RatingStats> stats) {
        List<Map.Entry<String, RatingStats>> rows = new ArrayList<>(stats.entrySet());
        rows.sort(Comparator
            .comparingDouble((Map.Entry<String, RatingStats> e) -> e.getValue().rating()).reversed()
            .thenComparing(Map.Entry::getKey));

        ImmutableList.Builder<LeaderboardEntry> entries = ImmutableList.builder();
        double totalVotes = 0.0;
        int rank = 1;
        for (Map.Entry<String, RatingStats> row : rows) {
            RatingStats s = row.getValue();
            entries.add(new LeaderboardEntry(
                rank++,
                row.getKey(),
                round2(s.rating()),
                round2(s.confidenceInterval().lower()),
                round2(s.confidenceInterval().upper()),
                round2(s.voteMass())));
            totalVotes += s.voteMass();
        }
        return new Leaderboard(rows.size(), round2(totalVotes), entries.build());
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
