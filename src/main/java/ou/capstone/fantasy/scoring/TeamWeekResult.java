package ou.capstone.fantasy.scoring;

import java.util.List;

/**
 * One team's week.
 *
 * @param played   every player who played at least one tournament, in roster order
 * @param selected the counted players, best first; at most {@link ScoringEngine#TOP_K}
 */
public record TeamWeekResult(String teamName,
                             String owner,
                             List<PlayerWeekScore> played,
                             List<PlayerWeekScore> selected,
                             double teamWeekScore) {

    public TeamWeekResult {
        played = List.copyOf(played);
        selected = List.copyOf(selected);
    }
}
