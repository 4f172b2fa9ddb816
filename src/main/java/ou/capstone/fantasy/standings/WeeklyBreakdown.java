package ou.capstone.fantasy.standings;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A team's recorded week: its score and the (up to) three players that made it. */
public record WeeklyBreakdown(
        @JsonProperty("week") int week,
        @JsonProperty("score") double score,
        @JsonProperty("top_3_players") List<CountedPlayer> topPlayers
) {
    public WeeklyBreakdown {
        topPlayers = topPlayers == null ? List.of() : List.copyOf(topPlayers);
    }
}
