package ou.capstone.fantasy.standings;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One player's row on the league leaderboard. */
public record PlayerStatLine(
        @JsonProperty("name") String name,
        @JsonProperty("pdga_number") long pdgaNumber,
        @JsonProperty("team") String team,
        @JsonProperty("owner") String owner,
        @JsonProperty("is_underdog") boolean underdog,
        @JsonProperty("season_total") double seasonTotal,
        @JsonProperty("tournaments_played") int tournamentsPlayed,
        @JsonProperty("times_counted") int timesCounted,
        @JsonProperty("average_when_counted") double averageWhenCounted
) {
}
