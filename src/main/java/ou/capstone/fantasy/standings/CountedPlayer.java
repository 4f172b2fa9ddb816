package ou.capstone.fantasy.standings;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A player whose week score counted toward the team's week. */
public record CountedPlayer(
        @JsonProperty("name") String name,
        @JsonProperty("score") double score,
        @JsonProperty("tournaments") int tournaments
) {
}
