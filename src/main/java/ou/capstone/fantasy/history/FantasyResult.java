package ou.capstone.fantasy.history;

import com.fasterxml.jackson.annotation.JsonProperty;

/** How a rostered player finished in a past tournament. */
public record FantasyResult(
        @JsonProperty("player") String player,
        @JsonProperty("team") String team,
        @JsonProperty("finish") String finish,
        @JsonProperty("points") double points
) {
}
