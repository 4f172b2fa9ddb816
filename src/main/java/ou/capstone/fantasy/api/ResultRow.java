package ou.capstone.fantasy.api;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One finisher in a division's results.
 *
 * @param placement  finishing place, 1 is best
 * @param pdgaNumber the player's PDGA number
 * @param name       display name as shown on the results page
 * @param tied       whether the place was shared
 */
public record ResultRow(
        @JsonProperty("placement") int placement,
        @JsonProperty("pdga_number") long pdgaNumber,
        @JsonProperty("name") String name,
        @JsonProperty("tied") boolean tied
) {
    public ResultRow {
        if (placement <= 0) {
            throw new IllegalArgumentException("placement must be positive: " + placement);
        }
        Objects.requireNonNull(name, "name is required");
    }
}
