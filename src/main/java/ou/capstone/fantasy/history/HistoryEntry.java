package ou.capstone.fantasy.history;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A scored tournament as kept in the recent-tournaments document. */
public record HistoryEntry(
        @JsonProperty("name") String name,
        @JsonProperty("event_id") String eventId,
        @JsonProperty("date") String date,
        @JsonProperty("tier") String tier,
        @JsonProperty("week") int week,
        @JsonProperty("fantasy_results") List<FantasyResult> fantasyResults
) {
    public HistoryEntry {
        fantasyResults = fantasyResults == null ? List.of() : List.copyOf(fantasyResults);
    }
}
