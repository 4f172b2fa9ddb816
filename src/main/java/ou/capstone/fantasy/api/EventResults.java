package ou.capstone.fantasy.api;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A single event's division results, as exported by the event command. */
public record EventResults(
        @JsonProperty("id") String eventId,
        @JsonProperty("name") String name,
        @JsonProperty("division") String division,
        @JsonProperty("url") String url,
        @JsonProperty("results") List<ResultRow> results
) {
    public EventResults {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
