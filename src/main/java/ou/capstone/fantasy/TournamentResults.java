package ou.capstone.fantasy;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import ou.capstone.fantasy.api.EventRef;
import ou.capstone.fantasy.api.ResultRow;

/**
 * A scheduled tournament matched to an event, together with its results.
 * This is the unit the scoring engine consumes.
 */
public record TournamentResults(Tournament tournament, EventRef event, List<ResultRow> results) {

    public TournamentResults {
        Objects.requireNonNull(tournament, "tournament is required");
        Objects.requireNonNull(event, "event is required");
        results = results == null ? List.of() : List.copyOf(results);
    }

    /** Key under which this tournament is recorded as processed. */
    public String processingKey() {
        return event.eventId();
    }

    /** First row for the given PDGA number, in page order. */
    public Optional<ResultRow> findResult(final long pdgaNumber) {
        return results.stream().filter(r -> r.pdgaNumber() == pdgaNumber).findFirst();
    }
}
