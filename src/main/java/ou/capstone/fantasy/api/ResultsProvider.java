package ou.capstone.fantasy.api;

import java.util.List;

import ou.capstone.fantasy.exceptions.EventNotFoundException;
import ou.capstone.fantasy.exceptions.ProviderException;

/**
 * Source of tournament results. Calls block until the provider answers or fails;
 * callers handle pacing between calls.
 */
public interface ResultsProvider {

    /** Top open professional division; the only one the league scores. */
    String DEFAULT_DIVISION = "MPO";

    /**
     * Resolves a tournament name or an event id to an event.
     *
     * @throws EventNotFoundException if nothing matches
     * @throws ProviderException      if the lookup itself failed
     */
    EventRef findEvent(String nameOrId) throws EventNotFoundException, ProviderException;

    /**
     * Fetches a division's results in page order.
     *
     * @return result rows, possibly empty when the event has no finishers yet
     * @throws ProviderException if the page could not be fetched or read
     */
    List<ResultRow> fetchResults(EventRef event, String division) throws ProviderException;
}
