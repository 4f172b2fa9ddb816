package ou.capstone.fantasy;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.fantasy.api.EventRef;
import ou.capstone.fantasy.api.EventResults;
import ou.capstone.fantasy.api.PdgaResultsProvider;
import ou.capstone.fantasy.exceptions.ProviderException;
import ou.capstone.fantasy.exceptions.StoreException;
import ou.capstone.fantasy.schedule.ScheduleIndex;
import ou.capstone.fantasy.store.JsonLeagueStore;

/**
 * Fetches event results by id and exports each event to its own JSON file.
 * Does not touch rosters or standings.
 */
public class EventScraper {

    private static final Logger logger = LoggerFactory.getLogger(EventScraper.class);

    private final PdgaResultsProvider provider;
    private final JsonLeagueStore store;
    private final Sleeper sleeper;
    private final String division;
    private final long fetchDelayMillis;

    public EventScraper(final PdgaResultsProvider provider,
                        final JsonLeagueStore store,
                        final LeagueConfig config,
                        final Sleeper sleeper) {
        this.provider = provider;
        this.store = store;
        this.sleeper = sleeper;
        this.division = config.division();
        this.fetchDelayMillis = config.fetchDelayMillis();
    }

    /**
     * Fetches one event and writes {@code events/event_<id>_results.json}.
     */
    public EventResults scrapeEvent(final String eventId) throws ProviderException, StoreException {
        logger.info("Scraping event {} ({})", eventId, division);
        final EventResults results = provider.fetchEvent(EventRef.of(eventId), division);
        store.writeEventResults(results);
        return results;
    }

    /**
     * Fetches every scheduled tournament that has an event id. A failed event is
     * logged and skipped; the others are still exported.
     */
    public List<EventResults> scrapeScheduled(final ScheduleIndex schedule) throws StoreException {
        final List<Tournament> withIds = schedule.withEventIds();
        if (withIds.isEmpty()) {
            logger.warn("No tournaments in the schedule have event IDs");
            return List.of();
        }

        logger.info("Scraping {} tournament(s) with event IDs", withIds.size());
        final List<EventResults> scraped = new ArrayList<>();
        for (int i = 0; i < withIds.size(); i++) {
            final Tournament tournament = withIds.get(i);
            if (i > 0 && fetchDelayMillis > 0) {
                try {
                    sleeper.sleep(fetchDelayMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted; stopping after {} event(s)", scraped.size());
                    break;
                }
            }

            final String eventId = tournament.getEventId().orElseThrow();
            try {
                final EventResults results = provider.fetchEvent(new EventRef(eventId, tournament.getName()), division);
                store.writeEventResults(results);
                scraped.add(results);
            } catch (ProviderException e) {
                logger.warn("Failed to scrape {} (event {}): {}", tournament.getName(), eventId, e.getMessage());
            }
        }

        logger.info("Scraped {} of {} tournament(s)", scraped.size(), withIds.size());
        return scraped;
    }
}
