package ou.capstone.fantasy.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.fantasy.exceptions.EventNotFoundException;
import ou.capstone.fantasy.exceptions.ProviderException;

/**
 * {@link ResultsProvider} backed by the PDGA website.
 * Uses {@link PdgaWebClient} for transport and {@link PdgaPageParser} for markup.
 */
public class PdgaResultsProvider implements ResultsProvider {
    private static final Logger logger = LoggerFactory.getLogger(PdgaResultsProvider.class);

    private static final String SEARCH_PATH = "/tour/search";
    private static final String EVENT_PATH = "/tour/event/";

    private final PdgaWebClient webClient;
    private final PdgaPageParser parser;

    public PdgaResultsProvider(final PdgaWebClient webClient) {
        this(webClient, new PdgaPageParser());
    }

    public PdgaResultsProvider(final PdgaWebClient webClient, final PdgaPageParser parser) {
        this.webClient = webClient;
        this.parser = parser;
    }

    @Override
    public EventRef findEvent(final String nameOrId) throws EventNotFoundException, ProviderException {
        final String query = StringUtils.trimToEmpty(nameOrId);
        if (query.isEmpty()) {
            throw new EventNotFoundException(String.valueOf(nameOrId));
        }
        if (StringUtils.isNumeric(query)) {
            return EventRef.of(query);
        }

        logger.info("Searching PDGA for '{}'", query);
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("title", query);
        params.put("OfficialName", query);

        final Optional<String> page = webClient.fetchPage(SEARCH_PATH, params);
        if (page.isEmpty()) {
            throw new EventNotFoundException(query);
        }

        final String eventId = parser.parseSearchResults(page.get())
                .orElseThrow(() -> new EventNotFoundException(query));
        logger.info("Found event ID {} for '{}'", eventId, query);
        return new EventRef(eventId, query);
    }

    @Override
    public List<ResultRow> fetchResults(final EventRef event, final String division) throws ProviderException {
        return parser.parseResults(fetchEventPage(event), division);
    }

    /**
     * Fetches one event's page and reads both its name and its division results.
     */
    public EventResults fetchEvent(final EventRef event, final String division) throws ProviderException {
        final String html = fetchEventPage(event);
        final List<ResultRow> rows = parser.parseResults(html, division);
        final String name = parser.parseEventName(html)
                .or(event::displayName)
                .orElse("Event " + event.eventId());
        return new EventResults(event.eventId(), name, division, eventUrl(event), rows);
    }

    public String eventUrl(final EventRef event) {
        return webClient.buildUri(EVENT_PATH + event.eventId(), Map.of()).toString();
    }

    private String fetchEventPage(final EventRef event) throws ProviderException {
        logger.debug("Fetching event page for {}", event.eventId());
        return webClient.fetchPage(EVENT_PATH + event.eventId(), Map.of())
                .orElseThrow(() -> new ProviderException("Event " + event.eventId() + " not found on PDGA"));
    }
}
