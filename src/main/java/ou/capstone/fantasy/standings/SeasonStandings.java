package ou.capstone.fantasy.standings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The standings document: season week counter, team standings and the ledger of
 * events already scored. Only {@link StandingsAggregator} advances the week.
 */
public final class SeasonStandings {
    private int currentWeek;
    private final List<StandingEntry> standings;
    private String lastUpdated;
    private final Set<String> processedEvents;

    public SeasonStandings() {
        this(0, null, null, null);
    }

    @JsonCreator
    public SeasonStandings(@JsonProperty("current_week") final int currentWeek,
                           @JsonProperty("standings") final List<StandingEntry> standings,
                           @JsonProperty("last_updated") final String lastUpdated,
                           @JsonProperty("processed_events") final List<String> processedEvents) {
        if (currentWeek < 0) {
            throw new IllegalArgumentException("current_week must not be negative");
        }
        this.currentWeek = currentWeek;
        this.standings = standings == null ? new ArrayList<>() : new ArrayList<>(standings);
        this.lastUpdated = lastUpdated;
        this.processedEvents = processedEvents == null
                ? new LinkedHashSet<>()
                : new LinkedHashSet<>(processedEvents);
    }

    @JsonProperty("current_week")
    public int getCurrentWeek() { return currentWeek; }

    @JsonProperty("standings")
    public List<StandingEntry> getStandings() {
        return Collections.unmodifiableList(standings);
    }

    @JsonProperty("last_updated")
    public String getLastUpdated() { return lastUpdated; }

    @JsonProperty("processed_events")
    public List<String> getProcessedEvents() {
        return List.copyOf(processedEvents);
    }

    public boolean isProcessed(final String eventKey) {
        return processedEvents.contains(eventKey);
    }

    public Optional<StandingEntry> findEntry(final String teamName) {
        return standings.stream().filter(s -> s.getTeamName().equals(teamName)).findFirst();
    }

    StandingEntry entryFor(final String teamName, final String owner) {
        return findEntry(teamName).orElseGet(() -> {
            final StandingEntry created = new StandingEntry(teamName, owner);
            standings.add(created);
            return created;
        });
    }

    void advanceWeek(final int week) {
        if (week != currentWeek + 1) {
            throw new IllegalStateException("Week " + week + " does not follow week " + currentWeek);
        }
        currentWeek = week;
    }

    void markProcessed(final String eventKey) {
        processedEvents.add(eventKey);
    }

    void stampUpdated(final String timestamp) {
        lastUpdated = timestamp;
    }

    List<StandingEntry> mutableStandings() {
        return standings;
    }
}
