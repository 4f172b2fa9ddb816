package ou.capstone.fantasy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import ou.capstone.fantasy.api.EventRef;
import ou.capstone.fantasy.api.EventResults;
import ou.capstone.fantasy.api.PdgaResultsProvider;
import ou.capstone.fantasy.api.ResultRow;
import ou.capstone.fantasy.exceptions.ProviderException;
import ou.capstone.fantasy.schedule.ScheduleIndex;
import ou.capstone.fantasy.store.JsonLeagueStore;

@ExtendWith(MockitoExtension.class)
class EventScraperTest {

    @TempDir
    Path dataDir;

    @Mock
    private PdgaResultsProvider provider;

    private List<Long> sleeps;
    private EventScraper scraper;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        scraper = new EventScraper(provider, new JsonLeagueStore(dataDir), LeagueConfig.defaults(), sleeps::add);
    }

    private static EventResults results(final String id, final String name) {
        return new EventResults(id, name, "MPO", "https://www.pdga.com/tour/event/" + id,
                List.of(new ResultRow(1, 69424, "Calvin Heimburg", false)));
    }

    private static EventRef withId(final String id) {
        return argThat(e -> e != null && e.eventId().equals(id));
    }

    @Test
    void scrapeEventWritesOneFile() throws Exception {
        when(provider.fetchEvent(withId("88276"), eq("MPO"))).thenReturn(results("88276", "Supreme Flight Open"));

        final EventResults scraped = scraper.scrapeEvent("88276");

        assertEquals("Supreme Flight Open", scraped.name());
        final Path file = dataDir.resolve(JsonLeagueStore.EVENTS_DIR).resolve("event_88276_results.json");
        assertTrue(Files.exists(file));
        assertTrue(Files.readString(file).contains("\"pdga_number\" : 69424"));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void scrapeEventPropagatesProviderFailure() throws Exception {
        when(provider.fetchEvent(withId("1"), eq("MPO"))).thenThrow(new ProviderException("Event page not found: 1"));

        assertThrows(ProviderException.class, () -> scraper.scrapeEvent("1"));
        assertFalse(Files.exists(dataDir.resolve(JsonLeagueStore.EVENTS_DIR)));
    }

    @Test
    void scrapeScheduledContinuesPastFailures() throws Exception {
        final ScheduleIndex schedule = ScheduleIndex.load(List.of(
                List.of("First Open", "ES", "May 1 - 3", "100"),
                List.of("No Id Classic", "ES", "May 8 - 10"),
                List.of("Broken Page Open", "ES", "May 15 - 17", "200"),
                List.of("Third Open", "ESP", "May 22 - 24", "300")));
        when(provider.fetchEvent(withId("100"), eq("MPO"))).thenReturn(results("100", "First Open"));
        when(provider.fetchEvent(withId("200"), eq("MPO"))).thenThrow(new ProviderException("HTTP 500"));
        when(provider.fetchEvent(withId("300"), eq("MPO"))).thenReturn(results("300", "Third Open"));

        final List<EventResults> scraped = scraper.scrapeScheduled(schedule);

        assertEquals(List.of("100", "300"), scraped.stream().map(EventResults::eventId).toList());
        assertTrue(Files.exists(dataDir.resolve("events/event_100_results.json")));
        assertFalse(Files.exists(dataDir.resolve("events/event_200_results.json")));
        assertTrue(Files.exists(dataDir.resolve("events/event_300_results.json")));
        assertEquals(List.of(3000L, 3000L), sleeps);
    }

    @Test
    void scrapeScheduledWithoutEventIdsDoesNothing() throws Exception {
        final ScheduleIndex schedule = ScheduleIndex.load(List.of(
                List.of("No Id Classic", "ES", "May 8 - 10")));

        assertTrue(scraper.scrapeScheduled(schedule).isEmpty());
        verifyNoInteractions(provider);
    }
}
