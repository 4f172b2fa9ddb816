package ou.capstone.fantasy.api;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import ou.capstone.fantasy.exceptions.EventNotFoundException;
import ou.capstone.fantasy.exceptions.ProviderException;
import ou.capstone.fantasy.exceptions.RateLimitException;

@ExtendWith(MockitoExtension.class)
class PdgaResultsProviderTest {

    @Mock
    private PdgaWebClient webClient;

    @Test
    void numericInputIsTakenAsEventId() throws Exception {
        final PdgaResultsProvider provider = new PdgaResultsProvider(webClient);

        final EventRef ref = provider.findEvent(" 88276 ");

        assertEquals("88276", ref.eventId());
        verify(webClient, never()).fetchPage(anyString(), anyMap());
    }

    @Test
    void nameIsSearchedWithTitleAndOfficialName() throws Exception {
        when(webClient.fetchPage(eq("/tour/search"), anyMap()))
                .thenReturn(Optional.of(PdgaPageParserTest.fixture("search_results.html")));
        final PdgaResultsProvider provider = new PdgaResultsProvider(webClient);

        final EventRef ref = provider.findEvent("Supreme Flight Open");

        assertEquals("88276", ref.eventId());
        assertEquals("Supreme Flight Open", ref.displayName().orElseThrow());
        verify(webClient).fetchPage("/tour/search",
                Map.of("title", "Supreme Flight Open", "OfficialName", "Supreme Flight Open"));
    }

    @Test
    void noSearchHitIsEventNotFound() throws Exception {
        when(webClient.fetchPage(eq("/tour/search"), anyMap()))
                .thenReturn(Optional.of(PdgaPageParserTest.fixture("search_empty.html")));
        final PdgaResultsProvider provider = new PdgaResultsProvider(webClient);

        final EventNotFoundException e = assertThrows(EventNotFoundException.class,
                () -> provider.findEvent("Nonexistent Classic"));
        assertEquals("Nonexistent Classic", e.getQuery());
    }

    @Test
    void searchPageNotFoundIsEventNotFound() throws Exception {
        when(webClient.fetchPage(eq("/tour/search"), anyMap())).thenReturn(Optional.empty());
        final PdgaResultsProvider provider = new PdgaResultsProvider(webClient);

        assertThrows(EventNotFoundException.class, () -> provider.findEvent("Anything"));
    }

    @Test
    void blankInputIsEventNotFound() {
        final PdgaResultsProvider provider = new PdgaResultsProvider(webClient);

        assertThrows(EventNotFoundException.class, () -> provider.findEvent("   "));
    }

    @Test
    void fetchResultsParsesEventPage() throws Exception {
        when(webClient.fetchPage(eq("/tour/event/88276"), anyMap()))
                .thenReturn(Optional.of(PdgaPageParserTest.fixture("event_88276.html")));
        final PdgaResultsProvider provider = new PdgaResultsProvider(webClient);

        final List<ResultRow> rows = provider.fetchResults(EventRef.of("88276"), "MPO");

        assertEquals(4, rows.size());
    }

    @Test
    void missingEventPageIsProviderError() throws Exception {
        when(webClient.fetchPage(anyString(), anyMap())).thenReturn(Optional.empty());
        final PdgaResultsProvider provider = new PdgaResultsProvider(webClient);

        assertThrows(ProviderException.class, () -> provider.fetchResults(EventRef.of("1"), "MPO"));
    }

    @Test
    void rateLimitPropagates() throws Exception {
        when(webClient.fetchPage(anyString(), anyMap())).thenThrow(new RateLimitException("slow down"));
        final PdgaResultsProvider provider = new PdgaResultsProvider(webClient);

        assertThrows(RateLimitException.class, () -> provider.fetchResults(EventRef.of("1"), "MPO"));
    }

    @Test
    void fetchEventCarriesPageTitleAndUrl() throws Exception {
        when(webClient.fetchPage(eq("/tour/event/88276"), anyMap()))
                .thenReturn(Optional.of(PdgaPageParserTest.fixture("event_88276.html")));
        when(webClient.buildUri(eq("/tour/event/88276"), any()))
                .thenReturn(URI.create("https://www.pdga.com/tour/event/88276"));
        final PdgaResultsProvider provider = new PdgaResultsProvider(webClient);

        final EventResults event = provider.fetchEvent(EventRef.of("88276"), "MPO");

        assertEquals("88276", event.eventId());
        assertEquals("Supreme Flight Open presented by Prodigy", event.name());
        assertEquals("MPO", event.division());
        assertEquals("https://www.pdga.com/tour/event/88276", event.url());
        assertEquals(4, event.results().size());
    }
}
