package ou.capstone.fantasy.schedule;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ou.capstone.fantasy.Tournament;
import ou.capstone.fantasy.tier.Tier;
import ou.capstone.fantasy.tier.TierClassifier;

class ScheduleIndexTest {

    private static final Clock JUNE_2025 = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);

    private ScheduleIndex index;

    @BeforeEach
    void setUp() {
        index = ScheduleIndex.load(
                List.of(
                        List.of("Supreme Flight Open", "ES", "February 27 - March 1", "88276"),
                        List.of("Big Easy Open", "ES", "March 14-16"),
                        List.of("Jonesboro Open", "ESP", "April 11 - 13", ""),
                        List.of("Champions Cup", "M", "May 29 - June 1"),
                        List.of("Mystery Open", "XX", "June 13-15"),
                        List.of("Broken Dates Open", "ES", "Sometime in July"),
                        List.of("Missing Fields Open", "ES")),
                new TierClassifier(),
                new DateRangeResolver(JUNE_2025));
    }

    @Test
    void loadsRecordsAndSkipsMalformedOnes() {
        assertEquals(6, index.size());
        assertEquals(1, index.skippedRecords());
        assertEquals(1, index.withEventIdCount());
        assertEquals(1, index.unmappedTierCount());
        assertEquals(1, index.unresolvedDateCount());
    }

    @Test
    void supremeFlightIsEliteSeriesWithEventId() {
        final Tournament t = index.findByName("supreme flight").orElseThrow();

        assertEquals(Tier.ELITE_SERIES, t.getTier().tier());
        assertEquals("Elite Series", t.getTier().tierName());
        assertEquals(1.0, t.getTier().multiplier());
        assertEquals("88276", t.getEventId().orElseThrow());
        assertEquals(LocalDate.of(2025, 2, 27), t.getStartDate());
        assertEquals(LocalDate.of(2025, 3, 1), t.getEndDate());
    }

    @Test
    void blankEventIdIsAbsent() {
        assertTrue(index.findByName("Jonesboro").orElseThrow().getEventId().isEmpty());
    }

    @Test
    void unknownTierIsKeptAsUnmapped() {
        final Tournament t = index.findByName("Mystery").orElseThrow();

        assertTrue(t.getTier().isUnmapped());
        assertEquals(1.0, t.getTier().multiplier());
    }

    @Test
    void findsByEventIdAndResolvesIdForName() {
        assertEquals("Supreme Flight Open", index.findByEventId(" 88276 ").orElseThrow().getName());
        assertTrue(index.findByEventId("12345").isEmpty());
        assertEquals("88276", index.eventIdFor("Supreme").orElseThrow());
        assertTrue(index.eventIdFor("Big Easy").isEmpty());
    }

    @Test
    void rangeQueryUsesInclusiveOverlap() {
        // Window touches Supreme Flight's last day only
        final List<Tournament> hits = index.getInRange(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 10));

        assertEquals(List.of("Supreme Flight Open"), hits.stream().map(Tournament::getName).toList());
    }

    @Test
    void rangeQueryMatchesOverlapLawAndSkipsUnresolved() {
        final LocalDate start = LocalDate.of(2025, 3, 1);
        final LocalDate end = LocalDate.of(2025, 7, 31);

        final List<Tournament> hits = index.getInRange(start, end);

        for (Tournament t : index.tournaments()) {
            final boolean expected = t.hasResolvedDates()
                    && !t.getStartDate().isAfter(end) && !t.getEndDate().isBefore(start);
            assertEquals(expected, hits.contains(t), t.getName());
        }
        assertFalse(hits.stream().anyMatch(t -> t.getName().equals("Broken Dates Open")));
    }

    @Test
    void rangeResultsKeepScheduleOrder() {
        final List<Tournament> hits = index.getInRange(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 12, 31));

        assertEquals(List.of("Supreme Flight Open", "Big Easy Open", "Jonesboro Open", "Champions Cup", "Mystery Open"),
                hits.stream().map(Tournament::getName).toList());
    }

    @Test
    void upcomingIsBoundedAndSorted() {
        final List<Tournament> upcoming = index.upcoming(LocalDate.of(2025, 5, 20), 30);

        assertEquals(List.of("Champions Cup", "Mystery Open"), upcoming.stream().map(Tournament::getName).toList());
    }

    @Test
    void partitionsByEventId() {
        assertEquals(1, index.withEventIds().size());
        assertEquals(5, index.withoutEventIds().size());
    }

    @Test
    void sortedViewPutsUnresolvedLast() {
        final List<Tournament> sorted = index.sortedByStartDate();

        assertEquals("Supreme Flight Open", sorted.get(0).getName());
        assertEquals("Broken Dates Open", sorted.get(sorted.size() - 1).getName());
    }

    @Test
    void readsScheduleFileSkippingCommentsAndBlankLines() throws Exception {
        final ScheduleIndex fromFile = ScheduleIndex.fromFile(fixture("league/tournaments.txt"),
                new TierClassifier(), JUNE_2025);

        assertEquals(6, fromFile.size());
        assertEquals(1, fromFile.skippedRecords());
        assertEquals(2, fromFile.withEventIdCount());
    }

    @Test
    void missingScheduleFileGivesEmptyIndex(@TempDir final Path dir) throws Exception {
        final ScheduleIndex empty = ScheduleIndex.fromFile(dir.resolve("nope.txt"), new TierClassifier(), JUNE_2025);

        assertEquals(0, empty.size());
        assertTrue(empty.getInRange(LocalDate.MIN, LocalDate.MAX).isEmpty());
    }

    private static Path fixture(final String name) throws URISyntaxException {
        return Paths.get(ScheduleIndexTest.class.getClassLoader().getResource(name).toURI());
    }
}
