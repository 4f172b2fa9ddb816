package ou.capstone.fantasy;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

import ou.capstone.fantasy.tier.TierClassifier;

class TournamentTest {

    private final TierClassifier tiers = new TierClassifier();

    @Test
    void builderRequiresNameTierAndDates() {
        assertThrows(NullPointerException.class, () -> new Tournament.Builder()
                .tier(tiers.classify("ES")).datesRaw("March 1 - 2").build());
        assertThrows(NullPointerException.class, () -> new Tournament.Builder()
                .name("Open").datesRaw("March 1 - 2").build());
        assertThrows(NullPointerException.class, () -> new Tournament.Builder()
                .name("Open").tier(tiers.classify("ES")).build());
    }

    @Test
    void startAndEndAreBothSetOrBothUnset() {
        assertThrows(IllegalArgumentException.class, () -> new Tournament.Builder()
                .name("Open").tier(tiers.classify("ES")).datesRaw("March 1 - 2")
                .startDate(LocalDate.of(2025, 3, 1)).build());
    }

    @Test
    void overlapIsInclusiveAtBothEnds() {
        final Tournament t = LeagueFixtures.tournament("Open", "ES",
                LocalDate.of(2025, 3, 14), LocalDate.of(2025, 3, 16), null);

        assertTrue(t.overlaps(LocalDate.of(2025, 3, 16), LocalDate.of(2025, 3, 20)));
        assertTrue(t.overlaps(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 14)));
        assertTrue(t.overlaps(LocalDate.of(2025, 3, 15), LocalDate.of(2025, 3, 15)));
        assertFalse(t.overlaps(LocalDate.of(2025, 3, 17), LocalDate.of(2025, 3, 20)));
        assertFalse(t.overlaps(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 13)));
    }

    @Test
    void unresolvedDatesNeverOverlap() {
        final Tournament t = new Tournament.Builder()
                .name("Open").tier(tiers.classify("ES")).datesRaw("TBD").eventId("  ").build();

        assertFalse(t.hasResolvedDates());
        assertFalse(t.overlaps(LocalDate.MIN, LocalDate.MAX));
        assertTrue(t.getEventId().isEmpty());
    }

    @Test
    void eventIdIsTrimmed() {
        final Tournament t = new Tournament.Builder()
                .name("Open").tier(tiers.classify("M")).datesRaw("TBD").eventId(" 88276 ").build();

        assertEquals("88276", t.getEventId().orElseThrow());
        assertEquals("M", t.getTierAbbreviation());
    }
}
