package ou.capstone.fantasy.history;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

import static ou.capstone.fantasy.LeagueFixtures.player;
import static ou.capstone.fantasy.LeagueFixtures.results;
import static ou.capstone.fantasy.LeagueFixtures.team;
import static ou.capstone.fantasy.LeagueFixtures.tournament;
import static ou.capstone.fantasy.LeagueFixtures.underdog;

import ou.capstone.fantasy.Tournament;
import ou.capstone.fantasy.scoring.StandardPlacementScorer;

class TournamentHistoryTest {

    private static HistoryEntry entry(final int i) {
        return new HistoryEntry("Event " + i, String.valueOf(i), null, "Elite", i, List.of());
    }

    @Test
    void keepsOnlyTheTenMostRecent() {
        final TournamentHistory history = new TournamentHistory();
        for (int i = 1; i <= 12; i++) {
            history.add(entry(i));
        }

        assertEquals(TournamentHistory.MAX_ENTRIES, history.getTournaments().size());
        assertEquals("Event 3", history.getTournaments().get(0).name());
        assertEquals("Event 12", history.getTournaments().get(9).name());
    }

    @Test
    void oversizedDocumentIsTrimmedOnLoad() {
        final List<HistoryEntry> fifteen = new ArrayList<>();
        for (int i = 1; i <= 15; i++) {
            fifteen.add(entry(i));
        }

        final TournamentHistory history = new TournamentHistory(fifteen);

        assertEquals(10, history.getTournaments().size());
        assertEquals("Event 6", history.getTournaments().get(0).name());
    }

    @Test
    void recordsRosteredFinishesWithScores() {
        final Tournament t = tournament("Jonesboro Open", "ESP",
                LocalDate.of(2025, 4, 11), LocalDate.of(2025, 4, 13), "88277");
        final TournamentHistory history = new TournamentHistory();

        history.record(results(t, 9, 21, 2), List.of(
                team("Alpha", player("Twenty-One", 21)),
                team("Beta", underdog("Two", 2), player("Absent", 77))),
                new StandardPlacementScorer(), 4);

        final HistoryEntry recorded = history.getTournaments().get(0);
        assertEquals("Jonesboro Open", recorded.name());
        assertEquals("88277", recorded.eventId());
        assertEquals("2025-04-13", recorded.date());
        assertEquals("Elite", recorded.tier());
        assertEquals(4, recorded.week());
        assertEquals(2, recorded.fantasyResults().size());

        final FantasyResult first = recorded.fantasyResults().get(0);
        assertEquals("Twenty-One", first.player());
        assertEquals("Alpha", first.team());
        assertEquals("2nd place", first.finish());
        assertEquals(3.0, first.points());

        final FantasyResult second = recorded.fantasyResults().get(1);
        assertEquals("3rd place", second.finish());
        assertEquals(2.25, second.points());
        assertTrue(recorded.fantasyResults().stream().noneMatch(r -> r.player().equals("Absent")));
    }

    @Test
    void ordinalSuffixes() {
        assertEquals("1st", Ordinals.of(1));
        assertEquals("2nd", Ordinals.of(2));
        assertEquals("3rd", Ordinals.of(3));
        assertEquals("4th", Ordinals.of(4));
        assertEquals("11th", Ordinals.of(11));
        assertEquals("12th", Ordinals.of(12));
        assertEquals("13th", Ordinals.of(13));
        assertEquals("21st", Ordinals.of(21));
        assertEquals("102nd", Ordinals.of(102));
        assertEquals("111th", Ordinals.of(111));
    }
}
