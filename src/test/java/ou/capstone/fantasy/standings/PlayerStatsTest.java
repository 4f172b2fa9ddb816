package ou.capstone.fantasy.standings;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;

import ou.capstone.fantasy.roster.Player;
import ou.capstone.fantasy.roster.Team;

class PlayerStatsTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2025-04-14T08:30:00Z"), ZoneOffset.UTC);

    @Test
    void scoredPlayersLeadLowestFirstThenUnscoredInRosterOrder() {
        final Player high = new Player("High", 1, false, 12.0, 2, 3, null);
        final Player idle = new Player("Idle", 2, true, 0.0, 0, 0, null);
        final Player low = new Player("Low", 3, false, 4.0, 1, 1, null);
        final Player bench = new Player("Bench", 4, false, 0.0, 0, 2, null);

        final PlayerStats stats = PlayerStats.rebuild(List.of(
                new Team("Alpha", "Ann", List.of(high, idle)),
                new Team("Beta", "Ben", List.of(low, bench))), FIXED);

        assertEquals(List.of("Low", "High", "Idle", "Bench"),
                stats.getLines().stream().map(PlayerStatLine::name).toList());
        assertEquals("2025-04-14T08:30:00Z", stats.getLastUpdated());

        final PlayerStatLine highLine = stats.getLines().get(1);
        assertEquals("Alpha", highLine.team());
        assertEquals("Ann", highLine.owner());
        assertEquals(6.0, highLine.averageWhenCounted());
        assertEquals(3, highLine.tournamentsPlayed());
        assertEquals(0.0, stats.getLines().get(2).averageWhenCounted());
    }
}
