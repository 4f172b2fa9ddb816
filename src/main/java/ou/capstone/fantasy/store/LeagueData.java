package ou.capstone.fantasy.store;

import java.util.Objects;

import ou.capstone.fantasy.history.TournamentHistory;
import ou.capstone.fantasy.roster.Rosters;
import ou.capstone.fantasy.standings.PlayerStats;
import ou.capstone.fantasy.standings.SeasonStandings;

/**
 * Every league document, loaded together at the start of a run and saved together at its end.
 */
public record LeagueData(Rosters rosters,
                         SeasonStandings standings,
                         TournamentHistory history,
                         PlayerStats playerStats) {

    public LeagueData {
        Objects.requireNonNull(rosters, "rosters is required");
        Objects.requireNonNull(standings, "standings is required");
        Objects.requireNonNull(history, "history is required");
        Objects.requireNonNull(playerStats, "playerStats is required");
    }

    public LeagueData withPlayerStats(final PlayerStats stats) {
        return new LeagueData(rosters, standings, history, stats);
    }
}
