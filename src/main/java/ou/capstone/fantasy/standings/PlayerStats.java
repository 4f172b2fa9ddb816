package ou.capstone.fantasy.standings;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import ou.capstone.fantasy.roster.Player;
import ou.capstone.fantasy.roster.Team;

/**
 * The player statistics document: a league-wide leaderboard derived from rosters.
 */
public final class PlayerStats {
    private final List<PlayerStatLine> lines;
    private final String lastUpdated;

    @JsonCreator
    public PlayerStats(@JsonProperty("player_stats") final List<PlayerStatLine> lines,
                       @JsonProperty("last_updated") final String lastUpdated) {
        this.lines = lines == null ? List.of() : List.copyOf(lines);
        this.lastUpdated = lastUpdated;
    }

    public static PlayerStats empty() {
        return new PlayerStats(List.of(), null);
    }

    /**
     * Rebuilds the leaderboard. Players with points come first, lowest total first;
     * players who have not scored yet follow in roster order.
     */
    public static PlayerStats rebuild(final List<Team> teams, final Clock clock) {
        final List<PlayerStatLine> scored = new ArrayList<>();
        final List<PlayerStatLine> unscored = new ArrayList<>();

        for (Team team : teams) {
            for (Player player : team.getPlayers()) {
                final PlayerStatLine line = new PlayerStatLine(
                        player.getName(),
                        player.getPdgaNumber(),
                        team.getName(),
                        team.getOwner(),
                        player.isUnderdog(),
                        player.getSeasonTotal(),
                        player.getTournamentsPlayed(),
                        player.getTimesCounted(),
                        player.averageWhenCounted());
                if (player.getSeasonTotal() > 0.0) {
                    scored.add(line);
                } else {
                    unscored.add(line);
                }
            }
        }

        scored.sort(Comparator.comparingDouble(PlayerStatLine::seasonTotal));
        final List<PlayerStatLine> all = new ArrayList<>(scored);
        all.addAll(unscored);

        return new PlayerStats(all, Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString());
    }

    @JsonProperty("player_stats")
    public List<PlayerStatLine> getLines() { return lines; }

    @JsonProperty("last_updated")
    public String getLastUpdated() { return lastUpdated; }
}
