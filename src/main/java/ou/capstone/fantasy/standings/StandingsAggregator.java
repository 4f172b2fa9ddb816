package ou.capstone.fantasy.standings;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.fantasy.scoring.PlayerWeekScore;
import ou.capstone.fantasy.scoring.TeamWeekResult;
import ou.capstone.fantasy.scoring.WeekSummary;

/**
 * Records scored weeks into the standings and derives totals and ranks.
 * Lower total is better.
 */
public class StandingsAggregator {

    private static final Logger logger = LoggerFactory.getLogger(StandingsAggregator.class);

    private final Clock clock;

    public StandingsAggregator() {
        this(Clock.systemUTC());
    }

    public StandingsAggregator(final Clock clock) {
        this.clock = clock;
    }

    /**
     * Commits a scored week: advances the season week, appends one breakdown per
     * team, records the scored events as processed and recomputes the standings.
     */
    public void commitWeek(final SeasonStandings season, final WeekSummary summary) {
        if (!summary.applied()) {
            throw new IllegalArgumentException("Cannot commit a week that was not applied");
        }

        season.advanceWeek(summary.weekNumber());

        for (TeamWeekResult result : summary.teamResults()) {
            final List<CountedPlayer> counted = result.selected().stream()
                    .map(StandingsAggregator::toCounted)
                    .toList();
            season.entryFor(result.teamName(), result.owner())
                    .appendWeek(new WeeklyBreakdown(summary.weekNumber(), result.teamWeekScore(), counted));
        }

        summary.processedKeys().forEach(season::markProcessed);
        season.stampUpdated(timestamp());
        recompute(season);

        logger.info("Committed week {} for {} team(s)", summary.weekNumber(), summary.teamResults().size());
    }

    /**
     * Recomputes every team's total and weeks counted from its breakdown, then
     * ranks ascending by total. Teams with equal totals keep their current order.
     * Breakdown records are read, never changed, so repeated calls give the same result.
     */
    public void recompute(final SeasonStandings season) {
        final List<StandingEntry> standings = season.mutableStandings();

        for (StandingEntry entry : standings) {
            double total = 0.0;
            for (WeeklyBreakdown week : entry.getWeeklyBreakdown()) {
                total += week.score();
            }
            entry.updateTotals(total, entry.getWeeklyBreakdown().size());
        }

        standings.sort(Comparator.comparingDouble(StandingEntry::getTotalScore));

        for (int i = 0; i < standings.size(); i++) {
            standings.get(i).updateRank(i + 1);
        }
    }

    /**
     * Ensures every team has a standings line, so teams added to the rosters
     * between seasons show up with zero weeks.
     */
    public void ensureEntries(final SeasonStandings season, final List<TeamRef> teams) {
        for (TeamRef team : teams) {
            season.entryFor(team.name(), team.owner());
        }
    }

    private String timestamp() {
        return Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString();
    }

    private static CountedPlayer toCounted(final PlayerWeekScore score) {
        return new CountedPlayer(score.playerName(), score.weekScore(), score.tournamentsPlayed());
    }

    /** Name and owner of a team, as listed in the rosters. */
    public record TeamRef(String name, String owner) {
    }
}
