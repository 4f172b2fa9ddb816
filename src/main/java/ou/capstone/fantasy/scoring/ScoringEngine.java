package ou.capstone.fantasy.scoring;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.fantasy.TournamentResults;
import ou.capstone.fantasy.api.ResultRow;
import ou.capstone.fantasy.roster.Player;
import ou.capstone.fantasy.roster.Team;
import ou.capstone.fantasy.roster.WeeklyScoreEntry;
import ou.capstone.fantasy.standings.SeasonStandings;
import ou.capstone.fantasy.standings.StandingsAggregator;

/**
 * Scores one week of tournaments for every team.
 *
 * Each player's week score is the sum of their placement scores over all
 * tournaments in the batch. Per team, only players who played are eligible and
 * the {@value #TOP_K} lowest week scores count (ties keep roster order). Counted
 * players get their week score added to their season total.
 *
 * Tournaments already recorded as processed in the season are dropped before
 * anything is mutated, so applying the same batch twice changes nothing the
 * second time.
 *
 * Not thread-safe; one weekly update at a time.
 */
public class ScoringEngine {

    private static final Logger logger = LoggerFactory.getLogger(ScoringEngine.class);

    public static final int TOP_K = 3;

    private final PlacementScorer scorer;
    private final StandingsAggregator aggregator;

    public ScoringEngine(final StandingsAggregator aggregator) {
        this(new StandardPlacementScorer(), aggregator);
    }

    public ScoringEngine(final PlacementScorer scorer, final StandingsAggregator aggregator) {
        this.scorer = scorer;
        this.aggregator = aggregator;
    }

    /**
     * Applies a week's batch of tournaments, in the order given, to every team.
     *
     * @param season       standings state; its week advances if anything is scored
     * @param batch        finished tournaments with their results
     * @param teams        league rosters; player accumulators are updated in place
     * @return what was scored
     */
    public WeekSummary applyWeek(final SeasonStandings season,
                                 final List<TournamentResults> batch,
                                 final List<Team> teams) {
        final List<TournamentResults> fresh = new ArrayList<>();
        final List<String> alreadyProcessed = new ArrayList<>();
        final Set<String> seenKeys = new HashSet<>();

        for (TournamentResults tr : batch) {
            final String key = tr.processingKey();
            if (season.isProcessed(key) || !seenKeys.add(key)) {
                logger.info("Skipping {} (event {}): already scored", tr.tournament().getName(), key);
                alreadyProcessed.add(tr.tournament().getName());
                continue;
            }
            fresh.add(tr);
        }

        if (fresh.isEmpty()) {
            logger.info("No new tournaments to score; standings stay at week {}", season.getCurrentWeek());
            return WeekSummary.notApplied(season.getCurrentWeek(), alreadyProcessed);
        }

        final int week = season.getCurrentWeek() + 1;
        logger.info("Updating fantasy scores for week {} ({} tournament(s))", week, fresh.size());

        final List<TeamWeekResult> teamResults = new ArrayList<>();
        for (Team team : teams) {
            teamResults.add(scoreTeam(team, fresh, week));
        }

        final WeekSummary summary = new WeekSummary(
                week,
                true,
                fresh.stream().map(tr -> tr.tournament().getName()).toList(),
                fresh.stream().map(TournamentResults::processingKey).toList(),
                alreadyProcessed,
                teamResults);

        aggregator.commitWeek(season, summary);
        return summary;
    }

    private TeamWeekResult scoreTeam(final Team team, final List<TournamentResults> batch, final int week) {
        logger.debug("Team: {}", team.getName());

        final List<PlayerWeek> played = new ArrayList<>();
        for (Player player : team.getPlayers()) {
            double weekScore = 0.0;
            final List<WeeklyScoreEntry> entries = new ArrayList<>();

            for (TournamentResults tr : batch) {
                final Optional<ResultRow> result = tr.findResult(player.getPdgaNumber());
                if (result.isEmpty()) {
                    continue;
                }
                final int placement = result.get().placement();
                final double score = scorer.score(placement, tr.tournament().getTier(), player.isUnderdog());
                weekScore += score;

                final WeeklyScoreEntry entry = new WeeklyScoreEntry(week, tr.tournament().getName(), placement,
                        score, tr.tournament().getTier().label(), false);
                player.addEntry(entry);
                entries.add(entry);
                if (logger.isDebugEnabled()) {
                    logger.debug("   {}: place {} at {} = {} pts",
                            player.getName(), placement, tr.tournament().getName(), score);
                }
            }

            if (!entries.isEmpty()) {
                player.addTournamentsPlayed(entries.size());
                played.add(new PlayerWeek(player, weekScore, entries));
            }
        }

        // List.sort is stable: equal week scores keep roster order
        final List<PlayerWeek> ranked = new ArrayList<>(played);
        ranked.sort(Comparator.comparingDouble(PlayerWeek::weekScore));
        final List<PlayerWeek> selected = ranked.subList(0, Math.min(TOP_K, ranked.size()));

        double teamWeekScore = 0.0;
        for (PlayerWeek pw : selected) {
            // Only this week's new entries; stored entries keep their flags
            pw.player().countWeek(pw.entries());
            teamWeekScore += pw.weekScore();
        }

        logger.info("Team {}: week {} total {} from {} counted player(s)",
                team.getName(), week, teamWeekScore, selected.size());

        return new TeamWeekResult(team.getName(), team.getOwner(),
                played.stream().map(PlayerWeek::toScore).toList(),
                selected.stream().map(PlayerWeek::toScore).toList(),
                teamWeekScore);
    }

    private record PlayerWeek(Player player, double weekScore, List<WeeklyScoreEntry> entries) {
        PlayerWeekScore toScore() {
            return new PlayerWeekScore(player.getName(), player.getPdgaNumber(), weekScore, entries.size());
        }
    }
}
