package ou.capstone.fantasy;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.fantasy.UpdateReport.SkipReason;
import ou.capstone.fantasy.UpdateReport.SkippedTournament;
import ou.capstone.fantasy.api.EventRef;
import ou.capstone.fantasy.api.ResultRow;
import ou.capstone.fantasy.api.ResultsProvider;
import ou.capstone.fantasy.exceptions.EventNotFoundException;
import ou.capstone.fantasy.exceptions.ProviderException;
import ou.capstone.fantasy.exceptions.RateLimitException;
import ou.capstone.fantasy.exceptions.StoreException;
import ou.capstone.fantasy.roster.Team;
import ou.capstone.fantasy.schedule.ScheduleIndex;
import ou.capstone.fantasy.scoring.PlacementScorer;
import ou.capstone.fantasy.scoring.ScoringEngine;
import ou.capstone.fantasy.scoring.StandardPlacementScorer;
import ou.capstone.fantasy.scoring.WeekSummary;
import ou.capstone.fantasy.standings.PlayerStats;
import ou.capstone.fantasy.standings.StandingsAggregator;
import ou.capstone.fantasy.store.LeagueData;
import ou.capstone.fantasy.store.LeagueStore;
import ou.capstone.fantasy.validation.RosterValidator;
import ou.capstone.fantasy.validation.ValidationResult;

/**
 * Runs the weekly league update.
 *
 * Loads the league, finds scheduled tournaments that finished inside the lookback
 * window, fetches their results one at a time, scores them as one week and saves
 * every document. A tournament that cannot be found or fetched is skipped for this
 * run; a store failure aborts the run before anything changes.
 */
public class LeagueUpdater {

    private static final Logger logger = LoggerFactory.getLogger(LeagueUpdater.class);

    private final LeagueStore store;
    private final ResultsProvider provider;
    private final ScheduleIndex schedule;
    private final PlacementScorer scorer;
    private final ScoringEngine engine;
    private final StandingsAggregator aggregator;
    private final RosterValidator rosterValidator;
    private final Clock clock;
    private final Sleeper sleeper;
    private final String division;
    private final int lookbackDays;
    private final long fetchDelayMillis;

    private int providerCalls;

    public LeagueUpdater(final LeagueStore store,
                         final ResultsProvider provider,
                         final ScheduleIndex schedule,
                         final LeagueConfig config,
                         final Clock clock,
                         final Sleeper sleeper) {
        this.store = store;
        this.provider = provider;
        this.schedule = schedule;
        this.clock = clock;
        this.sleeper = sleeper;
        this.scorer = new StandardPlacementScorer();
        this.aggregator = new StandingsAggregator(clock);
        this.engine = new ScoringEngine(scorer, aggregator);
        this.rosterValidator = new RosterValidator();
        this.division = config.division();
        this.lookbackDays = config.lookbackDays();
        this.fetchDelayMillis = config.fetchDelayMillis();
    }

    /**
     * Runs one update.
     *
     * @return what was scored and what was skipped
     * @throws StoreException if the league cannot be loaded, fails validation, or cannot be saved
     */
    public UpdateReport runWeeklyUpdate() throws StoreException {
        logger.info("Starting weekly update");
        providerCalls = 0;

        final LeagueData data = store.load();
        final ValidationResult validation = rosterValidator.validate(data.rosters(),
                data.standings().getCurrentWeek());
        if (!validation.isOk()) {
            logger.error("{}: {}", validation.message(), validation.problems());
            throw new StoreException(validation.message() + ": " + String.join("; ", validation.problems()));
        }

        final List<Team> teams = data.rosters().getTeams();
        aggregator.ensureEntries(data.standings(), teams.stream()
                .map(t -> new StandingsAggregator.TeamRef(t.getName(), t.getOwner()))
                .toList());

        final LocalDate today = LocalDate.now(clock);
        final LocalDate start = today.minusDays(lookbackDays);
        logger.info("Looking for tournaments between {} and {}", start, today);

        final List<TournamentResults> batch = new ArrayList<>();
        final List<SkippedTournament> skipped = new ArrayList<>();
        collectResults(schedule.getInRange(start, today), data, batch, skipped);

        final WeekSummary summary = engine.applyWeek(data.standings(), batch, teams);

        if (summary.applied()) {
            final Set<String> scoredKeys = Set.copyOf(summary.processedKeys());
            for (TournamentResults tr : batch) {
                if (scoredKeys.contains(tr.processingKey())) {
                    data.history().record(tr, teams, scorer, summary.weekNumber());
                }
            }
            store.save(data.withPlayerStats(PlayerStats.rebuild(teams, clock)));
            logger.info("Week {} complete: {} tournament(s) scored", summary.weekNumber(),
                    summary.scoredTournaments().size());
        } else {
            logger.info("No new tournament results; nothing saved");
        }

        return new UpdateReport(start, today, batch, skipped, summary);
    }

    private void collectResults(final List<Tournament> candidates,
                                final LeagueData data,
                                final List<TournamentResults> batch,
                                final List<SkippedTournament> skipped) {
        if (candidates.isEmpty()) {
            logger.info("No tournaments found in date range");
            return;
        }
        logger.info("Found {} scheduled tournament(s) in range", candidates.size());

        final LocalDateTime now = LocalDateTime.now(clock);
        for (Tournament tournament : candidates) {
            if (!tournament.getEndDate().atStartOfDay().isBefore(now)) {
                logger.info("Skipping {} (not finished yet)", tournament.getName());
                skipped.add(new SkippedTournament(tournament.getName(), SkipReason.NOT_FINISHED,
                        "ends " + tournament.getEndDate()));
                continue;
            }

            if (tournament.getEventId().map(data.standings()::isProcessed).orElse(false)) {
                logger.info("Skipping {} (event {} already scored)", tournament.getName(),
                        tournament.getEventId().get());
                skipped.add(new SkippedTournament(tournament.getName(), SkipReason.ALREADY_PROCESSED,
                        "event " + tournament.getEventId().get()));
                continue;
            }

            try {
                fetchOne(tournament, data, batch, skipped);
            } catch (EventNotFoundException e) {
                logger.warn("Could not find {} on the results site", tournament.getName());
                skipped.add(new SkippedTournament(tournament.getName(), SkipReason.EVENT_NOT_FOUND, e.getMessage()));
            } catch (RateLimitException e) {
                logger.warn("Rate limited while fetching {}: {}", tournament.getName(), e.getMessage());
                skipped.add(new SkippedTournament(tournament.getName(), SkipReason.PROVIDER_ERROR, e.getMessage()));
            } catch (ProviderException e) {
                logger.warn("Failed to fetch {}: {}", tournament.getName(), e.getMessage());
                if (logger.isDebugEnabled()) {
                    logger.debug("Stack trace for failed fetch:", e);
                }
                skipped.add(new SkippedTournament(tournament.getName(), SkipReason.PROVIDER_ERROR, e.getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting between requests; scoring what was fetched so far");
                skipped.add(new SkippedTournament(tournament.getName(), SkipReason.PROVIDER_ERROR, "interrupted"));
                return;
            }
        }
    }

    private void fetchOne(final Tournament tournament,
                          final LeagueData data,
                          final List<TournamentResults> batch,
                          final List<SkippedTournament> skipped)
            throws EventNotFoundException, ProviderException, InterruptedException {
        logger.info("Processing: {} ({}, {})", tournament.getName(),
                tournament.getTier().tierName(), tournament.getDatesRaw());

        final EventRef event;
        if (tournament.getEventId().isPresent()) {
            event = new EventRef(tournament.getEventId().get(), tournament.getName());
        } else {
            pace();
            event = provider.findEvent(tournament.getName());
            if (data.standings().isProcessed(event.eventId())) {
                logger.info("Skipping {} (event {} already scored)", tournament.getName(), event.eventId());
                skipped.add(new SkippedTournament(tournament.getName(), SkipReason.ALREADY_PROCESSED,
                        "event " + event.eventId()));
                return;
            }
        }

        pace();
        final List<ResultRow> rows = provider.fetchResults(event, division);
        if (rows.isEmpty()) {
            logger.warn("No {} results for {} yet", division, tournament.getName());
            skipped.add(new SkippedTournament(tournament.getName(), SkipReason.NO_RESULTS,
                    "event " + event.eventId()));
            return;
        }

        logger.info("Fetched {} result(s) for {}", rows.size(), tournament.getName());
        batch.add(new TournamentResults(tournament, event, rows));
    }

    private void pace() throws InterruptedException {
        if (providerCalls > 0 && fetchDelayMillis > 0) {
            logger.debug("Waiting {} ms before the next request", fetchDelayMillis);
            sleeper.sleep(fetchDelayMillis);
        }
        providerCalls++;
    }
}
