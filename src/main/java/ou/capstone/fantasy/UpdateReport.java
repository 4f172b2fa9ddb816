package ou.capstone.fantasy;

import java.time.LocalDate;
import java.util.List;

import ou.capstone.fantasy.scoring.WeekSummary;

/**
 * Outcome of one weekly update run.
 *
 * @param rangeStart first day of the lookback window
 * @param rangeEnd   last day of the lookback window (the run date)
 * @param scored     tournaments whose results went into the week, in schedule order
 * @param skipped    tournaments in the window that were not scored, with the reason
 * @param week       what the scoring engine did with the batch
 */
public record UpdateReport(LocalDate rangeStart,
                           LocalDate rangeEnd,
                           List<TournamentResults> scored,
                           List<SkippedTournament> skipped,
                           WeekSummary week) {

    public UpdateReport {
        scored = List.copyOf(scored);
        skipped = List.copyOf(skipped);
    }

    public boolean applied() {
        return week.applied();
    }

    public enum SkipReason {
        NOT_FINISHED,
        ALREADY_PROCESSED,
        EVENT_NOT_FOUND,
        PROVIDER_ERROR,
        NO_RESULTS
    }

    public record SkippedTournament(String name, SkipReason reason, String detail) {
    }
}
