package ou.capstone.fantasy.scoring;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link ScoringEngine#applyWeek}.
 *
 * When {@code applied} is false nothing was mutated: every tournament in the batch
 * had already been scored (or the batch was empty) and {@code weekNumber} is the
 * unchanged current week.
 */
public record WeekSummary(int weekNumber,
                          boolean applied,
                          List<String> scoredTournaments,
                          List<String> processedKeys,
                          List<String> alreadyProcessed,
                          List<TeamWeekResult> teamResults) {

    public WeekSummary {
        scoredTournaments = List.copyOf(scoredTournaments);
        processedKeys = List.copyOf(processedKeys);
        alreadyProcessed = List.copyOf(alreadyProcessed);
        teamResults = List.copyOf(teamResults);
    }

    static WeekSummary notApplied(final int currentWeek, final List<String> alreadyProcessed) {
        return new WeekSummary(currentWeek, false, List.of(), List.of(), alreadyProcessed, List.of());
    }

    public Optional<TeamWeekResult> teamResult(final String teamName) {
        return teamResults.stream().filter(r -> r.teamName().equals(teamName)).findFirst();
    }
}
