package ou.capstone.fantasy.print;

import java.util.List;
import java.util.stream.Collectors;

import ou.capstone.fantasy.scoring.PlayerWeekScore;
import ou.capstone.fantasy.scoring.TeamWeekResult;
import ou.capstone.fantasy.scoring.WeekSummary;
import ou.capstone.fantasy.standings.SeasonStandings;
import ou.capstone.fantasy.standings.StandingEntry;

/** Prints the season standings table. Lower points lead. */
public final class StandingsPrinter extends ConsolePrinter<SeasonStandings> {

    private static final int RANK_COL_WIDTH = 4;
    private static final int TEAM_COL_WIDTH = 28;
    private static final int OWNER_COL_WIDTH = 18;
    private static final int TOTAL_COL_WIDTH = 8;
    private static final int WEEKS_COL_WIDTH = 5;

    @Override
    public String render(final SeasonStandings season) {
        if (season == null || season.getStandings().isEmpty()) {
            return "No standings to display.";
        }

        final StringBuilder sb = new StringBuilder();
        sb.append("Standings after week ").append(season.getCurrentWeek());
        if (season.getLastUpdated() != null) {
            sb.append(" (updated ").append(season.getLastUpdated()).append(')');
        }
        sb.append('\n');
        sb.append(String.format("%s  %s  %s  %s  %s  %s",
                pad("#", RANK_COL_WIDTH),
                pad("Team", TEAM_COL_WIDTH),
                pad("Owner", OWNER_COL_WIDTH),
                padLeft("Total", TOTAL_COL_WIDTH),
                padLeft("Wks", WEEKS_COL_WIDTH),
                "Avg")).append('\n');
        sb.append(rule('-')).append('\n');

        for (StandingEntry entry : season.getStandings()) {
            sb.append(String.format("%s  %s  %s  %s  %s  %s",
                    pad(String.valueOf(entry.getRank()), RANK_COL_WIDTH),
                    pad(clamp(entry.getTeamName(), TEAM_COL_WIDTH), TEAM_COL_WIDTH),
                    pad(clamp(entry.getOwner(), OWNER_COL_WIDTH), OWNER_COL_WIDTH),
                    padLeft(points(entry.getTotalScore()), TOTAL_COL_WIDTH),
                    padLeft(String.valueOf(entry.getWeeksCounted()), WEEKS_COL_WIDTH),
                    points(entry.averagePerWeek()))).append('\n');
        }
        return sb.toString();
    }

    /**
     * Renders one scored week: each team's week score and the players who counted.
     */
    public String renderWeek(final WeekSummary week) {
        if (week == null || !week.applied()) {
            return "No new tournaments were scored.";
        }

        final StringBuilder sb = new StringBuilder();
        sb.append("Week ").append(week.weekNumber()).append(": ")
                .append(String.join(", ", week.scoredTournaments())).append('\n');
        sb.append(rule('-')).append('\n');

        for (TeamWeekResult team : week.teamResults()) {
            sb.append(pad(clamp(team.teamName(), TEAM_COL_WIDTH), TEAM_COL_WIDTH))
                    .append("  ")
                    .append(padLeft(points(team.teamWeekScore()), TOTAL_COL_WIDTH))
                    .append("  ")
                    .append(describeSelected(team.selected()))
                    .append('\n');
        }
        if (!week.alreadyProcessed().isEmpty()) {
            sb.append("Already scored: ").append(String.join(", ", week.alreadyProcessed())).append('\n');
        }
        return sb.toString();
    }

    private static String describeSelected(final List<PlayerWeekScore> selected) {
        if (selected.isEmpty()) {
            return "(no players played)";
        }
        return selected.stream()
                .map(p -> p.playerName() + " " + points(p.weekScore()))
                .collect(Collectors.joining(", "));
    }
}
