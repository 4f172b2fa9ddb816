package ou.capstone.fantasy.print;

import java.time.LocalDate;
import java.util.List;

import ou.capstone.fantasy.Tournament;
import ou.capstone.fantasy.schedule.ScheduleIndex;

/**
 * Prints the resolved season schedule, by start date, followed by a summary.
 */
public final class SchedulePrinter extends ConsolePrinter<ScheduleIndex> {

    private static final int UPCOMING_DAYS = 60;

    private static final int NAME_COL_WIDTH = 36;
    private static final int TIER_COL_WIDTH = 14;
    private static final int DATES_COL_WIDTH = 24;

    private final LocalDate today;

    public SchedulePrinter(final LocalDate today) {
        this.today = today;
    }

    @Override
    public String render(final ScheduleIndex schedule) {
        if (schedule == null || schedule.size() == 0) {
            return "No tournaments in the schedule.";
        }

        final StringBuilder sb = new StringBuilder();
        sb.append(String.format("%s  %s  %s  %s",
                pad("Tournament", NAME_COL_WIDTH),
                pad("Tier", TIER_COL_WIDTH),
                pad("Dates", DATES_COL_WIDTH),
                "Event ID")).append('\n');
        sb.append(rule('-')).append('\n');

        for (Tournament t : schedule.sortedByStartDate()) {
            sb.append(String.format("%s  %s  %s  %s",
                    pad(clamp(t.getName(), NAME_COL_WIDTH), NAME_COL_WIDTH),
                    pad(t.getTier().tierName() + " (" + t.getTierAbbreviation() + ")", TIER_COL_WIDTH),
                    pad(clamp(describeDates(t), DATES_COL_WIDTH), DATES_COL_WIDTH),
                    t.getEventId().orElse("-"))).append('\n');
        }

        sb.append(rule('-')).append('\n');
        sb.append("Total tournaments: ").append(schedule.size()).append('\n');
        sb.append("With event IDs:    ").append(schedule.withEventIdCount()).append('\n');
        sb.append("Without event IDs: ").append(schedule.size() - schedule.withEventIdCount()).append('\n');
        if (schedule.unmappedTierCount() > 0) {
            sb.append("Unmapped tiers:    ").append(schedule.unmappedTierCount()).append('\n');
        }
        if (schedule.unresolvedDateCount() > 0) {
            sb.append("Unreadable dates:  ").append(schedule.unresolvedDateCount()).append('\n');
        }

        final List<Tournament> upcoming = schedule.upcoming(today, UPCOMING_DAYS);
        sb.append('\n').append("Upcoming (next ").append(UPCOMING_DAYS).append(" days):").append('\n');
        if (upcoming.isEmpty()) {
            sb.append("  none").append('\n');
        }
        for (Tournament t : upcoming) {
            sb.append("  ").append(t.getStartDate()).append("  ").append(t.getName()).append('\n');
        }
        return sb.toString();
    }

    private static String describeDates(final Tournament t) {
        if (!t.hasResolvedDates()) {
            return t.getDatesRaw() + " (?)";
        }
        return t.getStartDate() + " to " + t.getEndDate();
    }
}
