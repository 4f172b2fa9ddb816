package ou.capstone.fantasy.print;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

import ou.capstone.fantasy.schedule.DateRangeResolver;
import ou.capstone.fantasy.schedule.ScheduleIndex;
import ou.capstone.fantasy.tier.TierClassifier;

final class SchedulePrinterTest {

    private static final Clock JUNE_1 = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);

    private final SchedulePrinter printer = new SchedulePrinter(LocalDate.of(2025, 6, 1));

    @Test
    void rendersEmptyState() {
        assertEquals("No tournaments in the schedule.", printer.render(ScheduleIndex.load(List.of())));
    }

    @Test
    void rendersTableSummaryAndUpcoming() {
        final ScheduleIndex schedule = ScheduleIndex.load(List.of(
                        List.of("Champions Cup", "M", "June 12 - 15"),
                        List.of("Jonesboro Open", "ESP", "April 11 - 13", "88277"),
                        List.of("Mystery Open", "XX", "September 5 - 7"),
                        List.of("Broken Dates Open", "ES", "Sometime in July")),
                new TierClassifier(), new DateRangeResolver(JUNE_1));

        final String out = printer.render(schedule);

        assertTrue(out.indexOf("Jonesboro Open") < out.indexOf("Champions Cup"), "Sorted by start date");
        assertTrue(out.contains("2025-04-11 to 2025-04-13"));
        assertTrue(out.contains("Sometime in July (?)"));
        assertTrue(out.contains("88277"));
        assertTrue(out.contains("Total tournaments: 4"));
        assertTrue(out.contains("With event IDs:    1"));
        assertTrue(out.contains("Without event IDs: 3"));
        assertTrue(out.contains("Unmapped tiers:    1"));
        assertTrue(out.contains("Unreadable dates:  1"));
        assertTrue(out.contains("  2025-06-12  Champions Cup"));
    }
}
