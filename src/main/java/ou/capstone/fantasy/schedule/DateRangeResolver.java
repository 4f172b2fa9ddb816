package ou.capstone.fantasy.schedule;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses schedule date text such as "February 27 - March 1" or "April 9 - 12".
 *
 * The year is inferred from the clock. When the start has already passed and the
 * clock is in January-March, the whole range is taken to belong to next year
 * (the schedule is for the upcoming season). A range whose end month comes before
 * its start month ("December 30 - January 2") ends in the following year.
 */
public class DateRangeResolver {

    private static final Logger logger = LoggerFactory.getLogger(DateRangeResolver.class);

    private static final int LAST_ROLLOVER_MONTH = 3;

    private static final DateTimeFormatter MONTH_DAY_YEAR = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("MMMM d uuuu")
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);

    private final Clock clock;

    public DateRangeResolver() {
        this(Clock.systemDefaultZone());
    }

    /** Constructor used by tests to inject a fixed clock. */
    public DateRangeResolver(final Clock clock) {
        this.clock = clock;
    }

    /**
     * @param text raw date range from the schedule
     * @return the resolved range, or empty when the text cannot be parsed
     */
    public Optional<DateRange> resolve(final String text) {
        if (text == null || text.isBlank()) {
            logger.warn("Could not parse dates: empty date range");
            return Optional.empty();
        }

        final String[] parts = text.split("-", -1);
        if (parts.length != 2) {
            logger.warn("Could not parse dates '{}': expected exactly one '-'", text);
            return Optional.empty();
        }

        final String startText = parts[0].trim();
        final String endText = parts[1].trim();

        try {
            final LocalDateTime now = LocalDateTime.now(clock);
            final int year = now.getYear();

            LocalDate start = parseMonthDay(startText, year);

            final LocalDate parsedEnd;
            if (endText.contains(" ")) {
                parsedEnd = parseMonthDay(endText, year);
            } else {
                final String monthName = startText.split("\\s+")[0];
                parsedEnd = parseMonthDay(monthName + " " + endText, year);
            }
            LocalDate end = parsedEnd;

            if (start.atStartOfDay().isBefore(now) && now.getMonthValue() <= LAST_ROLLOVER_MONTH) {
                start = LocalDate.of(year + 1, start.getMonth(), start.getDayOfMonth());
                end = LocalDate.of(end.getYear() + 1, end.getMonth(), end.getDayOfMonth());
            }

            if (end.isBefore(start)) {
                end = LocalDate.of(end.getYear() + 1, end.getMonth(), end.getDayOfMonth());
            }

            return Optional.of(new DateRange(start, end));
        } catch (final DateTimeException e) {
            logger.warn("Could not parse dates '{}': {}", text, e.getMessage());
            return Optional.empty();
        }
    }

    private static LocalDate parseMonthDay(final String monthDay, final int year) {
        return LocalDate.parse(StringUtils.normalizeSpace(monthDay) + " " + year, MONTH_DAY_YEAR);
    }
}
