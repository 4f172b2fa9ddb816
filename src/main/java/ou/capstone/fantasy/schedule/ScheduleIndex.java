package ou.capstone.fantasy.schedule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.fantasy.Tournament;
import ou.capstone.fantasy.tier.TierClassification;
import ou.capstone.fantasy.tier.TierClassifier;

/**
 * The season's tournaments, in schedule order.
 * Built once per run; the tournaments it holds are immutable.
 */
public final class ScheduleIndex {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleIndex.class);

    private static final int REQUIRED_FIELDS = 3;

    private final List<Tournament> tournaments;
    private final int skippedRecords;

    private ScheduleIndex(final List<Tournament> tournaments, final int skippedRecords) {
        this.tournaments = List.copyOf(tournaments);
        this.skippedRecords = skippedRecords;
    }

    /**
     * Builds the index from raw records of 3 or 4 fields: name, tier abbreviation,
     * date text and an optional event id. Records with fewer than 3 non-blank
     * leading fields are skipped. Unparsable dates leave the tournament without
     * dates rather than dropping it.
     */
    public static ScheduleIndex load(final List<List<String>> records,
                                     final TierClassifier tierClassifier,
                                     final DateRangeResolver dateResolver) {
        final List<Tournament> loaded = new ArrayList<>();
        int skipped = 0;

        for (List<String> record : records) {
            if (record == null || record.size() < REQUIRED_FIELDS
                    || isBlank(record.get(0)) || isBlank(record.get(1)) || isBlank(record.get(2))) {
                skipped++;
                logger.warn("Skipping malformed schedule record: {}", record);
                continue;
            }

            final String name = record.get(0).trim();
            final String datesRaw = record.get(2).trim();
            final String eventId = record.size() > REQUIRED_FIELDS && !isBlank(record.get(3))
                    ? record.get(3).trim()
                    : null;

            final TierClassification tier = tierClassifier.classify(record.get(1));
            final Optional<DateRange> dates = dateResolver.resolve(datesRaw);

            final Tournament.Builder builder = new Tournament.Builder()
                    .name(name)
                    .tier(tier)
                    .datesRaw(datesRaw)
                    .eventId(eventId);
            dates.ifPresent(range -> builder.startDate(range.start()).endDate(range.end()));

            loaded.add(builder.build());
        }

        final ScheduleIndex index = new ScheduleIndex(loaded, skipped);
        logger.info("Loaded {} tournaments from schedule ({} with event IDs, {} skipped)",
                loaded.size(), index.withEventIdCount(), skipped);
        if (index.unmappedTierCount() > 0 || index.unresolvedDateCount() > 0) {
            logger.warn("Schedule data quality: {} unmapped tier(s), {} unresolved date range(s)",
                    index.unmappedTierCount(), index.unresolvedDateCount());
        }
        return index;
    }

    public static ScheduleIndex load(final List<List<String>> records) {
        return load(records, new TierClassifier(), new DateRangeResolver());
    }

    /**
     * Loads the schedule file. A missing file yields an empty schedule so that the
     * rest of a run can still report on the stored league state.
     */
    public static ScheduleIndex fromFile(final Path path,
                                         final TierClassifier tierClassifier,
                                         final Clock clock) throws IOException {
        if (!Files.exists(path)) {
            logger.warn("Schedule file {} not found; continuing with an empty schedule", path);
            return new ScheduleIndex(List.of(), 0);
        }
        return load(ScheduleReader.readFile(path), tierClassifier, new DateRangeResolver(clock));
    }

    public List<Tournament> tournaments() {
        return tournaments;
    }

    public int size() {
        return tournaments.size();
    }

    public int skippedRecords() {
        return skippedRecords;
    }

    public int withEventIdCount() {
        return (int) tournaments.stream().filter(t -> t.getEventId().isPresent()).count();
    }

    public int unmappedTierCount() {
        return (int) tournaments.stream().filter(t -> t.getTier().isUnmapped()).count();
    }

    public int unresolvedDateCount() {
        return (int) tournaments.stream().filter(t -> !t.hasResolvedDates()).count();
    }

    /** Case-insensitive substring match; first hit in schedule order. */
    public Optional<Tournament> findByName(final String query) {
        if (query == null) {
            return Optional.empty();
        }
        final String needle = query.toLowerCase(Locale.ROOT);
        return tournaments.stream()
                .filter(t -> t.getName().toLowerCase(Locale.ROOT).contains(needle))
                .findFirst();
    }

    /** Exact match on the external event id. */
    public Optional<Tournament> findByEventId(final String eventId) {
        if (eventId == null) {
            return Optional.empty();
        }
        final String id = eventId.trim();
        return tournaments.stream()
                .filter(t -> t.getEventId().map(id::equals).orElse(false))
                .findFirst();
    }

    public Optional<String> eventIdFor(final String name) {
        return findByName(name).flatMap(Tournament::getEventId);
    }

    /**
     * Tournaments whose own dates overlap [start, end] inclusively, in schedule order.
     * Tournaments without resolved dates are never returned.
     */
    public List<Tournament> getInRange(final LocalDate start, final LocalDate end) {
        return tournaments.stream()
                .filter(t -> t.overlaps(start, end))
                .toList();
    }

    /** Display view: resolved tournaments by start date, unresolved ones last in schedule order. */
    public List<Tournament> sortedByStartDate() {
        final List<Tournament> copy = new ArrayList<>(tournaments);
        copy.sort(Comparator.comparing(Tournament::getStartDate,
                Comparator.nullsLast(Comparator.naturalOrder())));
        return copy;
    }

    public List<Tournament> withEventIds() {
        return tournaments.stream().filter(t -> t.getEventId().isPresent()).toList();
    }

    public List<Tournament> withoutEventIds() {
        return tournaments.stream().filter(t -> t.getEventId().isEmpty()).toList();
    }

    /** Tournaments starting between today and today + daysAhead, by start date. */
    public List<Tournament> upcoming(final LocalDate today, final int daysAhead) {
        final LocalDate horizon = today.plusDays(daysAhead);
        return tournaments.stream()
                .filter(Tournament::hasResolvedDates)
                .filter(t -> !t.getStartDate().isBefore(today) && !t.getStartDate().isAfter(horizon))
                .sorted(Comparator.comparing(Tournament::getStartDate))
                .toList();
    }

    private static boolean isBlank(final String s) {
        return s == null || s.isBlank();
    }
}
