package ou.capstone.fantasy;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.fantasy.tier.TierClassification;

/**
 * A scheduled tournament.
 * Built once from a schedule record and never changed afterwards.
 */
public final class Tournament {
    private final String name;
    private final TierClassification tier;
    private final String datesRaw;       // ex: "February 27 - March 1"
    private final LocalDate startDate;   // null when the date range did not parse
    private final LocalDate endDate;     // null when the date range did not parse
    private final String eventId;        // PDGA event id, optional

    /**
     * Builder Pattern (Effective Java Item 2).
     * Name, tier and raw dates are required; resolved dates and event id are optional.
     */
    public static class Builder {
        private static final Logger logger = LoggerFactory.getLogger(Builder.class);

        // Required parameters
        private String name;
        private TierClassification tier;
        private String datesRaw;

        // Optional / nullable parameters
        private LocalDate startDate;
        private LocalDate endDate;
        private String eventId;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder tier(TierClassification tier) {
            this.tier = tier;
            return this;
        }

        public Builder datesRaw(String datesRaw) {
            this.datesRaw = datesRaw;
            return this;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        /**
         * Validates required parameters and constructs a Tournament.
         * Start and end dates are either both set or both unset.
         */
        public Tournament build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(tier, "tier is required");
            Objects.requireNonNull(datesRaw, "datesRaw is required");

            if ((startDate == null) != (endDate == null)) {
                throw new IllegalArgumentException("startDate and endDate must both be set or both be unset");
            }
            if (startDate == null) {
                logger.debug("Building tournament '{}' without resolved dates", name);
            }
            if (eventId != null && eventId.isBlank()) {
                eventId = null;
            }

            return new Tournament(this);
        }
    }

    private Tournament(Builder builder) {
        this.name = builder.name;
        this.tier = builder.tier;
        this.datesRaw = builder.datesRaw;
        this.startDate = builder.startDate;
        this.endDate = builder.endDate;
        this.eventId = builder.eventId == null ? null : builder.eventId.trim();
    }

    public String getName() { return name; }
    public TierClassification getTier() { return tier; }
    public String getTierAbbreviation() { return tier.abbreviation(); }
    public String getDatesRaw() { return datesRaw; }
    public LocalDate getStartDate() { return startDate; }
    public LocalDate getEndDate() { return endDate; }
    public Optional<String> getEventId() { return Optional.ofNullable(eventId); }

    public boolean hasResolvedDates() {
        return startDate != null && endDate != null;
    }

    /** Inclusive overlap of this tournament's dates with [start, end]; false when dates are unresolved. */
    public boolean overlaps(final LocalDate start, final LocalDate end) {
        return hasResolvedDates() && !startDate.isAfter(end) && !endDate.isBefore(start);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tournament)) return false;
        Tournament that = (Tournament) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(datesRaw, that.datesRaw) &&
               Objects.equals(eventId, that.eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, datesRaw, eventId);
    }

    @Override
    public String toString() {
        return "Tournament{" +
                "name='" + name + '\'' +
                ", tier=" + tier.tier() +
                ", tierAbbr='" + tier.abbreviation() + '\'' +
                ", datesRaw='" + datesRaw + '\'' +
                ", startDate=" + startDate +
                ", endDate=" + endDate +
                ", eventId='" + eventId + '\'' +
                '}';
    }
}
