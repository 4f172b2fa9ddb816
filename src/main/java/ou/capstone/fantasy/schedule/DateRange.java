package ou.capstone.fantasy.schedule;

import java.time.LocalDate;
import java.util.Objects;

/** Inclusive start/end pair resolved from a schedule's date text. */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }
}
