package ou.capstone.fantasy.print;

import ou.capstone.fantasy.api.EventResults;
import ou.capstone.fantasy.api.ResultRow;

/** Prints the top of one event's division results. Shared places are shown as "T3". */
public final class EventResultsPrinter extends ConsolePrinter<EventResults> {

    public static final int DEFAULT_LIMIT = 10;

    private static final int PLACE_COL_WIDTH = 5;
    private static final int NAME_COL_WIDTH = 30;

    private final int limit;

    public EventResultsPrinter() {
        this(DEFAULT_LIMIT);
    }

    public EventResultsPrinter(final int limit) {
        this.limit = limit;
    }

    @Override
    public String render(final EventResults event) {
        if (event == null) {
            return "No event to display.";
        }

        final StringBuilder sb = new StringBuilder();
        sb.append(event.name()).append(" (").append(event.division()).append(", event ")
                .append(event.eventId()).append(')').append('\n');
        if (event.results().isEmpty()) {
            sb.append("No results posted yet.").append('\n');
            return sb.toString();
        }

        sb.append(String.format("%s  %s  %s", pad("Place", PLACE_COL_WIDTH), pad("Player", NAME_COL_WIDTH), "PDGA #"))
                .append('\n');
        sb.append(rule('-')).append('\n');

        event.results().stream().limit(limit).forEach(row -> sb.append(String.format("%s  %s  %d",
                pad(place(row), PLACE_COL_WIDTH),
                pad(clamp(row.name(), NAME_COL_WIDTH), NAME_COL_WIDTH),
                row.pdgaNumber())).append('\n'));

        if (event.results().size() > limit) {
            sb.append("... and ").append(event.results().size() - limit).append(" more").append('\n');
        }
        return sb.toString();
    }

    private static String place(final ResultRow row) {
        return (row.tied() ? "T" : "") + row.placement();
    }
}
