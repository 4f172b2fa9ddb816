package ou.capstone.fantasy.print;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

import ou.capstone.fantasy.api.EventResults;
import ou.capstone.fantasy.api.ResultRow;

final class EventResultsPrinterTest {

    @Test
    void marksSharedPlaces() {
        final EventResults event = new EventResults("88276", "Supreme Flight Open", "MPO", null, List.of(
                new ResultRow(1, 69424, "Gannon Buhr", false),
                new ResultRow(2, 27523, "Calvin Heimburg", true),
                new ResultRow(2, 50670, "Isaac Robinson", true)));

        final String out = new EventResultsPrinter().render(event);

        assertTrue(out.startsWith("Supreme Flight Open (MPO, event 88276)"));
        assertTrue(out.contains("T2     Calvin Heimburg"));
        assertTrue(out.contains("50670"));
        assertFalse(out.contains("more"));
    }

    @Test
    void limitsRows() {
        final List<ResultRow> rows = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            rows.add(new ResultRow(i, 1000 + i, "Player " + i, false));
        }

        final String out = new EventResultsPrinter(3).render(new EventResults("1", "Small Open", "MPO", null, rows));

        assertTrue(out.contains("Player 3"));
        assertFalse(out.contains("Player 4"));
        assertTrue(out.contains("... and 2 more"));
    }

    @Test
    void reportsMissingResults() {
        final String out = new EventResultsPrinter().render(new EventResults("2", "Future Open", "FPO", null, List.of()));

        assertTrue(out.contains("No results posted yet."));
    }
}
