package ou.capstone.fantasy.schedule;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;

class ScheduleReaderTest {

    @Test
    void splitsOnCommasAndTrimsFields() {
        final List<List<String>> records = ScheduleReader.parseLines(List.of(
                "# header",
                "",
                "  Supreme Flight Open , ES , February 27 - March 1 , 88276 ",
                "Big Easy Open,ES,March 14-16"));

        assertEquals(2, records.size());
        assertEquals(List.of("Supreme Flight Open", "ES", "February 27 - March 1", "88276"), records.get(0));
        assertEquals(List.of("Big Easy Open", "ES", "March 14-16"), records.get(1));
    }

    @Test
    void keepsTrailingEmptyField() {
        final List<List<String>> records = ScheduleReader.parseLines(List.of("Jonesboro Open,ESP,April 11 - 13,"));

        assertEquals(4, records.get(0).size());
        assertEquals("", records.get(0).get(3));
    }
}
