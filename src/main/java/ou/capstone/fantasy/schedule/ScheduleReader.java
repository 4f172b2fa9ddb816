package ou.capstone.fantasy.schedule;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the schedule text file into raw field lists.
 *
 * Layout: one tournament per line, {@code Name,Tier,Dates[,EventId]}.
 * Blank lines and lines starting with '#' are ignored. Field validation is
 * left to {@link ScheduleIndex#load(List)}.
 */
public final class ScheduleReader {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleReader.class);

    private ScheduleReader() {
        // Prevent instantiation
    }

    public static List<List<String>> readFile(final Path path) throws IOException {
        logger.debug("Reading schedule from {}", path.toAbsolutePath());
        return parseLines(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    public static List<List<String>> parseLines(final List<String> lines) {
        final List<List<String>> records = new ArrayList<>();
        for (String line : lines) {
            final String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            records.add(Arrays.stream(trimmed.split(",", -1))
                    .map(String::trim)
                    .toList());
        }
        return records;
    }
}
