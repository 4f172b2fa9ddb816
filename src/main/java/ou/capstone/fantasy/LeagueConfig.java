package ou.capstone.fantasy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.fantasy.api.PdgaWebClient;
import ou.capstone.fantasy.api.ResultsProvider;

/**
 * League settings read from a key=value file (league.properties).
 * Blank lines and lines starting with '#' are ignored; unknown keys are kept but unused.
 * Command line options override file values through {@link #with(String, String)}.
 */
public final class LeagueConfig {
    private static final Logger logger = LoggerFactory.getLogger(LeagueConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "league.properties";

    public static final String DATA_DIR = "data.dir";
    public static final String SCHEDULE_FILE = "schedule.file";
    public static final String DIVISION = "division";
    public static final String LOOKBACK_DAYS = "lookback.days";
    public static final String FETCH_DELAY_MILLIS = "fetch.delay.millis";
    public static final String HTTP_TIMEOUT_SECONDS = "http.timeout.seconds";
    public static final String PDGA_BASE_URL = "pdga.base.url";

    private static final Map<String, String> DEFAULTS;

    static {
        final Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put(DATA_DIR, "data");
        defaults.put(SCHEDULE_FILE, "tournaments.txt");
        defaults.put(DIVISION, ResultsProvider.DEFAULT_DIVISION);
        defaults.put(LOOKBACK_DAYS, "14");
        defaults.put(FETCH_DELAY_MILLIS, "3000");
        defaults.put(HTTP_TIMEOUT_SECONDS, "15");
        defaults.put(PDGA_BASE_URL, PdgaWebClient.DEFAULT_BASE_URL);
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final Map<String, String> values;

    private LeagueConfig(final Map<String, String> values) {
        this.values = values;
    }

    public static LeagueConfig defaults() {
        return new LeagueConfig(new LinkedHashMap<>(DEFAULTS));
    }

    /**
     * Loads a config file on top of the defaults.
     *
     * @param file     the config file
     * @param required whether a missing file is an error
     * @throws IllegalStateException if the file is required but missing, or cannot be read
     */
    public static LeagueConfig load(final Path file, final boolean required) {
        if (!Files.exists(file)) {
            if (required) {
                throw new IllegalStateException("Config file not found: " + file);
            }
            logger.info("No {} found; using default settings", file);
            return defaults();
        }
        try {
            final LeagueConfig config = parse(Files.readAllLines(file));
            logger.info("Loaded settings from {}", file);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Could not load " + file + ": " + e.getMessage(), e);
        }
    }

    static LeagueConfig parse(final List<String> lines) {
        final Map<String, String> values = new LinkedHashMap<>(DEFAULTS);
        for (String line : lines) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;

            final String[] parts = line.split("=", 2);
            if (parts.length == 2) {
                values.put(parts[0].trim(), parts[1].trim());
            } else {
                logger.warn("Ignoring config line without '=': {}", line);
            }
        }
        return new LeagueConfig(values);
    }

    /** Copy of this config with one value replaced. A null value keeps the current one. */
    public LeagueConfig with(final String key, final String value) {
        if (value == null) {
            return this;
        }
        final Map<String, String> copy = new LinkedHashMap<>(values);
        copy.put(key, value.trim());
        return new LeagueConfig(copy);
    }

    public Path dataDir() {
        return Paths.get(values.get(DATA_DIR));
    }

    public Path scheduleFile() {
        return Paths.get(values.get(SCHEDULE_FILE));
    }

    public String division() {
        return values.get(DIVISION).toUpperCase(Locale.ROOT);
    }

    public int lookbackDays() {
        return nonNegativeInt(LOOKBACK_DAYS);
    }

    public long fetchDelayMillis() {
        return nonNegativeInt(FETCH_DELAY_MILLIS);
    }

    public int httpTimeoutSeconds() {
        final int seconds = nonNegativeInt(HTTP_TIMEOUT_SECONDS);
        if (seconds == 0) {
            throw new IllegalArgumentException(HTTP_TIMEOUT_SECONDS + " must be positive");
        }
        return seconds;
    }

    public String pdgaBaseUrl() {
        return values.get(PDGA_BASE_URL);
    }

    private int nonNegativeInt(final String key) {
        final String raw = values.get(key);
        final int value;
        try {
            value = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + raw);
        }
        if (value < 0) {
            throw new IllegalArgumentException(key + " must not be negative: " + value);
        }
        return value;
    }
}
