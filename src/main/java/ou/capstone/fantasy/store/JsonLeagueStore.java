package ou.capstone.fantasy.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import ou.capstone.fantasy.Tournament;
import ou.capstone.fantasy.api.EventResults;
import ou.capstone.fantasy.exceptions.StoreException;
import ou.capstone.fantasy.history.TournamentHistory;
import ou.capstone.fantasy.roster.Rosters;
import ou.capstone.fantasy.standings.PlayerStats;
import ou.capstone.fantasy.standings.SeasonStandings;

/**
 * Stores the league as JSON files in one data directory.
 * <p>
 * Rosters and standings must exist; the history and player statistics documents
 * start empty when absent. Every write goes to a temporary file first and is then
 * moved over the target, so a failed run never leaves a half-written document.
 */
public class JsonLeagueStore implements LeagueStore {
    private static final Logger logger = LoggerFactory.getLogger(JsonLeagueStore.class);

    public static final String ROSTERS_FILE = "rosters.json";
    public static final String STANDINGS_FILE = "standings.json";
    public static final String HISTORY_FILE = "recent_tournaments.json";
    public static final String PLAYER_STATS_FILE = "player_stats.json";
    public static final String EVENTS_DIR = "events";

    private final Path dataDir;
    private final ObjectMapper objectMapper;

    public JsonLeagueStore(final Path dataDir) {
        this.dataDir = dataDir;
        this.objectMapper = ObjectMapperFactory.create();
    }

    @Override
    public LeagueData load() throws StoreException {
        logger.info("Loading league data from {}", dataDir.toAbsolutePath());

        final Rosters rosters = readRequired(ROSTERS_FILE, Rosters.class);
        final SeasonStandings standings = readRequired(STANDINGS_FILE, SeasonStandings.class);
        final TournamentHistory history = readOptional(HISTORY_FILE, TournamentHistory.class);
        final PlayerStats stats = readOptional(PLAYER_STATS_FILE, PlayerStats.class);

        logger.info("Loaded {} team(s), season at week {}", rosters.getTeams().size(), standings.getCurrentWeek());
        return new LeagueData(
                rosters,
                standings,
                history == null ? new TournamentHistory() : history,
                stats == null ? PlayerStats.empty() : stats);
    }

    /**
     * Writes all four documents. Every temporary file is written before any
     * document is replaced, so a failed write leaves the stored league as it was.
     */
    @Override
    public void save(final LeagueData data) throws StoreException {
        final Map<Path, Object> documents = new LinkedHashMap<>();
        documents.put(dataDir.resolve(ROSTERS_FILE), data.rosters());
        documents.put(dataDir.resolve(STANDINGS_FILE), data.standings());
        documents.put(dataDir.resolve(HISTORY_FILE), data.history());
        documents.put(dataDir.resolve(PLAYER_STATS_FILE), data.playerStats());

        final Map<Path, Path> staged = new LinkedHashMap<>();
        try {
            for (Map.Entry<Path, Object> doc : documents.entrySet()) {
                staged.put(doc.getKey(), writeTemp(doc.getKey(), doc.getValue()));
            }
        } catch (StoreException e) {
            discard(staged.values());
            throw e;
        }

        for (Map.Entry<Path, Path> doc : staged.entrySet()) {
            moveIntoPlace(doc.getValue(), doc.getKey());
        }
        logger.info("Saved league data to {}", dataDir.toAbsolutePath());
    }

    /**
     * Writes one event's results to {@code events/event_<id>_results.json}.
     *
     * @return the written file
     */
    public Path writeEventResults(final EventResults results) throws StoreException {
        final Path target = dataDir.resolve(EVENTS_DIR).resolve("event_" + results.eventId() + "_results.json");
        writeAtomically(target, results);
        logger.info("Exported {} result row(s) for event {} to {}", results.results().size(), results.eventId(), target);
        return target;
    }

    /**
     * Writes the resolved schedule as a JSON array of tournaments.
     */
    public void writeSchedule(final Path target, final List<Tournament> tournaments) throws StoreException {
        final List<Map<String, Object>> rows = tournaments.stream().map(JsonLeagueStore::scheduleRow).toList();
        writeAtomically(target, rows);
        logger.info("Exported {} tournament(s) to {}", tournaments.size(), target);
    }

    private static Map<String, Object> scheduleRow(final Tournament t) {
        final Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", t.getName());
        row.put("tier", t.getTierAbbreviation());
        row.put("tier_name", t.getTier().tierName());
        row.put("multiplier", t.getTier().multiplier());
        row.put("dates", t.getDatesRaw());
        row.put("start_date", t.getStartDate() == null ? null : t.getStartDate().toString());
        row.put("end_date", t.getEndDate() == null ? null : t.getEndDate().toString());
        row.put("event_id", t.getEventId().orElse(null));
        return row;
    }

    private <T> T readRequired(final String fileName, final Class<T> type) throws StoreException {
        final Path file = dataDir.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            throw new StoreException("Missing league document: " + file);
        }
        return read(file, type);
    }

    private <T> T readOptional(final String fileName, final Class<T> type) throws StoreException {
        final Path file = dataDir.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            logger.info("{} not found, starting empty", fileName);
            return null;
        }
        return read(file, type);
    }

    private <T> T read(final Path file, final Class<T> type) throws StoreException {
        try {
            final T value = objectMapper.readValue(file.toFile(), type);
            if (value == null) {
                throw new StoreException("Empty league document: " + file);
            }
            return value;
        } catch (IOException | RuntimeException e) {
            logger.error("Could not read {}", file, e);
            throw new StoreException("Could not read league document " + file + ": " + e.getMessage(), e);
        }
    }

    private void writeAtomically(final Path target, final Object value) throws StoreException {
        moveIntoPlace(writeTemp(target, value), target);
    }

    private Path writeTemp(final Path target, final Object value) throws StoreException {
        final Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            objectMapper.writeValue(temp.toFile(), value);
            return temp;
        } catch (IOException e) {
            logger.error("Could not write {}", temp, e);
            throw new StoreException("Could not write league document " + target, e);
        }
    }

    private static void moveIntoPlace(final Path temp, final Path target) throws StoreException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            logger.error("Could not replace {}", target, e);
            throw new StoreException("Could not write league document " + target, e);
        }
    }

    private static void discard(final Iterable<Path> temps) {
        for (Path temp : temps) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                logger.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
            }
        }
    }
}
