package ou.capstone.fantasy;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.fantasy.api.EventResults;
import ou.capstone.fantasy.api.PdgaResultsProvider;
import ou.capstone.fantasy.api.PdgaWebClient;
import ou.capstone.fantasy.exceptions.ProviderException;
import ou.capstone.fantasy.exceptions.RateLimitException;
import ou.capstone.fantasy.exceptions.StoreException;
import ou.capstone.fantasy.print.EventResultsPrinter;
import ou.capstone.fantasy.print.SchedulePrinter;
import ou.capstone.fantasy.print.StandingsPrinter;
import ou.capstone.fantasy.schedule.ScheduleIndex;
import ou.capstone.fantasy.store.JsonLeagueStore;
import ou.capstone.fantasy.tier.TierClassifier;

/**
 * Command line driver for the fantasy disc golf league.
 *
 * Exactly one action per invocation:
 * - weekly update (fetch, score, save)
 * - fetch and export a single event
 * - fetch and export every scheduled event that has an event ID
 * - print or export the resolved schedule
 */
public final class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static ExitHandler exitHandler = new ExitHandler();

    public static void setExitHandler( final ExitHandler exitHandler )
    {
        App.exitHandler = exitHandler;
    }

    private App() {
        // Prevent instantiation
    }

    public static void main(final String[] args) throws ParseException {
        final Option updateOption = Option.builder("u")
                .longOpt("update")
                .desc("Run the weekly update: fetch finished tournaments, score them and save standings").build();
        final Option eventOption = Option.builder("e")
                .longOpt("event").hasArg().argName("id")
                .desc("Fetch one event's results by PDGA event ID and export them as JSON").build();
        final Option scrapeScheduledOption = Option.builder("s")
                .longOpt("scrape-scheduled")
                .desc("Fetch and export every scheduled tournament that has an event ID").build();
        final Option printScheduleOption = Option.builder("p")
                .longOpt("print-schedule")
                .desc("Print the season schedule with resolved dates").build();
        final Option exportScheduleOption = Option.builder()
                .longOpt("export-schedule").hasArg().argName("file")
                .desc("Write the resolved schedule to a JSON file").build();

        final Option configOption = Option.builder("c")
                .longOpt("config").hasArg().argName("file")
                .desc("Settings file (default: " + LeagueConfig.DEFAULT_CONFIG_FILE + ")").build();
        final Option dataDirOption = Option.builder()
                .longOpt("data-dir").hasArg().argName("dir")
                .desc("Directory holding the league JSON documents (default: data)").build();
        final Option scheduleOption = Option.builder()
                .longOpt("schedule").hasArg().argName("file")
                .desc("Schedule file (default: tournaments.txt)").build();
        final Option divisionOption = Option.builder()
                .longOpt("division").hasArg().argName("code")
                .desc("Division to score (default: MPO)").build();
        final Option daysBackOption = Option.builder()
                .longOpt("days-back").hasArg().argName("n")
                .desc("How many days back the weekly update looks for finished tournaments (default: 14)").build();
        final Option helpOption = Option.builder("h").longOpt("help")
                .desc("Display help").build();

        final List<Option> actions = List.of(updateOption, eventOption, scrapeScheduledOption,
                printScheduleOption, exportScheduleOption);

        final Options options = new Options();
        actions.forEach(options::addOption);
        options.addOption( configOption );
        options.addOption( dataDirOption );
        options.addOption( scheduleOption );
        options.addOption( divisionOption );
        options.addOption( daysBackOption );
        options.addOption( helpOption );

        final CommandLineParser cliParser = new DefaultParser();
        final CommandLine line;
        try {
            line = cliParser.parse(options, args);
        } catch (final ParseException e) {
            logger.error("Parsing args failed for reason: {}",
                    e.getMessage());
            throw e;
        }

        if (line.hasOption(helpOption) || line.getOptions().length == 0) {
            final HelpFormatter helpFormatter = new HelpFormatter();
            helpFormatter.printHelp("app",
                    "Fantasy Disc Golf League Options", options,
                    "Exactly one of --update, --event, --scrape-scheduled, --print-schedule or --export-schedule is required.",
                    true);
            exitHandler.exit(0);
            return;
        }

        final long actionCount = actions.stream().filter(line::hasOption).count();
        if (actionCount != 1) {
            throw new ParseException("Invalid options: exactly one action is required, got " + actionCount);
        }

        if (line.hasOption(daysBackOption)) {
            final String daysBack = line.getOptionValue(daysBackOption);
            if (!daysBack.matches("\\d+")) {
                throw new ParseException("Invalid options: --days-back must be a non-negative number");
            }
        }
        if (line.hasOption(eventOption) && !line.getOptionValue(eventOption).trim().matches("\\d+")) {
            throw new ParseException("Invalid options: --event takes a numeric PDGA event ID");
        }

        logger.info("Fantasy league starting");

        try {
            final Path configFile = line.hasOption(configOption)
                    ? Paths.get(line.getOptionValue(configOption))
                    : Paths.get(LeagueConfig.DEFAULT_CONFIG_FILE);
            final LeagueConfig config = LeagueConfig.load(configFile, line.hasOption(configOption))
                    .with(LeagueConfig.DATA_DIR, line.getOptionValue(dataDirOption))
                    .with(LeagueConfig.SCHEDULE_FILE, line.getOptionValue(scheduleOption))
                    .with(LeagueConfig.DIVISION, line.getOptionValue(divisionOption))
                    .with(LeagueConfig.LOOKBACK_DAYS, line.getOptionValue(daysBackOption));

            final Clock clock = Clock.systemDefaultZone();
            final JsonLeagueStore store = new JsonLeagueStore(config.dataDir());

            if (line.hasOption(printScheduleOption)) {
                final ScheduleIndex schedule = loadSchedule(config, clock);
                new SchedulePrinter(LocalDate.now(clock)).print(schedule);
            } else if (line.hasOption(exportScheduleOption)) {
                final ScheduleIndex schedule = loadSchedule(config, clock);
                final Path target = Paths.get(line.getOptionValue(exportScheduleOption));
                store.writeSchedule(target, schedule.tournaments());
                System.out.println("Exported " + schedule.size() + " tournament(s) to " + target);
            } else if (line.hasOption(eventOption)) {
                final EventScraper scraper = new EventScraper(createProvider(config), store, config, Sleeper.system());
                final EventResults results = scraper.scrapeEvent(line.getOptionValue(eventOption).trim());
                new EventResultsPrinter().print(results);
            } else if (line.hasOption(scrapeScheduledOption)) {
                final ScheduleIndex schedule = loadSchedule(config, clock);
                final EventScraper scraper = new EventScraper(createProvider(config), store, config, Sleeper.system());
                final List<EventResults> scraped = scraper.scrapeScheduled(schedule);
                final EventResultsPrinter printer = new EventResultsPrinter(3);
                scraped.forEach(printer::print);
                System.out.println("Scraped " + scraped.size() + " of " + schedule.withEventIdCount()
                        + " scheduled event(s)");
            } else {
                final ScheduleIndex schedule = loadSchedule(config, clock);
                final LeagueUpdater updater = new LeagueUpdater(store, createProvider(config), schedule,
                        config, clock, Sleeper.system());
                final UpdateReport report = updater.runWeeklyUpdate();
                displayReport(report, store);
            }

            logger.info("Fantasy league completed successfully");
        } catch (final RateLimitException e) {
            System.err.println("PDGA Rate Limit Exceeded");
            System.err.println("\n" + "-".repeat(80));
            System.err.println("\nThe PDGA website is rejecting requests for now.");
            System.err.println("Please wait a few minutes before trying again.");
            exitHandler.exit(1);

        } catch (final StoreException e) {
            logger.error("League data error: {}", e.getMessage());
            System.err.println("\nLeague data error: " + e.getMessage());
            System.err.println("No changes were saved.");
            exitHandler.exit(1);

        } catch (final ProviderException e) {
            logger.error("Could not fetch results: {}", e.getMessage());
            System.err.println("\nCould not fetch results: " + e.getMessage());
            exitHandler.exit(1);

        } catch (final IllegalStateException e) {
            logger.error("Configuration error: {}", e.getMessage());
            System.err.println("\nConfiguration Error: " + e.getMessage());
            exitHandler.exit(1);

        } catch (final IllegalArgumentException e) {
            logger.error("Invalid input: {}", e.getMessage());
            System.err.println("\nError: " + e.getMessage());
            exitHandler.exit(1);

        } catch (final Exception e) {
            logger.error("Unexpected error during execution", e);
            System.err.println("\nUnexpected Error: " + e.getMessage());
            exitHandler.exit(1);
        }
    }

    private static ScheduleIndex loadSchedule(final LeagueConfig config, final Clock clock) throws IOException {
        return ScheduleIndex.fromFile(config.scheduleFile(), new TierClassifier(), clock);
    }

    private static PdgaResultsProvider createProvider(final LeagueConfig config) {
        return new PdgaResultsProvider(new PdgaWebClient(config.pdgaBaseUrl(), config.httpTimeoutSeconds()));
    }

    /**
     * Displays the outcome of a weekly update: the scored week, anything skipped,
     * and the standings as saved.
     */
    private static void displayReport(final UpdateReport report, final JsonLeagueStore store) throws StoreException {
        final StandingsPrinter printer = new StandingsPrinter();

        System.out.println("\n" + "=".repeat(80));
        System.out.println("Weekly update for " + report.rangeStart() + " to " + report.rangeEnd());
        System.out.println("=".repeat(80));
        System.out.println();

        System.out.println(printer.renderWeek(report.week()));
        for (UpdateReport.SkippedTournament skipped : report.skipped()) {
            System.out.println("Skipped " + skipped.name() + ": " + skipped.reason() + " (" + skipped.detail() + ")");
        }

        if (report.applied()) {
            System.out.println();
            printer.print(store.load().standings());
        }
        System.out.println("\n" + "=".repeat(80) + "\n");
    }

    public static class ExitHandler
    {
        public void exit( final int code )
        {
            System.exit( code );
        }
    }
}
