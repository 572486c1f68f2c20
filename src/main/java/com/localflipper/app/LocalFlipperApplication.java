package com.localflipper.app;

import com.localflipper.config.Config;
import com.localflipper.config.SearchConfiguration;
import com.localflipper.core.RunTelemetry;
import com.localflipper.db.Database;
import com.localflipper.db.MigrationRunner;
import com.localflipper.db.SavedSearchDao;
import com.localflipper.model.DealRow;
import com.localflipper.model.RankedResultSet;
import com.localflipper.output.CsvExporter;
import com.localflipper.output.ThymeleafReportRenderer;
import com.localflipper.output.XlsxExporter;
import com.localflipper.pipeline.SearchRunner;
import com.localflipper.utils.SellerTextCleaner;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Command-line entry point. Exit codes: 0 success (also when nothing matched), 1 runtime failure,
 * 2 usage or configuration error.
 */
public final class LocalFlipperApplication {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final Set<String> EXPORT_FORMATS = Set.of("csv", "xlsx", "html");
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private final Path workingDir;
    private final Map<String, String> env;
    private final Function<Config, SearchRunner> runnerFactory;
    private final boolean routeLogs;

    public LocalFlipperApplication() {
        this(Path.of(".").toAbsolutePath().normalize(), System.getenv(), SearchRunner::fromConfig, true);
    }

    LocalFlipperApplication(
            Path workingDir,
            Map<String, String> env,
            Function<Config, SearchRunner> runnerFactory,
            boolean routeLogs
    ) {
        this.workingDir = workingDir;
        this.env = env == null ? Map.of() : env;
        this.runnerFactory = runnerFactory;
        this.routeLogs = routeLogs;
    }

    public static void main(String[] args) {
        int exit = new LocalFlipperApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("localflipper", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("localflipper", options);
            return EXIT_OK;
        }

        if (cmd.hasOption("clean-text")) {
            System.out.println(SellerTextCleaner.clean(cmd.getOptionValue("clean-text")));
            return EXIT_OK;
        }

        Config config;
        Set<String> exports;
        try {
            config = Config.load(workingDir)
                    .withEnvironment(env)
                    .withOverrides(searchOverrides(cmd));
            exports = parseExports(cmd.getOptionValue("export", ""));
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        try {
            if (routeLogs) {
                installLogRoutingIfNeeded(config);
            }
            if (cmd.hasOption("add-saved") || cmd.hasOption("remove-saved") || cmd.hasOption("list-saved")) {
                return manageSaved(cmd, config);
            }

            SearchConfiguration search = SearchConfiguration.fromConfig(config);
            SearchRunner runner = runnerFactory.apply(config);
            RankedResultSet results;
            if (cmd.hasOption("saved")) {
                List<String> terms = openSavedSearches(config).listTerms();
                if (terms.isEmpty()) {
                    System.out.println("No saved searches. Add one with --add-saved TERM.");
                    return EXIT_OK;
                }
                System.out.println("Running saved searches: " + String.join(", ", terms));
                results = runner.runAll(search, terms);
            } else {
                System.out.println("Searching '" + search.getKeyword() + "' " + search);
                results = runner.run(search);
            }

            printResults(results);
            export(results, exports, config, cmd.getOptionValue("sheet"));
            return EXIT_OK;
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return EXIT_FAILURE;
        }
    }

    private int manageSaved(CommandLine cmd, Config config) throws Exception {
        SavedSearchDao dao = openSavedSearches(config);
        if (cmd.hasOption("add-saved")) {
            String term = cmd.getOptionValue("add-saved");
            boolean added = dao.addTerm(term);
            System.out.println(added ? "Saved search added: " + term.trim() : "Saved search already exists: " + term.trim());
        }
        if (cmd.hasOption("remove-saved")) {
            String term = cmd.getOptionValue("remove-saved");
            boolean removed = dao.removeTerm(term);
            System.out.println(removed ? "Saved search removed: " + term.trim() : "Saved search not found: " + term.trim());
        }
        if (cmd.hasOption("list-saved")) {
            List<String> terms = dao.listTerms();
            if (terms.isEmpty()) {
                System.out.println("No saved searches.");
            }
            for (String term : terms) {
                System.out.println("- " + term);
            }
        }
        return EXIT_OK;
    }

    private SavedSearchDao openSavedSearches(Config config) throws Exception {
        Database database = new Database(config.getPath("db.path"), config.getBoolean("db.sql_log.enabled", false));
        new MigrationRunner().run(database);
        return new SavedSearchDao(database);
    }

    private void printResults(RankedResultSet results) {
        if (results.isEmpty()) {
            System.out.println("No deals found for the current filters.");
            return;
        }
        System.out.println(String.format(Locale.US, "Found %d deal(s), mode=%s", results.size(), results.mode));
        int rank = 1;
        for (DealRow row : results.rows) {
            System.out.println(String.format(
                    Locale.US,
                    "%3d. [%s]%s %s | $%.2f | %s | demand=%s | eff_profit=%s | %s",
                    rank++,
                    row.source(),
                    row.getSearchTerm().isEmpty() ? "" : " (" + row.getSearchTerm() + ")",
                    row.title(),
                    row.localPrice(),
                    row.getConditionLabel() == null ? "-" : row.getConditionLabel().displayName(),
                    formatNullable(row.getDemandScore()),
                    formatNullable(row.getEffectiveProfit()),
                    row.listing().url
            ));
        }
    }

    private void export(RankedResultSet results, Set<String> formats, Config config, String sheetOverride) throws Exception {
        if (formats.isEmpty()) {
            return;
        }
        LocalDateTime now = LocalDateTime.now();
        Path exportDir = config.getPath("exports.dir");
        RunTelemetry telemetry = new RunTelemetry(results.mode, String.join(",", results.terms), Instant.now());
        telemetry.startStep(RunTelemetry.STEP_EXPORT);
        try {
            if (formats.contains("csv")) {
                Path path = new CsvExporter(exportDir).export(results, now);
                System.out.println("CSV exported: " + path);
            }
            if (formats.contains("xlsx")) {
                String sheet = sheetOverride == null || sheetOverride.isBlank()
                        ? config.getString("export.sheet_name", XlsxExporter.DEFAULT_SHEET)
                        : sheetOverride;
                Path path = new XlsxExporter(exportDir, sheet).export(results, now);
                System.out.println("Spreadsheet exported: " + path);
            }
            if (formats.contains("html")) {
                Path path = new ThymeleafReportRenderer().export(results, config.getPath("report.dir"), now);
                System.out.println("Report written: " + path);
            }
            telemetry.endStep(RunTelemetry.STEP_EXPORT, results.size(), results.size(), 0L, String.join(",", formats));
        } catch (Exception e) {
            telemetry.endStep(RunTelemetry.STEP_EXPORT, results.size(), 0L, 1L, String.join(",", formats));
            throw e;
        } finally {
            telemetry.finish();
            // looked up late so log routing has set the log directory first
            Logger log = LogManager.getLogger(LocalFlipperApplication.class);
            log.info(telemetry.getSummary());
        }
    }

    static Set<String> parseExports(String raw) {
        Set<String> out = new LinkedHashSet<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String token : raw.split(",")) {
            String format = token.trim().toLowerCase(Locale.ROOT);
            if (format.isEmpty()) {
                continue;
            }
            if (!EXPORT_FORMATS.contains(format)) {
                throw new IllegalArgumentException("unknown export format: " + format + " (use csv, xlsx, html)");
            }
            out.add(format);
        }
        return out;
    }

    /**
     * Maps search options onto config keys. Numbers are checked here so a typo is a usage error instead of a
     * silent fallback to the configured default.
     */
    static Map<String, String> searchOverrides(CommandLine cmd) {
        Map<String, String> out = new LinkedHashMap<>();
        putText(out, cmd, "query", "search.query");
        putText(out, cmd, "site", "search.craigslist_site");
        putText(out, cmd, "postal", "search.postal");
        putNumber(out, cmd, "radius", "search.radius_miles", true);
        putNumber(out, cmd, "max-price", "search.max_price", false);
        putNumber(out, cmd, "max-results", "search.max_results", true);
        putNumber(out, cmd, "min-profit", "filter.min_profit", false);
        putNumber(out, cmd, "min-margin", "filter.min_margin_pct", false);
        putNumber(out, cmd, "mpg", "travel.mpg", false);
        putNumber(out, cmd, "gas-price", "travel.gas_price", false);
        if (cmd.hasOption("facebook")) {
            out.put("search.include_facebook", "true");
        }
        return out;
    }

    private static void putText(Map<String, String> out, CommandLine cmd, String option, String key) {
        String value = cmd.getOptionValue(option);
        if (value != null && !value.isBlank()) {
            out.put(key, value.trim());
        }
    }

    private static void putNumber(Map<String, String> out, CommandLine cmd, String option, String key, boolean integer) {
        String value = cmd.getOptionValue(option);
        if (value == null) {
            return;
        }
        String trimmed = value.trim();
        try {
            if (integer) {
                Integer.parseInt(trimmed);
            } else {
                Double.parseDouble(trimmed);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + option + " expects a number, got '" + value + "'");
        }
        out.put(key, trimmed);
    }

    private static String formatNullable(Double value) {
        return value == null ? "-" : String.format(Locale.US, "%.2f", value);
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (LocalFlipperApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("localflipper.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(LocalFlipperApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("query").hasArg().argName("term").desc("search a single term (default: search.query)").build());
        options.addOption(Option.builder().longOpt("saved").desc("run every saved search and merge the results").build());
        options.addOption(Option.builder().longOpt("add-saved").hasArg().argName("term").desc("add a saved search term").build());
        options.addOption(Option.builder().longOpt("remove-saved").hasArg().argName("term").desc("remove a saved search term").build());
        options.addOption(Option.builder().longOpt("list-saved").desc("list saved search terms").build());
        options.addOption(Option.builder().longOpt("export").hasArg().argName("formats").desc("comma-separated sinks: csv,xlsx,html").build());
        options.addOption(Option.builder().longOpt("sheet").hasArg().argName("name").desc("worksheet name for the xlsx export").build());
        options.addOption(Option.builder().longOpt("site").hasArg().argName("subdomain").desc("Craigslist region subdomain").build());
        options.addOption(Option.builder().longOpt("postal").hasArg().argName("zip").desc("postal code to search around").build());
        options.addOption(Option.builder().longOpt("radius").hasArg().argName("miles").desc("search radius in miles").build());
        options.addOption(Option.builder().longOpt("max-price").hasArg().argName("usd").desc("max local price, 0 for none").build());
        options.addOption(Option.builder().longOpt("max-results").hasArg().argName("n").desc("max listings per source").build());
        options.addOption(Option.builder().longOpt("min-profit").hasArg().argName("usd").desc("minimum estimated eBay profit, 0 disables").build());
        options.addOption(Option.builder().longOpt("min-margin").hasArg().argName("pct").desc("minimum eBay profit margin percent, 0 disables").build());
        options.addOption(Option.builder().longOpt("facebook").desc("also search Facebook Marketplace").build());
        options.addOption(Option.builder().longOpt("mpg").hasArg().argName("mpg").desc("vehicle fuel economy").build());
        options.addOption(Option.builder().longOpt("gas-price").hasArg().argName("usd").desc("gas price per gallon").build());
        options.addOption(Option.builder().longOpt("clean-text").hasArg().argName("text").desc("print seller text cleaned for pasting, then exit").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
