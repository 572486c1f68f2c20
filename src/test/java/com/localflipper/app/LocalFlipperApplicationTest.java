package com.localflipper.app;

import com.localflipper.config.Config;
import com.localflipper.config.SearchConfiguration;
import com.localflipper.model.MarketPriceEstimate;
import com.localflipper.model.RawListing;
import com.localflipper.pipeline.DealEnricher;
import com.localflipper.pipeline.SearchRunner;
import com.localflipper.source.MarketplaceAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalFlipperApplicationTest {
    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;
    private final List<String> searchedTerms = new ArrayList<>();

    @BeforeEach
    void captureStreams() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void helpShouldExitZero() {
        assertEquals(LocalFlipperApplication.EXIT_OK, app().run(new String[]{"--help"}));
        assertTrue(out().contains("--add-saved"));
    }

    @Test
    void usageErrorsShouldExitTwo() {
        assertEquals(LocalFlipperApplication.EXIT_USAGE, app().run(new String[]{"--bogus"}));
        assertEquals(LocalFlipperApplication.EXIT_USAGE, app().run(new String[]{"--radius", "far"}));
        assertEquals(LocalFlipperApplication.EXIT_USAGE, app().run(new String[]{"--export", "pdf"}));
        assertEquals(LocalFlipperApplication.EXIT_USAGE, app().run(new String[]{"--mpg", "0"}));
        assertTrue(err().contains("--radius expects a number"));
        assertTrue(err().contains("invalid search config: fuel economy"));
        assertTrue(searchedTerms.isEmpty());
    }

    @Test
    void savedSearchesShouldBeManagedFromTheCommandLine() {
        assertEquals(0, app().run(new String[]{"--add-saved", "ps5"}));
        assertEquals(0, app().run(new String[]{"--add-saved", "switch"}));
        assertEquals(0, app().run(new String[]{"--add-saved", "ps5"}));
        assertEquals(0, app().run(new String[]{"--remove-saved", "xbox"}));
        assertEquals(0, app().run(new String[]{"--list-saved"}));

        String out = out();
        assertTrue(out.contains("Saved search added: ps5"));
        assertTrue(out.contains("Saved search already exists: ps5"));
        assertTrue(out.contains("Saved search not found: xbox"));
        assertTrue(out.contains("- ps5" + System.lineSeparator() + "- switch"));
        assertTrue(Files.exists(tempDir.resolve("flips.db")));
    }

    @Test
    void savedRunWithoutTermsShouldSayHowToAddOne() {
        assertEquals(0, app().run(new String[]{"--saved"}));

        assertTrue(out().contains("No saved searches. Add one with --add-saved TERM."));
        assertTrue(searchedTerms.isEmpty());
    }

    @Test
    void savedRunShouldSearchEveryTerm() {
        app().run(new String[]{"--add-saved", "ps5"});
        app().run(new String[]{"--add-saved", "switch"});

        assertEquals(0, app().run(new String[]{"--saved"}));

        assertEquals(List.of("ps5", "switch"), searchedTerms);
        assertTrue(out().contains("Found 2 deal(s), mode=saved"));
    }

    @Test
    void singleRunShouldPrintAndExportCsv() throws Exception {
        int exit = app().run(new String[]{"--query", "ps5 console", "--export", "csv"});

        assertEquals(0, exit);
        assertEquals(List.of("ps5 console"), searchedTerms);
        assertTrue(out().contains("Found 1 deal(s), mode=single"));
        Path exports = tempDir.resolve("exports");
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(exports, "localflipper_single_*.csv")) {
            stream.forEach(files::add);
        }
        assertEquals(1, files.size());
        assertTrue(Files.readString(files.get(0), StandardCharsets.UTF_8).contains("ps5 console listing"));
    }

    @Test
    void emptyResultShouldStillSucceed() {
        assertEquals(0, app().run(new String[]{"--query", "ps5", "--max-price", "10"}));

        assertTrue(out().contains("No deals found for the current filters."));
    }

    @Test
    void cleanTextShouldPrintCleanedDescription() {
        assertEquals(0, app().run(new String[]{"--clean-text", "<b>Mint!!!</b>"}));

        assertTrue(out().contains("Mint!"));
    }

    @Test
    void parseExportsShouldAcceptKnownFormatsOnly() {
        assertEquals(Set.of("csv", "html"), LocalFlipperApplication.parseExports(" CSV, html,,csv"));
        assertTrue(LocalFlipperApplication.parseExports(null).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> LocalFlipperApplication.parseExports("csv,pdf"));
    }

    private LocalFlipperApplication app() {
        Map<String, String> env = Map.of("LOCALFLIPPER_DB_PATH", tempDir.resolve("flips.db").toString());
        return new LocalFlipperApplication(tempDir, env, this::runner, false);
    }

    private SearchRunner runner(Config config) {
        return new SearchRunner(new FixedAdapter(), null, title -> MarketPriceEstimate.EMPTY, new DealEnricher(), 1, 5);
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    private final class FixedAdapter implements MarketplaceAdapter {
        @Override
        public String source() {
            return "craigslist";
        }

        @Override
        public List<RawListing> search(SearchConfiguration search, String term) {
            searchedTerms.add(term);
            return List.of(new RawListing(source(), term + " listing good condition", 120.0, "Redding",
                    "https://example.test/" + term.replace(' ', '-'), null));
        }
    }
}
