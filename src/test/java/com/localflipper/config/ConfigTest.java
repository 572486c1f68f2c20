package com.localflipper.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class ConfigTest {

    @Test
    void fromMapShouldLayerOverDefaults() {
        Config config = Config.fromMap(Path.of("/work"), Map.of("search.radius_miles", "10", "search.query", " "));

        assertEquals(10, config.getInt("search.radius_miles"));
        assertEquals("ps5", config.getString("search.query"));
        assertEquals(22.0, config.getDouble("travel.mpg"), 1e-9);
        assertEquals("override", config.sourceOf("search.radius_miles"));
        assertEquals("default", config.sourceOf("travel.mpg"));
    }

    @Test
    void withOverridesShouldIgnoreBlankValuesAndLeaveOriginalUntouched() {
        Config base = Config.fromMap(Path.of("."), Map.of("search.postal", "96001"));

        Config copy = base.withOverrides(Map.of("search.postal", "96002", "search.query", "  "));

        assertEquals("96002", copy.getString("search.postal"));
        assertEquals("ps5", copy.getString("search.query"));
        assertEquals("96001", base.getString("search.postal"));
    }

    @Test
    void environmentShouldMapKnownVariablesOnly() {
        Config base = Config.fromMap(Path.of("/work"), Map.of());

        Config withEnv = base.withEnvironment(Map.of(
                "LOCALFLIPPER_EBAY_APP_ID", " app-123 ",
                "LOCALFLIPPER_DB_PATH", "data/flips.db",
                "HOME", "/home/user"
        ));

        assertEquals("app-123", withEnv.getString("ebay.app_id"));
        assertEquals(Path.of("/work/data/flips.db"), withEnv.getPath("db.path"));
        assertSame(base, base.withEnvironment(Map.of("PATH", "/usr/bin")));
    }

    @Test
    void loadShouldPreferWorkingDirectoryFile(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("config.properties"), "search.craigslist_site=chico\n", StandardCharsets.UTF_8);

        Config config = Config.load(tempDir);

        assertEquals("chico", config.getString("search.craigslist_site"));
        assertEquals("override", config.sourceOf("search.craigslist_site"));
        assertEquals(tempDir.resolve("exports"), config.getPath("exports.dir"));
    }

    @Test
    void typedReadsShouldFallBackOnGarbage() {
        Config config = Config.fromMap(Path.of("."), Map.of("search.max_results", "lots", "travel.mpg", "n/a"));

        assertEquals(7, config.getInt("search.max_results", 7));
        assertEquals(22.0, config.getDouble("travel.mpg", 22.0), 1e-9);
        assertEquals(50, config.getInt("search.max_results"));
    }
}
