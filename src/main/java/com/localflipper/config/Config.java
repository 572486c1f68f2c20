package com.localflipper.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：分层读取默认值、classpath 配置与工作目录覆盖配置，为各模块提供带回退的类型化读取。
 * 使用建议：新增配置键时同步补充 buildDefaults，避免调用方散落硬编码默认值。
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();
    private static final Map<String, String> ENV_KEYS = Map.of(
            "LOCALFLIPPER_EBAY_APP_ID", "ebay.app_id",
            "LOCALFLIPPER_DB_PATH", "db.path"
    );

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
            }
        }

        return config;
    }

    /**
     * Builds a Config from explicit key/value pairs layered over the defaults. Used by tests and embedding callers.
     */
    public static Config fromMap(Path workingDir, Map<String, String> values) {
        Config config = new Config(workingDir);
        if (values != null) {
            for (Map.Entry<String, String> entry : values.entrySet()) {
                if (entry.getKey() == null || entry.getKey().trim().isEmpty()) {
                    continue;
                }
                String value = entry.getValue() == null ? "" : entry.getValue();
                config.overrideProps.setProperty(entry.getKey().trim(), value);
                config.props.setProperty(entry.getKey().trim(), value);
            }
        }
        return config;
    }

    /**
     * Returns a copy with {@code values} layered on top as overrides. Blank values are ignored.
     */
    public Config withOverrides(Map<String, String> values) {
        Config copy = new Config(workingDir);
        copy.resourceProps.putAll(resourceProps);
        copy.overrideProps.putAll(overrideProps);
        copy.props.putAll(props);
        if (values != null) {
            for (Map.Entry<String, String> entry : values.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().trim();
                String value = nonBlank(entry.getValue());
                if (key.isEmpty() || value.isEmpty()) {
                    continue;
                }
                copy.overrideProps.setProperty(key, value);
                copy.props.setProperty(key, value);
            }
        }
        return copy;
    }

    /**
     * Applies the secret/location environment variables ({@code LOCALFLIPPER_EBAY_APP_ID},
     * {@code LOCALFLIPPER_DB_PATH}) over file configuration.
     */
    public Config withEnvironment(Map<String, String> env) {
        Map<String, String> values = new HashMap<>();
        if (env != null) {
            for (Map.Entry<String, String> mapping : ENV_KEYS.entrySet()) {
                String value = env.get(mapping.getKey());
                if (value != null && !value.trim().isEmpty()) {
                    values.put(mapping.getValue(), value.trim());
                }
            }
        }
        return values.isEmpty() ? this : withOverrides(values);
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String raw = props.getProperty(key);
        if ((raw == null || raw.trim().isEmpty()) && !DEFAULTS.containsKey(key)) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        String value = getString(key);
        return parseInt(value, fallback);
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        String value = getString(key);
        return parseDouble(value, fallback);
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        String local = nonBlank(overrideProps.getProperty(key));
        if (!local.isEmpty()) {
            return "override";
        }
        String resource = nonBlank(resourceProps.getProperty(key));
        if (!resource.isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        String t = raw.trim();
        return t.isEmpty() ? "" : t;
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("exports.dir", "exports");
        defaults.put("db.path", "outputs/localflipper.db");
        defaults.put("db.sql_log.enabled", "false");

        defaults.put("search.craigslist_site", "redding");
        defaults.put("search.postal", "96001");
        defaults.put("search.radius_miles", "50");
        defaults.put("search.query", "ps5");
        defaults.put("search.max_price", "0");
        defaults.put("search.max_results", "50");
        defaults.put("search.include_facebook", "false");
        defaults.put("search.lookup_threads", "4");
        defaults.put("search.lookup_timeout_sec", "30");

        defaults.put("filter.min_profit", "0");
        defaults.put("filter.min_margin_pct", "0");

        defaults.put("travel.mpg", "22");
        defaults.put("travel.gas_price", "4.50");

        defaults.put("valuation.curve", "0.0:0.60,0.3:0.90,0.5:1.10,0.7:1.25,0.9:1.40,1.0:1.50");

        defaults.put("demand.weight_relevance", "0.35");
        defaults.put("demand.weight_condition", "0.25");
        defaults.put("demand.weight_profit", "0.40");
        defaults.put("demand.profit_half_saturation", "100");

        defaults.put("craigslist.base_url", "https://%s.craigslist.org/search/sss");
        defaults.put("craigslist.request_timeout_sec", "20");
        defaults.put("facebook.base_url", "https://www.facebook.com/marketplace/%s/search");
        defaults.put("facebook.request_timeout_sec", "20");

        defaults.put("ebay.app_id", "");
        defaults.put("ebay.finding_url", "https://svcs.ebay.com/services/search/FindingService/v1");
        defaults.put("ebay.request_timeout_sec", "15");
        defaults.put("ebay.max_entries", "50");

        defaults.put("export.sheet_name", "LocalFlipperDeals");
        defaults.put("report.dir", "outputs/reports");

        return Collections.unmodifiableMap(defaults);
    }
}
