package com.resreg.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Layered key/value configuration: built-in defaults, overridden by a properties file
 * or by an in-memory map.
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Path source;

    private Config(Path source) {
        this.source = source;
    }

    /**
     * Loads {@code file}; the file must exist.
     */
    public static Config load(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("config file must not be null");
        }
        Config config = new Config(file.toAbsolutePath().normalize());
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            config.props.load(in);
        }
        return config;
    }

    public static Config fromMap(Map<String, ?> values) {
        Config config = new Config(null);
        if (values != null) {
            for (Map.Entry<String, ?> entry : values.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().trim();
                if (key.isEmpty()) {
                    continue;
                }
                config.props.setProperty(key, entry.getValue() == null ? "" : String.valueOf(entry.getValue()));
            }
        }
        return config;
    }

    /**
     * The file this configuration was read from, or {@code null} for map-built configurations.
     */
    public Path source() {
        return source;
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

    /**
     * Raw value without trimming or defaults; passwords may legitimately carry blanks.
     */
    public String getRaw(String key) {
        String raw = props.getProperty(key);
        return raw == null ? "" : raw;
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

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        String raw = props.getProperty(key);
        if (raw != null && !raw.trim().isEmpty()) {
            return source == null ? "map" : "file";
        }
        return "default";
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();
        defaults.put("resource.cache", "false");
        defaults.put("resource.placeholder.style", "question");
        defaults.put("db.sql_log.enabled", "false");
        return Collections.unmodifiableMap(defaults);
    }
}
