package com.resreg.bundle;

import com.resreg.config.Config;
import com.resreg.db.Database;
import com.resreg.errors.BundleInitException;
import com.resreg.errors.ResourcesException;
import com.resreg.locale.SystemLocale;
import com.resreg.locale.SystemLocales;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bundle backed by a relational table with one row per (key, locale).
 * <p>
 * The locator names a configuration file without its {@code .properties} suffix. Every
 * statement is scoped to this bundle's locale and writes go to the table immediately.
 */
public class DbResourceBundle extends AbstractResourceBundle {
    private static final Logger log = LogManager.getLogger(DbResourceBundle.class);

    public static final String DB_CONNECT_DSN = Database.DB_CONNECT_DSN;
    public static final String DB_CONNECT_USER = Database.DB_CONNECT_USER;
    public static final String DB_CONNECT_PASSWORD = Database.DB_CONNECT_PASSWORD;
    public static final String DB_SQL_TABLE = "db.sql.table";
    public static final String DB_SQL_LOCALE_COLUMN = "db.sql.locale.column";
    public static final String DB_SQL_KEY_COLUMN = "db.sql.key.column";
    public static final String DB_SQL_VAL_COLUMN = "db.sql.val.column";
    public static final String RESOURCE_CACHE = "resource.cache";
    public static final String RESOURCE_PLACEHOLDER_STYLE = "resource.placeholder.style";

    private static final String SUFFIX = ".properties";

    private final String locator;
    private Connection connection;
    private Statements sql;
    private PlaceholderStyle placeholderStyle = PlaceholderStyle.QUESTION_SUFFIX;
    private boolean cacheResources;
    private final Map<String, String> cache = new HashMap<>();

    protected DbResourceBundle(String locator, SystemLocale systemLocale) {
        super(systemLocale);
        if (locator == null || locator.trim().isEmpty()) {
            throw new IllegalArgumentException("database bundle configuration must not be empty");
        }
        this.locator = locator;
    }

    public static DbResourceBundle getBundle(String locator, SystemLocale systemLocale) {
        SystemLocale locale = systemLocale == null ? SystemLocales.jvm().getDefault() : systemLocale;
        DbResourceBundle bundle = new DbResourceBundle(locator, locale);
        bundle.initialize();
        return bundle;
    }

    public static Path configFileFor(String locator) {
        return Paths.get(locator + SUFFIX);
    }

    @Override
    public void initialize() {
        ensureUsable();
        Path file = configFileFor(locator);
        if (!Files.isRegularFile(file)) {
            throw new BundleInitException("database resource configuration " + file.toAbsolutePath() + " does not exist");
        }
        Database database;
        try {
            Config config = Config.load(file);
            this.sql = new Statements(
                    Database.identifier(DB_SQL_TABLE, config.requireString(DB_SQL_TABLE)),
                    Database.identifier(DB_SQL_KEY_COLUMN, config.requireString(DB_SQL_KEY_COLUMN)),
                    Database.identifier(DB_SQL_LOCALE_COLUMN, config.requireString(DB_SQL_LOCALE_COLUMN)),
                    Database.identifier(DB_SQL_VAL_COLUMN, config.requireString(DB_SQL_VAL_COLUMN))
            );
            this.cacheResources = config.getBoolean(RESOURCE_CACHE);
            this.placeholderStyle = PlaceholderStyle.fromConfig(
                    config.getString(RESOURCE_PLACEHOLDER_STYLE), PlaceholderStyle.QUESTION_SUFFIX);
            database = Database.fromConfig(config);
        } catch (IOException | IllegalArgumentException e) {
            throw new BundleInitException("invalid database resource configuration " + file.toAbsolutePath()
                    + ": " + e.getMessage(), e);
        }
        try {
            this.connection = database.connect();
        } catch (SQLException e) {
            throw new BundleInitException(e.getMessage(), e);
        }
        log.debug("opened database bundle for locale {} on {} (cache={})",
                getSystemLocale(), database.maskedDsn(), cacheResources);
    }

    public boolean isCacheResources() {
        return cacheResources;
    }

    public PlaceholderStyle getPlaceholderStyle() {
        return placeholderStyle;
    }

    @Override
    public String find(String key, Map<String, ?> params) {
        requireKey(key);
        ensureOpen();
        String resource;
        if (cacheResources && cache.containsKey(key)) {
            resource = cache.get(key);
        } else {
            resource = lookup(key);
            if (cacheResources) {
                cache.put(key, resource);
            }
        }
        return Placeholders.substitute(resource, params, placeholderStyle);
    }

    @Override
    public void replace(String key, String value) {
        requireKey(key);
        ensureOpen();
        String stored = value == null ? "" : value;
        try (PreparedStatement ps = connection.prepareStatement(sql.update)) {
            ps.setString(1, stored);
            ps.setString(2, key);
            ps.setString(3, locale());
            if (ps.executeUpdate() == 0) {
                insert(key, stored);
            }
        } catch (SQLException e) {
            throw failure("replace", key, e);
        }
        if (cacheResources) {
            cache.put(key, stored);
        }
    }

    @Override
    public boolean attach(String key, String value) {
        requireKey(key);
        ensureOpen();
        String stored = value == null ? "" : value;
        try {
            if (exists(key)) {
                return false;
            }
            insert(key, stored);
        } catch (SQLException e) {
            if (isIntegrityViolation(e)) {
                log.debug("attach of {} for {} lost against a concurrent insert", key, getSystemLocale());
                return false;
            }
            throw failure("attach", key, e);
        }
        if (cacheResources) {
            cache.put(key, stored);
        }
        return true;
    }

    @Override
    public Optional<String> findKeyByValue(String value) {
        ensureOpen();
        try (PreparedStatement ps = connection.prepareStatement(sql.keyByValue)) {
            ps.setString(1, value);
            ps.setString(2, locale());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getString(1));
                }
            }
        } catch (SQLException e) {
            throw failure("findKeyByValue", value, e);
        }
        return Optional.empty();
    }

    @Override
    public int count() {
        ensureOpen();
        try (PreparedStatement ps = connection.prepareStatement(sql.count)) {
            ps.setString(1, locale());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw failure("count", null, e);
        }
    }

    @Override
    public Set<String> getKeys() {
        ensureOpen();
        Set<String> keys = new LinkedHashSet<>();
        try (PreparedStatement ps = connection.prepareStatement(sql.keys)) {
            ps.setString(1, locale());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    keys.add(rs.getString(1));
                }
            }
        } catch (SQLException e) {
            throw failure("getKeys", null, e);
        }
        return Collections.unmodifiableSet(keys);
    }

    @Override
    public void save() {
        ensureOpen();
        // writes are immediate
    }

    @Override
    protected void release() {
        cache.clear();
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            throw new ResourcesException("can't close database connection of bundle " + getSystemLocale(), e);
        } finally {
            connection = null;
        }
    }

    private String lookup(String key) {
        try (PreparedStatement ps = connection.prepareStatement(sql.select)) {
            ps.setString(1, key);
            ps.setString(2, locale());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    String value = rs.getString(1);
                    return value == null ? "" : value;
                }
            }
        } catch (SQLException e) {
            throw failure("find", key, e);
        }
        return "";
    }

    private boolean exists(String key) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(sql.exists)) {
            ps.setString(1, key);
            ps.setString(2, locale());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void insert(String key, String value) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(sql.insert)) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.setString(3, locale());
            ps.executeUpdate();
        }
    }

    private static boolean isIntegrityViolation(SQLException e) {
        if (e instanceof SQLIntegrityConstraintViolationException) {
            return true;
        }
        String state = e.getSQLState();
        if (state != null && state.startsWith("23")) {
            return true;
        }
        String msg = e.getMessage();
        return msg != null && msg.contains("constraint");
    }

    private ResourcesException failure(String operation, String key, SQLException e) {
        return new ResourcesException(operation + " failed for locale " + getSystemLocale()
                + (key == null ? "" : ", key=" + key) + ": " + e.getMessage(), e);
    }

    private String locale() {
        return getSystemLocale().toString();
    }

    private void ensureOpen() {
        ensureUsable();
        if (connection == null) {
            throw new IllegalStateException("database bundle for " + getSystemLocale() + " has not been initialized");
        }
    }

    private static final class Statements {
        final String select;
        final String exists;
        final String update;
        final String insert;
        final String keyByValue;
        final String count;
        final String keys;

        private Statements(String table, String keyColumn, String localeColumn, String valueColumn) {
            this.select = "SELECT " + valueColumn + " FROM " + table
                    + " WHERE " + keyColumn + " = ? AND " + localeColumn + " = ?";
            this.exists = "SELECT 1 FROM " + table
                    + " WHERE " + keyColumn + " = ? AND " + localeColumn + " = ?";
            this.update = "UPDATE " + table + " SET " + valueColumn + " = ?"
                    + " WHERE " + keyColumn + " = ? AND " + localeColumn + " = ?";
            this.insert = "INSERT INTO " + table + " (" + keyColumn + ", " + valueColumn + ", " + localeColumn + ")"
                    + " VALUES (?, ?, ?)";
            this.keyByValue = "SELECT " + keyColumn + " FROM " + table
                    + " WHERE " + valueColumn + " = ? AND " + localeColumn + " = ? ORDER BY " + keyColumn;
            this.count = "SELECT COUNT(*) FROM (SELECT " + keyColumn + " FROM " + table
                    + " WHERE " + localeColumn + " = ? GROUP BY " + keyColumn + ") grouped_keys";
            this.keys = "SELECT " + keyColumn + " FROM " + table
                    + " WHERE " + localeColumn + " = ? GROUP BY " + keyColumn + " ORDER BY " + keyColumn;
        }
    }
}
