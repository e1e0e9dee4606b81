package com.resreg.db;

import com.resreg.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * JDBC connection factory driven by the {@code db.connect.*} keys of a resource configuration.
 * Any driver on the classpath that accepts the configured DSN can be used.
 */
public final class Database {
    public static final String DB_CONNECT_DSN = "db.connect.dsn";
    public static final String DB_CONNECT_USER = "db.connect.user";
    public static final String DB_CONNECT_PASSWORD = "db.connect.password";
    public static final String DB_SQL_LOG_ENABLED = "db.sql_log.enabled";

    private static final Logger SQL_LOG = LogManager.getLogger("SQL");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String dsn;
    private final String user;
    private final String password;
    private final boolean sqlLogEnabled;

    public Database(String dsn, String user, String password, boolean sqlLogEnabled) {
        if (isBlank(dsn)) {
            throw new IllegalArgumentException(DB_CONNECT_DSN + " must not be empty");
        }
        this.dsn = dsn.trim();
        if (!this.dsn.toLowerCase(Locale.ROOT).startsWith("jdbc:")) {
            throw new IllegalArgumentException(DB_CONNECT_DSN + " must be a JDBC URL (jdbc:...)");
        }
        this.user = isBlank(user) ? null : user.trim();
        this.password = password;
        this.sqlLogEnabled = sqlLogEnabled;
    }

    public static Database fromConfig(Config config) {
        return new Database(
                config.requireString(DB_CONNECT_DSN),
                config.getString(DB_CONNECT_USER),
                config.getRaw(DB_CONNECT_PASSWORD),
                config.getBoolean(DB_SQL_LOG_ENABLED)
        );
    }

    public Connection connect() throws SQLException {
        try {
            Connection raw = user == null
                    ? DriverManager.getConnection(dsn)
                    : DriverManager.getConnection(dsn, user, password == null ? "" : password);
            return sqlLogEnabled ? SqlLogProxy.wrapConnection(raw, SQL_LOG) : raw;
        } catch (SQLException e) {
            String details = "DB connect failed: dsn=" + maskedDsn()
                    + ", hint=" + classifyConnectFailure(e)
                    + ", cause=" + safe(e.getMessage());
            throw new SQLException(details, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    /**
     * Validates a table or column name before it is spliced into SQL text.
     */
    public static String identifier(String key, String raw) {
        String value = raw == null ? "" : raw.trim();
        if (!IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException("invalid " + key + "='" + value
                    + "', allowed pattern: [A-Za-z_][A-Za-z0-9_]*");
        }
        return value;
    }

    public String maskedDsn() {
        String out = dsn;
        out = out.replaceAll("(?i)(password=)[^&;]+", "$1***");
        out = out.replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
        return out;
    }

    private String classifyConnectFailure(SQLException e) {
        String msg = safe(e == null ? null : e.getMessage()).toLowerCase(Locale.ROOT);
        if (msg.contains("no suitable driver")) {
            return "missing_driver";
        }
        if (msg.contains("password") || msg.contains("permission denied") || msg.contains("access is denied")) {
            return "permission";
        }
        if (msg.contains("locked")) {
            return "locked";
        }
        if (msg.contains("no such file") || msg.contains("cannot open") || msg.contains("does not exist")) {
            return "missing_dir";
        }
        return "connection_error";
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
