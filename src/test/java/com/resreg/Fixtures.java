package com.resreg;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Test data on disk: property bundles copied from the classpath and a seeded SQLite table.
 */
public final class Fixtures {
    public static final String PROPERTY_BASE = "testresources";
    public static final String DB_CONFIG = "dbresources";

    private Fixtures() {
    }

    /**
     * Copies the de_DE and en_US bundles into {@code dir}.
     *
     * @return the base path to hand to a property bundle
     */
    public static String propertyBundles(Path dir) throws IOException {
        for (String locale : new String[]{"de_DE", "en_US"}) {
            String name = PROPERTY_BASE + "_" + locale + ".properties";
            try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream("fixtures/" + name)) {
                if (in == null) {
                    throw new IOException("missing test fixture " + name);
                }
                Files.copy(in, dir.resolve(name));
            }
        }
        return dir.resolve(PROPERTY_BASE).toString();
    }

    /**
     * Creates {@code resources.db} with the two seeded rows and a configuration file next to it.
     *
     * @return the configuration locator (path without {@code .properties})
     */
    public static String database(Path dir, boolean cache, String placeholderStyle) throws IOException, SQLException {
        Path db = dir.resolve("resources.db");
        String dsn = "jdbc:sqlite:" + db.toAbsolutePath().toString().replace('\\', '/');
        try (Connection conn = DriverManager.getConnection(dsn);
             Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS resources ("
                    + "msg_key VARCHAR(255) NOT NULL,"
                    + "locale VARCHAR(5) NOT NULL,"
                    + "val VARCHAR(255) NOT NULL,"
                    + "PRIMARY KEY (msg_key, locale))");
            st.execute("INSERT INTO resources (msg_key, locale, val) VALUES "
                    + "('test.key', 'de_DE', 'Testwert'),"
                    + "('test.key', 'en_US', 'Testvalue')");
        }
        StringBuilder config = new StringBuilder()
                .append("db.connect.dsn = ").append(dsn).append('\n')
                .append("db.connect.user = \n")
                .append("db.connect.password = \n")
                .append("db.sql.table = resources\n")
                .append("db.sql.locale.column = locale\n")
                .append("db.sql.key.column = msg_key\n")
                .append("db.sql.val.column = val\n")
                .append("db.sql_log.enabled = true\n")
                .append("resource.cache = ").append(cache).append('\n');
        if (placeholderStyle != null) {
            config.append("resource.placeholder.style = ").append(placeholderStyle).append('\n');
        }
        Files.writeString(dir.resolve(DB_CONFIG + ".properties"), config.toString(), StandardCharsets.UTF_8);
        return dir.resolve(DB_CONFIG).toString();
    }

    public static String database(Path dir) throws IOException, SQLException {
        return database(dir, false, null);
    }

    public static void execute(String locator, String sql) throws IOException, SQLException {
        String dsn = null;
        for (String line : Files.readAllLines(Path.of(locator + ".properties"), StandardCharsets.UTF_8)) {
            if (line.startsWith("db.connect.dsn")) {
                dsn = line.substring(line.indexOf('=') + 1).trim();
            }
        }
        try (Connection conn = DriverManager.getConnection(dsn);
             Statement st = conn.createStatement()) {
            st.execute(sql);
        }
    }
}
