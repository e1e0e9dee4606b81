package com.resreg.tabular;

import com.resreg.bundle.ResourceBundle;
import com.resreg.errors.ResourcesException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Pivoted view of several bundles: one row per key, one column per locale.
 * The header row is {@code keys, locale1, locale2, ...}.
 */
public final class ResourceTable {
    public static final String KEY_HEADER = "keys";

    private final List<String> locales;
    private final List<Row> rows;

    public ResourceTable(List<String> locales, List<Row> rows) {
        this.locales = List.copyOf(locales);
        this.rows = List.copyOf(rows);
    }

    public static ResourceTable pivot(Collection<ResourceBundle> bundles) {
        List<String> locales = new ArrayList<>();
        Set<String> keys = new TreeSet<>();
        for (ResourceBundle bundle : bundles) {
            locales.add(bundle.getSystemLocale().toString());
            keys.addAll(bundle.getKeys());
        }
        List<Row> rows = new ArrayList<>(keys.size());
        for (String key : keys) {
            List<String> values = new ArrayList<>(locales.size());
            for (ResourceBundle bundle : bundles) {
                values.add(bundle.find(key));
            }
            rows.add(new Row(key, values));
        }
        return new ResourceTable(locales, rows);
    }

    /**
     * Builds a table from raw cells; the first line must be the header.
     */
    public static ResourceTable fromCells(List<List<String>> lines, String source) {
        if (lines.isEmpty()) {
            throw new ResourcesException("resource table " + source + " has no header row");
        }
        List<String> header = lines.get(0);
        if (header.isEmpty() || !KEY_HEADER.equals(header.get(0).trim().toLowerCase(Locale.ROOT))) {
            throw new ResourcesException("resource table " + source + " must start with a '" + KEY_HEADER + "' column");
        }
        List<String> locales = new ArrayList<>();
        for (int i = 1; i < header.size(); i++) {
            String locale = header.get(i).trim();
            if (locale.isEmpty()) {
                throw new ResourcesException("resource table " + source + " has an empty locale in column " + (i + 1));
            }
            locales.add(locale);
        }
        List<Row> rows = new ArrayList<>();
        for (int r = 1; r < lines.size(); r++) {
            List<String> line = lines.get(r);
            if (line.isEmpty() || line.get(0).trim().isEmpty()) {
                continue;
            }
            List<String> values = new ArrayList<>(locales.size());
            for (int c = 1; c <= locales.size(); c++) {
                values.add(c < line.size() ? line.get(c) : "");
            }
            rows.add(new Row(line.get(0).trim(), values));
        }
        return new ResourceTable(locales, rows);
    }

    public List<List<String>> toCells() {
        List<List<String>> out = new ArrayList<>(rows.size() + 1);
        List<String> header = new ArrayList<>(locales.size() + 1);
        header.add(KEY_HEADER);
        header.addAll(locales);
        out.add(header);
        for (Row row : rows) {
            List<String> line = new ArrayList<>(locales.size() + 1);
            line.add(row.key);
            line.addAll(row.values);
            out.add(line);
        }
        return out;
    }

    public List<String> getLocales() {
        return locales;
    }

    public List<Row> getRows() {
        return rows;
    }

    public static final class Row {
        private final String key;
        private final List<String> values;

        public Row(String key, List<String> values) {
            this.key = key;
            this.values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        public String getKey() {
            return key;
        }

        /**
         * Values in header order; an empty string marks a missing cell.
         */
        public List<String> getValues() {
            return values;
        }
    }
}
