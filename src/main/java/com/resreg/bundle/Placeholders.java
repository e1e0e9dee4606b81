package com.resreg.bundle;

import java.util.LinkedHashMap;
import java.util.Map;

public final class Placeholders {

    private Placeholders() {
    }

    /**
     * Replaces every token of every parameter literally. Parameters are applied in map order.
     */
    public static String substitute(String raw, Map<String, ?> params, PlaceholderStyle style) {
        if (raw == null || raw.isEmpty() || params == null || params.isEmpty()) {
            return raw == null ? "" : raw;
        }
        String out = raw;
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            if (entry.getKey() == null) {
                continue;
            }
            String value = entry.getValue() == null ? "" : String.valueOf(entry.getValue());
            out = out.replace(style.token(entry.getKey()), value);
        }
        return out;
    }

    /**
     * Positional parameters keyed {@code "0"}, {@code "1"}, ...
     */
    public static Map<String, Object> indexed(Object... values) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (values == null) {
            return out;
        }
        for (int i = 0; i < values.length; i++) {
            out.put(String.valueOf(i), values[i]);
        }
        return out;
    }

    public static Map<String, Object> named(Object... keyValues) {
        if (keyValues == null || keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("named parameters must be key,value pairs");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            out.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return out;
    }
}
