package com.resreg.bundle;

import java.util.Locale;

/**
 * How a parameter key is marked inside a resource string.
 */
public enum PlaceholderStyle {
    /** {@code {name}} */
    BRACES {
        @Override
        public String token(String paramKey) {
            return "{" + paramKey + "}";
        }
    },
    /** {@code name?} */
    QUESTION_SUFFIX {
        @Override
        public String token(String paramKey) {
            return paramKey + "?";
        }
    };

    public abstract String token(String paramKey);

    /**
     * Parses the configuration form: {@code braces} or {@code question}.
     */
    public static PlaceholderStyle fromConfig(String raw, PlaceholderStyle fallback) {
        if (raw == null || raw.trim().isEmpty()) {
            return fallback;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "braces":
                return BRACES;
            case "question":
            case "question_suffix":
                return QUESTION_SUFFIX;
            default:
                throw new IllegalArgumentException("unknown placeholder style: " + raw);
        }
    }
}
