package com.resreg.resources;

import java.util.Locale;

/**
 * Storage backends a factory can be built for.
 */
public enum Backend {
    PROPERTY("property", "properties", "file"),
    DATABASE("db", "database", "jdbc");

    private final String[] aliases;

    Backend(String... aliases) {
        this.aliases = aliases;
    }

    public ResourcesFactory newFactory() {
        switch (this) {
            case DATABASE:
                return new DbResourcesFactory();
            case PROPERTY:
            default:
                return new PropertyResourcesFactory();
        }
    }

    public static Backend fromName(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (Backend backend : values()) {
            if (backend.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return backend;
            }
            for (String alias : backend.aliases) {
                if (alias.equals(normalized)) {
                    return backend;
                }
            }
        }
        throw new IllegalArgumentException("unknown backend: " + raw + " (expected property or db)");
    }
}
