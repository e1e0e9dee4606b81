package com.resreg.locale;

import com.resreg.errors.LocaleParseException;

import java.util.Locale;

/**
 * Locale identity in the {@code language[_COUNTRY[_VARIANT]]} token form.
 * <p>
 * Two instances are equal when their canonical strings are equal, so a missing
 * segment and an empty one compare the same. Everything after the second separator
 * is the variant, so {@code es_ES_Traditional_WIN} has the variant {@code Traditional_WIN}.
 */
public final class SystemLocale {
    public static final String US = "en_US";
    public static final String UK = "en_UK";
    public static final String GERMANY = "de_DE";

    private static final String SEPARATOR = "_";

    private final String language;
    private final String country;
    private final String variant;
    private final String canonical;

    public SystemLocale(String language) {
        this(language, null, null);
    }

    public SystemLocale(String language, String country) {
        this(language, country, null);
    }

    public SystemLocale(String language, String country, String variant) {
        this.language = normalize(language);
        this.country = normalize(country);
        this.variant = normalize(variant);
        if (this.language.isEmpty() && this.country.isEmpty()) {
            throw new LocaleParseException("Either language or country must have a value");
        }
        this.canonical = buildCanonical();
    }

    public static SystemLocale parse(String token) {
        if (token == null || token.trim().isEmpty()) {
            throw new LocaleParseException("locale token must not be empty");
        }
        String[] parts = token.trim().split(SEPARATOR, 3);
        switch (parts.length) {
            case 1:
                return new SystemLocale(parts[0]);
            case 2:
                return new SystemLocale(parts[0], parts[1]);
            default:
                return new SystemLocale(parts[0], parts[1], parts[2]);
        }
    }

    /**
     * Converts a JDK locale. Script and extensions are dropped.
     */
    public static SystemLocale of(Locale locale) {
        if (locale == null) {
            throw new LocaleParseException("locale must not be null");
        }
        return new SystemLocale(locale.getLanguage(), locale.getCountry(), locale.getVariant());
    }

    public Locale toJavaLocale() {
        return new Locale(language, country, variant);
    }

    public String getLanguage() {
        return language;
    }

    public String getCountry() {
        return country;
    }

    public String getVariant() {
        return variant;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SystemLocale)) {
            return false;
        }
        return canonical.equals(((SystemLocale) other).canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @Override
    public String toString() {
        return canonical;
    }

    private String buildCanonical() {
        StringBuilder out = new StringBuilder(language);
        if (!country.isEmpty()) {
            out.append(SEPARATOR).append(country);
        }
        if (!variant.isEmpty()) {
            out.append(SEPARATOR).append(variant);
        }
        return out.toString();
    }

    private static String normalize(String raw) {
        return raw == null ? "" : raw.trim();
    }
}
