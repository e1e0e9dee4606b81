package com.resreg.locale;

import com.resreg.errors.LocaleParseException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SystemLocaleTest {

    @Test
    void parseAndFormatShouldRoundTripCanonicalTokens() {
        for (String token : List.of("en", "en_US", "de_DE", "es_ES_Traditional", "es_ES_Traditional_WIN", "_US")) {
            assertEquals(token, SystemLocale.parse(token).toString());
        }
    }

    @Test
    void parseShouldSplitSegmentsIntoFields() {
        SystemLocale locale = SystemLocale.parse("es_ES_Traditional");

        assertEquals("es", locale.getLanguage());
        assertEquals("ES", locale.getCountry());
        assertEquals("Traditional", locale.getVariant());
    }

    @Test
    void parseShouldKeepExtraSegmentsInVariant() {
        SystemLocale locale = SystemLocale.parse("es_ES_Traditional_WIN");

        assertEquals("Traditional_WIN", locale.getVariant());
        assertEquals("es_ES_Traditional_WIN", locale.toString());
        assertEquals(locale, SystemLocale.parse(new SystemLocale("es", "ES", "Traditional_WIN").toString()));
    }

    @Test
    void parseShouldRejectEmptyTokens() {
        assertThrows(LocaleParseException.class, () -> SystemLocale.parse(""));
        assertThrows(LocaleParseException.class, () -> SystemLocale.parse(null));
        assertThrows(LocaleParseException.class, () -> SystemLocale.parse("_"));
    }

    @Test
    void constructorShouldRequireLanguageOrCountry() {
        assertThrows(LocaleParseException.class, () -> new SystemLocale("", "", "WIN"));
        assertEquals("_DE", new SystemLocale(null, "DE").toString());
    }

    @Test
    void emptySegmentsShouldBeOmittedFromCanonicalForm() {
        assertEquals("en", new SystemLocale("en", "", "").toString());
        assertEquals("en_WIN", new SystemLocale("en", "", "WIN").toString());
    }

    @Test
    void equalityShouldFollowCanonicalString() {
        SystemLocale empty = new SystemLocale("en", "", "");
        SystemLocale missing = new SystemLocale("en", null, null);

        assertEquals(empty, missing);
        assertEquals(empty.hashCode(), missing.hashCode());
        assertEquals(SystemLocale.parse(SystemLocale.GERMANY), new SystemLocale("de", "DE"));
        assertNotEquals(SystemLocale.parse(SystemLocale.US), SystemLocale.parse(SystemLocale.UK));
    }

    @Test
    void jdkLocaleConversionShouldKeepLanguageCountryAndVariant() {
        assertEquals("ja_JP", SystemLocale.of(Locale.JAPAN).toString());
        assertEquals(Locale.GERMANY, SystemLocale.parse("de_DE").toJavaLocale());
    }
}
