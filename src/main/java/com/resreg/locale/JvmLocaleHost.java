package com.resreg.locale;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * {@link LocaleHost} backed by the JVM default locale and the locales the runtime provides.
 */
public final class JvmLocaleHost implements LocaleHost {

    @Override
    public Optional<Locale> current() {
        Locale locale = Locale.getDefault();
        if (locale == null || Locale.ROOT.equals(locale)) {
            return Optional.empty();
        }
        return Optional.of(locale);
    }

    @Override
    public List<Locale> installed() {
        return Arrays.asList(Locale.getAvailableLocales());
    }

    @Override
    public void apply(Locale locale) {
        Locale.setDefault(locale);
    }
}
