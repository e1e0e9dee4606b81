package com.resreg.locale;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Access to the locale settings of the host the registry runs on.
 */
public interface LocaleHost {

    /**
     * The locale currently in effect, empty when the host has none set.
     */
    Optional<Locale> current();

    List<Locale> installed();

    /**
     * Makes {@code locale} the host default.
     *
     * @throws RuntimeException when the host refuses the setting
     */
    void apply(Locale locale);
}
