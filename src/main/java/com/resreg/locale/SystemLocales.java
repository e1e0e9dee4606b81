package com.resreg.locale;

import com.resreg.errors.LocaleApplyException;
import com.resreg.errors.LocaleNotInstalledException;
import com.resreg.errors.NoSystemLocaleException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads and changes the host locale through a {@link LocaleHost}.
 */
public final class SystemLocales {
    private static final Logger log = LogManager.getLogger(SystemLocales.class);

    private static final SystemLocales JVM = new SystemLocales(new JvmLocaleHost());

    private final LocaleHost host;

    public SystemLocales(LocaleHost host) {
        if (host == null) {
            throw new IllegalArgumentException("host must not be null");
        }
        this.host = host;
    }

    public static SystemLocales jvm() {
        return JVM;
    }

    public SystemLocale getDefault() {
        Locale current = host.current().orElseThrow(() -> new NoSystemLocaleException("No system locale set"));
        if (current.getLanguage().isEmpty() && current.getCountry().isEmpty()) {
            throw new NoSystemLocaleException("No system locale set");
        }
        return SystemLocale.of(current);
    }

    public List<SystemLocale> getAvailableLocales() {
        Set<SystemLocale> out = new LinkedHashSet<>();
        for (Locale locale : host.installed()) {
            if (locale == null || (locale.getLanguage().isEmpty() && locale.getCountry().isEmpty())) {
                continue;
            }
            out.add(SystemLocale.of(locale));
        }
        return new ArrayList<>(out);
    }

    public boolean isInstalled(SystemLocale locale) {
        if (locale == null) {
            return false;
        }
        for (SystemLocale candidate : getAvailableLocales()) {
            if (candidate.toString().equals(locale.toString())) {
                return true;
            }
        }
        return false;
    }

    public void setDefault(SystemLocale locale) {
        if (!isInstalled(locale)) {
            throw new LocaleNotInstalledException("System locale " + locale + " is not installed");
        }
        try {
            host.apply(locale.toJavaLocale());
        } catch (RuntimeException e) {
            throw new LocaleApplyException("Default locale can't be set to " + locale, e);
        }
        log.info("default system locale set to {}", locale);
    }
}
