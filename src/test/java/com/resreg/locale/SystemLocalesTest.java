package com.resreg.locale;

import com.resreg.errors.LocaleApplyException;
import com.resreg.errors.LocaleNotInstalledException;
import com.resreg.errors.NoSystemLocaleException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SystemLocalesTest {

    @Test
    void getDefaultShouldFailWhenHostHasNoLocale() {
        SystemLocales locales = new SystemLocales(new FakeHost(null));

        assertThrows(NoSystemLocaleException.class, locales::getDefault);
    }

    @Test
    void getDefaultShouldFailOnRootLocale() {
        SystemLocales locales = new SystemLocales(new FakeHost(Locale.ROOT));

        assertThrows(NoSystemLocaleException.class, locales::getDefault);
    }

    @Test
    void getDefaultShouldConvertHostLocale() {
        SystemLocales locales = new SystemLocales(new FakeHost(Locale.GERMANY));

        assertEquals("de_DE", locales.getDefault().toString());
    }

    @Test
    void availableLocalesShouldSkipRootAndDuplicates() {
        FakeHost host = new FakeHost(Locale.US, Locale.ROOT, Locale.US, Locale.GERMANY);

        List<SystemLocale> available = new SystemLocales(host).getAvailableLocales();

        assertEquals(List.of(new SystemLocale("en", "US"), new SystemLocale("de", "DE")), available);
    }

    @Test
    void setDefaultShouldRejectLocaleThatIsNotInstalled() {
        FakeHost host = new FakeHost(Locale.US, Locale.US);
        SystemLocales locales = new SystemLocales(host);

        assertThrows(LocaleNotInstalledException.class, () -> locales.setDefault(SystemLocale.parse("de_DE")));
        assertEquals(0, host.applyCalls);
    }

    @Test
    void setDefaultShouldWrapHostFailure() {
        FakeHost host = new FakeHost(Locale.US, Locale.US, Locale.GERMANY);
        host.failApply = true;
        SystemLocales locales = new SystemLocales(host);

        LocaleApplyException error = assertThrows(LocaleApplyException.class,
                () -> locales.setDefault(SystemLocale.parse("de_DE")));
        assertTrue(error.getCause() instanceof UnsupportedOperationException);
    }

    @Test
    void setDefaultShouldApplyInstalledLocale() {
        FakeHost host = new FakeHost(Locale.US, Locale.US, Locale.GERMANY);
        SystemLocales locales = new SystemLocales(host);

        locales.setDefault(SystemLocale.parse("de_DE"));

        assertEquals(1, host.applyCalls);
        assertEquals("de_DE", locales.getDefault().toString());
        assertTrue(locales.isInstalled(SystemLocale.parse("en_US")));
        assertFalse(locales.isInstalled(null));
    }

    private static final class FakeHost implements LocaleHost {
        private Locale current;
        private final List<Locale> installed;
        boolean failApply;
        int applyCalls;

        private FakeHost(Locale current, Locale... installed) {
            this.current = current;
            this.installed = new ArrayList<>(Arrays.asList(installed));
        }

        @Override
        public Optional<Locale> current() {
            return Optional.ofNullable(current);
        }

        @Override
        public List<Locale> installed() {
            return installed;
        }

        @Override
        public void apply(Locale locale) {
            applyCalls++;
            if (failApply) {
                throw new UnsupportedOperationException("read-only host");
            }
            current = locale;
        }
    }
}
