package com.resreg.resources;

import com.resreg.bundle.ResourceBundle;
import com.resreg.locale.SystemLocale;

import java.util.Map;
import java.util.Set;

/**
 * One named resource-set across every locale looked up so far.
 * <p>
 * Bundles are loaded lazily, one per locale, on the first call that needs them. A {@code null}
 * locale argument stands for the default locale of the registry.
 */
public interface Resources {

    String getName();

    void initialize();

    void destroy();

    void save();

    default String find(String key) {
        return find(key, null, null);
    }

    default String find(String key, SystemLocale systemLocale) {
        return find(key, systemLocale, null);
    }

    /**
     * Resolves {@code key} in the bundle of {@code systemLocale}.
     *
     * @return the value, or an empty string when it is missing and {@link #isReturnNull()} is set
     * @throws com.resreg.errors.ResourcesKeyException when the value is missing and
     *                                                 {@link #isReturnNull()} is not set
     */
    String find(String key, SystemLocale systemLocale, Map<String, ?> params);

    void replace(String key, String value, SystemLocale systemLocale);

    boolean attach(String key, String value, SystemLocale systemLocale);

    /**
     * Union of the keys of the bundles loaded so far.
     */
    Set<String> getKeys();

    ResourceBundle getBundle(SystemLocale systemLocale);

    Set<String> getLoadedLocales();

    boolean isReturnNull();

    void setReturnNull(boolean returnNull);

    SystemLocale getDefaultSystemLocale();

    void setDefaultSystemLocale(SystemLocale systemLocale);
}
