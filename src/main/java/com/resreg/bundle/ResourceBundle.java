package com.resreg.bundle;

import com.resreg.locale.SystemLocale;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The string table of one resource-set at one locale.
 * <p>
 * Implementations are created and initialized by a static {@code getBundle(config, locale)}
 * method and must be released with {@link #destroy()}; a destroyed bundle rejects every call.
 */
public interface ResourceBundle {

    SystemLocale getSystemLocale();

    /**
     * Loads the backend data for this bundle's locale.
     *
     * @throws com.resreg.errors.BundleInitException when the backend cannot be loaded
     */
    void initialize();

    /**
     * Returns the value stored under {@code key}, or an empty string when there is none.
     */
    default String find(String key) {
        return find(key, null);
    }

    /**
     * Returns the value stored under {@code key} with every placeholder of {@code params}
     * substituted; placeholders without a parameter are left as they are.
     */
    String find(String key, Map<String, ?> params);

    /**
     * Stores {@code value} under {@code key}, overwriting any previous value.
     */
    void replace(String key, String value);

    /**
     * Stores {@code value} under {@code key} only if the key is absent.
     *
     * @return {@code false} if the key already existed, the stored value is then unchanged
     */
    boolean attach(String key, String value);

    Optional<String> findKeyByValue(String value);

    int count();

    Set<String> getKeys();

    void save();

    void destroy();
}
