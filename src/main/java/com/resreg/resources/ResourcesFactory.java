package com.resreg.resources;

import com.resreg.locale.SystemLocale;

/**
 * Cache of {@link Resources} keyed by resource-set name.
 * <p>
 * Construct one per application, hand it to the code that needs lookups and call
 * {@link #release()} on shutdown.
 */
public interface ResourcesFactory {

    /**
     * Returns the registry already cached under {@code name}.
     *
     * @throws com.resreg.errors.ResourcesException when no registry of that name exists yet
     */
    default Resources getResources(String name) {
        return getResources(name, null);
    }

    /**
     * Returns the registry cached under {@code name}, creating and initializing it on first use.
     * {@code config} is only consulted on creation.
     *
     * @throws com.resreg.errors.ResourcesException when a registry has to be created and
     *                                               {@code config} is blank
     */
    Resources getResources(String name, String config);

    /**
     * Destroys and forgets every cached registry. The factory stays usable.
     */
    void release();

    boolean isReturnNull();

    /**
     * Null-return policy for registries created from now on.
     */
    void setReturnNull(boolean returnNull);

    SystemLocale getDefaultSystemLocale();

    void setDefaultSystemLocale(SystemLocale systemLocale);
}
