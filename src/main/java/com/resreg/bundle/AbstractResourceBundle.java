package com.resreg.bundle;

import com.resreg.locale.SystemLocale;

/**
 * Locale ownership and the destroyed-state guard shared by every backend.
 */
public abstract class AbstractResourceBundle implements ResourceBundle {
    private final SystemLocale systemLocale;
    private boolean destroyed;

    protected AbstractResourceBundle(SystemLocale systemLocale) {
        if (systemLocale == null) {
            throw new IllegalArgumentException("systemLocale must not be null");
        }
        this.systemLocale = systemLocale;
    }

    @Override
    public SystemLocale getSystemLocale() {
        return systemLocale;
    }

    @Override
    public final void destroy() {
        ensureUsable();
        try {
            release();
        } finally {
            destroyed = true;
        }
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    /**
     * Frees the backend handle. Called once by {@link #destroy()}.
     */
    protected abstract void release();

    protected void ensureUsable() {
        if (destroyed) {
            throw new IllegalStateException("resource bundle for " + systemLocale + " has been destroyed");
        }
    }

    protected static String requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("resource key must not be null");
        }
        return key;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + systemLocale + "]";
    }
}
