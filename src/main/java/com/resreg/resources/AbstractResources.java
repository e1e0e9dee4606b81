package com.resreg.resources;

import com.resreg.bundle.ResourceBundle;
import com.resreg.errors.ResourcesKeyException;
import com.resreg.locale.SystemLocale;
import com.resreg.locale.SystemLocales;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bundle cache keyed by canonical locale token.
 * <p>
 * The lock is held across check, construction and insert, so a locale never gets two bundles.
 * A bundle whose initialization fails is not cached and the next lookup tries again.
 * <p>
 * {@link #save()} and {@link #getKeys()} walk a copy of the cache outside the lock. A
 * {@link #destroy()} running at the same time can destroy a bundle during that walk, which
 * then fails with {@link IllegalStateException}; callers destroy a registry only once
 * lookups on it have stopped.
 */
public abstract class AbstractResources implements Resources {
    private static final Logger log = LogManager.getLogger(AbstractResources.class);

    private final String name;
    private final SystemLocales systemLocales;
    private final ReentrantLock lock = new ReentrantLock();
    private Map<String, ResourceBundle> bundles = new LinkedHashMap<>();
    private volatile boolean returnNull = true;
    private volatile SystemLocale defaultSystemLocale;

    protected AbstractResources(String name) {
        this(name, SystemLocales.jvm());
    }

    protected AbstractResources(String name, SystemLocales systemLocales) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("resources name must not be empty");
        }
        this.name = name;
        this.systemLocales = systemLocales == null ? SystemLocales.jvm() : systemLocales;
    }

    /**
     * Constructs and initializes the bundle of this resource-set for {@code systemLocale}.
     */
    protected abstract ResourceBundle loadBundle(SystemLocale systemLocale);

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isReturnNull() {
        return returnNull;
    }

    @Override
    public void setReturnNull(boolean returnNull) {
        this.returnNull = returnNull;
    }

    @Override
    public SystemLocale getDefaultSystemLocale() {
        return defaultSystemLocale;
    }

    @Override
    public void setDefaultSystemLocale(SystemLocale systemLocale) {
        this.defaultSystemLocale = systemLocale;
    }

    @Override
    public void initialize() {
        lock.lock();
        try {
            bundles = new LinkedHashMap<>();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void destroy() {
        lock.lock();
        try {
            RuntimeException first = null;
            for (ResourceBundle bundle : bundles.values()) {
                try {
                    bundle.destroy();
                } catch (RuntimeException e) {
                    if (first == null) {
                        first = e;
                    } else {
                        first.addSuppressed(e);
                    }
                }
            }
            log.debug("destroyed {} bundles of resources {}", bundles.size(), name);
            bundles = new LinkedHashMap<>();
            if (first != null) {
                throw first;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void save() {
        for (ResourceBundle bundle : snapshot().values()) {
            bundle.save();
        }
    }

    @Override
    public String find(String key, SystemLocale systemLocale, Map<String, ?> params) {
        SystemLocale locale = resolve(systemLocale);
        String value = getBundle(locale).find(key, params);
        if ((value == null || value.isEmpty()) && !returnNull) {
            throw new ResourcesKeyException(key, locale.toString());
        }
        return value == null ? "" : value;
    }

    @Override
    public void replace(String key, String value, SystemLocale systemLocale) {
        getBundle(systemLocale).replace(key, value);
    }

    @Override
    public boolean attach(String key, String value, SystemLocale systemLocale) {
        return getBundle(systemLocale).attach(key, value);
    }

    @Override
    public Set<String> getKeys() {
        Set<String> keys = new TreeSet<>();
        for (ResourceBundle bundle : snapshot().values()) {
            keys.addAll(bundle.getKeys());
        }
        return keys;
    }

    @Override
    public ResourceBundle getBundle(SystemLocale systemLocale) {
        SystemLocale locale = resolve(systemLocale);
        String token = locale.toString();
        lock.lock();
        try {
            ResourceBundle bundle = bundles.get(token);
            if (bundle == null) {
                bundle = loadBundle(locale);
                bundles.put(token, bundle);
                log.info("loaded bundle {} of resources {}", token, name);
            }
            return bundle;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<String> getLoadedLocales() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(snapshot().keySet()));
    }

    /**
     * Puts {@code bundle} under its locale. A different bundle already cached there is
     * destroyed and replaced.
     */
    protected void add(ResourceBundle bundle) {
        lock.lock();
        try {
            ResourceBundle replaced = bundles.put(bundle.getSystemLocale().toString(), bundle);
            if (replaced != null && replaced != bundle) {
                replaced.destroy();
                log.info("replaced bundle {} of resources {}", bundle.getSystemLocale(), name);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of the cached bundles in load order.
     */
    protected Map<String, ResourceBundle> snapshot() {
        lock.lock();
        try {
            return new LinkedHashMap<>(bundles);
        } finally {
            lock.unlock();
        }
    }

    protected SystemLocale resolve(SystemLocale systemLocale) {
        if (systemLocale != null) {
            return systemLocale;
        }
        SystemLocale fallback = defaultSystemLocale;
        return fallback != null ? fallback : systemLocales.getDefault();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + ", locales=" + getLoadedLocales() + "]";
    }
}
