package com.resreg.resources;

import com.resreg.errors.ResourcesException;
import com.resreg.locale.SystemLocale;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

public abstract class AbstractResourcesFactory implements ResourcesFactory {
    private static final Logger log = LogManager.getLogger(AbstractResourcesFactory.class);

    private final Map<String, Resources> resources = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean returnNull = true;
    private volatile SystemLocale defaultSystemLocale;

    /**
     * Constructs the concrete, not yet initialized registry.
     */
    protected abstract Resources createResources(String name, String config);

    @Override
    public Resources getResources(String name, String config) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("resources name must not be empty");
        }
        lock.lock();
        try {
            Resources existing = resources.get(name);
            if (existing != null) {
                return existing;
            }
            if (config == null || config.trim().isEmpty()) {
                throw new ResourcesException("resources " + name + " are not cached yet and need a config locator");
            }
            Resources created = createResources(name, config);
            created.initialize();
            created.setReturnNull(returnNull);
            created.setDefaultSystemLocale(defaultSystemLocale);
            resources.put(name, created);
            log.info("created resources {} (config={}, returnNull={})", name, config, returnNull);
            return created;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release() {
        lock.lock();
        try {
            RuntimeException first = null;
            Iterator<Map.Entry<String, Resources>> it = resources.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Resources> entry = it.next();
                try {
                    entry.getValue().destroy();
                } catch (RuntimeException e) {
                    log.warn("destroy of resources {} failed: {}", entry.getKey(), e.getMessage());
                    if (first == null) {
                        first = e;
                    } else {
                        first.addSuppressed(e);
                    }
                }
                it.remove();
            }
            if (first != null) {
                throw first;
            }
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return resources.size();
        } finally {
            lock.unlock();
        }
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
}
