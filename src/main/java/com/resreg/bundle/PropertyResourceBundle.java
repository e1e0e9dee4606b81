package com.resreg.bundle;

import com.resreg.errors.BundleInitException;
import com.resreg.errors.ResourcesException;
import com.resreg.locale.SystemLocale;
import com.resreg.locale.SystemLocales;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;

/**
 * Bundle backed by a {@code <basePath>_<locale>.properties} file.
 */
public class PropertyResourceBundle extends AbstractResourceBundle {
    private static final Logger log = LogManager.getLogger(PropertyResourceBundle.class);

    public static final String SEPARATOR = "_";
    public static final String SUFFIX = ".properties";

    private final String basePath;
    private final Path file;
    private TreeMap<String, String> properties;

    protected PropertyResourceBundle(String basePath, SystemLocale systemLocale) {
        super(systemLocale);
        if (basePath == null || basePath.trim().isEmpty()) {
            throw new IllegalArgumentException("property bundle base path must not be empty");
        }
        this.basePath = basePath;
        this.file = fileFor(basePath, systemLocale);
    }

    public static PropertyResourceBundle getBundle(String basePath, SystemLocale systemLocale) {
        SystemLocale locale = systemLocale == null ? SystemLocales.jvm().getDefault() : systemLocale;
        PropertyResourceBundle bundle = new PropertyResourceBundle(basePath, locale);
        bundle.initialize();
        return bundle;
    }

    public static Path fileFor(String basePath, SystemLocale systemLocale) {
        return Paths.get(basePath + SEPARATOR + systemLocale + SUFFIX);
    }

    public Path getFile() {
        return file;
    }

    public String getBasePath() {
        return basePath;
    }

    @Override
    public void initialize() {
        ensureUsable();
        if (!Files.isRegularFile(file)) {
            throw new BundleInitException("resource file " + file.toAbsolutePath() + " does not exist");
        }
        Properties loaded = new Properties();
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            loaded.load(in);
        } catch (IOException | IllegalArgumentException e) {
            throw new BundleInitException("can't read resource file " + file.toAbsolutePath(), e);
        }
        TreeMap<String, String> out = new TreeMap<>();
        for (String name : loaded.stringPropertyNames()) {
            out.put(name, loaded.getProperty(name));
        }
        this.properties = out;
        log.debug("loaded {} resources for locale {} from {}", out.size(), getSystemLocale(), file);
    }

    @Override
    public String find(String key, Map<String, ?> params) {
        String raw = values().getOrDefault(requireKey(key), "");
        return Placeholders.substitute(raw, params, PlaceholderStyle.BRACES);
    }

    @Override
    public void replace(String key, String value) {
        values().put(requireKey(key), value == null ? "" : value);
    }

    @Override
    public boolean attach(String key, String value) {
        if (values().containsKey(requireKey(key))) {
            return false;
        }
        values().put(key, value == null ? "" : value);
        return true;
    }

    @Override
    public Optional<String> findKeyByValue(String value) {
        for (Map.Entry<String, String> entry : values().entrySet()) {
            if (Objects.equals(entry.getValue(), value)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    @Override
    public int count() {
        return values().size();
    }

    @Override
    public Set<String> getKeys() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(values().keySet()));
    }

    @Override
    public void save() {
        Properties out = new Properties();
        out.putAll(values());
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.store(writer, null);
        } catch (IOException e) {
            throw new ResourcesException("can't write resource file " + file.toAbsolutePath(), e);
        }
        log.debug("stored {} resources for locale {} to {}", out.size(), getSystemLocale(), file);
    }

    @Override
    protected void release() {
        properties = null;
    }

    private TreeMap<String, String> values() {
        ensureUsable();
        if (properties == null) {
            throw new IllegalStateException("resource bundle " + file + " has not been initialized");
        }
        return properties;
    }
}
