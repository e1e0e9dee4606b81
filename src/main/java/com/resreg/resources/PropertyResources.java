package com.resreg.resources;

import com.resreg.bundle.PropertyResourceBundle;
import com.resreg.bundle.ResourceBundle;
import com.resreg.errors.ResourcesException;
import com.resreg.locale.SystemLocale;
import com.resreg.locale.SystemLocales;
import com.resreg.model.ExportResult;
import com.resreg.model.ImportResult;
import com.resreg.tabular.ResourceTable;
import com.resreg.tabular.ResourceTableCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Resources stored in {@code <config>_<locale>.properties} files.
 * <p>
 * Besides lookups this registry can pivot its loaded bundles into a table file and replay
 * such a file back into the bundles.
 */
public class PropertyResources extends AbstractResources {
    private static final Logger log = LogManager.getLogger(PropertyResources.class);

    private final String config;

    public PropertyResources(String name, String config) {
        this(name, config, SystemLocales.jvm());
    }

    public PropertyResources(String name, String config, SystemLocales systemLocales) {
        super(name, systemLocales);
        this.config = config;
    }

    public String getConfig() {
        return config;
    }

    @Override
    protected ResourceBundle loadBundle(SystemLocale systemLocale) {
        return PropertyResourceBundle.getBundle(config, systemLocale);
    }

    /**
     * Writes one row per key and one column per loaded locale to {@code target}. When nothing
     * has been loaded yet the default locale is loaded first.
     */
    public ExportResult export(Path target) {
        if (getLoadedLocales().isEmpty()) {
            getBundle(null);
        }
        ResourceTable table = ResourceTable.pivot(snapshot().values());
        try {
            ResourceTableCodec.forPath(target).write(table, target);
        } catch (IOException e) {
            throw new ResourcesException("can't export resources " + getName() + " to " + target, e);
        }
        log.info("exported {} keys in {} locales of resources {} to {}",
                table.getRows().size(), table.getLocales().size(), getName(), target);
        return new ExportResult(target, table.getRows().size(), table.getLocales());
    }

    /**
     * Replays the cells of {@code source} as {@code replace} calls on the bundle of each
     * column's locale. Empty cells are skipped, so they never clear an existing value. Bundles
     * are loaded as their locales show up in the header. Nothing is saved; call
     * {@link #save()} to persist.
     */
    public ImportResult importFrom(Path source) {
        ResourceTable table;
        try {
            table = ResourceTableCodec.forPath(source).read(source);
        } catch (IOException e) {
            throw new ResourcesException("can't open " + source + " with resources to import", e);
        }
        List<ResourceBundle> targets = new ArrayList<>(table.getLocales().size());
        for (String token : table.getLocales()) {
            targets.add(getBundle(SystemLocale.parse(token)));
        }
        int cells = 0;
        for (ResourceTable.Row row : table.getRows()) {
            List<String> values = row.getValues();
            for (int i = 0; i < targets.size(); i++) {
                String value = values.get(i);
                if (value == null || value.isEmpty()) {
                    continue;
                }
                targets.get(i).replace(row.getKey(), value);
                cells++;
            }
        }
        log.info("imported {} values for {} keys into resources {} from {}",
                cells, table.getRows().size(), getName(), source);
        return new ImportResult(table.getRows().size(), cells, table.getLocales());
    }
}
