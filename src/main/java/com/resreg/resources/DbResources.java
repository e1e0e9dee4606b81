package com.resreg.resources;

import com.resreg.bundle.DbResourceBundle;
import com.resreg.bundle.ResourceBundle;
import com.resreg.locale.SystemLocale;
import com.resreg.locale.SystemLocales;

/**
 * Resources stored in a database table; {@code config} locates the connection configuration.
 */
public class DbResources extends AbstractResources {
    private final String config;

    public DbResources(String name, String config) {
        this(name, config, SystemLocales.jvm());
    }

    public DbResources(String name, String config, SystemLocales systemLocales) {
        super(name, systemLocales);
        this.config = config;
    }

    public String getConfig() {
        return config;
    }

    @Override
    protected ResourceBundle loadBundle(SystemLocale systemLocale) {
        return DbResourceBundle.getBundle(config, systemLocale);
    }
}
