package com.resreg.resources;

import com.resreg.locale.SystemLocales;

public class DbResourcesFactory extends AbstractResourcesFactory {
    private final SystemLocales systemLocales;

    public DbResourcesFactory() {
        this(SystemLocales.jvm());
    }

    public DbResourcesFactory(SystemLocales systemLocales) {
        this.systemLocales = systemLocales;
    }

    @Override
    protected Resources createResources(String name, String config) {
        return new DbResources(name, config, systemLocales);
    }
}
