package com.resreg.resources;

import com.resreg.locale.SystemLocales;

public class PropertyResourcesFactory extends AbstractResourcesFactory {
    private final SystemLocales systemLocales;

    public PropertyResourcesFactory() {
        this(SystemLocales.jvm());
    }

    public PropertyResourcesFactory(SystemLocales systemLocales) {
        this.systemLocales = systemLocales;
    }

    @Override
    protected Resources createResources(String name, String config) {
        return new PropertyResources(name, config, systemLocales);
    }
}
