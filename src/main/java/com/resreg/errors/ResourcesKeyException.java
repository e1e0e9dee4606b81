package com.resreg.errors;

/**
 * Raised by a registry when a key resolves to no value and the null-return policy is off.
 */
public class ResourcesKeyException extends ResourcesException {
    private final String key;
    private final String locale;

    public ResourcesKeyException(String key, String locale) {
        super("Found no value for requested resource " + key + " (locale=" + locale + ")");
        this.key = key;
        this.locale = locale;
    }

    public String getKey() {
        return key;
    }

    public String getLocale() {
        return locale;
    }
}
