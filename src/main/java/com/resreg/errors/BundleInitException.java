package com.resreg.errors;

/**
 * A bundle backend could not be loaded: property file missing, configuration incomplete,
 * database unreachable.
 */
public class BundleInitException extends ResourcesException {

    public BundleInitException(String message) {
        super(message);
    }

    public BundleInitException(String message, Throwable cause) {
        super(message, cause);
    }
}
