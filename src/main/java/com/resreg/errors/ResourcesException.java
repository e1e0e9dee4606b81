package com.resreg.errors;

/**
 * Base type of every failure raised by the resource registry.
 * Thrown directly for wrapped I/O and driver errors and for malformed import files.
 */
public class ResourcesException extends RuntimeException {

    public ResourcesException(String message) {
        super(message);
    }

    public ResourcesException(String message, Throwable cause) {
        super(message, cause);
    }
}
