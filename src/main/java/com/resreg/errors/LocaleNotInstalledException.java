package com.resreg.errors;

public class LocaleNotInstalledException extends ResourcesException {

    public LocaleNotInstalledException(String message) {
        super(message);
    }
}
