package com.resreg.errors;

public class LocaleParseException extends ResourcesException {

    public LocaleParseException(String message) {
        super(message);
    }
}
