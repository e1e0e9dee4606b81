package com.resreg.errors;

public class NoSystemLocaleException extends ResourcesException {

    public NoSystemLocaleException(String message) {
        super(message);
    }
}
