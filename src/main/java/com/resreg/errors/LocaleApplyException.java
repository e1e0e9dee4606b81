package com.resreg.errors;

public class LocaleApplyException extends ResourcesException {

    public LocaleApplyException(String message, Throwable cause) {
        super(message, cause);
    }
}
