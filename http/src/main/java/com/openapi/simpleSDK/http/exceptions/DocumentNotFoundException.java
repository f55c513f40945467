package com.openapi.simpleSDK.http.exceptions;

public class DocumentNotFoundException extends SdkGenException {
    private final String locator;

    public DocumentNotFoundException(String message, String locator) {
        super(message);
        this.locator = locator;
    }

    public DocumentNotFoundException(String message, String locator, Throwable cause) {
        super(message, cause);
        this.locator = locator;
    }

    public String getLocator() {
        return locator;
    }
}
