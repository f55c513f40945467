package com.openapi.simpleSDK.http.exceptions;

/**
 * An external document could not be read or transferred. {@link #getStatusCode()} is
 * {@code -1} when the failure did not come from an HTTP response.
 */
public class DocumentFetchException extends SdkGenException {
    private final String locator;
    private final int statusCode;

    public DocumentFetchException(String message, String locator) {
        this(message, locator, -1, null);
    }

    public DocumentFetchException(String message, String locator, Throwable cause) {
        this(message, locator, -1, cause);
    }

    public DocumentFetchException(String message, String locator, int statusCode) {
        this(message, locator, statusCode, null);
    }

    public DocumentFetchException(String message, String locator, int statusCode, Throwable cause) {
        super(message, cause);
        this.locator = locator;
        this.statusCode = statusCode;
    }

    public String getLocator() {
        return locator;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean hasStatusCode() {
        return statusCode >= 0;
    }
}
