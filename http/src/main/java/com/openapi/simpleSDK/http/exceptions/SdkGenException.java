package com.openapi.simpleSDK.http.exceptions;

/**
 * Root of every failure that aborts an analysis run: unreadable documents,
 * unreachable remote documents, malformed specifications and unresolvable references.
 */
public class SdkGenException extends Exception {
    public SdkGenException(String message) {
        super(message);
    }

    public SdkGenException(String message, Throwable cause) {
        super(message, cause);
    }

    public SdkGenException(Throwable cause) {
        super(cause);
    }
}
