package com.openapi.simpleSDK.generator.exceptions;

import com.openapi.simpleSDK.http.exceptions.SdkGenException;

/**
 * A reference names a key or array index that does not exist in its target document.
 */
public class ReferenceResolutionException extends SdkGenException {
    private final String reference;
    private final String pointer;

    public ReferenceResolutionException(String message, String reference, String pointer) {
        super(message + " (reference '" + reference + "', pointer '" + pointer + "')");
        this.reference = reference;
        this.pointer = pointer;
    }

    public String getReference() {
        return reference;
    }

    public String getPointer() {
        return pointer;
    }
}
