package com.openapi.simpleSDK.generator.exceptions;

import com.openapi.simpleSDK.http.exceptions.SdkGenException;

/**
 * The document is not a usable OpenAPI 3.x specification. Aborts the whole analysis.
 */
public class StructuralException extends SdkGenException {

    public StructuralException(String message) {
        super(message);
    }
}
