package com.openapi.simpleSDK.generator.endpoint;

/**
 * Sources of an operation's method name, strongest first.
 */
public enum NamingTier {
    /** A simple verb declared as operationId. */
    DECLARED_ID,
    /** An action word ending the path, e.g. {@code /files/{id}/download}. */
    RPC_ACTION,
    /** HTTP method plus path and response shape. */
    METHOD_SHAPE
}
