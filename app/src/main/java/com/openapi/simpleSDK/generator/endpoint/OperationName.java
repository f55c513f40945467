package com.openapi.simpleSDK.generator.endpoint;

/**
 * @param fallback true when no naming rule matched and a generic name was used
 */
public record OperationName(String name, NamingTier tier, boolean fallback) {

    static OperationName of(String name, NamingTier tier) {
        return new OperationName(name, tier, false);
    }

    static OperationName fallback(String name) {
        return new OperationName(name, NamingTier.METHOD_SHAPE, true);
    }
}
