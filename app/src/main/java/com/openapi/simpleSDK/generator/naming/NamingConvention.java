package com.openapi.simpleSDK.generator.naming;

public enum NamingConvention {
    SNAKE_CASE,
    CAMEL_CASE,
    PASCAL_CASE,
    SCREAMING_SNAKE_CASE,
    /** No recognizable pattern in a single name. */
    UNKNOWN,
    /** Keep names exactly as the API declares them. */
    ORIGINAL
}
