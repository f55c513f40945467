package com.openapi.simpleSDK.generator.endpoint;

/**
 * Whether a resource is constructed around a single id path parameter.
 */
public record ResourceId(boolean required, String paramName) {
    public static final ResourceId NONE = new ResourceId(false, null);
}
