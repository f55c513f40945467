package com.openapi.simpleSDK.generator.endpoint;

/**
 * A named method of a resource.
 *
 * @param name       inferred operation name, e.g. {@code list}
 * @param identifier legal, unique Java method identifier for the name
 * @param tier       naming rule that produced the name
 * @param path       path of the operation
 * @param httpMethod method of the operation
 */
public record ResourceMethod(String name, String identifier, NamingTier tier, String path, String httpMethod) {
}
