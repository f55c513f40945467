package com.openapi.simpleSDK.generator.namespace;

import com.openapi.simpleSDK.generator.endpoint.Resource;

import java.util.List;

/**
 * A version or release-stage grouping such as {@code v1} or {@code beta}.
 *
 * @param pathPrefix path up to and including the token, e.g. {@code /api/v1}
 */
public record Namespace(String name, String pathPrefix, NamespaceSource source, List<Resource> resources) {

    public Namespace {
        resources = List.copyOf(resources);
    }

    public Namespace withResources(List<Resource> resources) {
        return new Namespace(name, pathPrefix, source, resources);
    }
}
