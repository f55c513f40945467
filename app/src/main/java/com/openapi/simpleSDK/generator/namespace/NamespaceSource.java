package com.openapi.simpleSDK.generator.namespace;

public enum NamespaceSource {
    /** Found in a path segment. */
    PATH,
    /** Found in the first server URL; covers every path. */
    SERVER
}
