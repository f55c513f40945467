package com.openapi.simpleSDK.generator.endpoint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A group of operations sharing a tag, or sharing a leading path segment when untagged.
 *
 * @param nestedGroups sub-resources with at least two operations, by nested name
 */
public record Resource(
    String name,
    String className,
    String pathPrefix,
    boolean requiresId,
    String idParamName,
    List<Operation> operations,
    List<ResourceMethod> methods,
    Map<String, List<Operation>> nestedGroups
) {

    public Resource {
        operations = List.copyOf(operations);
        methods = List.copyOf(methods);
        nestedGroups = Collections.unmodifiableMap(new LinkedHashMap<>(nestedGroups));
    }

    /** True when any operation path lies under {@code prefix} at a segment boundary. */
    public boolean hasPathUnder(String prefix) {
        String normalized = prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
        return operations.stream()
            .map(Operation::path)
            .anyMatch(path -> path.equals(normalized) || path.startsWith(normalized + "/"));
    }
}
