package com.openapi.simpleSDK.generator.nested;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleSDK.generator.endpoint.Operation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Finds sub-resources inside a resource's operations, either declared through the
 * {@value #EXTENSION} extension or encoded in operationIds such as {@code stages_instruct_create}.
 */
public class NestedResourceDetector {
    public static final String EXTENSION = "x-nested-resource";

    /** Leading operationId words marking a flat operation. */
    static final Set<String> LEADING_VERBS = Set.of(
        "get", "list", "create", "update", "delete", "patch", "post", "put",
        "upload", "download", "fetch", "search", "find"
    );

    private static final int MAX_HAND_WRITTEN_PARTS = 5;

    /**
     * Nested name to operations, in encounter order. The extension always wins over the
     * operationId pattern; operations matching neither stay in the parent.
     */
    public Map<String, List<Operation>> detectNestedResources(List<Operation> operations) {
        Map<String, List<Operation>> nested = new LinkedHashMap<>();
        for (Operation operation : operations) {
            String nestedName = declaredNestedName(operation.operationSpec());
            if (nestedName == null && operation.operationId() != null && !operation.operationId().isEmpty()) {
                nestedName = extractNestedFromOperationId(operation.operationId());
            }
            if (nestedName != null) {
                nested.computeIfAbsent(nestedName, name -> new ArrayList<>()).add(operation);
            }
        }
        return nested;
    }

    /**
     * The second {@code _}-separated part of an operationId with at least three parts, unless
     * the id starts with a verb or looks generated (more than five parts including {@code api}).
     */
    public String extractNestedFromOperationId(String operationId) {
        String[] parts = operationId.split("_", -1);
        if (parts.length > MAX_HAND_WRITTEN_PARTS && List.of(parts).contains("api")) {
            return null;
        }
        if (LEADING_VERBS.contains(parts[0].toLowerCase(Locale.ROOT))) {
            return null;
        }
        return parts.length >= 3 ? parts[1] : null;
    }

    /** Single-operation groups fold back into their parent. */
    public boolean shouldCreateNestedResource(int operationCount) {
        return operationCount >= 2;
    }

    public String nestedPropertyName(String nestedName) {
        return nestedName.toLowerCase(Locale.ROOT);
    }

    private static String declaredNestedName(JsonNode operationSpec) {
        JsonNode extension = operationSpec == null ? null : operationSpec.get(EXTENSION);
        return extension != null && !extension.isNull() ? extension.asText() : null;
    }
}
