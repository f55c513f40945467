package com.openapi.simpleSDK.generator.resolver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The node left in place of a reference that points back into its own resolution chain:
 * {@code {"$circular_ref": "<original reference>"}}.
 */
public final class CircularReference {
    public static final String KEY = "$circular_ref";

    private CircularReference() {
    }

    public static ObjectNode marker(String reference) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(KEY, reference);
        return node;
    }

    public static boolean isCircular(JsonNode node) {
        return node != null && node.isObject() && node.path(KEY).isTextual();
    }

    /** The original reference carried by a marker, or null for any other node. */
    public static String referenceOf(JsonNode node) {
        return isCircular(node) ? node.get(KEY).asText() : null;
    }
}
