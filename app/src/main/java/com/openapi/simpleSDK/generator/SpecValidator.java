package com.openapi.simpleSDK.generator;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleSDK.generator.exceptions.StructuralException;

/**
 * Structural checks run before any analysis: an object root, an {@code openapi} field with
 * major version 3, and an {@code info} object with {@code title} and {@code version}.
 */
public class SpecValidator {

    public void validate(JsonNode document) throws StructuralException {
        if (document == null || !document.isObject()) {
            throw new StructuralException("Specification root must be an object");
        }

        JsonNode openapi = document.get("openapi");
        if (openapi == null || !openapi.isValueNode() || openapi.asText().isBlank()) {
            if (document.has("swagger")) {
                throw new StructuralException("Swagger 2.0 documents are not supported, convert to OpenAPI 3.x first");
            }
            throw new StructuralException("Missing required field 'openapi'");
        }
        String version = openapi.asText().trim();
        if (!version.equals("3") && !version.startsWith("3.")) {
            throw new StructuralException("Unsupported OpenAPI version " + version + ", expected 3.x");
        }

        JsonNode info = document.get("info");
        if (info == null || !info.isObject()) {
            throw new StructuralException("Missing required object 'info'");
        }
        requireText(info, "title");
        requireText(info, "version");
    }

    private static void requireText(JsonNode info, String field) throws StructuralException {
        JsonNode value = info.get(field);
        if (value == null || !value.isValueNode() || value.asText().isBlank()) {
            throw new StructuralException("Missing required field 'info." + field + "'");
        }
    }
}
