package com.openapi.simpleSDK.generator.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Either a named schema reference or an anonymous inline schema.
 */
public record CompositionMember(String schemaName, JsonNode inlineSchema) {

    public CompositionMember {
        if ((schemaName == null) == (inlineSchema == null)) {
            throw new IllegalArgumentException("exactly one of schemaName and inlineSchema must be set");
        }
    }

    public static CompositionMember reference(String schemaName) {
        return new CompositionMember(schemaName, null);
    }

    public static CompositionMember inline(JsonNode schema) {
        return new CompositionMember(null, schema);
    }

    public boolean isReference() {
        return schemaName != null;
    }
}
