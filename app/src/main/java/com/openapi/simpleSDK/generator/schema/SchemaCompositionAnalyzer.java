package com.openapi.simpleSDK.generator.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openapi.simpleSDK.generator.resolver.CircularReference;
import com.openapi.simpleSDK.generator.resolver.Reference;
import com.openapi.simpleSDK.generator.resolver.ReferenceResolver;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies allOf/oneOf/anyOf compositions and flattens allOf chains.
 */
public class SchemaCompositionAnalyzer {

    /**
     * The first of allOf, oneOf and anyOf carrying a non-empty list, or null.
     */
    public CompositionKind compositionKind(JsonNode schema) {
        if (schema == null || !schema.isObject()) {
            return null;
        }
        for (CompositionKind kind : CompositionKind.values()) {
            JsonNode members = schema.get(kind.keyword());
            if (members != null && members.isArray() && !members.isEmpty()) {
                return kind;
            }
        }
        return null;
    }

    public boolean isComposition(JsonNode schema) {
        return compositionKind(schema) != null;
    }

    /**
     * Returns the composition of {@code schema}, or null when it has none.
     */
    public Composition analyze(JsonNode schema) {
        CompositionKind kind = compositionKind(schema);
        if (kind == null) {
            return null;
        }

        List<CompositionMember> members = new ArrayList<>();
        for (JsonNode member : schema.get(kind.keyword())) {
            members.add(toMember(member));
        }

        JsonNode discriminator = schema.get("discriminator");
        return new Composition(kind, members,
            discriminator != null && discriminator.isObject() ? extractDiscriminator(discriminator) : null);
    }

    public Discriminator extractDiscriminator(JsonNode discriminator) {
        String propertyName = discriminator.path("propertyName").asText(Discriminator.DEFAULT_PROPERTY_NAME);
        Map<String, String> mapping = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = discriminator.path("mapping").fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            mapping.put(entry.getKey(), schemaNameOf(entry.getValue().asText()));
        }
        return new Discriminator(propertyName, mapping);
    }

    /**
     * Flattens allOf members into one object schema. Properties of later members replace
     * same-named earlier ones, while {@code description} and {@code title} keep the first
     * value seen. The {@code required} lists are concatenated and deduplicated.
     */
    public ObjectNode mergeAllOf(List<JsonNode> members) {
        ObjectNode merged = JsonNodeFactory.instance.objectNode();
        merged.put("type", "object");
        ObjectNode properties = merged.putObject("properties");
        List<String> required = new ArrayList<>();

        for (JsonNode member : members) {
            JsonNode memberProperties = member.get("properties");
            if (memberProperties != null && memberProperties.isObject()) {
                memberProperties.fields().forEachRemaining(field -> properties.set(field.getKey(), field.getValue()));
            }
            JsonNode memberRequired = member.get("required");
            if (memberRequired != null && memberRequired.isArray()) {
                memberRequired.forEach(name -> required.add(name.asText()));
            }
            for (String metadata : List.of("description", "title")) {
                if (!merged.has(metadata) && member.has(metadata)) {
                    merged.set(metadata, member.get(metadata));
                }
            }
        }

        Set<String> unique = new LinkedHashSet<>(required);
        ArrayNode requiredNode = merged.putArray("required");
        unique.forEach(requiredNode::add);
        return merged;
    }

    private CompositionMember toMember(JsonNode member) {
        JsonNode ref = member.get(ReferenceResolver.REF_KEY);
        if (ref != null && ref.isTextual()) {
            return CompositionMember.reference(Reference.parse(ref.asText()).schemaName());
        }
        if (CircularReference.isCircular(member)) {
            return CompositionMember.reference(Reference.parse(CircularReference.referenceOf(member)).schemaName());
        }
        return CompositionMember.inline(member);
    }

    /** Mapping values may be references or bare schema names. */
    private static String schemaNameOf(String reference) {
        return reference.indexOf('/') >= 0 || reference.indexOf('#') >= 0
            ? Reference.parse(reference).schemaName()
            : reference;
    }
}
