package com.openapi.simpleSDK.generator;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleSDK.generator.diagnostics.AmbiguityWarning;
import com.openapi.simpleSDK.generator.endpoint.Resource;
import com.openapi.simpleSDK.generator.namespace.Namespace;
import com.openapi.simpleSDK.generator.naming.NamingProfile;
import com.openapi.simpleSDK.generator.schema.Composition;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable outcome of one analysis run, the input of code generation.
 *
 * Everything in it is resolved and named: generators expand templates over it without any
 * further semantic analysis. A new specification version means a new {@code SpecResult}.
 *
 * @param resolvedSpec  the document with every reference replaced; cycles appear as
 *                      {@code $circular_ref} markers. Every site of the same reference holds
 *                      the same node instance, so callers that edit the tree must
 *                      {@code deepCopy()} it first
 * @param namespaces    detected namespaces with the resources they contain
 * @param resources     every resource, in tag order of first appearance
 * @param compositions  composition of each named component schema that has one
 * @param mergedSchemas flattened form of each named allOf schema
 * @param references    every reference string of the unresolved document
 * @param warnings      fallbacks taken by the naming heuristics
 */
public record SpecResult(
    ApiMetadata metadata,
    JsonNode resolvedSpec,
    List<Namespace> namespaces,
    List<Resource> resources,
    Map<String, Composition> compositions,
    Map<String, JsonNode> mergedSchemas,
    NamingProfile namingProfile,
    Set<String> references,
    List<AmbiguityWarning> warnings
) {
}
