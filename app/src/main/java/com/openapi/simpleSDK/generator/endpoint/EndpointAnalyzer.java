package com.openapi.simpleSDK.generator.endpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleSDK.generator.diagnostics.Diagnostics;
import com.openapi.simpleSDK.generator.naming.NameSanitizer;
import com.openapi.simpleSDK.generator.nested.NestedResourceDetector;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Groups the operations of a resolved specification into resources and names their methods.
 */
public class EndpointAnalyzer {

    public static final List<String> HTTP_METHODS = List.of("get", "post", "put", "patch", "delete", "head", "options");

    static final Set<String> STAGE_KEYWORDS = Set.of("api", "beta", "alpha");
    static final String DEFAULT_RESOURCE = "default";

    private final OperationNamer namer;
    private final NestedResourceDetector nestedDetector;

    public EndpointAnalyzer() {
        this(new OperationNamer(), new NestedResourceDetector());
    }

    public EndpointAnalyzer(OperationNamer namer, NestedResourceDetector nestedDetector) {
        this.namer = namer;
        this.nestedDetector = nestedDetector;
    }

    /**
     * Every operation of the specification, in path order and then {@link #HTTP_METHODS} order.
     */
    public List<Operation> extractOperations(JsonNode spec) {
        List<Operation> operations = new ArrayList<>();
        JsonNode paths = spec.path("paths");
        paths.fieldNames().forEachRemaining(path -> {
            JsonNode pathItem = paths.get(path);
            for (String method : HTTP_METHODS) {
                JsonNode operationNode = pathItem.get(method);
                if (operationNode != null && operationNode.isObject()) {
                    operations.add(toOperation(path, method, operationNode));
                }
            }
        });
        return operations;
    }

    /**
     * Operations by tag. An operation is listed under each of its tags; an untagged one under
     * the resource name derived from its path.
     */
    public Map<String, List<Operation>> groupByTags(JsonNode spec) {
        Map<String, List<Operation>> grouped = new LinkedHashMap<>();
        for (Operation operation : extractOperations(spec)) {
            List<String> tags = operation.tags().isEmpty()
                ? List.of(extractResourceFromPath(operation.path()))
                : operation.tags();
            for (String tag : tags) {
                grouped.computeIfAbsent(tag, key -> new ArrayList<>()).add(operation);
            }
        }
        return grouped;
    }

    /**
     * First path segment that is not a parameter, a version such as {@code v2}, or one of
     * {@code api}, {@code beta}, {@code alpha}; {@code default} when none is left.
     */
    public String extractResourceFromPath(String path) {
        for (String segment : PathSegments.segments(path)) {
            if (PathSegments.isParameter(segment) || PathSegments.isVersion(segment) || STAGE_KEYWORDS.contains(segment)) {
                continue;
            }
            return segment;
        }
        return DEFAULT_RESOURCE;
    }

    /**
     * For one path, {@code /} plus its first two static segments. For several, the first static
     * segment when every path agrees on it, otherwise null.
     */
    public String detectPathPrefix(List<String> paths) {
        if (paths.isEmpty()) {
            return null;
        }

        if (paths.size() == 1) {
            List<String> segments = PathSegments.staticSegments(paths.get(0));
            if (segments.isEmpty()) {
                return null;
            }
            return "/" + String.join("/", segments.subList(0, Math.min(2, segments.size())));
        }

        String common = null;
        for (String path : paths) {
            List<String> segments = PathSegments.staticSegments(path);
            if (segments.isEmpty()) {
                continue;
            }
            String prefix = "/" + segments.get(0);
            if (common == null) {
                common = prefix;
            } else if (!common.startsWith(prefix) && !prefix.startsWith(common)) {
                return null;
            }
        }
        return common;
    }

    /**
     * Whether exactly one distinct path parameter containing {@code id} (ignoring case) occurs
     * across {@code paths}.
     */
    public ResourceId requiresResourceId(Collection<String> paths) {
        Set<String> idParams = new LinkedHashSet<>();
        for (String path : paths) {
            for (String segment : PathSegments.segments(path)) {
                if (segment.startsWith("{") && segment.endsWith("}")) {
                    String param = segment.substring(1, segment.length() - 1);
                    if (param.toLowerCase(Locale.ROOT).contains("id")) {
                        idParams.add(param);
                    }
                }
            }
        }
        return idParams.size() == 1 ? new ResourceId(true, idParams.iterator().next()) : ResourceId.NONE;
    }

    public boolean responseIsArray(Map<String, JsonNode> responses) {
        return OperationNamer.responseIsArray(responses);
    }

    public String cleanOperationId(String operationId) {
        return OperationNamer.cleanOperationId(operationId);
    }

    public OperationName inferOperationName(String method, String path, String operationId, Map<String, JsonNode> responses) {
        return namer.infer(method, path, operationId, responses);
    }

    /**
     * One resource per tag group, with named methods and the nested groups large enough to
     * become sub-resources. Fallback names and renamed duplicates are reported to
     * {@code diagnostics}.
     */
    public List<Resource> buildResources(JsonNode spec, Diagnostics diagnostics) {
        List<Resource> resources = new ArrayList<>();
        groupByTags(spec).forEach((tag, operations) -> {
            List<String> paths = operations.stream().map(Operation::path).distinct().toList();
            ResourceId resourceId = requiresResourceId(paths);

            List<ResourceMethod> methods = new ArrayList<>();
            Set<String> usedIdentifiers = new HashSet<>();
            for (Operation operation : operations) {
                OperationName name = namer.infer(operation);
                if (name.fallback()) {
                    diagnostics.warn(operation.describe(), "no naming rule matched, using '" + name.name() + "'");
                }
                String identifier = uniqueIdentifier(NameSanitizer.sanitizeMethodName(name.name()), usedIdentifiers);
                if (!identifier.equals(NameSanitizer.sanitizeMethodName(name.name()))) {
                    diagnostics.warn(operation.describe(), "method name '" + name.name() + "' already used in resource '"
                        + tag + "', using '" + identifier + "'");
                }
                methods.add(new ResourceMethod(name.name(), identifier, name.tier(), operation.path(), operation.httpMethod()));
            }

            Map<String, List<Operation>> nestedGroups = new LinkedHashMap<>();
            nestedDetector.detectNestedResources(operations).forEach((nestedName, nestedOperations) -> {
                if (nestedDetector.shouldCreateNestedResource(nestedOperations.size())) {
                    nestedGroups.put(nestedName, nestedOperations);
                }
            });

            resources.add(new Resource(
                tag,
                NameSanitizer.sanitizeClassName(tag),
                detectPathPrefix(paths),
                resourceId.required(),
                resourceId.paramName(),
                operations,
                methods,
                nestedGroups
            ));
        });
        return resources;
    }

    private Operation toOperation(String path, String method, JsonNode operationNode) {
        JsonNode operationIdNode = operationNode.get("operationId");
        String operationId = operationIdNode != null && operationIdNode.isTextual() ? operationIdNode.asText() : null;

        List<String> tags = new ArrayList<>();
        JsonNode tagsNode = operationNode.get("tags");
        if (tagsNode != null && tagsNode.isArray()) {
            tagsNode.forEach(tag -> {
                if (!tags.contains(tag.asText())) {
                    tags.add(tag.asText());
                }
            });
        }

        Map<String, JsonNode> responses = new LinkedHashMap<>();
        JsonNode responsesNode = operationNode.get("responses");
        if (responsesNode != null && responsesNode.isObject()) {
            responsesNode.fields().forEachRemaining(entry -> responses.put(entry.getKey(), entry.getValue()));
        }

        return new Operation(path, method.toUpperCase(Locale.ROOT), operationId, tags, responses, operationNode);
    }

    private static String uniqueIdentifier(String desired, Set<String> used) {
        String candidate = desired;
        int counter = 2;
        while (used.contains(candidate)) {
            candidate = desired + counter;
            counter++;
        }
        used.add(candidate);
        return candidate;
    }
}
