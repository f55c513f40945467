package com.openapi.simpleSDK.generator.endpoint;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Infers a method name per operation. The tiers are tried in {@link NamingTier} order and the
 * first one producing a name wins; the method-shape tier always produces one.
 */
public class OperationNamer {

    /** Simple verbs accepted as a declared operationId. */
    static final Set<String> DECLARED_VERBS = Set.of(
        "create", "list", "get", "update", "delete", "download", "upload", "export", "import"
    );

    /** Trailing path words naming an RPC-style action. */
    static final Set<String> ACTION_WORDS = Set.of(
        // file
        "download", "upload", "export", "import",
        // state transitions
        "activate", "deactivate", "enable", "disable", "publish", "unpublish", "archive", "unarchive",
        // workflow
        "approve", "reject", "cancel", "complete", "submit", "confirm", "verify", "validate",
        // execution control
        "execute", "trigger", "run", "start", "stop", "pause", "resume", "retry", "restart",
        // sync
        "refresh", "sync", "clone", "duplicate", "copy", "resend", "reprocess",
        // utility
        "summary", "status", "health", "me", "current"
    );

    private static final Set<String> STRIPPABLE_STAGES = Set.of("v1", "v2", "beta");
    private static final String API_SUFFIX = "_api_";

    public OperationName infer(Operation operation) {
        return infer(operation.httpMethod(), operation.path(), operation.operationId(), operation.responses());
    }

    public OperationName infer(String method, String path, String operationId, Map<String, JsonNode> responses) {
        OperationName name = fromDeclaredId(operationId);
        if (name == null) {
            name = fromRpcAction(path);
        }
        if (name == null) {
            name = fromMethodAndShape(method.toUpperCase(Locale.ROOT), path, responses);
        }
        return name;
    }

    /**
     * Drops a framework-generated {@code _api_...} suffix and a trailing {@code v1}, {@code v2}
     * or {@code beta} token before it: {@code create_user_v1_api_v1_users_post} becomes
     * {@code create_user}.
     */
    public static String cleanOperationId(String operationId) {
        int suffix = operationId.indexOf(API_SUFFIX);
        if (suffix < 0) {
            return operationId;
        }
        String head = operationId.substring(0, suffix);
        int lastUnderscore = head.lastIndexOf('_');
        String lastToken = head.substring(lastUnderscore + 1);
        if (STRIPPABLE_STAGES.contains(lastToken)) {
            return lastUnderscore < 0 ? "" : head.substring(0, lastUnderscore);
        }
        return head;
    }

    /**
     * Whether the {@code 200} response, or else the {@code 201} response, declares a JSON
     * array. Only the first of the two that is present is consulted.
     */
    public static boolean responseIsArray(Map<String, JsonNode> responses) {
        for (String status : List.of("200", "201")) {
            JsonNode response = responses.get(status);
            if (response != null && !response.isNull()) {
                JsonNode type = response.path("content").path("application/json").path("schema").path("type");
                return "array".equals(type.asText(null));
            }
        }
        return false;
    }

    private OperationName fromDeclaredId(String operationId) {
        if (operationId == null || operationId.isEmpty()) {
            return null;
        }
        String cleaned = cleanOperationId(operationId);
        return DECLARED_VERBS.contains(cleaned) ? OperationName.of(cleaned, NamingTier.DECLARED_ID) : null;
    }

    private OperationName fromRpcAction(String path) {
        List<String> segments = PathSegments.staticSegments(path);
        if (segments.size() > 1) {
            String last = segments.get(segments.size() - 1);
            if (ACTION_WORDS.contains(last)) {
                return OperationName.of(last.toLowerCase(Locale.ROOT), NamingTier.RPC_ACTION);
            }
        }
        return null;
    }

    private OperationName fromMethodAndShape(String method, String path, Map<String, JsonNode> responses) {
        return switch (method) {
            case "GET" -> nameGet(path, responses);
            case "POST" -> OperationName.of("create", NamingTier.METHOD_SHAPE);
            case "PUT", "PATCH" -> OperationName.of("update", NamingTier.METHOD_SHAPE);
            case "DELETE" -> OperationName.of("delete", NamingTier.METHOD_SHAPE);
            default -> OperationName.fallback(method.toLowerCase(Locale.ROOT));
        };
    }

    private OperationName nameGet(String path, Map<String, JsonNode> responses) {
        if (PathSegments.hasParameter(path)) {
            return OperationName.of("get", NamingTier.METHOD_SHAPE);
        }
        if (responseIsArray(responses)) {
            return OperationName.of("list", NamingTier.METHOD_SHAPE);
        }
        List<String> segments = PathSegments.staticSegments(path);
        if (segments.isEmpty()) {
            return OperationName.fallback("get");
        }
        return OperationName.of(segments.get(segments.size() - 1).toLowerCase(Locale.ROOT), NamingTier.METHOD_SHAPE);
    }
}
