package com.openapi.simpleSDK.generator.endpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OperationNamerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final OperationNamer namer = new OperationNamer();

    private static Map<String, JsonNode> jsonResponse(String status, String type) throws Exception {
        return Map.of(status, MAPPER.readTree(
            "{\"content\": {\"application/json\": {\"schema\": {\"type\": \"" + type + "\"}}}}"));
    }

    @Nested
    class TierPrecedence {

        @Test
        @DisplayName("Declared id 'create' wins regardless of response shape")
        void declaredIdWins() throws Exception {
            OperationName name = namer.infer("POST", "/users", "create", jsonResponse("201", "array"));

            assertThat(name.name()).isEqualTo("create");
            assertThat(name.tier()).isEqualTo(NamingTier.DECLARED_ID);
        }

        @Test
        void rpcActionFromLastStaticSegment() {
            OperationName name = namer.infer("GET", "/files/{id}/download", null, Map.of());

            assertThat(name.name()).isEqualTo("download");
            assertThat(name.tier()).isEqualTo(NamingTier.RPC_ACTION);
        }

        @Test
        void arrayResponseNamesList() throws Exception {
            OperationName name = namer.infer("GET", "/users", null, jsonResponse("200", "array"));

            assertThat(name.name()).isEqualTo("list");
            assertThat(name.tier()).isEqualTo(NamingTier.METHOD_SHAPE);
        }

        @Test
        void declaredIdOutsideVocabularyFallsThrough() {
            OperationName name = namer.infer("POST", "/jobs/{id}/cancel", "cancelJob", Map.of());

            assertThat(name.name()).isEqualTo("cancel");
            assertThat(name.tier()).isEqualTo(NamingTier.RPC_ACTION);
        }

        @Test
        void declaredIdWinsOverRpcAction() {
            assertThat(namer.infer("GET", "/files/{id}/download", "export", Map.of()).name()).isEqualTo("export");
        }
    }

    @Test
    void singleSegmentActionWordIsNotAnRpcAction() {
        OperationName name = namer.infer("GET", "/health", null, Map.of());

        assertThat(name.tier()).isEqualTo(NamingTier.METHOD_SHAPE);
        assertThat(name.name()).isEqualTo("health");
    }

    @Test
    void actionMatchIsCaseSensitive() {
        assertThat(namer.infer("POST", "/jobs/{id}/Cancel", null, Map.of()).name()).isEqualTo("create");
    }

    @ParameterizedTest
    @CsvSource({
        "GET, /users/{id}, get",
        "POST, /users, create",
        "PUT, /users/{id}, update",
        "PATCH, /users/{id}, update",
        "DELETE, /users/{id}, delete",
        "GET, /status/current/Info, info"
    })
    void methodAndShapeNames(String method, String path, String expected) {
        OperationName name = namer.infer(method, path, null, Map.of());

        assertThat(name.name()).isEqualTo(expected);
        assertThat(name.fallback()).isFalse();
    }

    @Test
    void unknownMethodFallsBackToLowerCasedMethod() {
        OperationName name = namer.infer("OPTIONS", "/users", null, Map.of());

        assertThat(name.name()).isEqualTo("options");
        assertThat(name.fallback()).isTrue();
    }

    @Test
    void rootGetFallsBackToGet() {
        OperationName name = namer.infer("GET", "/", null, Map.of());

        assertThat(name.name()).isEqualTo("get");
        assertThat(name.fallback()).isTrue();
    }

    @ParameterizedTest
    @CsvSource({
        "create_user_api_v1_users_post, create_user",
        "list_api_v1_items_get, list",
        "create_v1_api_v1_users_post, create",
        "get_beta_api_beta_things_get, get",
        "export_v3_api_v3_export_get, export_v3",
        "plain_operation, plain_operation"
    })
    void cleanOperationIdStripsFrameworkSuffix(String operationId, String expected) {
        assertThat(OperationNamer.cleanOperationId(operationId)).isEqualTo(expected);
    }

    @Test
    void cleanedIdFeedsDeclaredTier() {
        OperationName name = namer.infer("GET", "/api/v1/items", "list_api_v1_items_get", Map.of());

        assertThat(name.name()).isEqualTo("list");
        assertThat(name.tier()).isEqualTo(NamingTier.DECLARED_ID);
    }

    @Test
    void firstPresentStatusDecidesArrayShape() throws Exception {
        Map<String, JsonNode> responses = Map.of(
            "200", MAPPER.readTree("{\"description\": \"no body\"}"),
            "201", jsonResponse("201", "array").get("201"));

        assertThat(OperationNamer.responseIsArray(responses)).isFalse();
        assertThat(OperationNamer.responseIsArray(jsonResponse("201", "array"))).isTrue();
        assertThat(OperationNamer.responseIsArray(jsonResponse("200", "object"))).isFalse();
        assertThat(OperationNamer.responseIsArray(Map.of())).isFalse();
    }
}
