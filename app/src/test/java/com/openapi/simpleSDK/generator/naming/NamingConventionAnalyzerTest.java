package com.openapi.simpleSDK.generator.naming;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NamingConventionAnalyzerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final NamingConventionAnalyzer analyzer = new NamingConventionAnalyzer();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void snakeCaseMajorityWins() throws Exception {
        JsonNode schema = json("{\"properties\": {\"first_name\": {}, \"last_name\": {}, \"nickName\": {}, \"id\": {}}}");

        assertThat(analyzer.detectFieldNaming(schema)).isEqualTo(NamingConvention.SNAKE_CASE);
    }

    @Test
    void anyCamelCaseWithoutSnakeMajorityIsCamelCase() throws Exception {
        JsonNode schema = json("{\"properties\": {\"first_name\": {}, \"lastName\": {}, \"id\": {}}}");

        assertThat(analyzer.detectFieldNaming(schema)).isEqualTo(NamingConvention.CAMEL_CASE);
    }

    @Test
    void undecidableNamesKeepOriginal() throws Exception {
        assertThat(analyzer.detectFieldNaming(json("{\"properties\": {\"id\": {}, \"name\": {}}}")))
            .isEqualTo(NamingConvention.ORIGINAL);
        assertThat(analyzer.detectFieldNaming(json("{\"type\": \"object\"}"))).isEqualTo(NamingConvention.ORIGINAL);
        assertThat(analyzer.detectFieldNaming(null)).isEqualTo(NamingConvention.ORIGINAL);
    }

    @Test
    void onlyFirstTenFieldsAreSampled() {
        ObjectNode properties = objectMapper.createObjectNode();
        for (char c = 'a'; c < 'a' + 10; c++) {
            properties.putObject(String.valueOf(c));
        }
        properties.putObject("late_one");
        properties.putObject("late_two");
        ObjectNode schema = objectMapper.createObjectNode();
        schema.set("properties", properties);

        assertThat(analyzer.detectFieldNaming(schema)).isEqualTo(NamingConvention.ORIGINAL);
    }

    @Test
    void parameterNaming() throws Exception {
        List<JsonNode> snake = List.of(json("{\"name\": \"page_size\"}"), json("{\"name\": \"pageToken\"}"),
            json("{\"name\": \"sort_by\"}"));
        List<JsonNode> camel = List.of(json("{\"name\": \"pageSize\"}"), json("{\"name\": \"limit\"}"));

        assertThat(analyzer.detectParameterNaming(snake)).isEqualTo(NamingConvention.SNAKE_CASE);
        assertThat(analyzer.detectParameterNaming(camel)).isEqualTo(NamingConvention.CAMEL_CASE);
        assertThat(analyzer.detectParameterNaming(List.of())).isEqualTo(NamingConvention.ORIGINAL);
    }

    @Test
    void analyzeUsesFirstSchemaAndAllOperationParameters() throws Exception {
        JsonNode spec = json("""
            {"components": {"schemas": {
                "User": {"properties": {"user_id": {}, "created_at": {}}},
                "Other": {"properties": {"someField": {}}}}},
             "paths": {"/users": {
                "parameters": [{"name": "ignored_here"}],
                "get": {"parameters": [{"name": "pageSize"}, {"name": "sortOrder"}]},
                "post": {"parameters": [{"name": "dry_run"}]}}}}
            """);

        NamingProfile profile = analyzer.analyze(spec);

        assertThat(profile.responseNaming()).isEqualTo(NamingConvention.SNAKE_CASE);
        assertThat(profile.parameterNaming()).isEqualTo(NamingConvention.CAMEL_CASE);
    }

    @Test
    void analyzeDefaultsToCamelCase() throws Exception {
        assertThat(analyzer.analyze(json("{\"paths\": {}}"))).isEqualTo(NamingProfile.DEFAULT);
    }
}
