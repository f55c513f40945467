package com.openapi.simpleSDK.generator.naming;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Detects whether an API names its fields and parameters in snake_case or camelCase.
 * Only the first {@value #SAMPLE_SIZE} names are sampled.
 */
public class NamingConventionAnalyzer {
    static final int SAMPLE_SIZE = 10;

    public NamingConvention detectFieldNaming(JsonNode schema) {
        JsonNode properties = schema == null ? null : schema.get("properties");
        if (properties == null || !properties.isObject() || properties.isEmpty()) {
            return NamingConvention.ORIGINAL;
        }

        int snake = 0;
        int camel = 0;
        Iterator<String> names = properties.fieldNames();
        for (int i = 0; i < SAMPLE_SIZE && names.hasNext(); i++) {
            NamingConvention convention = CaseConverter.detect(names.next());
            if (convention == NamingConvention.SNAKE_CASE) {
                snake++;
            } else if (convention == NamingConvention.CAMEL_CASE) {
                camel++;
            }
        }
        return decide(snake, camel);
    }

    public NamingConvention detectParameterNaming(List<JsonNode> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return NamingConvention.ORIGINAL;
        }

        int snake = 0;
        int camel = 0;
        for (JsonNode parameter : parameters.subList(0, Math.min(SAMPLE_SIZE, parameters.size()))) {
            String name = parameter.path("name").asText("");
            if (name.indexOf('_') >= 0) {
                snake++;
            } else if (name.chars().anyMatch(Character::isUpperCase)) {
                camel++;
            }
        }
        return decide(snake, camel);
    }

    /**
     * Response naming comes from the first schema under {@code components.schemas},
     * parameter naming from the parameters of every operation. Both default to camelCase.
     */
    public NamingProfile analyze(JsonNode spec) {
        NamingConvention responseNaming = NamingProfile.DEFAULT.responseNaming();
        NamingConvention parameterNaming = NamingProfile.DEFAULT.parameterNaming();

        JsonNode schemas = spec.path("components").path("schemas");
        if (schemas.isObject() && !schemas.isEmpty()) {
            responseNaming = detectFieldNaming(schemas.elements().next());
        }

        List<JsonNode> parameters = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> pathItems = spec.path("paths").fields();
        while (pathItems.hasNext()) {
            for (JsonNode operation : pathItems.next().getValue()) {
                JsonNode operationParameters = operation.get("parameters");
                if (operation.isObject() && operationParameters != null && operationParameters.isArray()) {
                    operationParameters.forEach(parameters::add);
                }
            }
        }
        if (!parameters.isEmpty()) {
            parameterNaming = detectParameterNaming(parameters);
        }

        return new NamingProfile(responseNaming, parameterNaming);
    }

    private static NamingConvention decide(int snake, int camel) {
        if (snake > camel) {
            return NamingConvention.SNAKE_CASE;
        }
        if (camel > 0) {
            return NamingConvention.CAMEL_CASE;
        }
        return NamingConvention.ORIGINAL;
    }
}
