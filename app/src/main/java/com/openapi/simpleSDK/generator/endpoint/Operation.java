package com.openapi.simpleSDK.generator.endpoint;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One HTTP operation of the specification. Identity is the pair of path and method; the
 * same operation may be listed under several resources.
 *
 * @param path          path template, e.g. {@code /users/{user_id}}
 * @param httpMethod    upper-case method
 * @param operationId   declared operationId, or null
 * @param tags          declared tags, empty when none
 * @param responses     status code to response object
 * @param operationSpec the resolved operation object
 */
public record Operation(
    String path,
    String httpMethod,
    String operationId,
    List<String> tags,
    Map<String, JsonNode> responses,
    JsonNode operationSpec
) {

    public Operation {
        tags = List.copyOf(tags);
        responses = Collections.unmodifiableMap(new LinkedHashMap<>(responses));
    }

    public String describe() {
        return httpMethod + " " + path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Operation other)) {
            return false;
        }
        return path.equals(other.path) && httpMethod.equals(other.httpMethod);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, httpMethod);
    }
}
