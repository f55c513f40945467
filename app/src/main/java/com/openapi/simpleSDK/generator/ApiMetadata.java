package com.openapi.simpleSDK.generator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * @param baseUrl first server URL, empty when no server is declared
 */
public record ApiMetadata(
    String title,
    String version,
    String openapiVersion,
    String description,
    String license,
    List<String> servers,
    String baseUrl
) {

    public ApiMetadata {
        servers = List.copyOf(servers);
    }

    public static ApiMetadata from(JsonNode spec) {
        JsonNode info = spec.path("info");

        List<String> servers = new ArrayList<>();
        spec.path("servers").forEach(server -> {
            String url = server.path("url").asText("");
            if (!url.isEmpty()) {
                servers.add(url);
            }
        });

        return new ApiMetadata(
            info.path("title").asText(""),
            info.path("version").asText(""),
            spec.path("openapi").asText(""),
            info.path("description").asText(null),
            info.path("license").path("name").asText(null),
            servers,
            servers.isEmpty() ? "" : servers.get(0)
        );
    }
}
