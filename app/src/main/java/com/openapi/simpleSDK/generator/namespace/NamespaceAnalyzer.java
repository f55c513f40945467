package com.openapi.simpleSDK.generator.namespace;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleSDK.generator.endpoint.PathSegments;
import com.openapi.simpleSDK.generator.endpoint.Resource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Detects version and stage namespaces from paths, falling back to the first server URL.
 */
public class NamespaceAnalyzer {

    static final Set<String> STAGE_WORDS = Set.of("beta", "alpha", "canary", "preview");
    static final String DEFAULT_NAMESPACE = "default";

    /**
     * One namespace per distinct token, in order of first appearance. Empty when neither the
     * paths nor the first server URL carry a token.
     */
    public List<Namespace> detectNamespaces(JsonNode spec) {
        Map<String, Namespace> namespaces = new LinkedHashMap<>();
        spec.path("paths").fieldNames().forEachRemaining(path -> {
            String token = extractNamespaceFromPath(path);
            if (token != null && !namespaces.containsKey(token)) {
                namespaces.put(token, new Namespace(token, prefixThrough(path, token), NamespaceSource.PATH, List.of()));
            }
        });

        if (namespaces.isEmpty()) {
            JsonNode servers = spec.path("servers");
            if (servers.isArray() && !servers.isEmpty()) {
                String url = servers.get(0).path("url").asText("");
                String token = extractNamespaceFromUrl(url);
                if (token != null) {
                    namespaces.put(token, new Namespace(token, prefixThrough(urlPath(url), token), NamespaceSource.SERVER, List.of()));
                }
            }
        }

        return new ArrayList<>(namespaces.values());
    }

    /**
     * The first segment that is {@code v<digits>}, a stage word, or a {@code v<digits>}
     * segment right after {@code api}; null when there is none.
     */
    public String extractNamespaceFromPath(String path) {
        List<String> segments = PathSegments.segments(path);
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            if (PathSegments.isVersion(segment) || STAGE_WORDS.contains(segment)) {
                return segment;
            }
            if (segment.equals("api") && i + 1 < segments.size() && PathSegments.isVersion(segments.get(i + 1))) {
                return segments.get(i + 1);
            }
        }
        return null;
    }

    public String extractNamespaceFromUrl(String url) {
        String path = urlPath(url);
        return path.isEmpty() ? null : extractNamespaceFromPath(path);
    }

    /** Paths by namespace token; paths without one go under {@code default}. */
    public Map<String, List<String>> groupPathsByNamespace(Collection<String> paths) {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (String path : paths) {
            String token = extractNamespaceFromPath(path);
            grouped.computeIfAbsent(token != null ? token : DEFAULT_NAMESPACE, key -> new ArrayList<>()).add(path);
        }
        return grouped;
    }

    /**
     * Associates resources to namespaces by path-prefix containment. A resource may belong to
     * several namespaces; a server namespace contains every resource.
     */
    public List<Namespace> attachResources(List<Namespace> namespaces, List<Resource> resources) {
        List<Namespace> attached = new ArrayList<>();
        for (Namespace namespace : namespaces) {
            List<Resource> contained = namespace.source() == NamespaceSource.SERVER
                ? resources
                : resources.stream().filter(resource -> resource.hasPathUnder(namespace.pathPrefix())).toList();
            attached.add(namespace.withResources(contained));
        }
        return attached;
    }

    private static String urlPath(String url) {
        String rest = url;
        int scheme = rest.indexOf("://");
        if (scheme >= 0) {
            rest = rest.substring(scheme + 3);
        }
        int slash = rest.indexOf('/');
        return slash < 0 ? "" : rest.substring(slash);
    }

    private static String prefixThrough(String path, String token) {
        List<String> segments = PathSegments.segments(path);
        int index = segments.indexOf(token);
        return "/" + String.join("/", segments.subList(0, index + 1));
    }
}
