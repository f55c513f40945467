package com.openapi.simpleSDK.generator.resolver;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleSDK.http.exceptions.SdkGenException;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * State of one top-level resolution: the memo of resolved references, the references on the
 * current resolution chain and the external documents loaded so far. Never shared between
 * two resolutions.
 */
class ResolutionContext {

    @FunctionalInterface
    interface DocumentLoader {
        JsonNode load(String document) throws SdkGenException;
    }

    private final JsonNode root;
    private final Path baseDirectory;
    private final Map<String, JsonNode> resolved = new HashMap<>();
    private final Set<String> inProgress = new LinkedHashSet<>();
    private final ConcurrentHashMap<String, CompletableFuture<JsonNode>> documents = new ConcurrentHashMap<>();

    ResolutionContext(JsonNode root, Path baseDirectory) {
        this.root = root;
        this.baseDirectory = baseDirectory;
    }

    JsonNode root() {
        return root;
    }

    Path baseDirectory() {
        return baseDirectory;
    }

    boolean isInProgress(String reference) {
        return inProgress.contains(reference);
    }

    void enter(String reference) {
        inProgress.add(reference);
    }

    void leave(String reference) {
        inProgress.remove(reference);
    }

    JsonNode memoized(String reference) {
        return resolved.get(reference);
    }

    void memoize(String reference, JsonNode value) {
        resolved.put(reference, value);
    }

    /**
     * Loads an external document at most once. A concurrent caller for the same key waits on
     * the in-flight load; a failed load is forgotten so a later call can try again.
     */
    JsonNode document(String key, DocumentLoader loader) throws SdkGenException {
        CompletableFuture<JsonNode> pending = new CompletableFuture<>();
        CompletableFuture<JsonNode> existing = documents.putIfAbsent(key, pending);
        if (existing != null) {
            return await(existing, key);
        }

        try {
            JsonNode document = loader.load(key);
            pending.complete(document);
            return document;
        } catch (SdkGenException | RuntimeException e) {
            documents.remove(key, pending);
            pending.completeExceptionally(e);
            throw e;
        }
    }

    private static JsonNode await(CompletableFuture<JsonNode> future, String key) throws SdkGenException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SdkGenException("Interrupted while waiting for " + key, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof SdkGenException cause) {
                throw cause;
            }
            throw new SdkGenException("Failed to load " + key, e.getCause());
        }
    }
}
