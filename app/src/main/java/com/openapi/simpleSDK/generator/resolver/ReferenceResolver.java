package com.openapi.simpleSDK.generator.resolver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openapi.simpleSDK.generator.exceptions.ReferenceResolutionException;
import com.openapi.simpleSDK.http.DocumentFetcher;
import com.openapi.simpleSDK.http.DocumentReader;
import com.openapi.simpleSDK.http.exceptions.DocumentNotFoundException;
import com.openapi.simpleSDK.http.exceptions.SdkGenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Replaces every {@code $ref} in a specification with the content it points to.
 *
 * <p>References into the same document, into files (relative to the base directory of the
 * top-level source) and into URLs (through the remote {@link DocumentFetcher}) are followed
 * recursively. A reference met again while it is still being resolved becomes a
 * {@link CircularReference} marker. Local references inside an external document point
 * into the root specification.</p>
 *
 * <p>The resolver keeps no state between calls; every {@link #resolve} starts from an empty
 * cache, so one instance can serve independent specifications concurrently.</p>
 */
public class ReferenceResolver {
    private static final Logger logger = LoggerFactory.getLogger(ReferenceResolver.class);

    public static final String REF_KEY = "$ref";

    private final DocumentFetcher remoteFetcher;
    private final DocumentReader reader;

    public ReferenceResolver(DocumentFetcher remoteFetcher) {
        this(remoteFetcher, new DocumentReader());
    }

    public ReferenceResolver(DocumentFetcher remoteFetcher, DocumentReader reader) {
        this.remoteFetcher = Objects.requireNonNull(remoteFetcher, "remoteFetcher");
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    public JsonNode resolve(JsonNode spec) throws SdkGenException {
        return resolve(spec, Paths.get("").toAbsolutePath());
    }

    public JsonNode resolve(JsonNode spec, Path baseDirectory) throws SdkGenException {
        ResolutionContext context = new ResolutionContext(spec, baseDirectory);
        return resolveNode(spec, context);
    }

    /**
     * Every textual {@code $ref} value found anywhere in {@code spec}, in encounter order.
     */
    public static Set<String> extractAllReferences(JsonNode spec) {
        Set<String> references = new LinkedHashSet<>();
        collectReferences(spec, references);
        return references;
    }

    private static void collectReferences(JsonNode node, Set<String> references) {
        if (node == null) {
            return;
        }
        if (node.isObject()) {
            JsonNode ref = node.get(REF_KEY);
            if (ref != null && ref.isTextual()) {
                references.add(ref.asText());
            }
            node.elements().forEachRemaining(child -> collectReferences(child, references));
        } else if (node.isArray()) {
            node.forEach(child -> collectReferences(child, references));
        }
    }

    private JsonNode resolveNode(JsonNode node, ResolutionContext context) throws SdkGenException {
        if (node.isObject()) {
            JsonNode ref = node.get(REF_KEY);
            if (ref != null && ref.isTextual()) {
                return resolveReference(ref.asText(), context);
            }

            ObjectNode copy = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), resolveNode(field.getValue(), context));
            }
            return copy;
        }

        if (node.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode(node.size());
            for (JsonNode element : node) {
                copy.add(resolveNode(element, context));
            }
            return copy;
        }

        return node;
    }

    private JsonNode resolveReference(String raw, ResolutionContext context) throws SdkGenException {
        if (context.isInProgress(raw)) {
            logger.debug("Circular reference {}", raw);
            return CircularReference.marker(raw);
        }

        JsonNode memoized = context.memoized(raw);
        if (memoized != null) {
            return memoized;
        }

        context.enter(raw);
        try {
            Reference reference = Reference.parse(raw);
            JsonNode document = reference.isLocal() ? context.root() : loadReferencedDocument(reference, context);
            JsonNode target = navigate(document, reference);
            JsonNode resolved = resolveNode(target, context);
            context.memoize(raw, resolved);
            return resolved;
        } finally {
            context.leave(raw);
        }
    }

    /** A missing document is reported with the reference that named it. */
    private JsonNode loadReferencedDocument(Reference reference, ResolutionContext context) throws SdkGenException {
        try {
            return loadDocument(reference, context);
        } catch (DocumentNotFoundException e) {
            throw new DocumentNotFoundException("Document not found for reference '" + reference.raw() + "': "
                + e.getLocator(), reference.raw(), e);
        }
    }

    private JsonNode loadDocument(Reference reference, ResolutionContext context) throws SdkGenException {
        if (reference.isUrl()) {
            return context.document(reference.document(), url -> {
                logger.debug("Fetching external document {}", url);
                return remoteFetcher.fetch(url);
            });
        }

        Path file = context.baseDirectory().resolve(reference.document()).normalize();
        return context.document(file.toString(), location -> {
            logger.debug("Reading external document {}", location);
            return reader.readFile(file);
        });
    }

    static JsonNode navigate(JsonNode document, Reference reference) throws ReferenceResolutionException {
        String pointer = reference.pointer();
        if (pointer.isEmpty() || pointer.equals("/")) {
            return document;
        }

        String path = pointer.startsWith("/") ? pointer.substring(1) : pointer;
        JsonNode current = document;
        for (String rawSegment : path.split("/", -1)) {
            String segment = Reference.unescape(rawSegment);
            if (current.isObject()) {
                JsonNode child = current.get(segment);
                if (child == null) {
                    throw new ReferenceResolutionException("Key '" + segment + "' not found", reference.raw(), pointer);
                }
                current = child;
            } else if (current.isArray()) {
                current = current.get(parseIndex(segment, current.size(), reference));
            } else {
                throw new ReferenceResolutionException("Cannot descend into a scalar at '" + segment + "'", reference.raw(), pointer);
            }
        }
        return current;
    }

    private static int parseIndex(String segment, int size, Reference reference) throws ReferenceResolutionException {
        int index;
        try {
            index = Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            throw new ReferenceResolutionException("Array index '" + segment + "' is not a number", reference.raw(), reference.pointer());
        }
        if (index < 0 || index >= size) {
            throw new ReferenceResolutionException("Array index " + index + " out of bounds (size " + size + ")",
                reference.raw(), reference.pointer());
        }
        return index;
    }
}
