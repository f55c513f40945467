package com.openapi.simpleSDK.generator.resolver;

import com.openapi.simpleSDK.http.DocumentFetcher;

/**
 * A parsed {@code $ref} value: {@code document#pointer}. An empty document part points into
 * the root specification, an empty pointer means the whole document.
 */
public record Reference(String raw, String document, String pointer) {

    public static Reference parse(String raw) {
        int hash = raw.indexOf('#');
        if (hash < 0) {
            return new Reference(raw, raw, "");
        }
        return new Reference(raw, raw.substring(0, hash), raw.substring(hash + 1));
    }

    public boolean isLocal() {
        return document.isEmpty();
    }

    public boolean isUrl() {
        return DocumentFetcher.isRemote(document);
    }

    /**
     * Bare name of the referenced schema: the last pointer segment, or the document's file
     * name without extension when there is no pointer.
     */
    public String schemaName() {
        String trimmed = pointer.endsWith("/") ? pointer.substring(0, pointer.length() - 1) : pointer;
        if (!trimmed.isEmpty()) {
            return unescape(trimmed.substring(trimmed.lastIndexOf('/') + 1));
        }
        String fileName = document.substring(document.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /** RFC 6901 segment unescaping; {@code ~1} is replaced before {@code ~0}. */
    static String unescape(String segment) {
        return segment.replace("~1", "/").replace("~0", "~");
    }
}
