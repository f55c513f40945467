package com.openapi.simpleSDK.http;

import java.util.Locale;

public enum DocumentFormat {
    JSON,
    YAML,
    /** Not known up front: JSON is tried first, YAML second. */
    AUTO;

    public static DocumentFormat fromFileName(String fileName) {
        String lower = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".json")) {
            return JSON;
        }
        if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            return YAML;
        }
        return AUTO;
    }

    /**
     * Format of an HTTP body: the content type decides, then the URL suffix, and JSON otherwise.
     */
    public static DocumentFormat fromContentType(String contentType, String url) {
        String type = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (type.contains("json")) {
            return JSON;
        }
        if (type.contains("yaml") || fromFileName(stripQuery(url)) == YAML) {
            return YAML;
        }
        return JSON;
    }

    private static String stripQuery(String url) {
        if (url == null) {
            return "";
        }
        int cut = url.length();
        int query = url.indexOf('?');
        int fragment = url.indexOf('#');
        if (query >= 0) {
            cut = Math.min(cut, query);
        }
        if (fragment >= 0) {
            cut = Math.min(cut, fragment);
        }
        return url.substring(0, cut);
    }
}
