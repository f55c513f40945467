package com.openapi.simpleSDK.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleSDK.http.exceptions.SdkGenException;

import java.net.URI;
import java.util.Locale;

/**
 * Turns a locator of an external document into its decoded tree. Implementations must be
 * idempotent so callers are free to cache what they return.
 */
@FunctionalInterface
public interface DocumentFetcher {

    JsonNode fetch(String locator) throws SdkGenException;

    /**
     * True for {@code http} and {@code https} locators; anything else is treated as a file path.
     */
    static boolean isRemote(String locator) {
        if (locator == null) {
            return false;
        }
        try {
            String scheme = URI.create(locator.trim()).getScheme();
            if (scheme == null) {
                return false;
            }
            String normalized = scheme.toLowerCase(Locale.ROOT);
            return normalized.equals("http") || normalized.equals("https");
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
