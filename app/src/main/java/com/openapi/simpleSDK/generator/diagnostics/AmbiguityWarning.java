package com.openapi.simpleSDK.generator.diagnostics;

/**
 * A naming or grouping heuristic fell back to a generic default.
 *
 * @param subject what the warning is about, e.g. {@code GET /}
 * @param message what was chosen and why
 */
public record AmbiguityWarning(String subject, String message) {
}
