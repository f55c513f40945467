package com.openapi.simpleSDK.generator.cli;

public enum OutputFormat {
    /** Human-readable overview through the log. */
    SUMMARY,
    /** The complete result as JSON. */
    JSON
}
