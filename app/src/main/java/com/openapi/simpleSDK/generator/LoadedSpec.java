package com.openapi.simpleSDK.generator;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;

/**
 * A decoded specification and the directory its relative file references resolve against.
 *
 * @param source        the path or URL it was loaded from
 * @param baseDirectory parent directory of a file source, working directory for a URL source
 */
public record LoadedSpec(String source, JsonNode document, Path baseDirectory) {
}
