package com.openapi.simpleSDK.generator;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleSDK.http.DocumentFetcher;
import com.openapi.simpleSDK.http.DocumentReader;
import com.openapi.simpleSDK.http.exceptions.SdkGenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads the top-level OpenAPI document from a file or a URL.
 *
 * URLs go through the remote fetcher, anything else is read as a JSON or YAML file. The base
 * directory for relative references is fixed here, once per load.
 */
public class SpecLoader {
    private static final Logger logger = LoggerFactory.getLogger(SpecLoader.class);

    private final DocumentFetcher remoteFetcher;
    private final DocumentReader reader;

    public SpecLoader(DocumentFetcher remoteFetcher) {
        this(remoteFetcher, new DocumentReader());
    }

    public SpecLoader(DocumentFetcher remoteFetcher, DocumentReader reader) {
        this.remoteFetcher = remoteFetcher;
        this.reader = reader;
    }

    public LoadedSpec load(String source) throws SdkGenException {
        if (DocumentFetcher.isRemote(source)) {
            JsonNode document = remoteFetcher.fetch(source);
            Path workingDirectory = Paths.get("").toAbsolutePath();
            logger.info("Loaded specification from {}", source);
            return new LoadedSpec(source, document, workingDirectory);
        }

        Path file = Paths.get(source).toAbsolutePath().normalize();
        JsonNode document = reader.readFile(file);
        logger.info("Loaded specification from {}", file);
        return new LoadedSpec(source, document, file.getParent());
    }
}
