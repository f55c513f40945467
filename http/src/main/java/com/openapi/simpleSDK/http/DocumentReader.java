package com.openapi.simpleSDK.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.openapi.simpleSDK.http.exceptions.DocumentFetchException;
import com.openapi.simpleSDK.http.exceptions.DocumentNotFoundException;
import com.openapi.simpleSDK.http.exceptions.SdkGenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decodes JSON and YAML documents into Jackson trees.
 */
public class DocumentReader {
    private static final Logger logger = LoggerFactory.getLogger(DocumentReader.class);

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public DocumentReader() {
        this.jsonMapper = new ObjectMapper();
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    public JsonNode readFile(Path path) throws SdkGenException {
        String locator = path.toString();
        if (!Files.isRegularFile(path)) {
            throw new DocumentNotFoundException("Document not found: " + path, locator);
        }

        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new DocumentFetchException("Failed to read document: " + path, locator, e);
        }

        logger.debug("Read {} characters from {}", content.length(), path);
        return parse(content, DocumentFormat.fromFileName(path.getFileName().toString()), locator);
    }

    public JsonNode parse(String content, DocumentFormat format, String locator) throws SdkGenException {
        if (content == null || content.isBlank()) {
            throw new DocumentFetchException("Document is empty: " + locator, locator);
        }

        JsonNode document = switch (format) {
            case JSON -> decode(jsonMapper, content, locator);
            case YAML -> decode(yamlMapper, content, locator);
            case AUTO -> decodeEither(content, locator);
        };

        if (document == null || document.isMissingNode()) {
            throw new DocumentFetchException("Document has no content: " + locator, locator);
        }
        return document;
    }

    private JsonNode decodeEither(String content, String locator) throws SdkGenException {
        try {
            return jsonMapper.readTree(content);
        } catch (JsonProcessingException e) {
            logger.debug("{} is not JSON, trying YAML", locator);
            return decode(yamlMapper, content, locator);
        }
    }

    private JsonNode decode(ObjectMapper mapper, String content, String locator) throws SdkGenException {
        try {
            return mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new DocumentFetchException("Failed to decode document " + locator + ": " + e.getOriginalMessage(), locator, e);
        }
    }
}
