package com.openapi.simpleSDK.generator.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.openapi.simpleSDK.generator.SpecResult;
import com.openapi.simpleSDK.generator.diagnostics.AmbiguityWarning;
import com.openapi.simpleSDK.generator.endpoint.Resource;
import com.openapi.simpleSDK.generator.endpoint.ResourceMethod;
import com.openapi.simpleSDK.generator.namespace.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Prints analysis results for the command line. No analysis happens here.
 */
public class SpecResultPrinter {
    private static final Logger logger = LoggerFactory.getLogger(SpecResultPrinter.class);

    private final ObjectMapper objectMapper;

    public SpecResultPrinter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void printSummary(SpecResult result) {
        logger.info("=================================================");
        logger.info("{} {}", result.metadata().title(), result.metadata().version());
        logger.info("=================================================");
        logger.info("OpenAPI: {}", result.metadata().openapiVersion());
        logger.info("Base URL: {}", result.metadata().baseUrl().isEmpty() ? "None" : result.metadata().baseUrl());
        logger.info("Naming: responses {}, parameters {}",
            result.namingProfile().responseNaming(), result.namingProfile().parameterNaming());

        logger.info("-------------------------------------------------");
        logger.info("Namespaces: {}", result.namespaces().isEmpty() ? "None" : "");
        for (Namespace namespace : result.namespaces()) {
            logger.info("  {} ({}, {}): {} resources", namespace.name(), namespace.pathPrefix(),
                namespace.source(), namespace.resources().size());
        }

        logger.info("Resources: {}", result.resources().size());
        for (Resource resource : result.resources()) {
            logger.info("  {} [{}]{}{}", resource.name(), resource.className(),
                resource.pathPrefix() != null ? " prefix " + resource.pathPrefix() : "",
                resource.requiresId() ? " id " + resource.idParamName() : "");
            for (ResourceMethod method : resource.methods()) {
                logger.info("    {}() -> {} {} ({})", method.identifier(), method.httpMethod(), method.path(), method.tier());
            }
            resource.nestedGroups().forEach((name, operations) ->
                logger.info("    nested {}: {} operations", name, operations.size()));
        }

        logger.info("Compositions: {}, flattened allOf schemas: {}",
            result.compositions().size(), result.mergedSchemas().size());
        result.compositions().forEach((name, composition) ->
            logger.info("  {}: {} of {} members{}", name, composition.kind(), composition.members().size(),
                composition.hasDiscriminator() ? ", discriminator " + composition.discriminator().propertyName() : ""));

        if (!result.warnings().isEmpty()) {
            logger.info("-------------------------------------------------");
            logger.info("Warnings: {}", result.warnings().size());
            for (AmbiguityWarning warning : result.warnings()) {
                logger.info("  {}: {}", warning.subject(), warning.message());
            }
        }
        logger.info("=================================================");
    }

    public void printReferences(Set<String> references) {
        logger.info("References: {}", references.size());
        references.forEach(reference -> logger.info("  {}", reference));
    }

    public String toJson(SpecResult result) throws JsonProcessingException {
        return objectMapper.writeValueAsString(result);
    }

    public void writeJson(SpecResult result, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(output.toFile(), result);
        logger.info("Wrote analysis result to {}", output.toAbsolutePath());
    }
}
