package com.openapi.simpleSDK.generator;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleSDK.generator.diagnostics.Diagnostics;
import com.openapi.simpleSDK.generator.endpoint.EndpointAnalyzer;
import com.openapi.simpleSDK.generator.endpoint.Resource;
import com.openapi.simpleSDK.generator.namespace.Namespace;
import com.openapi.simpleSDK.generator.namespace.NamespaceAnalyzer;
import com.openapi.simpleSDK.generator.naming.NamingConventionAnalyzer;
import com.openapi.simpleSDK.generator.naming.NamingProfile;
import com.openapi.simpleSDK.generator.resolver.ReferenceResolver;
import com.openapi.simpleSDK.generator.schema.Composition;
import com.openapi.simpleSDK.generator.schema.CompositionKind;
import com.openapi.simpleSDK.generator.schema.SchemaCompositionAnalyzer;
import com.openapi.simpleSDK.http.exceptions.SdkGenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the whole analysis over one loaded specification.
 *
 * Order: structural validation, reference collection, resolution, then the independent
 * analyzers over the resolved document. Compositions are read from the unresolved
 * {@code components.schemas}, where member references still carry their schema names.
 * Any {@link SdkGenException} aborts the run; naming heuristics only add warnings.
 */
public class ApiAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(ApiAnalyzer.class);

    private final ReferenceResolver resolver;
    private final SpecValidator validator;
    private final SchemaCompositionAnalyzer compositionAnalyzer;
    private final EndpointAnalyzer endpointAnalyzer;
    private final NamespaceAnalyzer namespaceAnalyzer;
    private final NamingConventionAnalyzer namingAnalyzer;

    public ApiAnalyzer(ReferenceResolver resolver) {
        this(resolver, new SpecValidator(), new SchemaCompositionAnalyzer(), new EndpointAnalyzer(),
            new NamespaceAnalyzer(), new NamingConventionAnalyzer());
    }

    public ApiAnalyzer(ReferenceResolver resolver, SpecValidator validator,
                       SchemaCompositionAnalyzer compositionAnalyzer, EndpointAnalyzer endpointAnalyzer,
                       NamespaceAnalyzer namespaceAnalyzer, NamingConventionAnalyzer namingAnalyzer) {
        this.resolver = resolver;
        this.validator = validator;
        this.compositionAnalyzer = compositionAnalyzer;
        this.endpointAnalyzer = endpointAnalyzer;
        this.namespaceAnalyzer = namespaceAnalyzer;
        this.namingAnalyzer = namingAnalyzer;
    }

    public SpecResult analyze(LoadedSpec spec) throws SdkGenException {
        JsonNode document = spec.document();
        validator.validate(document);
        ApiMetadata metadata = ApiMetadata.from(document);
        logger.info("Analyzing {} {} (OpenAPI {})", metadata.title(), metadata.version(), metadata.openapiVersion());

        Set<String> references = ReferenceResolver.extractAllReferences(document);
        JsonNode resolved = resolver.resolve(document, spec.baseDirectory());
        logger.info("Resolved {} distinct references", references.size());

        Map<String, Composition> compositions = analyzeCompositions(document);
        Map<String, JsonNode> mergedSchemas = mergeAllOfSchemas(resolved, compositions);

        Diagnostics diagnostics = new Diagnostics();
        List<Resource> resources = endpointAnalyzer.buildResources(resolved, diagnostics);
        List<Namespace> namespaces = namespaceAnalyzer.attachResources(namespaceAnalyzer.detectNamespaces(resolved), resources);
        NamingProfile namingProfile = namingAnalyzer.analyze(resolved);

        logger.info("Built {} resources in {} namespaces, {} compositions, {} warnings",
            resources.size(), namespaces.size(), compositions.size(), diagnostics.getWarnings().size());

        return new SpecResult(
            metadata,
            resolved,
            namespaces,
            resources,
            Collections.unmodifiableMap(compositions),
            Collections.unmodifiableMap(mergedSchemas),
            namingProfile,
            Collections.unmodifiableSet(references),
            diagnostics.getWarnings()
        );
    }

    private Map<String, Composition> analyzeCompositions(JsonNode document) {
        Map<String, Composition> compositions = new LinkedHashMap<>();
        JsonNode schemas = document.path("components").path("schemas");
        schemas.fieldNames().forEachRemaining(name -> {
            Composition composition = compositionAnalyzer.analyze(schemas.get(name));
            if (composition != null) {
                compositions.put(name, composition);
            }
        });
        return compositions;
    }

    private Map<String, JsonNode> mergeAllOfSchemas(JsonNode resolved, Map<String, Composition> compositions) {
        Map<String, JsonNode> merged = new LinkedHashMap<>();
        JsonNode schemas = resolved.path("components").path("schemas");
        compositions.forEach((name, composition) -> {
            if (composition.kind() != CompositionKind.ALL_OF) {
                return;
            }
            JsonNode members = schemas.path(name).path(CompositionKind.ALL_OF.keyword());
            if (members.isArray()) {
                List<JsonNode> memberList = new ArrayList<>();
                members.forEach(memberList::add);
                merged.put(name, compositionAnalyzer.mergeAllOf(memberList));
            }
        });
        return merged;
    }
}
