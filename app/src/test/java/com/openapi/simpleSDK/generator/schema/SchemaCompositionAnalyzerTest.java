package com.openapi.simpleSDK.generator.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openapi.simpleSDK.generator.resolver.CircularReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class SchemaCompositionAnalyzerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SchemaCompositionAnalyzer analyzer = new SchemaCompositionAnalyzer();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    private List<JsonNode> members(String array) throws Exception {
        List<JsonNode> members = new ArrayList<>();
        json(array).forEach(members::add);
        return members;
    }

    @Test
    void plainSchemaHasNoComposition() throws Exception {
        JsonNode schema = json("{\"type\": \"object\", \"properties\": {}}");

        assertThat(analyzer.analyze(schema)).isNull();
        assertThat(analyzer.isComposition(schema)).isFalse();
        assertThat(analyzer.compositionKind(schema)).isNull();
    }

    @Test
    void referenceMembersKeepBareSchemaNames() throws Exception {
        Composition composition = analyzer.analyze(json("""
            {"oneOf": [
                {"$ref": "#/components/schemas/Cat"},
                {"$ref": "./animals.yaml#/Dog"},
                {"type": "object", "properties": {"wings": {"type": "integer"}}}
            ]}
            """));

        assertThat(composition.kind()).isEqualTo(CompositionKind.ONE_OF);
        assertThat(composition.members()).hasSize(3);
        assertThat(composition.members().get(0)).isEqualTo(CompositionMember.reference("Cat"));
        assertThat(composition.members().get(1).schemaName()).isEqualTo("Dog");
        assertThat(composition.members().get(2).isReference()).isFalse();
        assertThat(composition.members().get(2).inlineSchema().at("/properties/wings/type").asText()).isEqualTo("integer");
        assertThat(composition.hasDiscriminator()).isFalse();
    }

    @Test
    void circularMarkerMemberIsTreatedAsReference() throws Exception {
        ObjectNode schema = objectMapper.createObjectNode();
        schema.putArray("anyOf").add(CircularReference.marker("#/components/schemas/Node"));

        Composition composition = analyzer.analyze(schema);

        assertThat(composition.kind()).isEqualTo(CompositionKind.ANY_OF);
        assertThat(composition.members()).containsExactly(CompositionMember.reference("Node"));
    }

    @Test
    @DisplayName("allOf wins over oneOf and anyOf on the same schema")
    void kindsAreCheckedInPriorityOrder() throws Exception {
        JsonNode schema = json("""
            {"anyOf": [{"type": "string"}], "oneOf": [{"type": "integer"}], "allOf": [{"type": "object"}]}
            """);

        assertThat(analyzer.compositionKind(schema)).isEqualTo(CompositionKind.ALL_OF);
        assertThat(analyzer.analyze(schema).members()).hasSize(1);
    }

    @Test
    void emptyCompositionListIsIgnored() throws Exception {
        JsonNode schema = json("""
            {"allOf": [], "anyOf": [{"type": "string"}]}
            """);

        assertThat(analyzer.compositionKind(schema)).isEqualTo(CompositionKind.ANY_OF);
        assertThat(analyzer.analyze(json("{\"oneOf\": []}"))).isNull();
    }

    @Test
    void discriminatorDefaultsToTypeWithEmptyMapping() throws Exception {
        Composition composition = analyzer.analyze(json("""
            {"oneOf": [{"$ref": "#/components/schemas/Cat"}], "discriminator": {}}
            """));

        assertThat(composition.discriminator().propertyName()).isEqualTo("type");
        assertThat(composition.discriminator().mapping()).isEmpty();
    }

    @Test
    void discriminatorMappingPointsToSchemaNames() throws Exception {
        Composition composition = analyzer.analyze(json("""
            {"oneOf": [{"$ref": "#/components/schemas/Cat"}, {"$ref": "#/components/schemas/Dog"}],
             "discriminator": {"propertyName": "petType",
                               "mapping": {"cat": "#/components/schemas/Cat", "dog": "Dog"}}}
            """));

        assertThat(composition.discriminator().propertyName()).isEqualTo("petType");
        assertThat(composition.discriminator().mapping())
            .containsExactly(entry("cat", "Cat"), entry("dog", "Dog"));
    }

    @Test
    void compositionRequiresMembers() {
        assertThatThrownBy(() -> new Composition(CompositionKind.ONE_OF, List.of(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mergeAllOfUnionsPropertiesAndDeduplicatesRequired() throws Exception {
        ObjectNode merged = analyzer.mergeAllOf(members("""
            [{"properties": {"name": {"type": "string"}}, "required": ["name"]},
             {"properties": {"age": {"type": "integer"}}}]
            """));

        assertThat(merged.get("type").asText()).isEqualTo("object");
        assertThat(merged.get("properties").has("name")).isTrue();
        assertThat(merged.get("properties").has("age")).isTrue();
        assertThat(merged.get("required")).hasSize(1);
        assertThat(merged.get("required").get(0).asText()).isEqualTo("name");
    }

    @Test
    void mergeAllOfDeduplicatesRepeatedRequiredNames() throws Exception {
        ObjectNode merged = analyzer.mergeAllOf(members("""
            [{"required": ["id", "name"]}, {"required": ["name", "id", "email"]}]
            """));

        List<String> required = new ArrayList<>();
        merged.get("required").forEach(node -> required.add(node.asText()));
        assertThat(required).containsExactlyInAnyOrder("id", "name", "email");
    }

    /**
     * Properties are last-write-wins while description and title are first-write-wins.
     * The two policies differ and both are observable in generated code.
     */
    @Test
    @DisplayName("allOf merge: later properties override, earlier metadata is kept")
    void mergeAllOfPolicyIsAsymmetric() throws Exception {
        ObjectNode merged = analyzer.mergeAllOf(members("""
            [{"title": "Base", "description": "first", "properties": {"id": {"type": "integer"}}},
             {"title": "Derived", "description": "second", "properties": {"id": {"type": "string"}}}]
            """));

        assertThat(merged.at("/properties/id/type").asText()).isEqualTo("string");
        assertThat(merged.get("title").asText()).isEqualTo("Base");
        assertThat(merged.get("description").asText()).isEqualTo("first");
    }

    @Test
    void mergeAllOfTakesMetadataFromLaterMemberWhenEarlierHasNone() throws Exception {
        ObjectNode merged = analyzer.mergeAllOf(members("""
            [{"properties": {}}, {"description": "only one"}]
            """));

        assertThat(merged.get("description").asText()).isEqualTo("only one");
        assertThat(merged.has("title")).isFalse();
    }

    @Test
    void mergeAllOfDoesNotModifyMembers() throws Exception {
        List<JsonNode> members = members("""
            [{"properties": {"a": {"type": "string"}}, "required": ["a"]}]
            """);
        JsonNode before = members.get(0).deepCopy();

        analyzer.mergeAllOf(members);

        assertThat(members.get(0)).isEqualTo(before);
    }
}
