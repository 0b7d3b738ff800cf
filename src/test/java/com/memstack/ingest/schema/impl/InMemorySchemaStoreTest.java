package com.memstack.ingest.schema.impl;

import com.memstack.ingest.graph.GraphEdge;
import com.memstack.ingest.graph.GraphNode;
import com.memstack.ingest.schema.EdgeTypeMapping;
import com.memstack.ingest.schema.ExtractionSchema;
import com.memstack.ingest.schema.SchemaSyncResult;
import com.memstack.ingest.schema.TypeDefinition;
import com.memstack.ingest.schema.TypeSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("In-Memory Schema Store Tests")
class InMemorySchemaStoreTest {

    private InMemorySchemaStore store;

    @BeforeEach
    void setUp() {
        store = new InMemorySchemaStore();
    }

    @Test
    @DisplayName("Should return an empty schema for an unknown project")
    void loadSchema_unknownProject_shouldBeEmpty() {
        assertThat(store.loadSchema("nope").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should load only enabled types")
    void loadSchema_shouldSkipDisabledTypes() {
        // Given
        store.putEntityType("p1", TypeDefinition.builder().name("Person").description("A human").build());
        store.putEntityType("p1", TypeDefinition.builder().name("Legacy").enabled(false).build());
        store.putEdgeType("p1", TypeDefinition.builder().name("WORKS_AT").build());
        store.putEdgeTypeMapping("p1", new EdgeTypeMapping("Person", "Company", "WORKS_AT"));

        // When
        ExtractionSchema schema = store.loadSchema("p1");

        // Then
        assertThat(schema.getEntityTypes()).extracting(TypeDefinition::getName).containsExactly("Person");
        assertThat(schema.getEdgeTypes()).extracting(TypeDefinition::getName).containsExactly("WORKS_AT");
        assertThat(schema.getEdgeTypeMap()).containsExactly(new EdgeTypeMapping("Person", "Company", "WORKS_AT"));
    }

    @Test
    @DisplayName("Should create generated types and mappings for new labels and edges")
    void syncSchema_shouldCreateMissingTypes() {
        // Given
        List<GraphNode> nodes = List.of(
            node("n1", "Entity", "Person"),
            node("n2", "Entity", "Entity_abc123", "Company"),
            node("n3", "Entity"));
        List<GraphEdge> edges = List.of(
            edge("WORKS_AT", "n1", "n2"),
            edge("KNOWS", "n1", "n3"),
            edge("MENTIONS_EXTERNAL", "n1", "outside"));

        // When
        SchemaSyncResult result = store.syncSchema(nodes, edges, "p1");

        // Then
        assertThat(result.entityTypesCreated()).isEqualTo(2);
        assertThat(result.edgeTypesCreated()).isEqualTo(3);
        assertThat(result.edgeTypeMappingsCreated()).isEqualTo(2);

        ExtractionSchema schema = store.loadSchema("p1");
        assertThat(schema.getEntityTypes())
            .extracting(TypeDefinition::getName)
            .containsExactly("Person", "Company");
        assertThat(schema.getEntityTypes())
            .allSatisfy(type -> {
                assertThat(type.getSource()).isEqualTo(TypeSource.GENERATED);
                assertThat(type.getDescription()).isEqualTo(InMemorySchemaStore.GENERATED_ENTITY_DESCRIPTION);
            });
        assertThat(schema.getEdgeTypeMap()).containsExactly(
            new EdgeTypeMapping("Person", "Company", "WORKS_AT"),
            new EdgeTypeMapping("Person", "Entity", "KNOWS"));
    }

    @Test
    @DisplayName("Should not overwrite user-defined types or duplicate existing entries")
    void syncSchema_existingTypes_shouldBeLeftAlone() {
        // Given
        store.putEntityType("p1", TypeDefinition.builder().name("Person").description("A human").build());
        store.syncSchema(List.of(node("n1", "Person"), node("n2", "Company")),
            List.of(edge("WORKS_AT", "n1", "n2")), "p1");

        // When
        SchemaSyncResult second = store.syncSchema(List.of(node("n3", "Person"), node("n4", "Company")),
            List.of(edge("WORKS_AT", "n3", "n4")), "p1");

        // Then
        assertThat(second.total()).isZero();
        TypeDefinition person = store.loadSchema("p1").getEntityTypes().get(0);
        assertThat(person.getDescription()).isEqualTo("A human");
        assertThat(person.getSource()).isEqualTo(TypeSource.USER);
    }

    @Test
    @DisplayName("Should do nothing without a project")
    void syncSchema_noProject_shouldDoNothing() {
        SchemaSyncResult result = store.syncSchema(List.of(node("n1", "Person")), List.of(), " ");

        assertThat(result).isEqualTo(SchemaSyncResult.none());
    }

    private static GraphNode node(String uuid, String... labels) {
        return GraphNode.builder().uuid(uuid).name(uuid).labels(List.of(labels)).build();
    }

    private static GraphEdge edge(String name, String source, String target) {
        return GraphEdge.builder().name(name).sourceNodeUuid(source).targetNodeUuid(target).build();
    }
}
