package com.memstack.ingest.schema.impl;

import com.memstack.ingest.graph.GraphEdge;
import com.memstack.ingest.graph.GraphNode;
import com.memstack.ingest.schema.EdgeTypeMapping;
import com.memstack.ingest.schema.ExtractionSchema;
import com.memstack.ingest.schema.SchemaStore;
import com.memstack.ingest.schema.SchemaSyncResult;
import com.memstack.ingest.schema.TypeDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local schema store.
 *
 * <p>Each project's schema is guarded by its own monitor so a sync and a load for the
 * same project never interleave.
 */
@Slf4j
@Component
public class InMemorySchemaStore implements SchemaStore {

    static final String GENERATED_ENTITY_DESCRIPTION = "Auto-generated entity type from graph engine";
    static final String GENERATED_EDGE_DESCRIPTION = "Auto-generated edge type from graph engine";

    private final ConcurrentHashMap<String, ProjectSchema> schemas = new ConcurrentHashMap<>();

    /**
     * Declare (or replace) a user-defined entity type.
     */
    public void putEntityType(String projectId, TypeDefinition type) {
        ProjectSchema schema = schemaFor(projectId);
        synchronized (schema) {
            schema.entityTypes.put(type.getName(), type);
        }
    }

    /**
     * Declare (or replace) a user-defined edge type.
     */
    public void putEdgeType(String projectId, TypeDefinition type) {
        ProjectSchema schema = schemaFor(projectId);
        synchronized (schema) {
            schema.edgeTypes.put(type.getName(), type);
        }
    }

    public void putEdgeTypeMapping(String projectId, EdgeTypeMapping mapping) {
        ProjectSchema schema = schemaFor(projectId);
        synchronized (schema) {
            schema.edgeTypeMap.add(mapping);
        }
    }

    @Override
    public ExtractionSchema loadSchema(String projectId) {
        ProjectSchema schema = schemas.get(projectId);
        if (schema == null) {
            return ExtractionSchema.empty();
        }

        synchronized (schema) {
            ExtractionSchema.ExtractionSchemaBuilder builder = ExtractionSchema.builder();
            schema.entityTypes.values().stream()
                .filter(TypeDefinition::isEnabled)
                .forEach(builder::entityType);
            schema.edgeTypes.values().stream()
                .filter(TypeDefinition::isEnabled)
                .forEach(builder::edgeType);
            schema.edgeTypeMap.forEach(builder::edgeTypeMapping);
            return builder.build();
        }
    }

    @Override
    public SchemaSyncResult syncSchema(List<GraphNode> nodes, List<GraphEdge> edges, String projectId) {
        if (projectId == null || projectId.isBlank()) {
            return SchemaSyncResult.none();
        }

        List<GraphNode> safeNodes = nodes != null ? nodes : List.of();
        List<GraphEdge> safeEdges = edges != null ? edges : List.of();

        ProjectSchema schema = schemaFor(projectId);
        int entityTypesCreated = 0;
        int edgeTypesCreated = 0;
        int mappingsCreated = 0;

        synchronized (schema) {
            Map<String, String> nodeTypes = new HashMap<>();
            for (GraphNode node : safeNodes) {
                nodeTypes.put(node.getUuid(), node.specificLabel());
                if (node.getLabels() == null) {
                    continue;
                }
                for (String label : node.getLabels()) {
                    if (GraphNode.isSpecificLabel(label) && !schema.entityTypes.containsKey(label)) {
                        schema.entityTypes.put(label, TypeDefinition.generated(label, GENERATED_ENTITY_DESCRIPTION));
                        entityTypesCreated++;
                        log.info("Auto-generated EntityType {} for project {}", label, projectId);
                    }
                }
            }

            for (GraphEdge edge : safeEdges) {
                String edgeName = edge.getName();
                if (edgeName == null || edgeName.isBlank()) {
                    continue;
                }

                if (!schema.edgeTypes.containsKey(edgeName)) {
                    schema.edgeTypes.put(edgeName, TypeDefinition.generated(edgeName, GENERATED_EDGE_DESCRIPTION));
                    edgeTypesCreated++;
                    log.info("Auto-generated EdgeType {} for project {}", edgeName, projectId);
                }

                // Only edges whose endpoints are both in this result can be typed
                String sourceType = nodeTypes.get(edge.getSourceNodeUuid());
                String targetType = nodeTypes.get(edge.getTargetNodeUuid());
                if (sourceType != null && targetType != null) {
                    EdgeTypeMapping mapping = new EdgeTypeMapping(sourceType, targetType, edgeName);
                    if (schema.edgeTypeMap.add(mapping)) {
                        mappingsCreated++;
                        log.info("Auto-generated EdgeTypeMap {}->{}->{}", sourceType, edgeName, targetType);
                    }
                }
            }
        }

        return new SchemaSyncResult(entityTypesCreated, edgeTypesCreated, mappingsCreated);
    }

    private ProjectSchema schemaFor(String projectId) {
        return schemas.computeIfAbsent(projectId, id -> new ProjectSchema());
    }

    private static final class ProjectSchema {
        private final Map<String, TypeDefinition> entityTypes = new LinkedHashMap<>();
        private final Map<String, TypeDefinition> edgeTypes = new LinkedHashMap<>();
        private final Set<EdgeTypeMapping> edgeTypeMap = new LinkedHashSet<>();
    }
}
