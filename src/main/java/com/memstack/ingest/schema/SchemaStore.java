package com.memstack.ingest.schema;

import com.memstack.ingest.graph.GraphEdge;
import com.memstack.ingest.graph.GraphNode;

import java.util.List;

/**
 * Per-project store of extraction schemas.
 */
public interface SchemaStore {

    /**
     * Load the enabled entity types, edge types and edge type map of a project.
     *
     * @param projectId project id
     * @return the project's schema, or {@link ExtractionSchema#empty()} for an unknown project
     */
    ExtractionSchema loadSchema(String projectId);

    /**
     * Record type shapes observed in an ingestion result that the project does not know yet.
     *
     * <p>Labels other than {@code Entity} / {@code Entity_*} become entity types, edge names
     * become edge types, and each (source type, target type, edge name) triple becomes an
     * edge type mapping. Existing entries are left untouched.
     *
     * @param nodes nodes returned by the graph engine
     * @param edges edges returned by the graph engine
     * @param projectId owning project
     * @return what was created
     */
    SchemaSyncResult syncSchema(List<GraphNode> nodes, List<GraphEdge> edges, String projectId);
}
