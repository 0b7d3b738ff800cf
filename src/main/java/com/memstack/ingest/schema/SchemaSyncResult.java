package com.memstack.ingest.schema;

/**
 * Counts of schema entries created by one sync.
 */
public record SchemaSyncResult(int entityTypesCreated, int edgeTypesCreated, int edgeTypeMappingsCreated) {

    public static SchemaSyncResult none() {
        return new SchemaSyncResult(0, 0, 0);
    }

    public int total() {
        return entityTypesCreated + edgeTypesCreated + edgeTypeMappingsCreated;
    }
}
