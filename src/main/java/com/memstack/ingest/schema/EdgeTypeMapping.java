package com.memstack.ingest.schema;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Allows an edge type between a source entity type and a target entity type.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EdgeTypeMapping(String sourceType, String targetType, String edgeType) {
}
