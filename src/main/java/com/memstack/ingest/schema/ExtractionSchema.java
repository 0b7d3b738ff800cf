package com.memstack.ingest.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Entity types, edge types and the edge type map handed to the graph engine
 * for one extraction. An empty schema means "use the engine's defaults".
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExtractionSchema {

    private static final ExtractionSchema EMPTY = ExtractionSchema.builder().build();

    @Singular
    List<TypeDefinition> entityTypes;

    @Singular
    List<TypeDefinition> edgeTypes;

    @Singular("edgeTypeMapping")
    List<EdgeTypeMapping> edgeTypeMap;

    public static ExtractionSchema empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return entityTypes.isEmpty() && edgeTypes.isEmpty() && edgeTypeMap.isEmpty();
    }
}
