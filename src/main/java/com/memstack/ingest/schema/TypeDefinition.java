package com.memstack.ingest.schema;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entity or edge type definition of a project's extraction schema.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TypeDefinition {

    private String name;
    private String description;

    /**
     * Attribute name to attribute description; empty for generated types.
     */
    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    @Builder.Default
    private TypeSource source = TypeSource.USER;

    @Builder.Default
    private boolean enabled = true;

    public static TypeDefinition generated(String name, String description) {
        return TypeDefinition.builder()
            .name(name)
            .description(description)
            .source(TypeSource.GENERATED)
            .build();
    }
}
