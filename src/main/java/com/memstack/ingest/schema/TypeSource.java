package com.memstack.ingest.schema;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of a schema type: declared by a user or discovered from ingested graph data.
 */
public enum TypeSource {
    USER("user"),
    GENERATED("generated");

    private final String value;

    TypeSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
