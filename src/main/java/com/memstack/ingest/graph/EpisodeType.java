package com.memstack.ingest.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse kind of content carried by an episode, as understood by the graph engine.
 */
public enum EpisodeType {
    MESSAGE("message"),
    JSON("json"),
    TEXT("text");

    private final String value;

    EpisodeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient lookup; unknown or missing values fall back to {@link #TEXT}.
     */
    @JsonCreator
    public static EpisodeType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        for (EpisodeType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return TEXT;
    }
}
