package com.memstack.ingest.model;

/**
 * External collaborators whose calls are logged through {@link com.memstack.ingest.util.ExternalCallLogger}.
 */
public enum ServiceType {
    GRAPH_ENGINE("🟣", "GraphEngine"),
    NEO4J("🟢", "Neo4j");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
