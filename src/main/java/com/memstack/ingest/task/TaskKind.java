package com.memstack.ingest.task;

/**
 * Task kinds this service ships handlers for.
 *
 * <p>The registry is keyed by the string {@link #getType()}, so additional kinds can be
 * registered without touching this enum; the enum only names the built-in ones and lets
 * the registry report built-in kinds that lack a handler.
 */
public enum TaskKind {
    ADD_EPISODE("add_episode"),
    REBUILD_COMMUNITIES("rebuild_communities"),
    INCREMENTAL_REFRESH("incremental_refresh");

    private final String type;

    TaskKind(String type) {
        this.type = type;
    }

    public String getType() {
        return type;
    }
}
