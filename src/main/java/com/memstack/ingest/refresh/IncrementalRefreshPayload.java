package com.memstack.ingest.refresh;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Payload of an {@code incremental_refresh} task.
 *
 * @param episodeUuids episodes to re-ingest; when empty, the most recent episodes of the group
 * @param groupId group the episodes are re-ingested into, {@value #GLOBAL_GROUP} when absent
 * @param rebuildCommunities rebuild the group's communities once every episode is re-ingested
 * @param tenantId optional tenant scoping
 * @param projectId optional project scoping, also selects the extraction schema
 * @param userId optional user scoping
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IncrementalRefreshPayload(
    List<String> episodeUuids,
    String groupId,
    boolean rebuildCommunities,
    String tenantId,
    String projectId,
    String userId
) {

    public static final String GLOBAL_GROUP = "global";

    public IncrementalRefreshPayload {
        episodeUuids = episodeUuids == null ? List.of() : List.copyOf(episodeUuids);
        if (groupId == null || groupId.isBlank()) {
            groupId = GLOBAL_GROUP;
        }
    }

    @JsonIgnore
    public boolean isGlobal() {
        return GLOBAL_GROUP.equals(groupId);
    }
}
