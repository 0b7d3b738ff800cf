package com.memstack.ingest.community;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Payload of a {@code rebuild_communities} task.
 *
 * @param groupId group (project) whose communities are rebuilt
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CommunityRebuildPayload(@JsonAlias("task_group_id") String groupId) {
}
