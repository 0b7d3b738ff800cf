package com.memstack.ingest.episode;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.memstack.ingest.graph.EpisodeType;

/**
 * Payload of an {@code add_episode} task.
 *
 * @param uuid stable episode id, reused as the graph node uuid
 * @param groupId group the episode is ingested into
 * @param name episode name
 * @param content raw episode body
 * @param sourceDescription free-text description of the source
 * @param episodeType coarse content kind, defaults to text
 * @param tenantId optional tenant scoping
 * @param projectId optional project scoping, also selects the extraction schema
 * @param userId optional user scoping
 * @param memoryId optional application record whose status tracks this task
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EpisodePayload(
    String uuid,
    String groupId,
    String name,
    String content,
    String sourceDescription,
    EpisodeType episodeType,
    String tenantId,
    String projectId,
    String userId,
    String memoryId
) {

    public EpisodePayload {
        if (episodeType == null) {
            episodeType = EpisodeType.TEXT;
        }
    }

    @JsonIgnore
    public boolean hasScoping() {
        return isPresent(tenantId) || isPresent(projectId) || isPresent(userId);
    }

    @JsonIgnore
    public boolean hasCommunityScoping() {
        return isPresent(tenantId) || isPresent(projectId);
    }

    @JsonIgnore
    public boolean hasProject() {
        return isPresent(projectId);
    }

    @JsonIgnore
    public boolean hasMemory() {
        return isPresent(memoryId);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
