package com.memstack.ingest.refresh;

import com.memstack.ingest.community.CommunityRebuildPayload;
import com.memstack.ingest.community.RebuildCommunitiesTaskHandler;
import com.memstack.ingest.episode.EpisodeIngestionContext;
import com.memstack.ingest.episode.EpisodeIngestionPipeline;
import com.memstack.ingest.episode.EpisodePayload;
import com.memstack.ingest.episode.PipelineReport;
import com.memstack.ingest.episode.StepOutcome;
import com.memstack.ingest.exception.EpisodeIngestionException;
import com.memstack.ingest.graph.EpisodeType;
import com.memstack.ingest.task.TaskContext;
import com.memstack.ingest.task.TaskHandler;
import com.memstack.ingest.task.TaskKind;
import com.memstack.ingest.task.TaskProgress;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Re-ingests existing episodes so the graph picks up a changed extraction schema or engine.
 *
 * <p>Episodes are chosen by uuid, or else the {@value #RECENT_EPISODE_LIMIT} most recent ones
 * of the group, and re-ingested oldest first through the regular episode pipeline with
 * community maintenance switched off. The first episode whose graph write fails fails the
 * task. Communities can be rebuilt afterwards in the same task.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IncrementalRefreshTaskHandler implements TaskHandler<IncrementalRefreshPayload> {

    static final int RECENT_EPISODE_LIMIT = 100;

    static final String EPISODES_BY_UUID = """
        MATCH (ep:Episodic)
        WHERE ep.uuid IN $uuids
        RETURN ep.uuid AS uuid, ep.name AS name, ep.content AS content,
               ep.source_description AS source_description, ep.source AS source,
               ep.valid_at AS valid_at
        ORDER BY ep.valid_at
        """;

    static final String RECENT_EPISODES = """
        MATCH (ep:Episodic)
        WHERE $group_id IS NULL OR ep.group_id = $group_id
        RETURN ep.uuid AS uuid, ep.name AS name, ep.content AS content,
               ep.source_description AS source_description, ep.source AS source,
               ep.valid_at AS valid_at
        ORDER BY ep.valid_at DESC
        LIMIT $limit
        """;

    private final EpisodeIngestionPipeline pipeline;
    private final RebuildCommunitiesTaskHandler communityRebuild;

    @Override
    public String getTaskType() {
        return TaskKind.INCREMENTAL_REFRESH.getType();
    }

    @Override
    public Class<IncrementalRefreshPayload> getPayloadType() {
        return IncrementalRefreshPayload.class;
    }

    @Override
    public void process(IncrementalRefreshPayload payload, TaskContext context) {
        TaskProgress progress = context.getProgress();
        long startTime = System.currentTimeMillis();

        progress.report(5, "Selecting episodes");
        List<Map<String, Object>> episodes = findEpisodes(payload, context);
        log.info("Incremental refresh of group {}: {} episode(s)", payload.groupId(), episodes.size());

        int refreshed = 0;
        int skipped = 0;
        for (Map<String, Object> episode : episodes) {
            String uuid = asString(episode.get("uuid"));
            String content = asString(episode.get("content"));
            if (uuid == null || content == null) {
                log.warn("Skipping episode {} without uuid or content", uuid);
                skipped++;
                continue;
            }

            reingest(toEpisodePayload(episode, payload), asInstant(episode.get("valid_at")), context);
            refreshed++;
            progress.report(10 + 80 * (refreshed + skipped) / episodes.size(),
                "Refreshed " + refreshed + " of " + episodes.size() + " episodes");
        }

        boolean rebuilt = false;
        if (payload.rebuildCommunities()) {
            log.info("Rebuilding communities of group {} after refresh", payload.groupId());
            communityRebuild.process(new CommunityRebuildPayload(payload.groupId()), context);
            rebuilt = true;
        }

        progress.result(Map.of(
            "episodes_count", episodes.size(),
            "refreshed_count", refreshed,
            "skipped_count", skipped,
            "communities_rebuilt", rebuilt));
        progress.report(100, "Incremental refresh completed");

        log.info("✅ Incremental refresh of group {} finished in {}ms: {} refreshed, {} skipped",
            payload.groupId(), System.currentTimeMillis() - startTime, refreshed, skipped);
    }

    private List<Map<String, Object>> findEpisodes(IncrementalRefreshPayload payload, TaskContext context) {
        if (!payload.episodeUuids().isEmpty()) {
            return context.getGraphQueries().executeWrite(EPISODES_BY_UUID, Map.of("uuids", payload.episodeUuids()));
        }

        Map<String, Object> params = new HashMap<>();
        params.put("group_id", payload.isGlobal() ? null : payload.groupId());
        params.put("limit", RECENT_EPISODE_LIMIT);
        List<Map<String, Object>> newestFirst = new ArrayList<>(context.getGraphQueries().executeWrite(RECENT_EPISODES, params));
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    private void reingest(EpisodePayload episode, Instant validAt, TaskContext context) {
        EpisodeIngestionContext ingestion = new EpisodeIngestionContext(episode, context);
        ingestion.setReferenceTime(validAt);
        ingestion.setUpdateCommunities(false);

        PipelineReport report = pipeline.run(ingestion);
        if (!report.isSuccessful()) {
            StepOutcome fatal = report.fatalOutcome().orElseThrow();
            throw new EpisodeIngestionException(episode.uuid(),
                "Refresh of episode " + episode.uuid() + " failed at step " + fatal.step() + ": " + fatal.message(),
                fatal.error());
        }
    }

    private static EpisodePayload toEpisodePayload(Map<String, Object> episode, IncrementalRefreshPayload payload) {
        return new EpisodePayload(
            asString(episode.get("uuid")),
            payload.groupId(),
            asString(episode.get("name")),
            asString(episode.get("content")),
            asString(episode.get("source_description")),
            EpisodeType.fromValue(asString(episode.get("source"))),
            payload.tenantId(),
            payload.projectId(),
            payload.userId(),
            null);
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }

    private static Instant asInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        if (value instanceof OffsetDateTime offset) {
            return offset.toInstant();
        }
        return null;
    }
}
