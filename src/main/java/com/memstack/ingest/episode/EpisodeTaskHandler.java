package com.memstack.ingest.episode;

import com.memstack.ingest.exception.EpisodeIngestionException;
import com.memstack.ingest.exception.InvalidTaskPayloadException;
import com.memstack.ingest.status.ItemStatusStore;
import com.memstack.ingest.status.ProcessingStatus;
import com.memstack.ingest.task.TaskContext;
import com.memstack.ingest.task.TaskHandler;
import com.memstack.ingest.task.TaskKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Ingests one episode into the knowledge graph and keeps its application record's status.
 *
 * <p>Flow:
 * <ol>
 *   <li>record → PROCESSING (if a record id was supplied)</li>
 *   <li>run the ordered pipeline: load schema, add episode, sync schema,
 *       propagate metadata, update communities</li>
 *   <li>record → COMPLETED, or FAILED when the graph write failed</li>
 * </ol>
 *
 * Only the graph write can fail the task. The other steps only enrich metadata, so their
 * failures are logged and the task still completes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EpisodeTaskHandler implements TaskHandler<EpisodePayload> {

    private final EpisodeIngestionPipeline pipeline;

    @Override
    public String getTaskType() {
        return TaskKind.ADD_EPISODE.getType();
    }

    @Override
    public Class<EpisodePayload> getPayloadType() {
        return EpisodePayload.class;
    }

    @Override
    public void process(EpisodePayload payload, TaskContext context) {
        ItemStatusStore statusStore = context.getItemStatusStore();
        String memoryId = payload.hasMemory() ? payload.memoryId() : null;

        updateStatus(statusStore, memoryId, ProcessingStatus.PROCESSING);

        try {
            validate(payload);
        } catch (InvalidTaskPayloadException e) {
            updateStatus(statusStore, memoryId, ProcessingStatus.FAILED);
            throw e;
        }

        log.info("Ingesting episode {} into group {}", payload.uuid(), payload.groupId());
        PipelineReport report;
        try {
            report = pipeline.run(new EpisodeIngestionContext(payload, context));
        } catch (RuntimeException | Error e) {
            updateStatus(statusStore, memoryId, ProcessingStatus.FAILED);
            throw e;
        }

        if (!report.isSuccessful()) {
            StepOutcome fatal = report.fatalOutcome().orElseThrow();
            updateStatus(statusStore, memoryId, ProcessingStatus.FAILED);
            throw new EpisodeIngestionException(payload.uuid(),
                "Episode " + payload.uuid() + " failed at step " + fatal.step() + ": " + fatal.message(),
                fatal.error());
        }

        updateStatus(statusStore, memoryId, ProcessingStatus.COMPLETED);

        if (report.advisoryFailureCount() > 0) {
            log.warn("Episode {} ingested with {} advisory failure(s)", payload.uuid(), report.advisoryFailureCount());
        } else {
            log.info("Episode {} ingested", payload.uuid());
        }
    }

    private void validate(EpisodePayload payload) {
        if (payload.uuid() == null || payload.uuid().isBlank()) {
            throw new InvalidTaskPayloadException(getTaskType(), "uuid is required");
        }
        if (payload.groupId() == null || payload.groupId().isBlank()) {
            throw new InvalidTaskPayloadException(getTaskType(), "group_id is required");
        }
        if (payload.content() == null) {
            throw new InvalidTaskPayloadException(getTaskType(), "content is required");
        }
    }

    /**
     * Status bookkeeping never decides the task's outcome.
     */
    private void updateStatus(ItemStatusStore statusStore, String memoryId, ProcessingStatus status) {
        if (memoryId == null) {
            return;
        }
        try {
            statusStore.updateStatus(memoryId, status);
        } catch (RuntimeException e) {
            log.error("Failed to update memory status {} to {}: {}", memoryId, status, e.getMessage());
        }
    }
}
