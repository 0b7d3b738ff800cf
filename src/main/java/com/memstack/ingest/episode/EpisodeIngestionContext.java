package com.memstack.ingest.episode;

import com.memstack.ingest.graph.AddEpisodeResult;
import com.memstack.ingest.schema.ExtractionSchema;
import com.memstack.ingest.task.TaskContext;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Mutable state carried through the steps of a single episode ingestion.
 */
@Getter
public class EpisodeIngestionContext {

    private final EpisodePayload payload;
    private final TaskContext taskContext;

    @Setter
    private ExtractionSchema schema = ExtractionSchema.empty();

    /**
     * Set by the add-episode step; null until the graph write succeeded.
     */
    @Setter
    private AddEpisodeResult result;

    /**
     * Reference time sent with the episode; null means "now".
     */
    @Setter
    private Instant referenceTime;

    /**
     * Whether touched nodes get community maintenance. Refreshes turn it off and leave
     * communities to an explicit rebuild.
     */
    @Setter
    private boolean updateCommunities = true;

    public EpisodeIngestionContext(EpisodePayload payload, TaskContext taskContext) {
        this.payload = payload;
        this.taskContext = taskContext;
    }

    public boolean isIngested() {
        return result != null;
    }
}
