package com.memstack.ingest.episode.steps;

import com.memstack.ingest.episode.EpisodeIngestionContext;
import com.memstack.ingest.episode.EpisodeIngestionStep;
import com.memstack.ingest.episode.StepOutcome;
import com.memstack.ingest.graph.AddEpisodeResult;
import com.memstack.ingest.schema.SchemaSyncResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Records entity and edge type shapes the engine produced back into the project's schema.
 */
@Slf4j
@Component
@Order(30)
public class SyncSchemaStep implements EpisodeIngestionStep {

    @Override
    public String getName() {
        return "sync-schema";
    }

    @Override
    public StepOutcome execute(EpisodeIngestionContext context) {
        if (!context.isIngested() || !context.getPayload().hasProject()) {
            return StepOutcome.skipped(getName(), "no ingestion result or no project");
        }

        AddEpisodeResult result = context.getResult();
        SchemaSyncResult synced = context.getTaskContext().getSchemaStore()
            .syncSchema(result.getNodes(), result.getEdges(), context.getPayload().projectId());

        if (synced != null && synced.total() > 0) {
            log.info("Schema sync for project {}: {} entity type(s), {} edge type(s), {} mapping(s) created",
                context.getPayload().projectId(),
                synced.entityTypesCreated(), synced.edgeTypesCreated(), synced.edgeTypeMappingsCreated());
        }
        return StepOutcome.success(getName());
    }
}
