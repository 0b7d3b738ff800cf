package com.memstack.ingest.episode.steps;

import com.memstack.ingest.episode.EpisodeIngestionContext;
import com.memstack.ingest.episode.EpisodeIngestionStep;
import com.memstack.ingest.episode.EpisodePayload;
import com.memstack.ingest.episode.StepOutcome;
import com.memstack.ingest.schema.ExtractionSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Loads the project's extraction schema. On failure the engine's default schema is used.
 */
@Slf4j
@Component
@Order(10)
public class LoadSchemaStep implements EpisodeIngestionStep {

    @Override
    public String getName() {
        return "load-schema";
    }

    @Override
    public StepOutcome execute(EpisodeIngestionContext context) {
        EpisodePayload payload = context.getPayload();
        if (!payload.hasProject()) {
            return StepOutcome.skipped(getName(), "no project scoping, using default schema");
        }

        ExtractionSchema schema = context.getTaskContext().getSchemaStore().loadSchema(payload.projectId());
        context.setSchema(schema != null ? schema : ExtractionSchema.empty());

        return StepOutcome.success(getName(), context.getSchema().getEntityTypes().size() + " entity type(s)");
    }
}
