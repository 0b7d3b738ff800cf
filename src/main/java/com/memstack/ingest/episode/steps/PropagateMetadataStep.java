package com.memstack.ingest.episode.steps;

import com.memstack.ingest.episode.EpisodeIngestionContext;
import com.memstack.ingest.episode.EpisodeIngestionStep;
import com.memstack.ingest.episode.EpisodePayload;
import com.memstack.ingest.episode.StepOutcome;
import com.memstack.ingest.graph.GraphQueryExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Stamps tenant/project/user scoping onto the episodic node and the entities it mentions,
 * and marks the episode as synced. One write either way.
 */
@Slf4j
@Component
@Order(40)
public class PropagateMetadataStep implements EpisodeIngestionStep {

    static final String SYNCED_STATUS = "Synced";

    static final String PROPAGATE_SCOPING = """
        MATCH (ep:Episodic {uuid: $uuid})
        SET ep.tenant_id = $tenant_id,
            ep.project_id = $project_id,
            ep.user_id = $user_id,
            ep.status = $status
        WITH ep
        MATCH (ep)-[:MENTIONS]->(e:Entity)
        SET e.tenant_id = ep.tenant_id,
            e.project_id = ep.project_id,
            e.user_id = ep.user_id
        """;

    static final String MARK_SYNCED = """
        MATCH (ep:Episodic {uuid: $uuid})
        SET ep.status = $status
        """;

    @Override
    public String getName() {
        return "propagate-metadata";
    }

    @Override
    public StepOutcome execute(EpisodeIngestionContext context) {
        if (!context.isIngested()) {
            return StepOutcome.skipped(getName(), "episode not ingested");
        }

        EpisodePayload payload = context.getPayload();
        GraphQueryExecutor queries = context.getTaskContext().getGraphQueries();

        Map<String, Object> params = new HashMap<>();
        params.put("uuid", payload.uuid());
        params.put("status", SYNCED_STATUS);

        if (payload.hasScoping()) {
            params.put("tenant_id", payload.tenantId());
            params.put("project_id", payload.projectId());
            params.put("user_id", payload.userId());
            queries.executeWrite(PROPAGATE_SCOPING, params);
            return StepOutcome.success(getName(), "scoping propagated");
        }

        queries.executeWrite(MARK_SYNCED, params);
        return StepOutcome.success(getName(), "marked synced");
    }
}
