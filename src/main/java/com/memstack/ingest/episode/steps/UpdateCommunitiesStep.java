package com.memstack.ingest.episode.steps;

import com.memstack.ingest.episode.EpisodeIngestionContext;
import com.memstack.ingest.episode.EpisodeIngestionStep;
import com.memstack.ingest.episode.EpisodePayload;
import com.memstack.ingest.episode.StepOutcome;
import com.memstack.ingest.graph.GraphEngineClient;
import com.memstack.ingest.graph.GraphNode;
import com.memstack.ingest.util.BoundedFanOut;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Community maintenance for every node the ingestion touched, then tenant/project scoping
 * for the communities those nodes belong to.
 */
@Slf4j
@Component
@Order(50)
public class UpdateCommunitiesStep implements EpisodeIngestionStep {

    static final String PROPAGATE_COMMUNITY_SCOPING = """
        MATCH (ep:Episodic {uuid: $uuid})-[:MENTIONS]->(e:Entity)-[:BELONGS_TO]->(c:Community)
        SET c.tenant_id = $tenant_id,
            c.project_id = $project_id
        """;

    @Override
    public String getName() {
        return "update-communities";
    }

    @Override
    public StepOutcome execute(EpisodeIngestionContext context) {
        if (!context.isUpdateCommunities()) {
            return StepOutcome.skipped(getName(), "community updates disabled");
        }
        if (!context.isIngested() || !context.getResult().hasNodes()) {
            return StepOutcome.skipped(getName(), "no touched nodes");
        }

        EpisodePayload payload = context.getPayload();
        GraphEngineClient engine = context.getTaskContext().getGraphEngine();
        List<GraphNode> nodes = context.getResult().getNodes();

        BoundedFanOut.runAll(nodes, engine.getMaxConcurrency(), "community-update-", engine::updateCommunity);

        if (payload.hasCommunityScoping()) {
            Map<String, Object> params = new HashMap<>();
            params.put("uuid", payload.uuid());
            params.put("tenant_id", payload.tenantId());
            params.put("project_id", payload.projectId());
            context.getTaskContext().getGraphQueries().executeWrite(PROPAGATE_COMMUNITY_SCOPING, params);
        }

        return StepOutcome.success(getName(), nodes.size() + " node(s) updated");
    }
}
