package com.memstack.ingest.episode.steps;

import com.memstack.ingest.episode.EpisodeIngestionContext;
import com.memstack.ingest.episode.EpisodeIngestionStep;
import com.memstack.ingest.episode.EpisodePayload;
import com.memstack.ingest.episode.StepOutcome;
import com.memstack.ingest.graph.AddEpisodeRequest;
import com.memstack.ingest.graph.AddEpisodeResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Writes the episode through the graph engine. The only fatal step of the pipeline.
 *
 * <p>The engine's own community update is switched off; {@link UpdateCommunitiesStep}
 * runs it afterwards for the touched nodes only.
 */
@Slf4j
@Component
@Order(20)
public class AddEpisodeStep implements EpisodeIngestionStep {

    private final Clock clock;

    public AddEpisodeStep() {
        this(Clock.systemUTC());
    }

    AddEpisodeStep(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "add-episode";
    }

    @Override
    public boolean isFatal() {
        return true;
    }

    @Override
    public StepOutcome execute(EpisodeIngestionContext context) {
        EpisodePayload payload = context.getPayload();

        AddEpisodeRequest request = AddEpisodeRequest.builder()
            .uuid(payload.uuid())
            .name(payload.name())
            .episodeBody(payload.content())
            .sourceDescription(payload.sourceDescription())
            .source(payload.episodeType())
            .groupId(payload.groupId())
            .referenceTime(context.getReferenceTime() != null ? context.getReferenceTime() : clock.instant())
            .updateCommunities(false)
            .schema(context.getSchema())
            .build();

        AddEpisodeResult result = context.getTaskContext().getGraphEngine().addEpisode(request);
        context.setResult(result != null ? result : new AddEpisodeResult());

        return StepOutcome.success(getName(),
            context.getResult().getNodes().size() + " node(s), " + context.getResult().getEdges().size() + " edge(s)");
    }
}
