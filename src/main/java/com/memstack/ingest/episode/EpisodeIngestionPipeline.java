package com.memstack.ingest.episode;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the ordered ingestion steps and applies the fatal/advisory policy in one place.
 *
 * <p>Spring injects every {@link EpisodeIngestionStep} bean sorted by its {@code @Order}.
 */
@Slf4j
@Component
public class EpisodeIngestionPipeline {

    private final List<EpisodeIngestionStep> steps;

    public EpisodeIngestionPipeline(List<EpisodeIngestionStep> steps) {
        this.steps = List.copyOf(steps);
        log.info("Episode pipeline steps: {}", steps.stream().map(EpisodeIngestionStep::getName).toList());
    }

    public PipelineReport run(EpisodeIngestionContext context) {
        String episodeId = context.getPayload().uuid();
        List<StepOutcome> outcomes = new ArrayList<>();

        for (EpisodeIngestionStep step : steps) {
            StepOutcome outcome;
            try {
                outcome = step.execute(context);
                log.debug(">> Step {} for episode {}: {}", step.getName(), episodeId, outcome.type());
            } catch (RuntimeException e) {
                if (step.isFatal()) {
                    log.error("Step {} failed for episode {}: {}", step.getName(), episodeId, e.getMessage());
                    outcomes.add(StepOutcome.fatal(step.getName(), e));
                    return new PipelineReport(outcomes);
                }
                log.warn("Advisory step {} failed for episode {}: {}", step.getName(), episodeId, e.getMessage());
                outcome = StepOutcome.advisoryFailure(step.getName(), e);
            }
            outcomes.add(outcome);
        }

        return new PipelineReport(outcomes);
    }

    public List<String> getStepNames() {
        return steps.stream().map(EpisodeIngestionStep::getName).toList();
    }
}
