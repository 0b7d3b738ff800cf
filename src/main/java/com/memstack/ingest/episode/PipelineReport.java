package com.memstack.ingest.episode;

import java.util.List;
import java.util.Optional;

/**
 * Outcomes of one pipeline run, in step order. A fatal outcome is always the last one.
 */
public record PipelineReport(List<StepOutcome> outcomes) {

    public PipelineReport {
        outcomes = List.copyOf(outcomes);
    }

    public Optional<StepOutcome> fatalOutcome() {
        return outcomes.stream().filter(StepOutcome::isFatal).findFirst();
    }

    public boolean isSuccessful() {
        return fatalOutcome().isEmpty();
    }

    public long advisoryFailureCount() {
        return outcomes.stream().filter(o -> o.type() == StepOutcome.Type.ADVISORY_FAILURE).count();
    }
}
