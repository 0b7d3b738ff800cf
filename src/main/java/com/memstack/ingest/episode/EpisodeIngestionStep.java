package com.memstack.ingest.episode;

/**
 * One step of the episode ingestion pipeline.
 *
 * <p>Implementations are Spring beans ordered with {@code @Order}. A step reports what it
 * did by returning an outcome; throwing means it failed, and {@link #isFatal()} decides
 * whether that failure fails the whole task or is only logged.
 */
public interface EpisodeIngestionStep {

    String getName();

    /**
     * Whether an exception from this step aborts the pipeline and fails the task.
     */
    default boolean isFatal() {
        return false;
    }

    /**
     * @param context state of the current ingestion
     * @return SUCCESS or SKIPPED
     */
    StepOutcome execute(EpisodeIngestionContext context);
}
