package com.memstack.ingest.status;

/**
 * Processing status of an application-level record whose content is ingested into the graph.
 *
 * <p>State transitions:
 * <pre>
 * PENDING → PROCESSING → COMPLETED
 *               ↓
 *            FAILED → PROCESSING (explicit retry)
 * </pre>
 *
 * Only the episode ingestion pipeline moves a record through this machine.
 */
public enum ProcessingStatus {

    /**
     * Record created and queued; ingestion not started.
     */
    PENDING,

    /**
     * The graph engine call is about to run or running.
     */
    PROCESSING,

    /**
     * Content ingested. Advisory enrichment may still have failed.
     */
    COMPLETED,

    /**
     * The graph write failed; waits for an explicit retry.
     */
    FAILED;

    /**
     * Check whether moving from this status to {@code next} is a legal transition.
     *
     * @param next target status
     * @return true if allowed
     */
    public boolean canTransitionTo(ProcessingStatus next) {
        return switch (this) {
            case PENDING, FAILED -> next == PROCESSING;
            case PROCESSING -> next == COMPLETED || next == FAILED;
            case COMPLETED -> false;
        };
    }
}
