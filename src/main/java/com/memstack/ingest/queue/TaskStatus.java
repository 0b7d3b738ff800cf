package com.memstack.ingest.queue;

/**
 * Lifecycle of a queued task, as recorded in the task log.
 */
public enum TaskStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    /**
     * A FAILED task that has been re-submitted as a new task; it cannot be retried again.
     */
    RETRIED;

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED || this == RETRIED;
    }
}
