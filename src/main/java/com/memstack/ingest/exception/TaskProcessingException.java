package com.memstack.ingest.exception;

/**
 * Base class for failures that are fatal to a single queued task.
 *
 * <p>Raised inside a group worker, logged, recorded on the task log, and never
 * allowed to stop the worker.
 */
public class TaskProcessingException extends RuntimeException {

    public TaskProcessingException(String message) {
        super(message);
    }

    public TaskProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
