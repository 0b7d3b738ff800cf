package com.memstack.ingest.queue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Store of task log entries.
 */
public interface TaskLogStore {

    void create(TaskLog taskLog);

    Optional<TaskLog> find(String taskId);

    void markProcessing(String taskId);

    void markCompleted(String taskId);

    void markFailed(String taskId, String errorMessage);

    /**
     * Atomically move a FAILED entry to RETRIED.
     *
     * @return true if this call claimed the retry; false if the entry is unknown or not FAILED
     */
    boolean markRetried(String taskId);

    /**
     * Undo {@link #markRetried} when the re-submission could not be queued.
     */
    void releaseRetry(String taskId);

    void updateProgress(String taskId, int progress, String message);

    void recordResult(String taskId, Map<String, Object> result);

    List<TaskLog> findByGroup(String groupId);
}
