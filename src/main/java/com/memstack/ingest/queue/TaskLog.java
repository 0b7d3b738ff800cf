package com.memstack.ingest.queue;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Bookkeeping record of one submitted task.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TaskLog {

    private String taskId;
    private String groupId;
    private String taskType;
    private Map<String, Object> payload;

    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private String errorMessage;

    /**
     * Completion between 0 and 100, as reported by the handler.
     */
    private int progress;

    private String message;

    /**
     * Result summary reported by the handler, if any.
     */
    private Map<String, Object> result;

    private int retryCount;

    /**
     * Id of the failed task this one re-submits, if any.
     */
    private String retryOf;
}
