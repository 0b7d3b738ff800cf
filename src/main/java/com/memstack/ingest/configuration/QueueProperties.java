package com.memstack.ingest.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings of the per-group worker pool.
 *
 * <p>Properties are loaded from the {@code memstack.queue} namespace:
 * <pre>
 * memstack:
 *   queue:
 *     core-workers: 4
 *     worker-thread-prefix: group-worker-
 *     shutdown-await-seconds: 30
 *     task-log-max-entries: 10000
 *     task-log-completed-retention: 24h
 * </pre>
 *
 * <p>The pool has no upper bound on threads. A group whose task blocks keeps its
 * thread, and every other group still gets one.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "memstack.queue")
public class QueueProperties {

    /**
     * Worker threads kept alive while idle.
     */
    @Min(0)
    private int coreWorkers = 4;

    @NotBlank
    private String workerThreadPrefix = "group-worker-";

    /**
     * How long shutdown waits for interrupted workers to unwind.
     */
    @Min(0)
    private int shutdownAwaitSeconds = 30;

    /**
     * Upper bound on task log entries. Past it, the oldest finished entries are evicted;
     * pending and running tasks are always kept.
     */
    @Min(1)
    private int taskLogMaxEntries = 10_000;

    /**
     * How long a COMPLETED entry stays in the task log.
     */
    @NotNull
    private Duration taskLogCompletedRetention = Duration.ofHours(24);
}
