package com.memstack.ingest.queue.impl;

import com.memstack.ingest.configuration.QueueProperties;
import com.memstack.ingest.queue.TaskLog;
import com.memstack.ingest.queue.TaskLogStore;
import com.memstack.ingest.queue.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local task log. Returned entries are copies.
 *
 * <p>Bounded: every {@link #create} first drops COMPLETED entries older than the configured
 * retention, then evicts the oldest finished entries while the log is over its size limit.
 */
@Slf4j
@Component
public class InMemoryTaskLogStore implements TaskLogStore {

    private final ConcurrentHashMap<String, TaskLog> entries = new ConcurrentHashMap<>();
    private final int maxEntries;
    private final Duration completedRetention;
    private final Clock clock;

    @Autowired
    public InMemoryTaskLogStore(QueueProperties properties) {
        this(properties, Clock.systemUTC());
    }

    InMemoryTaskLogStore(QueueProperties properties, Clock clock) {
        this.maxEntries = properties.getTaskLogMaxEntries();
        this.completedRetention = properties.getTaskLogCompletedRetention();
        this.clock = clock;
    }

    @Override
    public void create(TaskLog taskLog) {
        Instant now = clock.instant();
        TaskLog entry = taskLog.toBuilder()
            .createdAt(taskLog.getCreatedAt() != null ? taskLog.getCreatedAt() : now)
            .payload(freeze(taskLog.getPayload()))
            .build();
        entries.put(entry.getTaskId(), entry);
        prune(now);
    }

    @Override
    public Optional<TaskLog> find(String taskId) {
        return Optional.ofNullable(entries.get(taskId)).map(entry -> entry.toBuilder().build());
    }

    @Override
    public void markProcessing(String taskId) {
        Instant now = clock.instant();
        update(taskId, entry -> entry.toBuilder()
            .status(TaskStatus.PROCESSING)
            .startedAt(now)
            .build());
    }

    @Override
    public void markCompleted(String taskId) {
        Instant now = clock.instant();
        update(taskId, entry -> entry.toBuilder()
            .status(TaskStatus.COMPLETED)
            .completedAt(now)
            .progress(100)
            .build());
    }

    @Override
    public void markFailed(String taskId, String errorMessage) {
        Instant now = clock.instant();
        update(taskId, entry -> entry.toBuilder()
            .status(TaskStatus.FAILED)
            .completedAt(now)
            .errorMessage(errorMessage)
            .build());
    }

    @Override
    public boolean markRetried(String taskId) {
        boolean[] claimed = {false};
        entries.computeIfPresent(taskId, (id, entry) -> {
            if (entry.getStatus() != TaskStatus.FAILED) {
                return entry;
            }
            claimed[0] = true;
            return entry.toBuilder().status(TaskStatus.RETRIED).build();
        });
        return claimed[0];
    }

    @Override
    public void releaseRetry(String taskId) {
        entries.computeIfPresent(taskId, (id, entry) -> entry.getStatus() == TaskStatus.RETRIED
            ? entry.toBuilder().status(TaskStatus.FAILED).build()
            : entry);
    }

    @Override
    public void updateProgress(String taskId, int progress, String message) {
        int bounded = Math.max(0, Math.min(100, progress));
        update(taskId, entry -> entry.toBuilder()
            .progress(bounded)
            .message(message)
            .build());
    }

    @Override
    public void recordResult(String taskId, Map<String, Object> result) {
        Map<String, Object> frozen = freeze(result);
        update(taskId, entry -> entry.toBuilder()
            .result(frozen)
            .build());
    }

    @Override
    public List<TaskLog> findByGroup(String groupId) {
        return entries.values().stream()
            .filter(entry -> groupId.equals(entry.getGroupId()))
            .sorted(Comparator.comparing(TaskLog::getCreatedAt))
            .map(entry -> entry.toBuilder().build())
            .toList();
    }

    int size() {
        return entries.size();
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(completedRetention);
        entries.values().removeIf(entry -> entry.getStatus() == TaskStatus.COMPLETED
            && entry.getCompletedAt() != null
            && entry.getCompletedAt().isBefore(cutoff));

        int excess = entries.size() - maxEntries;
        if (excess <= 0) {
            return;
        }
        List<TaskLog> evicted = entries.values().stream()
            .filter(entry -> entry.getStatus().isFinished())
            .sorted(Comparator.comparing(TaskLog::getCreatedAt))
            .limit(excess)
            .toList();
        // remove(key, value) skips entries updated since the snapshot
        evicted.forEach(entry -> entries.remove(entry.getTaskId(), entry));
        log.debug("Evicted {} finished task log entries (limit {})", evicted.size(), maxEntries);
    }

    private void update(String taskId, UnaryOperator<TaskLog> change) {
        if (entries.computeIfPresent(taskId, (id, entry) -> change.apply(entry)) == null) {
            log.warn("Task log {} not found", taskId);
        }
    }

    // LinkedHashMap keeps null values, which Map.copyOf would reject
    private static Map<String, Object> freeze(Map<String, Object> values) {
        return values == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
