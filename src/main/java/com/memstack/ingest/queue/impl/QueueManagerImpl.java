package com.memstack.ingest.queue.impl;

import com.memstack.ingest.configuration.QueueExecutorConfig;
import com.memstack.ingest.queue.GroupQueue;
import com.memstack.ingest.queue.GroupTask;
import com.memstack.ingest.queue.QueueManager;
import com.memstack.ingest.queue.SubmissionReceipt;
import com.memstack.ingest.queue.TaskLog;
import com.memstack.ingest.queue.TaskLogStore;
import com.memstack.ingest.task.TaskContext;
import com.memstack.ingest.task.TaskHandlerRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * In-process queue manager with one lazily created {@link GroupQueue} per group.
 *
 * <p>Group queues are created on the first task of a group and live for the rest of the
 * process; an idle queue has no worker.
 */
@Slf4j
@Service
public class QueueManagerImpl implements QueueManager {

    private final ConcurrentHashMap<String, GroupQueue> queues = new ConcurrentHashMap<>();

    private final TaskHandlerRegistry registry;
    private final TaskContext taskContext;
    private final TaskLogStore taskLogStore;
    private final Executor workerExecutor;
    private final Clock clock;

    private volatile boolean accepting = true;

    @Autowired
    public QueueManagerImpl(TaskHandlerRegistry registry,
                            TaskContext taskContext,
                            TaskLogStore taskLogStore,
                            @Qualifier(QueueExecutorConfig.GROUP_WORKER_EXECUTOR) Executor workerExecutor) {
        this(registry, taskContext, taskLogStore, workerExecutor, Clock.systemUTC());
    }

    QueueManagerImpl(TaskHandlerRegistry registry,
                     TaskContext taskContext,
                     TaskLogStore taskLogStore,
                     Executor workerExecutor,
                     Clock clock) {
        this.registry = registry;
        this.taskContext = taskContext;
        this.taskLogStore = taskLogStore;
        this.workerExecutor = workerExecutor;
        this.clock = clock;
    }

    @Override
    public SubmissionReceipt submit(String groupId, String kind, Map<String, Object> payload) {
        TaskLog entry = TaskLog.builder()
            .taskId(UUID.randomUUID().toString())
            .groupId(groupId)
            .taskType(kind)
            .payload(payload)
            .build();
        return enqueue(entry);
    }

    @Override
    public SubmissionReceipt resubmit(TaskLog failed) {
        TaskLog entry = TaskLog.builder()
            .taskId(UUID.randomUUID().toString())
            .groupId(failed.getGroupId())
            .taskType(failed.getTaskType())
            .payload(failed.getPayload())
            .retryCount(failed.getRetryCount() + 1)
            .retryOf(failed.getTaskId())
            .build();
        return enqueue(entry);
    }

    private SubmissionReceipt enqueue(TaskLog entry) {
        if (entry.getGroupId() == null || entry.getGroupId().isBlank()) {
            throw new IllegalArgumentException("Group id is required");
        }
        if (entry.getTaskType() == null || entry.getTaskType().isBlank()) {
            throw new IllegalArgumentException("Task kind is required");
        }
        if (!accepting) {
            throw new IllegalStateException("Queue manager is shutting down");
        }

        Instant now = clock.instant();
        entry.setCreatedAt(now);
        // The producer keeps its map; a later retry must see what was submitted
        entry.setPayload(entry.getPayload() == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(entry.getPayload())));
        recordSafely(entry.getTaskId(), () -> taskLogStore.create(entry));

        GroupTask task = new GroupTask(entry.getTaskId(), entry.getGroupId(), entry.getTaskType(),
            entry.getPayload(), now);

        GroupQueue queue = queues.computeIfAbsent(entry.getGroupId(),
            id -> new GroupQueue(id, workerExecutor, this::runTask));
        int depth = queue.enqueue(task);

        log.info("Task {} ({}) added to group {} (depth={})",
            task.taskId(), task.kind(), task.groupId(), depth);
        return new SubmissionReceipt(task.taskId(), task.groupId(), depth);
    }

    @Override
    public int getQueueDepth(String groupId) {
        GroupQueue queue = queues.get(groupId);
        return queue != null ? queue.size() : 0;
    }

    @Override
    public boolean isWorkerRunning(String groupId) {
        GroupQueue queue = queues.get(groupId);
        return queue != null && queue.isWorkerRunning();
    }

    @Override
    public Set<String> getGroupIds() {
        return new TreeSet<>(queues.keySet());
    }

    @PreDestroy
    public void shutdown() {
        accepting = false;
        int pending = queues.values().stream().mapToInt(GroupQueue::size).sum();
        long active = queues.values().stream().filter(GroupQueue::isWorkerRunning).count();
        log.info("Queue manager shutting down: {} active worker(s), {} queued task(s) dropped", active, pending);
    }

    /**
     * Runs on the group's worker thread. Never throws, so a failing task cannot stop the worker.
     */
    private void runTask(GroupTask task) {
        log.info("Processing task {} ({}) for group {}", task.taskId(), task.kind(), task.groupId());
        recordSafely(task.taskId(), () -> taskLogStore.markProcessing(task.taskId()));
        long startTime = System.currentTimeMillis();

        try {
            registry.dispatch(task.kind(), task.payload(), new QueuedTaskContext(taskContext, taskLogStore, task.taskId()));

            recordSafely(task.taskId(), () -> taskLogStore.markCompleted(task.taskId()));
            log.info("✅ Task {} completed in {}ms", task.taskId(), System.currentTimeMillis() - startTime);

        } catch (Throwable e) {
            // An Error from a handler fails the task, not the worker
            log.error("❌ Error processing task {} ({}) for group {}: {}",
                task.taskId(), task.kind(), task.groupId(), e.getMessage(), e);
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            recordSafely(task.taskId(), () -> taskLogStore.markFailed(task.taskId(), error));
        }
    }

    private void recordSafely(String taskId, Runnable update) {
        try {
            update.run();
        } catch (RuntimeException e) {
            log.warn("Failed to update task log {}: {}", taskId, e.getMessage());
        }
    }
}
