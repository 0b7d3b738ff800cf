package com.memstack.ingest.queue.impl;

import com.memstack.ingest.graph.GraphEngineClient;
import com.memstack.ingest.graph.GraphQueryExecutor;
import com.memstack.ingest.queue.TaskLogStore;
import com.memstack.ingest.schema.SchemaStore;
import com.memstack.ingest.status.ItemStatusStore;
import com.memstack.ingest.task.TaskContext;
import com.memstack.ingest.task.TaskProgress;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Shared task context plus a progress reporter bound to one task log entry.
 */
@Slf4j
class QueuedTaskContext implements TaskContext, TaskProgress {

    private final TaskContext shared;
    private final TaskLogStore taskLogStore;
    private final String taskId;

    QueuedTaskContext(TaskContext shared, TaskLogStore taskLogStore, String taskId) {
        this.shared = shared;
        this.taskLogStore = taskLogStore;
        this.taskId = taskId;
    }

    @Override
    public GraphEngineClient getGraphEngine() {
        return shared.getGraphEngine();
    }

    @Override
    public GraphQueryExecutor getGraphQueries() {
        return shared.getGraphQueries();
    }

    @Override
    public SchemaStore getSchemaStore() {
        return shared.getSchemaStore();
    }

    @Override
    public ItemStatusStore getItemStatusStore() {
        return shared.getItemStatusStore();
    }

    @Override
    public TaskProgress getProgress() {
        return this;
    }

    @Override
    public void report(int percent, String message) {
        log.debug("Task {} at {}%: {}", taskId, percent, message);
        try {
            taskLogStore.updateProgress(taskId, percent, message);
        } catch (RuntimeException e) {
            log.warn("Failed to record progress of task {}: {}", taskId, e.getMessage());
        }
    }

    @Override
    public void result(Map<String, Object> result) {
        try {
            taskLogStore.recordResult(taskId, result);
        } catch (RuntimeException e) {
            log.warn("Failed to record result of task {}: {}", taskId, e.getMessage());
        }
    }
}
