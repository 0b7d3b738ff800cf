package com.memstack.ingest.task;

import com.memstack.ingest.graph.GraphEngineClient;
import com.memstack.ingest.graph.GraphQueryExecutor;
import com.memstack.ingest.schema.SchemaStore;
import com.memstack.ingest.status.ItemStatusStore;

/**
 * Shared, read-mostly resources handed to every handler invocation.
 *
 * <p>The same instance is passed to all groups; handlers must not mutate it.
 */
public interface TaskContext {

    /**
     * Client of the external graph-reasoning engine.
     */
    GraphEngineClient getGraphEngine();

    /**
     * Generic graph query/write primitive.
     */
    GraphQueryExecutor getGraphQueries();

    /**
     * Schema loader and sync target.
     */
    SchemaStore getSchemaStore();

    /**
     * Status store of application-level records.
     */
    ItemStatusStore getItemStatusStore();

    /**
     * Progress reporter of the task being processed. Queued tasks get one bound to their
     * task log entry.
     */
    default TaskProgress getProgress() {
        return TaskProgress.NONE;
    }
}
