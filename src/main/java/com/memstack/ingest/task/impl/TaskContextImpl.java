package com.memstack.ingest.task.impl;

import com.memstack.ingest.graph.GraphEngineClient;
import com.memstack.ingest.graph.GraphQueryExecutor;
import com.memstack.ingest.schema.SchemaStore;
import com.memstack.ingest.status.ItemStatusStore;
import com.memstack.ingest.task.TaskContext;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.springframework.stereotype.Component;

/**
 * Default implementation of TaskContext, assembled from the application's singletons.
 */
@Value
@Builder
@AllArgsConstructor
@Component
public class TaskContextImpl implements TaskContext {

    @NonNull
    GraphEngineClient graphEngine;

    @NonNull
    GraphQueryExecutor graphQueries;

    @NonNull
    SchemaStore schemaStore;

    @NonNull
    ItemStatusStore itemStatusStore;
}
