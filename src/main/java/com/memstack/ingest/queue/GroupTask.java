package com.memstack.ingest.queue;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One queued unit of work. Immutable once enqueued.
 *
 * @param taskId task log id assigned at submission
 * @param groupId ordering domain
 * @param kind selects the task handler
 * @param payload opaque key/value bag, copied and frozen on construction
 * @param submittedAt submission time
 */
public record GroupTask(String taskId, String groupId, String kind, Map<String, Object> payload, Instant submittedAt) {

    public GroupTask {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(groupId, "groupId");
        Objects.requireNonNull(kind, "kind");
        // LinkedHashMap keeps null values, which Map.copyOf would reject
        payload = payload == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
