package com.memstack.ingest.task;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memstack.ingest.exception.InvalidTaskPayloadException;
import com.memstack.ingest.exception.NoTaskHandlerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps a task kind to the handler that processes it.
 *
 * <p>Spring injects every {@link TaskHandler} bean at startup. Re-registering a kind
 * replaces the previous handler.
 */
@Slf4j
@Component
public class TaskHandlerRegistry {

    private final ConcurrentHashMap<String, TaskHandler<?>> handlers = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public TaskHandlerRegistry(List<TaskHandler<?>> handlers, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        handlers.forEach(this::register);

        for (TaskKind kind : TaskKind.values()) {
            if (!this.handlers.containsKey(kind.getType())) {
                log.warn("⚠️  No handler registered for built-in task kind: {}", kind.getType());
            }
        }
        log.info("Task handlers registered: {}", getRegisteredKinds());
    }

    public void register(TaskHandler<?> handler) {
        TaskHandler<?> previous = handlers.put(handler.getTaskType(), handler);
        if (previous != null && previous != handler) {
            log.info("Replaced handler for task kind {}: {} -> {}", handler.getTaskType(),
                previous.getClass().getSimpleName(), handler.getClass().getSimpleName());
        }
    }

    public Optional<TaskHandler<?>> getHandler(String kind) {
        return Optional.ofNullable(handlers.get(kind));
    }

    public Set<String> getRegisteredKinds() {
        return new TreeSet<>(handlers.keySet());
    }

    /**
     * Bind the payload to the handler's payload type and invoke the handler.
     *
     * @param kind task kind
     * @param payload submitted key/value payload
     * @param context shared resources
     * @throws NoTaskHandlerException if nothing is registered for {@code kind}
     * @throws InvalidTaskPayloadException if the payload cannot be bound
     */
    public void dispatch(String kind, Map<String, Object> payload, TaskContext context) {
        TaskHandler<?> handler = handlers.get(kind);
        if (handler == null) {
            throw new NoTaskHandlerException(kind);
        }
        invoke(handler, payload, context);
    }

    private <P> void invoke(TaskHandler<P> handler, Map<String, Object> payload, TaskContext context) {
        P boundPayload = bind(handler, payload);
        log.debug("Dispatching {} to {}", handler.getTaskType(), handler.getClass().getSimpleName());
        handler.process(boundPayload, context);
    }

    private <P> P bind(TaskHandler<P> handler, Map<String, Object> payload) {
        try {
            return objectMapper.convertValue(payload != null ? payload : Map.of(), handler.getPayloadType());
        } catch (IllegalArgumentException e) {
            throw new InvalidTaskPayloadException(handler.getTaskType(), e.getMessage(), e);
        }
    }
}
