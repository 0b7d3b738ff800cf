package com.memstack.ingest.task;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memstack.ingest.episode.EpisodePayload;
import com.memstack.ingest.exception.InvalidTaskPayloadException;
import com.memstack.ingest.exception.NoTaskHandlerException;
import com.memstack.ingest.graph.EpisodeType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

@DisplayName("Task Handler Registry Tests")
class TaskHandlerRegistryTest {

    private final TaskContext context = mock(TaskContext.class);

    @Test
    @DisplayName("Should bind a snake_case payload to the handler's payload type")
    void dispatch_shouldBindPayload() {
        // Given
        CapturingHandler<EpisodePayload> handler = new CapturingHandler<>("add_episode", EpisodePayload.class);
        TaskHandlerRegistry registry = new TaskHandlerRegistry(List.of(handler), new ObjectMapper());

        // When
        registry.dispatch("add_episode", Map.of(
            "uuid", "ep-1",
            "group_id", "g1",
            "content", "Alice met Bob",
            "episode_type", "message",
            "project_id", "p1",
            "extra_field", "ignored"), context);

        // Then
        assertThat(handler.received).hasSize(1);
        EpisodePayload payload = handler.received.get(0);
        assertThat(payload.uuid()).isEqualTo("ep-1");
        assertThat(payload.groupId()).isEqualTo("g1");
        assertThat(payload.episodeType()).isEqualTo(EpisodeType.MESSAGE);
        assertThat(payload.projectId()).isEqualTo("p1");
        assertThat(payload.memoryId()).isNull();
    }

    @Test
    @DisplayName("Should fail with NoTaskHandlerException for an unknown kind")
    void dispatch_unknownKind_shouldThrow() {
        TaskHandlerRegistry registry = new TaskHandlerRegistry(List.of(), new ObjectMapper());

        assertThatThrownBy(() -> registry.dispatch("unknown", Map.of(), context))
            .isInstanceOf(NoTaskHandlerException.class)
            .hasMessageContaining("unknown");
    }

    @Test
    @DisplayName("Should replace the handler when a kind is registered again")
    void register_sameKind_shouldReplace() {
        // Given
        CapturingHandler<EpisodePayload> first = new CapturingHandler<>("add_episode", EpisodePayload.class);
        CapturingHandler<EpisodePayload> second = new CapturingHandler<>("add_episode", EpisodePayload.class);
        TaskHandlerRegistry registry = new TaskHandlerRegistry(List.of(first), new ObjectMapper());

        // When
        registry.register(second);
        registry.dispatch("add_episode", Map.of("uuid", "ep-1"), context);

        // Then
        assertThat(first.received).isEmpty();
        assertThat(second.received).hasSize(1);
        assertThat(registry.getHandler("add_episode")).containsSame(second);
        assertThat(registry.getRegisteredKinds()).containsExactly("add_episode");
    }

    @Test
    @DisplayName("Should report a payload that cannot be bound")
    void dispatch_unbindablePayload_shouldThrowInvalidPayload() {
        // Given
        CapturingHandler<EpisodePayload> handler = new CapturingHandler<>("add_episode", EpisodePayload.class);
        TaskHandlerRegistry registry = new TaskHandlerRegistry(List.of(handler), new ObjectMapper());

        // When / Then
        assertThatThrownBy(() -> registry.dispatch("add_episode", Map.of("uuid", List.of("a", "b")), context))
            .isInstanceOf(InvalidTaskPayloadException.class)
            .hasMessageContaining("add_episode");
        assertThat(handler.received).isEmpty();
    }

    private static final class CapturingHandler<P> implements TaskHandler<P> {

        private final String type;
        private final Class<P> payloadType;
        private final List<P> received = new ArrayList<>();

        private CapturingHandler(String type, Class<P> payloadType) {
            this.type = type;
            this.payloadType = payloadType;
        }

        @Override
        public String getTaskType() {
            return type;
        }

        @Override
        public Class<P> getPayloadType() {
            return payloadType;
        }

        @Override
        public void process(P payload, TaskContext context) {
            received.add(payload);
        }
    }
}
