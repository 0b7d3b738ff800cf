package com.memstack.ingest.episode;

import com.memstack.ingest.episode.steps.AddEpisodeStep;
import com.memstack.ingest.episode.steps.LoadSchemaStep;
import com.memstack.ingest.episode.steps.PropagateMetadataStep;
import com.memstack.ingest.episode.steps.SyncSchemaStep;
import com.memstack.ingest.episode.steps.UpdateCommunitiesStep;
import com.memstack.ingest.exception.EpisodeIngestionException;
import com.memstack.ingest.exception.GraphEngineException;
import com.memstack.ingest.exception.InvalidTaskPayloadException;
import com.memstack.ingest.graph.AddEpisodeRequest;
import com.memstack.ingest.graph.AddEpisodeResult;
import com.memstack.ingest.graph.GraphEngineClient;
import com.memstack.ingest.graph.GraphNode;
import com.memstack.ingest.graph.GraphQueryExecutor;
import com.memstack.ingest.schema.SchemaStore;
import com.memstack.ingest.status.ItemStatusStore;
import com.memstack.ingest.status.ProcessingStatus;
import com.memstack.ingest.status.StatusChange;
import com.memstack.ingest.status.impl.InMemoryItemStatusStore;
import com.memstack.ingest.task.TaskContext;
import com.memstack.ingest.task.impl.TaskContextImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Episode Task Handler Tests")
class EpisodeTaskHandlerTest {

    @Mock
    private GraphEngineClient graphEngine;

    @Mock
    private GraphQueryExecutor graphQueries;

    @Mock
    private SchemaStore schemaStore;

    private InMemoryItemStatusStore statusStore;
    private TaskContext taskContext;
    private EpisodeTaskHandler handler;

    @BeforeEach
    void setUp() {
        statusStore = new InMemoryItemStatusStore();
        taskContext = TaskContextImpl.builder()
            .graphEngine(graphEngine)
            .graphQueries(graphQueries)
            .schemaStore(schemaStore)
            .itemStatusStore(statusStore)
            .build();

        EpisodeIngestionPipeline pipeline = new EpisodeIngestionPipeline(List.of(
            new LoadSchemaStep(),
            new AddEpisodeStep(),
            new SyncSchemaStep(),
            new PropagateMetadataStep(),
            new UpdateCommunitiesStep()));
        handler = new EpisodeTaskHandler(pipeline);

        lenient().when(graphEngine.getMaxConcurrency()).thenReturn(2);
    }

    @Test
    @DisplayName("Should move the memory record to COMPLETED after a successful ingestion")
    void process_success_shouldCompleteMemory() {
        // Given
        statusStore.createPending("m1");
        when(graphEngine.addEpisode(any())).thenReturn(resultWithNodes("n1", "n2"));

        // When
        handler.process(payload("m1", "t1", "p1", "u1"), taskContext);

        // Then
        assertThat(statusStore.getHistory("m1"))
            .extracting(StatusChange::status)
            .containsExactly(ProcessingStatus.PENDING, ProcessingStatus.PROCESSING, ProcessingStatus.COMPLETED);
        verify(graphEngine, times(2)).updateCommunity(any(GraphNode.class));
    }

    @Test
    @DisplayName("Should ask the graph engine not to update communities itself")
    void process_shouldDisableEngineCommunityUpdate() {
        // Given
        when(graphEngine.addEpisode(any())).thenReturn(resultWithNodes());

        // When
        handler.process(payload(null, null, null, null), taskContext);

        // Then
        ArgumentCaptor<AddEpisodeRequest> request = ArgumentCaptor.forClass(AddEpisodeRequest.class);
        verify(graphEngine).addEpisode(request.capture());
        assertThat(request.getValue().isUpdateCommunities()).isFalse();
        assertThat(request.getValue().getUuid()).isEqualTo("ep-1");
        assertThat(request.getValue().getGroupId()).isEqualTo("g1");
        assertThat(request.getValue().getEpisodeBody()).isEqualTo("Alice met Bob");
        assertThat(request.getValue().getReferenceTime()).isNotNull();
        assertThat(request.getValue().getSchema().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should fail the memory record when the graph write fails")
    void process_engineFailure_shouldFailMemory() {
        // Given
        statusStore.createPending("m1");
        when(graphEngine.addEpisode(any()))
            .thenThrow(new GraphEngineException("add_episode", "engine unavailable", null));

        // When / Then
        assertThatThrownBy(() -> handler.process(payload("m1", "t1", "p1", "u1"), taskContext))
            .isInstanceOf(EpisodeIngestionException.class)
            .hasCauseInstanceOf(GraphEngineException.class)
            .hasMessageContaining("add-episode");

        assertThat(statusStore.getHistory("m1"))
            .extracting(StatusChange::status)
            .containsExactly(ProcessingStatus.PENDING, ProcessingStatus.PROCESSING, ProcessingStatus.FAILED);
        verify(graphEngine, never()).updateCommunity(any());
        verifyNoInteractions(graphQueries);
    }

    @Test
    @DisplayName("Should still complete when schema, metadata and community steps fail")
    void process_advisoryFailures_shouldStillComplete() {
        // Given
        statusStore.createPending("m1");
        when(schemaStore.loadSchema("p1")).thenThrow(new IllegalStateException("schema db down"));
        when(schemaStore.syncSchema(anyList(), anyList(), anyString())).thenThrow(new IllegalStateException("sync down"));
        when(graphEngine.addEpisode(any())).thenReturn(resultWithNodes("n1"));
        doThrow(new GraphEngineException("update_community", "timeout", null))
            .when(graphEngine).updateCommunity(any());
        when(graphQueries.executeWrite(anyString(), anyMap())).thenThrow(new RuntimeException("neo4j down"));

        // When
        handler.process(payload("m1", "t1", "p1", "u1"), taskContext);

        // Then
        assertThat(statusStore.getStatus("m1")).contains(ProcessingStatus.COMPLETED);
        ArgumentCaptor<AddEpisodeRequest> request = ArgumentCaptor.forClass(AddEpisodeRequest.class);
        verify(graphEngine).addEpisode(request.capture());
        assertThat(request.getValue().getSchema().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should stamp scoping on the episode, its entities and their communities")
    @SuppressWarnings("unchecked")
    void process_withScoping_shouldPropagateMetadata() {
        // Given
        when(graphEngine.addEpisode(any())).thenReturn(resultWithNodes("n1"));

        // When
        handler.process(payload(null, "t1", "p1", "u1"), taskContext);

        // Then
        ArgumentCaptor<String> cypher = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(graphQueries, times(2)).executeWrite(cypher.capture(), params.capture());

        assertThat(cypher.getAllValues().get(0)).contains("ep.tenant_id = $tenant_id", "[:MENTIONS]");
        assertThat(params.getAllValues().get(0))
            .containsEntry("uuid", "ep-1")
            .containsEntry("tenant_id", "t1")
            .containsEntry("project_id", "p1")
            .containsEntry("user_id", "u1")
            .containsEntry("status", "Synced");

        assertThat(cypher.getAllValues().get(1)).contains("(c:Community)");
        assertThat(params.getAllValues().get(1))
            .containsEntry("uuid", "ep-1")
            .containsEntry("tenant_id", "t1")
            .containsEntry("project_id", "p1");
    }

    @Test
    @DisplayName("Should only mark the episode synced when there is no scoping")
    @SuppressWarnings("unchecked")
    void process_withoutScoping_shouldOnlyMarkSynced() {
        // Given
        when(graphEngine.addEpisode(any())).thenReturn(resultWithNodes("n1"));

        // When
        handler.process(payload(null, null, null, null), taskContext);

        // Then
        ArgumentCaptor<String> cypher = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(graphQueries).executeWrite(cypher.capture(), params.capture());
        assertThat(cypher.getValue()).contains("SET ep.status = $status").doesNotContain("tenant_id");
        assertThat(params.getValue()).containsOnlyKeys("uuid", "status");
        verifyNoInteractions(schemaStore);
    }

    @Test
    @DisplayName("Should reject an episode without content")
    void process_missingContent_shouldFailMemory() {
        // Given
        statusStore.createPending("m1");
        EpisodePayload invalid = new EpisodePayload("ep-1", "g1", "chat", null, "api", null,
            null, null, null, "m1");

        // When / Then
        assertThatThrownBy(() -> handler.process(invalid, taskContext))
            .isInstanceOf(InvalidTaskPayloadException.class)
            .hasMessageContaining("content");
        assertThat(statusStore.getStatus("m1")).contains(ProcessingStatus.FAILED);
        verify(graphEngine, never()).addEpisode(any());
    }

    @Test
    @DisplayName("Should mark the record FAILED when an Error escapes the pipeline")
    void process_errorDuringIngestion_shouldMarkFailed() {
        // Given
        statusStore.createPending("m1");
        when(graphEngine.addEpisode(any())).thenThrow(new AssertionError("boom"));

        // When / Then
        assertThatThrownBy(() -> handler.process(payload("m1", null, null, null), taskContext))
            .isInstanceOf(AssertionError.class)
            .hasMessage("boom");
        assertThat(statusStore.getStatus("m1")).contains(ProcessingStatus.FAILED);
    }

    @Test
    @DisplayName("Should not touch the status store when no memory id is given")
    void process_withoutMemoryId_shouldSkipStatusUpdates() {
        // Given
        ItemStatusStore mockStatusStore = mock(ItemStatusStore.class);
        TaskContext context = TaskContextImpl.builder()
            .graphEngine(graphEngine)
            .graphQueries(graphQueries)
            .schemaStore(schemaStore)
            .itemStatusStore(mockStatusStore)
            .build();
        when(graphEngine.addEpisode(any())).thenReturn(resultWithNodes());

        // When
        handler.process(payload(null, null, null, null), context);

        // Then
        verifyNoInteractions(mockStatusStore);
    }

    @Test
    @DisplayName("Should complete the task even if the status store rejects the update")
    void process_unknownMemory_shouldStillIngest() {
        // Given: m-missing was never registered as pending
        when(graphEngine.addEpisode(any())).thenReturn(resultWithNodes());

        // When
        handler.process(payload("m-missing", null, null, null), taskContext);

        // Then
        verify(graphEngine).addEpisode(any());
        assertThat(statusStore.getStatus("m-missing")).isEmpty();
    }

    private static EpisodePayload payload(String memoryId, String tenantId, String projectId, String userId) {
        return new EpisodePayload("ep-1", "g1", "chat", "Alice met Bob", "api", null,
            tenantId, projectId, userId, memoryId);
    }

    private static AddEpisodeResult resultWithNodes(String... uuids) {
        List<GraphNode> nodes = new ArrayList<>();
        for (String uuid : uuids) {
            nodes.add(GraphNode.builder()
                .uuid(uuid)
                .name(uuid)
                .groupId("g1")
                .labels(List.of("Entity", "Person"))
                .build());
        }
        return AddEpisodeResult.builder().nodes(nodes).build();
    }
}
