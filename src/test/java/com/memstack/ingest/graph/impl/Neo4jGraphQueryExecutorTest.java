package com.memstack.ingest.graph.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.TransactionCallback;
import org.neo4j.driver.TransactionContext;
import org.neo4j.driver.exceptions.ServiceUnavailableException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Neo4j Graph Query Executor Tests")
class Neo4jGraphQueryExecutorTest {

    private static final String CYPHER = "MATCH (ep:Episodic {uuid: $uuid}) SET ep.status = $status";

    @Mock
    private Driver driver;

    @Mock
    private Session session;

    @Mock
    private TransactionContext tx;

    @Mock
    private Result result;

    private Neo4jGraphQueryExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new Neo4jGraphQueryExecutor(driver);
        when(driver.session()).thenReturn(session);
    }

    @Test
    @DisplayName("Should run the statement in a write transaction and return its rows")
    @SuppressWarnings("unchecked")
    void executeWrite_shouldRunInWriteTransaction() {
        // Given
        when(session.executeWrite(any())).thenAnswer(invocation -> {
            TransactionCallback<?> callback = invocation.getArgument(0);
            return callback.execute(tx);
        });
        when(tx.run(eq(CYPHER), anyMap())).thenReturn(result);
        doReturn(List.of(Map.of("updated", 1))).when(result).list(any());

        Map<String, Object> params = new HashMap<>();
        params.put("uuid", "ep-1");
        params.put("status", "Synced");

        // When
        List<Map<String, Object>> rows = executor.executeWrite(CYPHER, params);

        // Then
        assertThat(rows).containsExactly(Map.of("updated", 1));
        ArgumentCaptor<Map<String, Object>> sent = ArgumentCaptor.forClass(Map.class);
        verify(tx).run(eq(CYPHER), sent.capture());
        assertThat(sent.getValue()).containsEntry("uuid", "ep-1").containsEntry("status", "Synced");
        verify(session).close();
    }

    @Test
    @DisplayName("Should wrap driver failures and close the session")
    void executeWrite_driverFailure_shouldThrow() {
        // Given
        when(session.executeWrite(any())).thenThrow(new ServiceUnavailableException("no route"));

        // When / Then
        assertThatThrownBy(() -> executor.executeWrite(CYPHER, Map.of("uuid", "ep-1")))
            .isInstanceOf(RuntimeException.class)
            .hasMessage("Failed to execute graph write")
            .hasCauseInstanceOf(ServiceUnavailableException.class);
        verify(session).close();
    }
}
