package com.memstack.ingest;

import com.memstack.ingest.episode.EpisodeIngestionPipeline;
import com.memstack.ingest.task.TaskHandlerRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Wiring check for the full application context. Nothing here talks to Neo4j or the
 * graph engine; both clients connect lazily.
 */
@SpringBootTest
@DisplayName("Application Context Tests")
class MemStackIngestApplicationTest {

    @Autowired
    private TaskHandlerRegistry registry;

    @Autowired
    private EpisodeIngestionPipeline pipeline;

    @Test
    @DisplayName("Should register a handler for every built-in task kind")
    void contextLoads_shouldRegisterBuiltInHandlers() {
        assertThat(registry.getRegisteredKinds()).containsExactly("add_episode", "incremental_refresh", "rebuild_communities");
    }

    @Test
    @DisplayName("Should order the episode pipeline steps")
    void contextLoads_shouldOrderPipelineSteps() {
        assertThat(pipeline.getStepNames()).containsExactly(
            "load-schema", "add-episode", "sync-schema", "propagate-metadata", "update-communities");
    }
}
