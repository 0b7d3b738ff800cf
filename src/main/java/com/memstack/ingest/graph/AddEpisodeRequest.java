package com.memstack.ingest.graph;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.memstack.ingest.schema.ExtractionSchema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Arguments of the graph engine's episode ingestion call.
 *
 * <p>{@code updateCommunities} is always sent as {@code false} by the ingestion pipeline;
 * community maintenance runs afterwards, scoped to the nodes the call touched.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AddEpisodeRequest {

    String uuid;
    String name;
    String episodeBody;
    String sourceDescription;
    EpisodeType source;
    String groupId;
    Instant referenceTime;
    boolean updateCommunities;
    ExtractionSchema schema;
}
