package com.memstack.ingest.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Nodes and edges created or touched by one episode ingestion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AddEpisodeResult {

    private GraphNode episode;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<GraphNode> nodes = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<GraphEdge> edges = new ArrayList<>();

    /**
     * Never null, also when the engine sent {@code "nodes": null}.
     */
    public List<GraphNode> getNodes() {
        return nodes != null ? nodes : List.of();
    }

    public List<GraphEdge> getEdges() {
        return edges != null ? edges : List.of();
    }

    public boolean hasNodes() {
        return !getNodes().isEmpty();
    }
}
