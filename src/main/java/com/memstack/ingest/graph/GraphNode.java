package com.memstack.ingest.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A node created or touched by the graph engine (entity, episodic or community node).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GraphNode {

    public static final String BASE_ENTITY_LABEL = "Entity";

    private String uuid;
    private String name;
    private String groupId;
    private String summary;

    @Builder.Default
    private List<String> labels = new ArrayList<>();

    /**
     * The most specific label of this node, ignoring the generic {@code Entity}
     * label and the engine's {@code Entity_*} partition labels.
     *
     * @return specific label, or {@code Entity} when the node has none
     */
    public String specificLabel() {
        if (labels == null) {
            return BASE_ENTITY_LABEL;
        }
        return labels.stream()
            .filter(GraphNode::isSpecificLabel)
            .findFirst()
            .orElse(BASE_ENTITY_LABEL);
    }

    public static boolean isSpecificLabel(String label) {
        return label != null
            && !label.equals(BASE_ENTITY_LABEL)
            && !label.startsWith(BASE_ENTITY_LABEL + "_");
    }
}
