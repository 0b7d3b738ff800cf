package com.memstack.ingest.graph;

import java.util.List;

/**
 * Narrow call interface to the external graph-reasoning engine.
 *
 * <p>The engine performs entity extraction, embedding and the graph writes themselves;
 * this service only orchestrates when and how those calls are made.
 *
 * @see com.memstack.ingest.graph.impl.HttpGraphEngineClient
 */
public interface GraphEngineClient {

    /**
     * Ingest one episode.
     *
     * @param request episode content, scoping and extraction schema
     * @return nodes and edges created or touched
     * @throws com.memstack.ingest.exception.GraphEngineException if the engine rejects or cannot be reached
     */
    AddEpisodeResult addEpisode(AddEpisodeRequest request);

    /**
     * Run incremental community maintenance for a single node.
     *
     * @param node node whose community membership should be refreshed
     */
    void updateCommunity(GraphNode node);

    /**
     * Detect and persist communities for a whole group from scratch.
     *
     * @param groupId group to rebuild
     * @return the community nodes that were created
     */
    List<GraphNode> buildCommunities(String groupId);

    /**
     * Upper bound on concurrent calls this client should receive from a single fan-out.
     */
    int getMaxConcurrency();
}
