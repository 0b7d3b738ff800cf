package com.memstack.ingest.graph.impl;

import com.memstack.ingest.configuration.GraphEngineProperties;
import com.memstack.ingest.exception.GraphEngineException;
import com.memstack.ingest.graph.AddEpisodeRequest;
import com.memstack.ingest.graph.AddEpisodeResult;
import com.memstack.ingest.graph.GraphEngineClient;
import com.memstack.ingest.graph.GraphNode;
import com.memstack.ingest.model.CallContext;
import com.memstack.ingest.model.ServiceType;
import com.memstack.ingest.util.ExternalCallLogger;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Graph engine client that talks to the engine's HTTP sidecar.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /episodes} - ingest one episode</li>
 *   <li>{@code POST /communities/update} - incremental community update for one node</li>
 *   <li>{@code POST /communities/build} - full community detection for a group</li>
 * </ul>
 */
@Slf4j
@Component
public class HttpGraphEngineClient implements GraphEngineClient {

    private static final ParameterizedTypeReference<List<GraphNode>> NODE_LIST =
        new ParameterizedTypeReference<>() {};

    private final GraphEngineProperties properties;
    private final WebClient webClient;

    public HttpGraphEngineClient(GraphEngineProperties properties, WebClient.Builder webClientBuilder) {
        this.properties = properties;

        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, properties.getConnectTimeoutMs())
            .responseTimeout(Duration.ofSeconds(properties.getResponseTimeoutSeconds()));

        this.webClient = webClientBuilder.clone()
            .baseUrl(properties.getBaseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();

        log.info("Graph engine client configured: {} (maxConcurrency={})",
            properties.getBaseUrl(), properties.getMaxConcurrency());
    }

    @Override
    public AddEpisodeResult addEpisode(AddEpisodeRequest request) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GRAPH_ENGINE, "AddEpisode",
            request.getUuid(), log);
        callCtx.logRequest("Ingesting episode",
            "Group", request.getGroupId(),
            "Schema types", request.getSchema() != null ? request.getSchema().getEntityTypes().size() : 0,
            "Body", ExternalCallLogger.truncate(request.getEpisodeBody(), 200));

        try {
            AddEpisodeResult result = webClient.post()
                .uri("/episodes")
                .bodyValue(request)
                .retrieve()
                .bodyToMono(AddEpisodeResult.class)
                .block();

            if (result == null) {
                result = new AddEpisodeResult();
            }

            callCtx.logResponse("Episode ingested",
                "Nodes", result.getNodes().size(),
                "Edges", result.getEdges().size());
            return result;

        } catch (Exception e) {
            callCtx.logError("Episode ingestion failed", e);
            throw new GraphEngineException("AddEpisode", e.getMessage(), e);
        }
    }

    @Override
    public void updateCommunity(GraphNode node) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GRAPH_ENGINE, "UpdateCommunity",
            node.getUuid(), log);
        callCtx.logRequest("Updating community", "Group", node.getGroupId());

        try {
            webClient.post()
                .uri("/communities/update")
                .bodyValue(node)
                .retrieve()
                .toBodilessEntity()
                .block();

            callCtx.logResponse("Community updated");

        } catch (Exception e) {
            callCtx.logError("Community update failed", e);
            throw new GraphEngineException("UpdateCommunity", e.getMessage(), e);
        }
    }

    @Override
    public List<GraphNode> buildCommunities(String groupId) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GRAPH_ENGINE, "BuildCommunities",
            groupId, log);
        callCtx.logRequest("Building communities");

        try {
            List<GraphNode> communities = webClient.post()
                .uri("/communities/build")
                .bodyValue(Map.of("group_id", groupId))
                .retrieve()
                .bodyToMono(NODE_LIST)
                .block();

            List<GraphNode> built = communities != null ? communities : List.of();
            callCtx.logResponse("Communities built", "Communities", built.size());
            return built;

        } catch (Exception e) {
            callCtx.logError("Community build failed", e);
            throw new GraphEngineException("BuildCommunities", e.getMessage(), e);
        }
    }

    @Override
    public int getMaxConcurrency() {
        return properties.getMaxConcurrency();
    }
}
