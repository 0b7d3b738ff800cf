package com.memstack.ingest.graph.impl;

import com.memstack.ingest.configuration.Neo4jProperties;
import com.memstack.ingest.graph.GraphQueryExecutor;
import com.memstack.ingest.model.CallContext;
import com.memstack.ingest.model.ServiceType;
import com.memstack.ingest.util.ExternalCallLogger;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Neo4j-backed graph query/write primitive used for metadata propagation and
 * community bookkeeping.
 */
@Slf4j
@Component
public class Neo4jGraphQueryExecutor implements GraphQueryExecutor {

    private final Driver driver;

    @Autowired
    public Neo4jGraphQueryExecutor(Neo4jProperties properties) {
        this(createDriver(properties));
    }

    Neo4jGraphQueryExecutor(Driver driver) {
        this.driver = driver;
    }

    private static Driver createDriver(Neo4jProperties properties) {
        log.info("Connecting to Neo4j at: {}", properties.getUri());
        return GraphDatabase.driver(properties.getUri(),
            AuthTokens.basic(properties.getUsername(), properties.getPassword()));
    }

    @PreDestroy
    public void close() {
        driver.close();
        log.info("Neo4j connection closed");
    }

    @Override
    public List<Map<String, Object>> executeWrite(String cypher, Map<String, Object> parameters) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.NEO4J, "ExecuteWrite",
            ExternalCallLogger.firstLine(cypher), log);
        Map<String, Object> params = parameters != null ? new HashMap<>(parameters) : new HashMap<>();
        callCtx.logRequest(cypher.strip(), "Params", ExternalCallLogger.formatParams(params));

        try (Session session = driver.session()) {
            List<Map<String, Object>> rows = session.executeWrite(tx -> tx.run(cypher, params).list(Record::asMap));
            callCtx.logResponse("Write committed", "Rows", rows.size());
            return rows;

        } catch (Exception e) {
            callCtx.logError("Cypher write failed", e);
            throw new RuntimeException("Failed to execute graph write", e);
        }
    }
}
