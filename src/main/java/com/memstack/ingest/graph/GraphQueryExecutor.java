package com.memstack.ingest.graph;

import java.util.List;
import java.util.Map;

/**
 * Generic graph query/write primitive, parameterized by a Cypher string and named arguments.
 */
public interface GraphQueryExecutor {

    /**
     * Execute a write query in its own transaction.
     *
     * @param cypher query text
     * @param parameters named arguments; {@code null} values are passed through as Cypher nulls
     * @return returned rows as maps (empty for pure writes)
     */
    List<Map<String, Object>> executeWrite(String cypher, Map<String, Object> parameters);
}
