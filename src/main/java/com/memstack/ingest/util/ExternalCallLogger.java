package com.memstack.ingest.util;

import com.memstack.ingest.model.CallContext;
import com.memstack.ingest.model.ServiceType;
import org.slf4j.Logger;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Entry point for outbound-call logging, plus helpers that keep episode bodies and
 * query parameters from flooding the log.
 */
public final class ExternalCallLogger {

    private static final int MAX_PARAM_VALUE_LENGTH = 60;

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, String subject, Logger logger) {
        return new CallContext(service, operation, subject != null ? subject : "-", logger);
    }

    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    /**
     * Render query parameters as {@code key=value} pairs in key order, long values truncated.
     */
    public static String formatParams(Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return "{}";
        }
        return params.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .map(e -> e.getKey() + "=" + truncate(String.valueOf(e.getValue()), MAX_PARAM_VALUE_LENGTH))
            .collect(Collectors.joining(", ", "{", "}"));
    }

    /**
     * First line of a Cypher statement, used as the subject of a Neo4j call.
     */
    public static String firstLine(String cypher) {
        if (cypher == null) {
            return null;
        }
        String stripped = cypher.strip();
        int newline = stripped.indexOf('\n');
        return newline < 0 ? stripped : stripped.substring(0, newline).strip();
    }
}
