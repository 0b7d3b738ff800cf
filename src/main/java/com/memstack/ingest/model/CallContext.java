package com.memstack.ingest.model;

import lombok.Getter;
import org.slf4j.Logger;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Tracks one outbound call to the graph engine or Neo4j.
 *
 * <p>Each call gets a short id and the subject it acts on (an episode, node or group), so the
 * request, response and error lines of one call can be correlated across concurrent group
 * workers. Details are passed as alternating key/value pairs and logged on a single line.
 *
 * @see com.memstack.ingest.util.ExternalCallLogger
 */
@Getter
public class CallContext {

    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final String subject;
    private final Logger logger;
    private final long startNanos;

    public CallContext(ServiceType service, String operation, String subject, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.subject = subject;
        this.logger = logger;
        this.startNanos = System.nanoTime();
    }

    public void logRequest(String summary, Object... details) {
        logger.info("{} {}.{} → {} [{}]", service.getEmoji(), service.getName(), operation, subject, callId);
        if (logger.isDebugEnabled()) {
            logger.debug("  [{}] {}{}", callId, summary, formatDetails(details));
        }
    }

    public void logResponse(String summary, Object... details) {
        logger.info("{} {}.{} ← {} [{}] {}ms{}",
            service.getEmoji(), service.getName(), operation, subject, callId, getElapsedMs(), formatDetails(details));
        if (summary != null && logger.isDebugEnabled()) {
            logger.debug("  [{}] {}", callId, summary);
        }
    }

    /**
     * Stack trace at DEBUG only; callers rethrow.
     */
    public void logError(String summary, Throwable cause) {
        logger.error("{} {}.{} ✖ {} [{}] {}ms: {} ({})",
            service.getEmoji(), service.getName(), operation, subject, callId, getElapsedMs(), summary,
            cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : "no cause");
        if (cause != null) {
            logger.debug("  [{}] failure detail", callId, cause);
        }
    }

    public long getElapsedMs() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String formatDetails(Object... details) {
        if (details == null || details.length < 2) {
            return "";
        }
        StringBuilder line = new StringBuilder(" (");
        for (int i = 0; i + 1 < details.length; i += 2) {
            if (i > 0) {
                line.append(", ");
            }
            line.append(details[i]).append('=').append(details[i + 1]);
        }
        return line.append(')').toString();
    }
}
