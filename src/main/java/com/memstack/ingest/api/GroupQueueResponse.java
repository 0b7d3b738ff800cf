package com.memstack.ingest.api;

public record GroupQueueResponse(String groupId, int queueDepth, boolean workerRunning) {
}
