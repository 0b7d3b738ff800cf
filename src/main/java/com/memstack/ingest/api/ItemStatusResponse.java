package com.memstack.ingest.api;

import com.memstack.ingest.status.ProcessingStatus;
import com.memstack.ingest.status.StatusChange;

import java.util.List;

public record ItemStatusResponse(String recordId, ProcessingStatus status, List<StatusChange> history) {
}
