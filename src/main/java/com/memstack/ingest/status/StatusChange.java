package com.memstack.ingest.status;

import java.time.Instant;

public record StatusChange(ProcessingStatus status, Instant changedAt) {
}
