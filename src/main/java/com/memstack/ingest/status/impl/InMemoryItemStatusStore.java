package com.memstack.ingest.status.impl;

import com.memstack.ingest.status.ItemStatusStore;
import com.memstack.ingest.status.ProcessingStatus;
import com.memstack.ingest.status.StatusChange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local item status store that keeps the full transition history of each record.
 */
@Slf4j
@Component
public class InMemoryItemStatusStore implements ItemStatusStore {

    private final ConcurrentHashMap<String, List<StatusChange>> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryItemStatusStore() {
        this(Clock.systemUTC());
    }

    InMemoryItemStatusStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void createPending(String recordId) {
        List<StatusChange> history = new ArrayList<>();
        history.add(new StatusChange(ProcessingStatus.PENDING, clock.instant()));
        records.put(recordId, history);
    }

    @Override
    public boolean updateStatus(String recordId, ProcessingStatus status) {
        List<StatusChange> history = records.get(recordId);
        if (history == null) {
            log.warn("Record {} not found when updating status to {}", recordId, status);
            return false;
        }

        synchronized (history) {
            ProcessingStatus current = history.get(history.size() - 1).status();
            if (!current.canTransitionTo(status)) {
                log.warn("Rejected status transition {} -> {} for record {}", current, status, recordId);
                return false;
            }
            history.add(new StatusChange(status, clock.instant()));
        }
        log.debug("Record {} -> {}", recordId, status);
        return true;
    }

    @Override
    public Optional<ProcessingStatus> getStatus(String recordId) {
        List<StatusChange> history = records.get(recordId);
        if (history == null) {
            return Optional.empty();
        }
        synchronized (history) {
            return Optional.of(history.get(history.size() - 1).status());
        }
    }

    @Override
    public List<StatusChange> getHistory(String recordId) {
        List<StatusChange> history = records.get(recordId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return List.copyOf(history);
        }
    }
}
