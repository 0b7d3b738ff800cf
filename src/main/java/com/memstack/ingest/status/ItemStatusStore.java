package com.memstack.ingest.status;

import java.util.List;
import java.util.Optional;

/**
 * Status store of application-level records (memories) whose ingestion this service drives.
 */
public interface ItemStatusStore {

    /**
     * Register a record in {@link ProcessingStatus#PENDING}. Called by producers before submission.
     *
     * @param recordId record id
     */
    void createPending(String recordId);

    /**
     * Move a record to a new status.
     *
     * @param recordId record id
     * @param status new status
     * @return false if the record is unknown or the transition is not allowed
     */
    boolean updateStatus(String recordId, ProcessingStatus status);

    Optional<ProcessingStatus> getStatus(String recordId);

    /**
     * Every status the record has been in, oldest first.
     */
    List<StatusChange> getHistory(String recordId);
}
