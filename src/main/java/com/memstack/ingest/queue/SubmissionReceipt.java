package com.memstack.ingest.queue;

/**
 * Returned by a submission. Completion is only observable through the task log or item status.
 *
 * @param taskId task log id
 * @param groupId group the task was queued in
 * @param queueDepth group queue depth right after insertion (visibility only, not back-pressure)
 */
public record SubmissionReceipt(String taskId, String groupId, int queueDepth) {
}
