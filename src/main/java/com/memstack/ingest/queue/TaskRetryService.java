package com.memstack.ingest.queue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Explicit retry of failed tasks. Nothing is retried automatically.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskRetryService {

    private final TaskLogStore taskLogStore;
    private final QueueManager queueManager;

    /**
     * Re-submit a failed task's payload to its group as a brand-new task.
     *
     * <p>The failed entry moves to RETRIED first, atomically, so each failure is retried at
     * most once; retrying again means retrying the new task once it has failed.
     *
     * @param taskId id of the failed task
     * @return receipt of the new task, or empty if the task is unknown or not FAILED
     */
    public Optional<SubmissionReceipt> retry(String taskId) {
        Optional<TaskLog> existing = taskLogStore.find(taskId);
        if (existing.isEmpty()) {
            log.warn("Task {} not found for retry", taskId);
            return Optional.empty();
        }

        if (!taskLogStore.markRetried(taskId)) {
            log.warn("Task {} is not FAILED (status: {}), skipping retry", taskId, existing.get().getStatus());
            return Optional.empty();
        }

        TaskLog failed = existing.get();
        SubmissionReceipt receipt;
        try {
            receipt = queueManager.resubmit(failed);
        } catch (RuntimeException e) {
            taskLogStore.releaseRetry(taskId);
            throw e;
        }
        log.info("Retrying task {} as {} (attempt {})", taskId, receipt.taskId(), failed.getRetryCount() + 1);
        return Optional.of(receipt);
    }
}
