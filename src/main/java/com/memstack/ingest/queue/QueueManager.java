package com.memstack.ingest.queue;

import java.util.Map;
import java.util.Set;

/**
 * Accepts task submissions and runs them with strict per-group ordering.
 *
 * <p>Tasks of one group execute one at a time, in submission order. Different groups run
 * concurrently and a failing or slow task never affects another group.
 *
 * @see com.memstack.ingest.queue.impl.QueueManagerImpl
 */
public interface QueueManager {

    /**
     * Queue a task for asynchronous execution. Never blocks on processing.
     *
     * @param groupId ordering domain, supplied by the caller
     * @param kind task kind
     * @param payload task payload
     * @return receipt with the new task id and queue depth
     */
    SubmissionReceipt submit(String groupId, String kind, Map<String, Object> payload);

    /**
     * Queue a task that re-submits a failed one.
     *
     * @param failed task log entry of the failed task
     * @return receipt for the new task
     */
    SubmissionReceipt resubmit(TaskLog failed);

    /**
     * @return number of tasks waiting in the group, 0 for an unknown group
     */
    int getQueueDepth(String groupId);

    boolean isWorkerRunning(String groupId);

    /**
     * Groups that have received at least one task since startup.
     */
    Set<String> getGroupIds();
}
