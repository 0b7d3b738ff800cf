package com.memstack.ingest.queue;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Unbounded FIFO of pending tasks for one group, drained by at most one worker at a time.
 *
 * <p>The worker is started on demand by {@link #enqueue} and exits as soon as it observes
 * the queue empty. The running flag is only ever set by a successful compare-and-set, so two
 * workers can never hold it for the same group.
 */
@Slf4j
public class GroupQueue {

    private final String groupId;
    private final BlockingQueue<GroupTask> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Executor executor;
    private final Consumer<GroupTask> taskProcessor;

    /**
     * @param groupId ordering domain this queue serves
     * @param executor runs the worker loop; must not queue the worker behind other groups
     * @param taskProcessor processes one task; expected to handle its own failures
     */
    public GroupQueue(String groupId, Executor executor, Consumer<GroupTask> taskProcessor) {
        this.groupId = groupId;
        this.executor = executor;
        this.taskProcessor = taskProcessor;
    }

    /**
     * Append a task and make sure a worker is running.
     *
     * @return queue depth right after insertion
     */
    public int enqueue(GroupTask task) {
        queue.offer(task);
        int depth = queue.size();
        tryStartWorker();
        return depth;
    }

    public int size() {
        return queue.size();
    }

    public boolean isWorkerRunning() {
        return running.get();
    }

    public String getGroupId() {
        return groupId;
    }

    private void tryStartWorker() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            running.set(false);
            log.error("Could not start worker for group {} ({} task(s) pending): {}",
                groupId, queue.size(), e.getMessage());
        }
    }

    private void drain() {
        log.debug("Worker started for group {}", groupId);
        boolean releasedFlag = false;
        boolean exitedNormally = false;
        try {
            while (!Thread.currentThread().isInterrupted()) {
                GroupTask task = queue.poll();
                if (task != null) {
                    taskProcessor.accept(task);
                    continue;
                }

                running.set(false);
                // A submit between poll() and the reset saw running == true and did not start a worker
                if (queue.isEmpty() || !running.compareAndSet(false, true)) {
                    releasedFlag = true;
                    log.debug("Worker exiting for group {}", groupId);
                    return;
                }
            }
            exitedNormally = true;
            log.warn("Worker for group {} cancelled with {} task(s) still queued", groupId, queue.size());
        } finally {
            if (!releasedFlag) {
                running.set(false);
                // Tasks queued behind a task that blew up the loop would otherwise wait for the next submit
                if (!exitedNormally && !queue.isEmpty()) {
                    log.warn("Worker for group {} died with {} task(s) queued, starting a new one",
                        groupId, queue.size());
                    tryStartWorker();
                }
            }
        }
    }
}
