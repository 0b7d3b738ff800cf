package com.memstack.ingest.task;

import java.util.Map;

/**
 * Progress and result reporting of the task currently being processed.
 *
 * <p>Reports are bookkeeping only: they never change the task's outcome, and
 * implementations must not throw.
 */
public interface TaskProgress {

    /**
     * Reporter that drops everything, for handlers invoked outside a queued task.
     */
    TaskProgress NONE = new TaskProgress() {
        @Override
        public void report(int percent, String message) {
        }

        @Override
        public void result(Map<String, Object> result) {
        }
    };

    /**
     * @param percent completion between 0 and 100
     * @param message short description of the current stage
     */
    void report(int percent, String message);

    /**
     * Record the final result summary of the task.
     */
    void result(Map<String, Object> result);
}
