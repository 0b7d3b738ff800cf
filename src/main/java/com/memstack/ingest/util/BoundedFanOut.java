package com.memstack.ingest.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Runs an action over a list of items with at most {@code maxConcurrency} in flight.
 */
public final class BoundedFanOut {

    private BoundedFanOut() {
    }

    /**
     * Apply {@code action} to every item and wait for all of them.
     *
     * @throws RuntimeException the first failure, after every item has finished
     * @throws CancellationException if the calling thread is interrupted while waiting
     */
    public static <T> void runAll(List<T> items, int maxConcurrency, String threadPrefix, Consumer<T> action) {
        if (items.isEmpty()) {
            return;
        }

        int threads = Math.max(1, Math.min(maxConcurrency, items.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadPrefix + thread.getId());
            thread.setDaemon(true);
            return thread;
        });

        try {
            List<Callable<Void>> calls = new ArrayList<>(items.size());
            for (T item : items) {
                calls.add(() -> {
                    action.accept(item);
                    return null;
                });
            }

            RuntimeException firstFailure = null;
            for (Future<Void> future : pool.invokeAll(calls)) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    if (firstFailure == null) {
                        firstFailure = e.getCause() instanceof RuntimeException re
                            ? re
                            : new IllegalStateException(e.getCause());
                    }
                }
            }
            if (firstFailure != null) {
                throw firstFailure;
            }

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for " + items.size() + " call(s)");
        } finally {
            pool.shutdownNow();
        }
    }
}
