package com.e2eq.l10n.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs one task per item on a bounded, short-lived pool and returns the results in input order.
 */
public final class WorkerPool {

    private WorkerPool() {
    }

    /**
     * @param items       work items, one task each
     * @param parallelism maximum number of worker threads; values below 1 run on one thread
     * @param threadName  prefix for worker thread names
     * @param task        the work; runtime exceptions thrown by a task are rethrown to the caller
     */
    public static <T, R> List<R> map(List<T> items, int parallelism, String threadName, Function<T, R> task) {
        if (items.isEmpty()) {
            return List.of();
        }
        int threads = Math.max(1, Math.min(parallelism, items.size()));
        AtomicInteger counter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads, r -> {
            Thread th = new Thread(r, threadName + "-" + counter.incrementAndGet());
            th.setDaemon(true);
            return th;
        });
        try {
            List<Future<R>> futures = new ArrayList<>(items.size());
            for (T item : items) {
                futures.add(executor.submit(() -> task.apply(item)));
            }
            List<R> results = new ArrayList<>(items.size());
            for (Future<R> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + threadName + " tasks", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException(threadName + " task failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }
}
