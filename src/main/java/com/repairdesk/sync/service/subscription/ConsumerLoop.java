package com.repairdesk.sync.service.subscription;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Single-threaded FIFO executor owning the collections of one entity kind in one session.
 * Tasks run in submission order, which keeps events for the same row in arrival order.
 */
@Slf4j
public class ConsumerLoop {

    private final String name;
    private final SessionEpoch epoch;
    private final ExecutorService worker;

    public ConsumerLoop(String name, SessionEpoch epoch) {
        this.name = name;
        this.epoch = epoch;
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Queues a task. It is skipped if the session has ended by the time it runs.
     *
     * @return false if the loop no longer accepts work
     */
    public boolean submit(Runnable task) {
        if (!epoch.isActive()) {
            return false;
        }
        try {
            worker.execute(() -> {
                if (!epoch.isActive()) {
                    return;
                }
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("[{}] Task failed: {}", name, e.getMessage(), e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Loop is shut down, task dropped", name);
            return false;
        }
    }

    /**
     * Runs a task on the loop and hands back its result. The future is cancelled if the
     * session ends before the task runs.
     */
    public <T> CompletableFuture<T> call(Supplier<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        if (!epoch.isActive()) {
            result.cancel(false);
            return result;
        }
        try {
            worker.execute(() -> {
                if (!epoch.isActive()) {
                    result.cancel(false);
                    return;
                }
                try {
                    result.complete(task.get());
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.cancel(false);
        }
        return result;
    }

    /**
     * Waits until everything queued before this call has run.
     *
     * @return false if the wait timed out or the loop stopped
     */
    public boolean awaitIdle(Duration timeout) {
        try {
            return call(() -> Boolean.TRUE).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException | CancellationException e) {
            return false;
        }
    }

    public String name() {
        return name;
    }

    public void shutdown() {
        worker.shutdownNow();
    }
}
