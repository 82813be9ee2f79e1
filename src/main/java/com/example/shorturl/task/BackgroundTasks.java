package com.example.shorturl.task;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fire-and-forget side effects. Failures are logged and counted, never rethrown.
 */
@Slf4j
public class BackgroundTasks {

    private final Executor executor;
    private final TaskScheduler scheduler;
    private final Counter failures;
    private final Set<CompletableFuture<Void>> inFlight = ConcurrentHashMap.newKeySet();

    public BackgroundTasks(Executor executor, MeterRegistry meterRegistry) {
        this(executor, null, meterRegistry);
    }

    public BackgroundTasks(Executor executor, TaskScheduler scheduler, MeterRegistry meterRegistry) {
        this.executor = executor;
        this.scheduler = scheduler;
        this.failures = Counter.builder("shorturl.background.failures")
                .description("Background side effects that failed or were rejected")
                .register(meterRegistry);
    }

    public CompletableFuture<Void> submit(String name, Runnable task) {
        CompletableFuture<Void> tracked = new CompletableFuture<>();
        inFlight.add(tracked);
        try {
            CompletableFuture.runAsync(task, executor).whenComplete((ignored, error) -> {
                if (error != null) {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause() : error;
                    failures.increment();
                    log.warn("Background task {} failed", name, cause);
                }
                finish(tracked);
            });
        } catch (RejectedExecutionException e) {
            failures.increment();
            log.warn("Background task {} rejected, effect dropped", name, e);
            finish(tracked);
        }
        return tracked;
    }

    /**
     * Runs {@code task} after {@code delay}. Without a scheduler, or for a non-positive delay, it runs
     * right away.
     */
    public CompletableFuture<Void> submitDelayed(String name, Duration delay, Runnable task) {
        if (scheduler == null || delay == null || delay.isZero() || delay.isNegative()) {
            return submit(name, task);
        }
        CompletableFuture<Void> tracked = new CompletableFuture<>();
        inFlight.add(tracked);
        try {
            scheduler.schedule(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    failures.increment();
                    log.warn("Background task {} failed", name, e);
                } finally {
                    finish(tracked);
                }
            }, Instant.now().plus(delay));
        } catch (RejectedExecutionException e) {
            failures.increment();
            log.warn("Background task {} rejected, effect dropped", name, e);
            finish(tracked);
        }
        return tracked;
    }

    /**
     * Waits until every task submitted so far, and any submitted while waiting, has finished.
     *
     * @return false if the timeout elapsed or the thread was interrupted first
     */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!inFlight.isEmpty()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            CompletableFuture<?>[] snapshot = inFlight.toArray(new CompletableFuture<?>[0]);
            try {
                CompletableFuture.allOf(snapshot).get(remaining, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (TimeoutException e) {
                return false;
            } catch (ExecutionException e) {
                // tracked futures never complete exceptionally
                throw new IllegalStateException(e);
            }
        }
        return true;
    }

    public int pendingCount() {
        return inFlight.size();
    }

    private void finish(CompletableFuture<Void> tracked) {
        inFlight.remove(tracked);
        tracked.complete(null);
    }
}
