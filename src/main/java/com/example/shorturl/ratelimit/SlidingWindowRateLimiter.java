package com.example.shorturl.ratelimit;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding-window limiter keyed by client identity. Idle keys are swept after twice the window.
 */
@Slf4j
public class SlidingWindowRateLimiter implements AutoCloseable {

    @Getter
    private final int limit;
    @Getter
    private final Duration window;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Deque<Instant>> requests = new HashMap<>();
    private final ScheduledFuture<?> sweepTask;

    /** A null scheduler or non-positive interval disables background sweeping. */
    public SlidingWindowRateLimiter(int limit, Duration window, Duration sweepInterval, Clock clock,
                                    TaskScheduler scheduler) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.limit = limit;
        this.window = window;
        this.clock = clock;
        if (scheduler != null && sweepInterval != null && !sweepInterval.isZero() && !sweepInterval.isNegative()) {
            this.sweepTask = scheduler.scheduleAtFixedRate(this::sweepSafely,
                    Instant.now().plus(sweepInterval), sweepInterval);
        } else {
            this.sweepTask = null;
        }
    }

    /**
     * Records a request for {@code key} if it fits in the current window.
     *
     * @return false when the key already has {@code limit} requests inside the window
     */
    public boolean tryAcquire(String key) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);
        lock.lock();
        try {
            Deque<Instant> stamps = requests.computeIfAbsent(key, k -> new ArrayDeque<>());
            while (!stamps.isEmpty() && !stamps.peekFirst().isAfter(cutoff)) {
                stamps.pollFirst();
            }
            if (stamps.size() >= limit) {
                return false;
            }
            stamps.addLast(now);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Evicts keys with no request newer than twice the window.
     *
     * @return number of keys evicted
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(window.multipliedBy(2));
        int evicted = 0;
        lock.lock();
        try {
            Iterator<Map.Entry<String, Deque<Instant>>> it = requests.entrySet().iterator();
            while (it.hasNext()) {
                Deque<Instant> stamps = it.next().getValue();
                while (!stamps.isEmpty() && !stamps.peekFirst().isAfter(cutoff)) {
                    stamps.pollFirst();
                }
                if (stamps.isEmpty()) {
                    it.remove();
                    evicted++;
                }
            }
        } finally {
            lock.unlock();
        }
        return evicted;
    }

    public int trackedKeys() {
        lock.lock();
        try {
            return requests.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
    }

    private void sweepSafely() {
        try {
            int evicted = sweep();
            if (evicted > 0) {
                log.debug("Rate limiter evicted {} idle clients", evicted);
            }
        } catch (RuntimeException e) {
            log.warn("Rate limiter sweep failed", e);
        }
    }
}
