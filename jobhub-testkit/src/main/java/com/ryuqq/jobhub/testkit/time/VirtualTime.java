package com.ryuqq.jobhub.testkit.time;

import com.ryuqq.jobhub.core.time.Delayer;
import com.ryuqq.jobhub.core.time.TimeSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;

/**
 * Manually advanced clock that also acts as a {@link Delayer}.
 *
 * <p>Delays never complete on their own. {@link #advance(long)} moves the clock forward
 * and completes every pending delay that falls due, in due order, with the clock set to
 * each delay's due time while its callbacks run. Delays registered by those callbacks
 * are picked up in the same advance if they also fall due.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * VirtualTime time = new VirtualTime();
 * RateLimiter limiter = new FixedWindowRateLimiter(config, time, time);
 * CompletableFuture&lt;Void&gt; third = limiter.acquire();
 * time.advance(1000);
 * assertTrue(third.isDone());
 * </pre>
 *
 * <p>Futures are completed outside the internal lock so callbacks may call back into
 * this clock.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class VirtualTime implements TimeSource, Delayer {

    private static final int MAX_IDLE_STEPS = 100_000;

    private final Object lock = new Object();
    private final PriorityQueue<PendingDelay> pending = new PriorityQueue<>(
        Comparator.comparingLong(PendingDelay::dueAt).thenComparingLong(PendingDelay::sequence));
    private final List<Long> requestedDelays = new ArrayList<>();
    private long now;
    private long sequence;

    /**
     * Clock starting at epoch millis 0.
     */
    public VirtualTime() {
        this(0L);
    }

    /**
     * Clock starting at the given epoch millis.
     *
     * @param startMillis initial time
     */
    public VirtualTime(long startMillis) {
        this.now = startMillis;
    }

    @Override
    public long currentTimeMillis() {
        synchronized (lock) {
            return now;
        }
    }

    @Override
    public CompletableFuture<Void> delay(long delayMs) {
        synchronized (lock) {
            requestedDelays.add(delayMs);
            if (delayMs <= 0) {
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> future = new CompletableFuture<>();
            pending.add(new PendingDelay(now + delayMs, sequence++, future));
            return future;
        }
    }

    /**
     * Moves the clock forward, completing every delay due on the way.
     *
     * @param millis amount to advance (must not be negative)
     * @throws IllegalArgumentException if millis is negative
     */
    public void advance(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis must not be negative (current: " + millis + ")");
        }
        long target;
        synchronized (lock) {
            target = now + millis;
        }
        while (true) {
            PendingDelay due;
            synchronized (lock) {
                PendingDelay head = pending.peek();
                if (head == null || head.dueAt() > target) {
                    now = target;
                    return;
                }
                due = pending.poll();
                now = due.dueAt();
            }
            due.future().complete(null);
        }
    }

    /**
     * Advances straight to each pending delay until none are left.
     *
     * @throws IllegalStateException if delays keep rescheduling themselves
     */
    public void runUntilIdle() {
        for (int step = 0; step < MAX_IDLE_STEPS; step++) {
            PendingDelay due;
            synchronized (lock) {
                due = pending.poll();
                if (due == null) {
                    return;
                }
                now = Math.max(now, due.dueAt());
            }
            due.future().complete(null);
        }
        throw new IllegalStateException("VirtualTime did not become idle after " + MAX_IDLE_STEPS + " steps");
    }

    /**
     * Every delay requested so far, in request order, including zero delays.
     *
     * @return snapshot of requested delays
     */
    public List<Long> requestedDelays() {
        synchronized (lock) {
            return List.copyOf(requestedDelays);
        }
    }

    /**
     * Number of delays not yet due.
     *
     * @return pending delay count
     */
    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    private record PendingDelay(long dueAt, long sequence, CompletableFuture<Void> future) {
    }
}
