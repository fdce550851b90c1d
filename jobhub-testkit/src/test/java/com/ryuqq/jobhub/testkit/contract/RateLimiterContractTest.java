package com.ryuqq.jobhub.testkit.contract;

import com.ryuqq.jobhub.adapter.runner.ratelimit.FixedWindowRateLimiter;
import com.ryuqq.jobhub.adapter.runner.ratelimit.WindowGranularity;
import com.ryuqq.jobhub.core.protection.RateLimiterConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: fixed-window admission.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>no window ever admits more than its configured max</li>
 *   <li>blocked callers are admitted once their window rolls over</li>
 *   <li>the third of three back-to-back calls at maxPerSecond=2 waits out the second window</li>
 * </ul>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
class RateLimiterContractTest extends AbstractContractTest {

    // ===================================================================
    // PER-WINDOW MAXIMUM
    // ===================================================================

    @Test
    void testTryAcquire_NeverExceedsAnyWindowMax() {
        // Given
        RateLimiterConfig config = new RateLimiterConfig(3, 7, 12);
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(config, time, time);

        // When: hammer the limiter while time moves in 250ms steps for two minutes
        for (int step = 0; step < 480; step++) {
            for (int call = 0; call < 5; call++) {
                limiter.tryAcquire();
            }

            // Then
            assertTrue(limiter.currentCount(WindowGranularity.SECOND) <= config.maxPerSecond());
            assertTrue(limiter.currentCount(WindowGranularity.MINUTE) <= config.maxPerMinute());
            assertTrue(limiter.currentCount(WindowGranularity.DAY) <= config.maxPerDay());
            time.advance(250);
        }
        assertEquals(12, limiter.currentCount(WindowGranularity.DAY));
    }

    @Test
    void testAcquire_QueuedCallersAdmittedPerSecondWindow() {
        // Given
        long start = time.currentTimeMillis();
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(
                new RateLimiterConfig().withMaxPerSecond(2), time, time);
        List<Long> admittedAt = new CopyOnWriteArrayList<>();
        List<CompletableFuture<Void>> calls = new ArrayList<>();

        // When
        for (int i = 0; i < 7; i++) {
            calls.add(limiter.acquire().thenRun(() -> admittedAt.add(time.currentTimeMillis() - start)));
        }
        time.runUntilIdle();

        // Then: nobody starves and each one-second window admits at most two
        assertTrue(calls.stream().allMatch(CompletableFuture::isDone));
        assertEquals(List.of(0L, 0L, 1000L, 1000L, 2000L, 2000L, 3000L), admittedAt);
        Map<Long, Long> perWindow = admittedAt.stream()
                .collect(Collectors.groupingBy(t -> t / 1000, Collectors.counting()));
        assertTrue(perWindow.values().stream().allMatch(count -> count <= 2));
    }

    @Test
    void testAcquire_CancelledWhileWaiting_DoesNotTakeSlot() {
        // Given
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(
                new RateLimiterConfig().withMaxPerSecond(1), time, time);
        assertTrue(limiter.tryAcquire());
        CompletableFuture<Void> abandoned = limiter.acquire();
        CompletableFuture<Void> kept = limiter.acquire();

        // When
        abandoned.cancel(false);
        time.advance(1_000);

        // Then: the slot of the next window goes to the caller still waiting
        assertTrue(abandoned.isCancelled());
        assertTrue(kept.isDone());
        assertEquals(1, limiter.currentCount(WindowGranularity.SECOND));
    }

    @Test
    void testAcquire_MinuteWindowFull_WaitsForMinuteRollover() {
        // Given
        long start = time.currentTimeMillis();
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(
                new RateLimiterConfig(10, 15, 1_000_000L), time, time);
        List<Long> admittedAt = new CopyOnWriteArrayList<>();

        // When
        for (int i = 0; i < 20; i++) {
            limiter.acquire().thenRun(() -> admittedAt.add(time.currentTimeMillis() - start));
        }
        time.runUntilIdle();

        // Then
        assertEquals(20, admittedAt.size());
        assertEquals(15, admittedAt.stream().filter(t -> t < 60_000L).count());
        assertEquals(5, admittedAt.stream().filter(t -> t == 60_000L).count());
    }

    // ===================================================================
    // SCENARIO A
    // ===================================================================

    @Test
    void testScenarioA_ThirdCallBlocksForRemainderOfSecond() {
        // Given
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(
                new RateLimiterConfig().withMaxPerSecond(2), time, time);

        // When
        CompletableFuture<Void> first = limiter.acquire();
        CompletableFuture<Void> second = limiter.acquire();
        CompletableFuture<Void> third = limiter.acquire();

        // Then
        assertTrue(first.isDone());
        assertTrue(second.isDone());
        assertFalse(third.isDone());
        assertEquals(List.of(1000L), time.requestedDelays());

        time.advance(999);
        assertFalse(third.isDone(), "third call must not be admitted before the window rolls over");

        time.advance(1);
        assertTrue(third.isDone());
        assertEquals(1, limiter.currentCount(WindowGranularity.SECOND));
    }
}
