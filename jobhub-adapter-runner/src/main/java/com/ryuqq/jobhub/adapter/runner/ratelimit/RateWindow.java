package com.ryuqq.jobhub.adapter.runner.ratelimit;

/**
 * 하나의 고정 윈도우 (count, resetAt).
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>resetAt은 앞으로만 이동</li>
 *   <li>count는 윈도우 안에서 증가만 하며 롤오버 시점에 정확히 0으로 초기화</li>
 * </ul>
 *
 * <p>thread-safe 하지 않습니다. 소유한 {@link FixedWindowRateLimiter}의 락 안에서만 사용됩니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
final class RateWindow {

    private final WindowGranularity granularity;
    private final long max;
    private long count;
    private long resetAt;

    RateWindow(WindowGranularity granularity, long max, long now) {
        this.granularity = granularity;
        this.max = max;
        this.count = 0;
        this.resetAt = now + granularity.durationMs();
    }

    /**
     * 만료된 윈도우 롤오버.
     *
     * @param now 현재 시각 (epoch millis)
     */
    void rollIfExpired(long now) {
        if (now >= resetAt) {
            count = 0;
            resetAt = now + granularity.durationMs();
        }
    }

    boolean isFull() {
        return count >= max;
    }

    void increment() {
        count++;
    }

    long count() {
        return count;
    }

    long resetAt() {
        return resetAt;
    }

    WindowGranularity granularity() {
        return granularity;
    }
}
