package com.ryuqq.jobhub.adapter.runner.ratelimit;

/**
 * 고정 윈도우 단위.
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public enum WindowGranularity {

    SECOND(1_000L),

    MINUTE(60_000L),

    DAY(86_400_000L);

    private final long durationMs;

    WindowGranularity(long durationMs) {
        this.durationMs = durationMs;
    }

    public long durationMs() {
        return durationMs;
    }
}
