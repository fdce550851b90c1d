package com.ryuqq.jobhub.core.protection;

/**
 * Rate Limiter 설정.
 *
 * <p>초/분/일 고정 윈도우별 최대 허용 호출 수입니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>maxPerSecond: 10</li>
 *   <li>maxPerMinute: 250</li>
 *   <li>maxPerDay: 1,000,000,000</li>
 * </ul>
 *
 * @param maxPerSecond 초당 최대 호출 수
 * @param maxPerMinute 분당 최대 호출 수
 * @param maxPerDay 일당 최대 호출 수
 * @author JobHub Team
 * @since 1.0.0
 */
public record RateLimiterConfig(int maxPerSecond, int maxPerMinute, long maxPerDay) {

    public static final int DEFAULT_MAX_PER_SECOND = 10;
    public static final int DEFAULT_MAX_PER_MINUTE = 250;
    public static final long DEFAULT_MAX_PER_DAY = 1_000_000_000L;

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException 한도가 양수가 아닌 경우
     */
    public RateLimiterConfig {
        if (maxPerSecond <= 0) {
            throw new IllegalArgumentException("maxPerSecond must be positive (current: " + maxPerSecond + ")");
        }
        if (maxPerMinute <= 0) {
            throw new IllegalArgumentException("maxPerMinute must be positive (current: " + maxPerMinute + ")");
        }
        if (maxPerDay <= 0) {
            throw new IllegalArgumentException("maxPerDay must be positive (current: " + maxPerDay + ")");
        }
    }

    /**
     * 기본 설정.
     */
    public RateLimiterConfig() {
        this(DEFAULT_MAX_PER_SECOND, DEFAULT_MAX_PER_MINUTE, DEFAULT_MAX_PER_DAY);
    }

    public RateLimiterConfig withMaxPerSecond(int newMaxPerSecond) {
        return new RateLimiterConfig(newMaxPerSecond, maxPerMinute, maxPerDay);
    }

    public RateLimiterConfig withMaxPerMinute(int newMaxPerMinute) {
        return new RateLimiterConfig(maxPerSecond, newMaxPerMinute, maxPerDay);
    }

    public RateLimiterConfig withMaxPerDay(long newMaxPerDay) {
        return new RateLimiterConfig(maxPerSecond, maxPerMinute, newMaxPerDay);
    }
}
