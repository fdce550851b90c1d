package com.ryuqq.jobhub.adapter.runner.retry;

/**
 * 재시도 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxRetries: 첫 시도 이후 최대 재시도 횟수 (기본 3, 총 시도는 maxRetries + 1)</li>
 *   <li>baseDelayMs: 첫 재시도 전 대기 시간 (기본 1000ms)</li>
 *   <li>multiplier: 지수 배수 (기본 2.0)</li>
 *   <li>maxDelayMs: 대기 시간 상한 (기본 30000ms)</li>
 *   <li>jitterFactor: 추가 jitter 비율 (기본 0.0, 0.0 ~ 1.0)</li>
 * </ul>
 *
 * @param maxRetries 최대 재시도 횟수 (0 이상)
 * @param baseDelayMs 기본 지연 시간 (양수)
 * @param multiplier 지수 배수 (1.0 이상)
 * @param maxDelayMs 최대 지연 시간 (baseDelayMs 이상)
 * @param jitterFactor jitter 비율 (0.0 ~ 1.0)
 * @author JobHub Team
 * @since 1.0.0
 */
public record RetryConfig(
    int maxRetries,
    long baseDelayMs,
    double multiplier,
    long maxDelayMs,
    double jitterFactor
) {

    /**
     * 기본 설정 생성자.
     */
    public RetryConfig() {
        this(3, 1000, 2.0, 30000, 0.0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries must be non-negative (current: " + maxRetries + ")"
            );
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException(
                "multiplier must be >= 1.0 (current: " + multiplier + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    public RetryConfig withMaxRetries(int maxRetries) {
        return new RetryConfig(maxRetries, baseDelayMs, multiplier, maxDelayMs, jitterFactor);
    }

    public RetryConfig withBaseDelayMs(long baseDelayMs) {
        return new RetryConfig(maxRetries, baseDelayMs, multiplier, maxDelayMs, jitterFactor);
    }

    public RetryConfig withMultiplier(double multiplier) {
        return new RetryConfig(maxRetries, baseDelayMs, multiplier, maxDelayMs, jitterFactor);
    }

    public RetryConfig withMaxDelayMs(long maxDelayMs) {
        return new RetryConfig(maxRetries, baseDelayMs, multiplier, maxDelayMs, jitterFactor);
    }

    public RetryConfig withJitterFactor(double jitterFactor) {
        return new RetryConfig(maxRetries, baseDelayMs, multiplier, maxDelayMs, jitterFactor);
    }
}
