package com.ryuqq.jobhub.adapter.runner.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff 계산기.
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = min(baseDelay * multiplier^k, maxDelay)     (k = 0은 첫 번째 재시도)
 * delay = min(exponential + random(0, exponential * jitterFactor), maxDelay)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=100ms, multiplier=2, maxDelay=1000ms, jitter 없음):</strong></p>
 * <ul>
 *   <li>k=0: 100ms</li>
 *   <li>k=1: 200ms</li>
 *   <li>k=2: 400ms</li>
 *   <li>k=3: 800ms</li>
 *   <li>k=4: 1000ms (1600ms에서 상한 적용)</li>
 * </ul>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final double multiplier;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * RetryConfig 기반 생성.
     *
     * @param config 재시도 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public BackoffCalculator(RetryConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급원 주입 생성 (테스트용).
     *
     * @param config 재시도 설정
     * @param random [0, 1) 범위 난수 공급원
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public BackoffCalculator(RetryConfig config, DoubleSupplier random) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = config.baseDelayMs();
        this.multiplier = config.multiplier();
        this.maxDelayMs = config.maxDelayMs();
        this.jitterFactor = config.jitterFactor();
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attemptIndex 재시도 인덱스 (0부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attemptIndex가 음수인 경우
     */
    public long calculate(int attemptIndex) {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException(
                "attemptIndex must be non-negative (current: " + attemptIndex + ")"
            );
        }

        // double로 계산해 overflow 없이 상한 비교
        double raw = baseDelayMs * Math.pow(multiplier, attemptIndex);
        long exponential = raw >= maxDelayMs ? maxDelayMs : (long) raw;

        if (jitterFactor == 0.0) {
            return exponential;
        }
        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }
}
