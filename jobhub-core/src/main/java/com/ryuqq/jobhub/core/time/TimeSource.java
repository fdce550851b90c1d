package com.ryuqq.jobhub.core.time;

import java.time.Instant;

/**
 * 현재 시각 공급자.
 *
 * <p>Rate Limiter 윈도우와 Envelope timestamp 계산에 사용됩니다.
 * 테스트에서는 가상 시계로 대체합니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public interface TimeSource {

    /**
     * 시스템 시계.
     */
    TimeSource SYSTEM = System::currentTimeMillis;

    /**
     * 현재 시각 (epoch millis).
     *
     * @return epoch milliseconds
     */
    long currentTimeMillis();

    /**
     * 현재 시각 (Instant).
     *
     * @return 현재 Instant
     */
    default Instant now() {
        return Instant.ofEpochMilli(currentTimeMillis());
    }
}
