package com.ryuqq.jobhub.adapter.runner.connection;

/**
 * Liveness Monitor 설정.
 *
 * @param heartbeatIntervalMs tick 간격 (기본 30000ms)
 * @author JobHub Team
 * @since 1.0.0
 */
public record LivenessConfig(long heartbeatIntervalMs) {

    public LivenessConfig() {
        this(30000);
    }

    public LivenessConfig {
        if (heartbeatIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "heartbeatIntervalMs must be positive (current: " + heartbeatIntervalMs + ")"
            );
        }
    }

    public LivenessConfig withHeartbeatIntervalMs(long heartbeatIntervalMs) {
        return new LivenessConfig(heartbeatIntervalMs);
    }
}
