package com.ryuqq.jobhub.application.retry;

/**
 * 재시도 직전의 시도 정보 (일시적, 저장하지 않음).
 *
 * @param attemptIndex 재시도 인덱스 (0부터 시작, 0은 첫 번째 재시도)
 * @param error 직전 시도의 실패 원인
 * @param backoffDelayMs 다음 시도 전 대기 시간 (밀리초)
 * @author JobHub Team
 * @since 1.0.0
 */
public record RetryAttempt(int attemptIndex, Throwable error, long backoffDelayMs) {

    public RetryAttempt {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex must be non-negative (current: " + attemptIndex + ")");
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        if (backoffDelayMs < 0) {
            throw new IllegalArgumentException("backoffDelayMs must be non-negative (current: " + backoffDelayMs + ")");
        }
    }
}
