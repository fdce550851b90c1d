package com.ryuqq.jobhub.core.error;

/**
 * 외부 호출 실패 분류.
 *
 * <p><strong>재시도 규칙:</strong></p>
 * <ul>
 *   <li>AUTHENTICATION, AUTHORIZATION, VALIDATION: 재시도 불가 (재시도해도 결과가 같고 할당량만 소모)</li>
 *   <li>RATE_LIMITED, TRANSIENT: 재시도 가능 (시도 횟수가 남아 있는 동안)</li>
 * </ul>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public enum ErrorCategory {

    /**
     * 인증 실패 (예: 401, 만료된 자격 증명).
     */
    AUTHENTICATION(false),

    /**
     * 권한 없음 (예: rate-limit 신호가 아닌 403). 수동 조치 필요.
     */
    AUTHORIZATION(false),

    /**
     * 잘못된 요청 (예: 400). 호출자 버그.
     */
    VALIDATION(false),

    /**
     * 명시적인 rate-limit 신호 (예: 429, "rate limit" 메시지를 가진 403).
     */
    RATE_LIMITED(true),

    /**
     * 일시적 장애 (네트워크 오류, 5xx 등).
     */
    TRANSIENT(true);

    private final boolean retryable;

    ErrorCategory(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * 재시도 가능 여부.
     *
     * @return 재시도 가능하면 true
     */
    public boolean isRetryable() {
        return retryable;
    }
}
