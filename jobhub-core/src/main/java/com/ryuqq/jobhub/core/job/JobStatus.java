package com.ryuqq.jobhub.core.job;

/**
 * 에이전트 작업 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * QUEUED → PROCESSING → COMPLETED
 *                    ↘ FAILED
 * QUEUED → FAILED
 * </pre>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public enum JobStatus {

    QUEUED("queued"),

    PROCESSING("processing"),

    COMPLETED("completed"),

    FAILED("failed");

    private final String wireName;

    JobStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 클라이언트 메시지에 사용하는 이름.
     *
     * @return 소문자 상태 이름
     */
    public String wireName() {
        return wireName;
    }

    /**
     * 종료 상태 여부.
     *
     * @return COMPLETED 또는 FAILED이면 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
