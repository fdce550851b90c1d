package com.ryuqq.jobhub.core.model;

/**
 * 백그라운드 Agent 종류.
 *
 * <p>각 Agent는 외부 서비스 호출 시 반드시 Retry Executor를 사용해야 합니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public enum AgentType {

    /**
     * 리드 발굴 Agent.
     */
    LEADGEN("leadgen"),

    /**
     * 프로필 리서치 Agent.
     */
    RESEARCH("research"),

    /**
     * 이메일 모니터링 Agent.
     */
    EMAIL("email");

    private final String wireName;

    AgentType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Envelope에 기록되는 이름.
     *
     * @return 소문자 wire 이름 (예: "leadgen")
     */
    public String wireName() {
        return wireName;
    }
}
