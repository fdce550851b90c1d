package com.ryuqq.jobhub.core.contract;

/**
 * Wire 메시지 타입 상수.
 *
 * <p>아웃바운드 타입 목록은 확장 가능하며, 협력 Agent가 만든 Job 상태 타입은
 * 그대로 통과합니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class MessageTypes {

    // Inbound
    public static final String PING = "ping";
    public static final String SUBSCRIBE_TO_JOBS = "subscribe_to_jobs";
    public static final String GET_AGENT_STATUS = "get_agent_status";

    // Outbound
    public static final String CONNECTION_ESTABLISHED = "connection_established";
    public static final String PONG = "pong";
    public static final String SUBSCRIPTION_CONFIRMED = "subscription_confirmed";
    public static final String AGENT_STATUS_UPDATE = "agent_status_update";
    public static final String SYSTEM_NOTIFICATION = "system_notification";
    public static final String MAINTENANCE_NOTIFICATION = "maintenance_notification";
    public static final String JOB_PROGRESS = "job_progress";
    public static final String JOB_COMPLETED = "job_completed";
    public static final String JOB_FAILED = "job_failed";

    private MessageTypes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
