package com.ryuqq.jobhub.adapter.runner.notify;

/**
 * 시스템 알림 수준.
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public enum NotificationLevel {

    INFO("info"),

    WARNING("warning"),

    ERROR("error");

    private final String wireName;

    NotificationLevel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
