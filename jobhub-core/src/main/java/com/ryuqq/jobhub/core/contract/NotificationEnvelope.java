package com.ryuqq.jobhub.core.contract;

import java.time.Instant;
import java.util.Map;

/**
 * 전송 시점에 생성되는 불변 아웃바운드 Envelope.
 *
 * <p>Wire 형식: {@code {"type": string, "data": object, "timestamp": ISO-8601}}</p>
 *
 * @param type 메시지 타입
 * @param data 메시지 데이터 (불변)
 * @param timestamp 전송 시각
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public record NotificationEnvelope(
    String type,
    Map<String, Object> data,
    Instant timestamp
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public NotificationEnvelope {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }

    /**
     * Notification에 전송 시각을 붙여 Envelope 생성.
     *
     * @param notification 발신자 메시지
     * @param sentAt 전송 시각
     * @return 생성된 Envelope
     */
    public static NotificationEnvelope stamp(Notification notification, Instant sentAt) {
        if (notification == null) {
            throw new IllegalArgumentException("notification cannot be null");
        }
        return new NotificationEnvelope(notification.type(), notification.data(), sentAt);
    }
}
