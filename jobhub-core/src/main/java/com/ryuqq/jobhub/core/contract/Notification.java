package com.ryuqq.jobhub.core.contract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 발신자가 구성하는 알림 메시지 (timestamp 없음).
 *
 * <p>Broadcast Dispatcher가 전송 시점에 timestamp를 붙여
 * {@link NotificationEnvelope}으로 변환합니다. 호출자는 timestamp를 직접 설정하지 않습니다.</p>
 *
 * <p>{@code data}는 불투명(opaque) 페이로드로 취급되며 변경 없이 그대로 전달됩니다.</p>
 *
 * @param type 메시지 타입 (예: job_progress, system_notification)
 * @param data 메시지 데이터 (null이면 빈 객체)
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public record Notification(
    String type,
    Map<String, Object> data
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException type이 null이거나 빈 문자열인 경우
     */
    public Notification {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        data = data == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * Notification 생성.
     *
     * @param type 메시지 타입
     * @param data 메시지 데이터
     * @return Notification 인스턴스
     */
    public static Notification of(String type, Map<String, Object> data) {
        return new Notification(type, data);
    }

    /**
     * 데이터 없는 Notification 생성.
     *
     * @param type 메시지 타입
     * @return Notification 인스턴스
     */
    public static Notification of(String type) {
        return new Notification(type, Map.of());
    }
}
