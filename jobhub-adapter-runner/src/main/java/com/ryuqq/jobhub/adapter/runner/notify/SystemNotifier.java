package com.ryuqq.jobhub.adapter.runner.notify;

import com.ryuqq.jobhub.application.dispatch.BroadcastDispatcher;
import com.ryuqq.jobhub.core.contract.MessageTypes;
import com.ryuqq.jobhub.core.contract.Notification;
import com.ryuqq.jobhub.core.model.UserId;
import com.ryuqq.jobhub.core.spi.PlanDirectory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 운영 공지 브로드캐스트.
 *
 * <p><strong>메시지:</strong></p>
 * <ul>
 *   <li>system_notification: {message, notificationType: info|warning|error}</li>
 *   <li>maintenance_notification: {message, scheduledTime?}</li>
 * </ul>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class SystemNotifier {

    private final BroadcastDispatcher dispatcher;

    public SystemNotifier(BroadcastDispatcher dispatcher) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        this.dispatcher = dispatcher;
    }

    /**
     * 모든 연결에 시스템 알림 전송.
     *
     * @return 기록된 연결 수
     */
    public int sendSystemNotification(String message, NotificationLevel level) {
        return sendSystemNotification(message, level, userId -> true);
    }

    /**
     * 조건을 만족하는 사용자에게 시스템 알림 전송.
     *
     * @param message 알림 내용
     * @param level 알림 수준
     * @param userFilter 사용자 필터 (예: {@link #planFilter(PlanDirectory, Set)})
     * @return 기록된 연결 수
     * @throws IllegalArgumentException message 또는 level이 null인 경우
     */
    public int sendSystemNotification(String message, NotificationLevel level, Predicate<UserId> userFilter) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", message);
        data.put("notificationType", level.wireName());
        return dispatcher.broadcastAll(Notification.of(MessageTypes.SYSTEM_NOTIFICATION, data), userFilter);
    }

    /**
     * 점검 공지 전송.
     *
     * @param message 공지 내용
     * @param scheduledTime 점검 예정 시각 (null 가능)
     * @return 기록된 연결 수
     */
    public int sendMaintenanceNotification(String message, Instant scheduledTime) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", message);
        if (scheduledTime != null) {
            data.put("scheduledTime", scheduledTime.toString());
        }
        return dispatcher.broadcastAll(Notification.of(MessageTypes.MAINTENANCE_NOTIFICATION, data));
    }

    /**
     * 요금제 기반 사용자 필터.
     *
     * @param directory 요금제 조회 SPI
     * @param plans 허용할 요금제 이름
     * @return 요금제가 plans에 포함된 사용자만 통과시키는 필터
     */
    public static Predicate<UserId> planFilter(PlanDirectory directory, Set<String> plans) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (plans == null) {
            throw new IllegalArgumentException("plans cannot be null");
        }
        Set<String> allowed = Set.copyOf(plans);
        return userId -> directory.planOf(userId).map(allowed::contains).orElse(false);
    }
}
