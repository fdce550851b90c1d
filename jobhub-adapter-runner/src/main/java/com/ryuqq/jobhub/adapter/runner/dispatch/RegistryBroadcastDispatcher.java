package com.ryuqq.jobhub.adapter.runner.dispatch;

import com.ryuqq.jobhub.adapter.runner.connection.ConnectionRegistry;
import com.ryuqq.jobhub.application.dispatch.BroadcastDispatcher;
import com.ryuqq.jobhub.core.connection.Connection;
import com.ryuqq.jobhub.core.contract.Notification;
import com.ryuqq.jobhub.core.contract.NotificationEnvelope;
import com.ryuqq.jobhub.core.model.UserId;
import com.ryuqq.jobhub.core.spi.EnvelopeCodec;
import com.ryuqq.jobhub.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.function.Predicate;

/**
 * Registry 기반 BroadcastDispatcher 구현.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. Notification + 현재 시각 → NotificationEnvelope
 * 2. 한 번만 직렬화
 * 3. Registry 스냅샷의 각 연결에 같은 payload 기록
 *    - OPEN이 아닌 연결은 건너뜀
 *    - 연결별 쓰기 실패는 로깅 후 격리
 * </pre>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class RegistryBroadcastDispatcher implements BroadcastDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RegistryBroadcastDispatcher.class);

    private final ConnectionRegistry registry;
    private final EnvelopeCodec codec;
    private final TimeSource timeSource;

    /**
     * 생성자.
     *
     * @param registry 연결 Registry
     * @param codec Envelope 코덱
     * @param timeSource 전송 시각 공급원
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RegistryBroadcastDispatcher(ConnectionRegistry registry, EnvelopeCodec codec, TimeSource timeSource) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.registry = registry;
        this.codec = codec;
        this.timeSource = timeSource;
    }

    @Override
    public int unicastToUser(UserId userId, Notification notification) {
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        if (notification == null) {
            throw new IllegalArgumentException("notification cannot be null");
        }
        Set<Connection> connections = registry.lookup(userId);
        if (connections.isEmpty()) {
            log.debug("No live connections for {}, dropping {}", userId, notification.type());
            return 0;
        }

        String payload = serialize(notification);
        int written = 0;
        for (Connection connection : connections) {
            if (write(connection, payload)) {
                written++;
            }
        }
        log.debug("Sent {} to {} ({} connections)", notification.type(), userId, written);
        return written;
    }

    @Override
    public int broadcastAll(Notification notification) {
        return broadcastAll(notification, userId -> true);
    }

    @Override
    public int broadcastAll(Notification notification, Predicate<UserId> userFilter) {
        if (notification == null) {
            throw new IllegalArgumentException("notification cannot be null");
        }
        if (userFilter == null) {
            throw new IllegalArgumentException("userFilter cannot be null");
        }

        String payload = serialize(notification);
        int written = 0;
        for (UserId userId : registry.connectedUsers()) {
            if (!matches(userFilter, userId)) {
                continue;
            }
            for (Connection connection : registry.lookup(userId)) {
                if (write(connection, payload)) {
                    written++;
                }
            }
        }
        log.info("Broadcast {} to {} connections", notification.type(), written);
        return written;
    }

    @Override
    public boolean sendTo(Connection connection, Notification notification) {
        if (connection == null) {
            throw new IllegalArgumentException("connection cannot be null");
        }
        if (notification == null) {
            throw new IllegalArgumentException("notification cannot be null");
        }
        return write(connection, serialize(notification));
    }

    private String serialize(Notification notification) {
        return codec.encode(NotificationEnvelope.stamp(notification, timeSource.now()));
    }

    private static boolean matches(Predicate<UserId> userFilter, UserId userId) {
        try {
            return userFilter.test(userId);
        } catch (RuntimeException e) {
            log.warn("Broadcast filter failed for {}, skipping", userId, e);
            return false;
        }
    }

    private static boolean write(Connection connection, String payload) {
        try {
            return connection.send(payload);
        } catch (RuntimeException e) {
            log.warn("Failed to write to {}", connection.getId(), e);
            return false;
        }
    }
}
