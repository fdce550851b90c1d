package com.ryuqq.jobhub.adapter.runner.connection;

import com.ryuqq.jobhub.core.connection.Connection;
import com.ryuqq.jobhub.core.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 사용자 → 라이브 연결 집합 Registry.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>모든 등록된 연결은 정확히 한 사용자의 집합에 속함</li>
 *   <li>빈 집합은 즉시 제거됨 (연결 0개인 사용자 엔트리는 남지 않음)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>register/unregister는 사용자 키 단위로 {@code compute}/{@code computeIfPresent} 안에서 직렬화</li>
 *   <li>lookup은 스냅샷을 반환하므로 소켓 쓰기가 Registry 락을 잡지 않음</li>
 * </ul>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ConcurrentHashMap<UserId, Set<Connection>> connectionsByUser = new ConcurrentHashMap<>();

    /**
     * 연결 등록. 사용자 집합이 없으면 생성합니다.
     *
     * @param userId 소유 사용자
     * @param connection 등록할 연결
     * @throws IllegalArgumentException 파라미터가 null이거나 연결의 소유자가 다른 경우
     */
    public void register(UserId userId, Connection connection) {
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        if (connection == null) {
            throw new IllegalArgumentException("connection cannot be null");
        }
        if (!userId.equals(connection.getUserId())) {
            throw new IllegalArgumentException(
                "connection belongs to another user (expected: " + userId + ", actual: " + connection.getUserId() + ")"
            );
        }

        connectionsByUser.compute(userId, (key, existing) -> {
            Set<Connection> set = existing == null ? ConcurrentHashMap.newKeySet() : existing;
            set.add(connection);
            return set;
        });
        log.debug("Registered {} for {}", connection.getId(), userId);
    }

    /**
     * 연결 제거. 없는 연결을 제거해도 예외가 발생하지 않습니다 (멱등).
     *
     * @param userId 소유 사용자
     * @param connection 제거할 연결
     * @return 실제로 제거되었으면 true
     */
    public boolean unregister(UserId userId, Connection connection) {
        if (userId == null || connection == null) {
            return false;
        }
        AtomicBoolean removed = new AtomicBoolean(false);
        connectionsByUser.computeIfPresent(userId, (key, set) -> {
            removed.set(set.remove(connection));
            return set.isEmpty() ? null : set;
        });
        if (removed.get()) {
            log.debug("Unregistered {} for {}", connection.getId(), userId);
        }
        return removed.get();
    }

    /**
     * 사용자의 연결 스냅샷 (읽기 전용).
     *
     * @param userId 사용자
     * @return 연결 집합 스냅샷 (없으면 빈 집합)
     */
    public Set<Connection> lookup(UserId userId) {
        if (userId == null) {
            return Set.of();
        }
        Set<Connection> set = connectionsByUser.get(userId);
        return set == null ? Set.of() : Set.copyOf(set);
    }

    /**
     * 전체 연결 수.
     */
    public int connectionCount() {
        int total = 0;
        for (Set<Connection> set : connectionsByUser.values()) {
            total += set.size();
        }
        return total;
    }

    /**
     * 사용자의 연결 수.
     */
    public int connectionCount(UserId userId) {
        Set<Connection> set = userId == null ? null : connectionsByUser.get(userId);
        return set == null ? 0 : set.size();
    }

    /**
     * 연결이 하나 이상 있는 사용자 스냅샷.
     */
    public Set<UserId> connectedUsers() {
        return Set.copyOf(connectionsByUser.keySet());
    }

    /**
     * 전체 연결 스냅샷.
     */
    public List<Connection> allConnections() {
        List<Connection> all = new ArrayList<>();
        for (Set<Connection> set : connectionsByUser.values()) {
            all.addAll(set);
        }
        return all;
    }

    /**
     * 모든 연결을 강제 종료하고 Registry를 비웁니다 (서버 종료 시).
     *
     * @return 종료한 연결 수
     */
    public int closeAll() {
        List<Connection> all = allConnections();
        for (Connection connection : all) {
            try {
                connection.terminate();
            } catch (RuntimeException e) {
                log.warn("Failed to terminate {} during shutdown", connection.getId(), e);
            }
            unregister(connection.getUserId(), connection);
        }
        log.info("Closed {} connections", all.size());
        return all.size();
    }
}
