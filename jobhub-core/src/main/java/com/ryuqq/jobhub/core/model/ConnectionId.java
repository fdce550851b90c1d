package com.ryuqq.jobhub.core.model;

import java.util.UUID;

/**
 * 실시간 Connection 식별자.
 *
 * <p>트랜스포트 채널마다 하나씩 발급되며, 로그와 Registry 추적에 사용됩니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class ConnectionId {

    private final String value;

    private ConnectionId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ConnectionId cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * ConnectionId 생성.
     *
     * @param value 식별자 값 (예: Netty channel id)
     * @return ConnectionId 인스턴스
     * @throws IllegalArgumentException 값이 null이거나 빈 문자열인 경우
     */
    public static ConnectionId of(String value) {
        return new ConnectionId(value);
    }

    /**
     * 무작위 ConnectionId 생성 (UUID 기반).
     *
     * @return 새 ConnectionId
     */
    public static ConnectionId random() {
        return new ConnectionId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConnectionId that = (ConnectionId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ConnectionId{" + value + '}';
    }
}
