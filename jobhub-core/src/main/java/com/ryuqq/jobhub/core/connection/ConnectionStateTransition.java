package com.ryuqq.jobhub.core.connection;

/**
 * 연결 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CONNECTING → OPEN, CLOSED</li>
 *   <li>OPEN → CLOSING, CLOSED</li>
 *   <li>CLOSING → CLOSED</li>
 * </ul>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class ConnectionStateTransition {

    private ConnectionStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이 가능 여부.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이이면 true
     */
    public static boolean isAllowed(ConnectionState from, ConnectionState to) {
        if (from == null || to == null || from.isTerminal()) {
            return false;
        }
        return switch (from) {
            case CONNECTING -> to == ConnectionState.OPEN || to == ConnectionState.CLOSED;
            case OPEN -> to == ConnectionState.CLOSING || to == ConnectionState.CLOSED;
            case CLOSING -> to == ConnectionState.CLOSED;
            case CLOSED -> false;
        };
    }

    /**
     * 상태 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ConnectionState from, ConnectionState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid connection state transition: %s → %s", from, to)
            );
        }
    }
}
