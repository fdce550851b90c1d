package com.ryuqq.jobhub.core.connection;

import com.ryuqq.jobhub.core.model.ConnectionId;
import com.ryuqq.jobhub.core.model.UserId;
import com.ryuqq.jobhub.core.spi.ConnectionChannel;

/**
 * 인증된 사용자에 귀속된 하나의 라이브 양방향 채널.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>userId는 생성 후 변경되지 않음</li>
 *   <li>OPEN 상태이고 채널이 열려 있을 때만 쓰기 수행</li>
 *   <li>같은 연결에 대한 send 호출 순서는 전송 순서와 동일 (FIFO)</li>
 * </ul>
 *
 * <p><strong>Liveness 프로토콜:</strong></p>
 * <ul>
 *   <li>{@link #awaitPong()}: ALIVE면 PENDING으로 바꾸고 true, 이미 PENDING이면 DEAD로 바꾸고 false</li>
 *   <li>{@link #onPong()}: ALIVE로 복귀</li>
 * </ul>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class Connection {

    private final UserId userId;
    private final ConnectionChannel channel;
    private volatile ConnectionState state;
    private volatile Liveness liveness;

    private Connection(UserId userId, ConnectionChannel channel) {
        this.userId = userId;
        this.channel = channel;
        this.state = ConnectionState.CONNECTING;
        this.liveness = Liveness.ALIVE;
    }

    /**
     * CONNECTING 상태의 연결 생성.
     *
     * @param userId 인증된 사용자
     * @param channel 트랜스포트 채널
     * @return 새 연결
     * @throws IllegalArgumentException userId 또는 channel이 null인 경우
     */
    public static Connection of(UserId userId, ConnectionChannel channel) {
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        return new Connection(userId, channel);
    }

    public ConnectionId getId() {
        return channel.id();
    }

    public UserId getUserId() {
        return userId;
    }

    public ConnectionState getState() {
        return state;
    }

    public Liveness getLiveness() {
        return liveness;
    }

    /**
     * 메시지를 보낼 수 있는 상태인지 확인.
     *
     * @return OPEN이고 채널이 열려 있으면 true
     */
    public boolean isWritable() {
        return state == ConnectionState.OPEN && channel.isOpen();
    }

    /**
     * 등록 완료 후 OPEN으로 전이.
     *
     * @throws IllegalStateException CONNECTING 상태가 아닌 경우
     */
    public synchronized void markOpen() {
        ConnectionStateTransition.validate(state, ConnectionState.OPEN);
        state = ConnectionState.OPEN;
    }

    /**
     * 텍스트 프레임 전송.
     *
     * <p>쓰기 불가 상태면 아무것도 하지 않고 false를 반환합니다.</p>
     *
     * @param payload 직렬화된 메시지
     * @return 채널에 기록했으면 true
     */
    public synchronized boolean send(String payload) {
        if (!isWritable()) {
            return false;
        }
        channel.sendText(payload);
        return true;
    }

    /**
     * Liveness tick 처리.
     *
     * @return ping을 보내야 하면 true, 이미 pong을 기다리던 중이면(DEAD) false
     */
    public synchronized boolean awaitPong() {
        if (liveness == Liveness.PENDING || liveness == Liveness.DEAD) {
            liveness = Liveness.DEAD;
            return false;
        }
        liveness = Liveness.PENDING;
        return true;
    }

    /**
     * pong 수신. DEAD로 판정된 연결은 되살리지 않습니다.
     */
    public synchronized void onPong() {
        if (liveness != Liveness.DEAD) {
            liveness = Liveness.ALIVE;
        }
    }

    /**
     * ping 프레임 전송.
     */
    public void ping() {
        if (isWritable()) {
            channel.ping();
        }
    }

    /**
     * 정상 종료 시작 (close 프레임 전송).
     *
     * @param code close 코드
     * @param reason 종료 사유
     */
    public synchronized void close(int code, String reason) {
        if (!ConnectionStateTransition.isAllowed(state, ConnectionState.CLOSING)) {
            return;
        }
        state = ConnectionState.CLOSING;
        channel.close(code, reason);
    }

    /**
     * 강제 종료 (close 핸드셰이크 없이).
     */
    public synchronized void terminate() {
        if (state.isTerminal()) {
            return;
        }
        state = ConnectionState.CLOSED;
        channel.terminate();
    }

    /**
     * 트랜스포트가 닫혔음을 반영. 여러 번 호출해도 안전합니다.
     */
    public synchronized void markClosed() {
        state = ConnectionState.CLOSED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Connection)) return false;
        Connection that = (Connection) o;
        return getId().equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getId().hashCode();
    }

    @Override
    public String toString() {
        return "Connection{id=" + getId().getValue() + ", userId=" + userId.getValue() + ", state=" + state + "}";
    }
}
