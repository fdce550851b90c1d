package com.ryuqq.jobhub.core.connection;

/**
 * 연결 수명 주기 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CONNECTING → OPEN → CLOSING → CLOSED
 * CONNECTING → CLOSED
 * OPEN → CLOSED
 * </pre>
 *
 * <p>OPEN 상태의 연결만 메시지를 전달받습니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public enum ConnectionState {

    /**
     * 핸드셰이크 진행 중. 아직 Registry에 노출되지 않음.
     */
    CONNECTING,

    /**
     * 인증 및 등록 완료. 메시지 송수신 가능.
     */
    OPEN,

    /**
     * 정상 종료 진행 중 (close 프레임 전송됨).
     */
    CLOSING,

    /**
     * 종료됨 (종료 상태).
     */
    CLOSED;

    /**
     * 종료 상태 여부.
     *
     * @return CLOSED이면 true
     */
    public boolean isTerminal() {
        return this == CLOSED;
    }
}
