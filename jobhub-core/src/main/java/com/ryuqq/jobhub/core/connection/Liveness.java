package com.ryuqq.jobhub.core.connection;

/**
 * 연결 생존 마커.
 *
 * <p>ALIVE → (liveness tick, ping 전송) → PENDING → (pong 수신) → ALIVE.
 * PENDING 상태에서 다음 tick을 맞으면 DEAD가 되어 강제 종료됩니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public enum Liveness {
    ALIVE,
    PENDING,
    DEAD
}
