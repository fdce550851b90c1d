package com.ryuqq.jobhub.core.spi;

import com.ryuqq.jobhub.core.model.ConnectionId;

/**
 * 실시간 트랜스포트 핸들 SPI.
 *
 * <p>WebSocket 등 실제 트랜스포트를 추상화합니다. Registry, Liveness Monitor,
 * Dispatcher는 이 인터페이스만 알고 있으므로 실제 소켓 없이 테스트할 수 있습니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>{@link #sendText(String)}는 호출 순서대로 전송되어야 합니다 (FIFO)</li>
 *   <li>모든 메서드는 비블로킹이어야 합니다 (I/O는 트랜스포트 스레드에 위임)</li>
 *   <li>닫힌 채널에 대한 호출은 예외 없이 무시해도 됩니다</li>
 * </ul>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public interface ConnectionChannel {

    /**
     * 채널 식별자.
     *
     * @return ConnectionId
     */
    ConnectionId id();

    /**
     * 트랜스포트가 열려 있는지 확인.
     *
     * @return 열려 있으면 true
     */
    boolean isOpen();

    /**
     * UTF-8 텍스트 프레임 전송.
     *
     * @param payload 직렬화된 Envelope
     */
    void sendText(String payload);

    /**
     * 하트비트 ping 전송.
     */
    void ping();

    /**
     * 닫기 핸드셰이크 없이 즉시 종료.
     *
     * <p>종료 후 트랜스포트의 close 콜백이 Registry 정리를 유발합니다.</p>
     */
    void terminate();

    /**
     * close 코드와 사유를 포함한 정상 종료.
     *
     * @param code close 코드 (예: 1000 정상, 1008 정책 위반)
     * @param reason 사유
     */
    void close(int code, String reason);
}
