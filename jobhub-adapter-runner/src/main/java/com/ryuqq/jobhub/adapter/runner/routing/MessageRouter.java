package com.ryuqq.jobhub.adapter.runner.routing;

import com.ryuqq.jobhub.application.dispatch.BroadcastDispatcher;
import com.ryuqq.jobhub.core.connection.Connection;
import com.ryuqq.jobhub.core.contract.InboundFrame;
import com.ryuqq.jobhub.core.contract.MessageTypes;
import com.ryuqq.jobhub.core.spi.AgentStatusProvider;
import com.ryuqq.jobhub.core.spi.EnvelopeCodec;
import com.ryuqq.jobhub.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 인바운드 프레임 라우터.
 *
 * <p>프레임의 {@code type} 필드로 처리기를 선택합니다.</p>
 *
 * <p><strong>실패 격리:</strong></p>
 * <ul>
 *   <li>형식이 잘못된 프레임: warn 로그 후 무시 (연결 유지)</li>
 *   <li>알 수 없는 type: debug 로그 후 무시</li>
 *   <li>처리기 예외: warn 로그 후 무시 (다른 연결에 영향 없음)</li>
 * </ul>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class MessageRouter {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final EnvelopeCodec codec;
    private final Map<String, MessageHandler> handlers;

    /**
     * 생성자.
     *
     * @param codec 프레임 디코더
     * @param handlers type → 처리기
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public MessageRouter(EnvelopeCodec codec, Map<String, MessageHandler> handlers) {
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (handlers == null) {
            throw new IllegalArgumentException("handlers cannot be null");
        }
        this.codec = codec;
        this.handlers = Map.copyOf(handlers);
    }

    /**
     * ping, subscribe_to_jobs, get_agent_status 처리기가 등록된 라우터 생성.
     *
     * @param codec 프레임 디코더
     * @param dispatcher 회신 전송자
     * @param timeSource pong 시각 공급원
     * @param statusProvider Agent 상태 공급원
     * @return 라우터
     */
    public static MessageRouter withDefaultHandlers(
        EnvelopeCodec codec,
        BroadcastDispatcher dispatcher,
        TimeSource timeSource,
        AgentStatusProvider statusProvider
    ) {
        Map<String, MessageHandler> handlers = new LinkedHashMap<>();
        handlers.put(MessageTypes.PING, new PingHandler(dispatcher, timeSource));
        handlers.put(MessageTypes.SUBSCRIBE_TO_JOBS, new SubscribeToJobsHandler(dispatcher));
        handlers.put(MessageTypes.GET_AGENT_STATUS, new AgentStatusHandler(dispatcher, statusProvider));
        return new MessageRouter(codec, handlers);
    }

    /**
     * 텍스트 프레임 하나를 처리.
     *
     * @param connection 프레임을 보낸 연결
     * @param text 원본 텍스트
     * @return 처리기가 정상 완료되었으면 true
     */
    public boolean route(Connection connection, String text) {
        InboundFrame frame;
        try {
            frame = codec.decode(text);
        } catch (IllegalArgumentException e) {
            log.warn("Malformed frame from {}: {}", connection.getId(), e.getMessage());
            return false;
        }

        MessageHandler handler = handlers.get(frame.type());
        if (handler == null) {
            log.debug("Unknown message type '{}' from {}", frame.type(), connection.getId());
            return false;
        }

        try {
            handler.handle(connection, frame);
            return true;
        } catch (RuntimeException e) {
            log.warn("Handler for '{}' failed on {}", frame.type(), connection.getId(), e);
            return false;
        }
    }
}
