package com.ryuqq.jobhub.adapter.runner.routing;

import com.ryuqq.jobhub.core.connection.Connection;
import com.ryuqq.jobhub.core.contract.InboundFrame;

/**
 * 인바운드 제어 프레임 처리기.
 *
 * <p>트랜스포트 스레드에서 호출되므로 빠르게 반환하거나 작업을 넘겨야 합니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * 프레임 처리.
     *
     * @param connection 프레임을 보낸 연결
     * @param frame 디코딩된 프레임
     */
    void handle(Connection connection, InboundFrame frame);
}
