package com.ryuqq.jobhub.adapter.runner.routing;

import com.ryuqq.jobhub.application.dispatch.BroadcastDispatcher;
import com.ryuqq.jobhub.core.connection.Connection;
import com.ryuqq.jobhub.core.contract.InboundFrame;
import com.ryuqq.jobhub.core.contract.MessageTypes;
import com.ryuqq.jobhub.core.contract.Notification;
import com.ryuqq.jobhub.core.time.TimeSource;

import java.util.Map;

/**
 * {@code ping} → {@code pong {timestamp}} 응답.
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class PingHandler implements MessageHandler {

    private final BroadcastDispatcher dispatcher;
    private final TimeSource timeSource;

    public PingHandler(BroadcastDispatcher dispatcher, TimeSource timeSource) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.dispatcher = dispatcher;
        this.timeSource = timeSource;
    }

    @Override
    public void handle(Connection connection, InboundFrame frame) {
        Map<String, Object> data = Map.of("timestamp", timeSource.now().toString());
        dispatcher.sendTo(connection, Notification.of(MessageTypes.PONG, data));
    }
}
