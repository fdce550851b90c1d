package com.ryuqq.jobhub.adapter.runner.routing;

import com.ryuqq.jobhub.application.dispatch.BroadcastDispatcher;
import com.ryuqq.jobhub.core.connection.Connection;
import com.ryuqq.jobhub.core.contract.InboundFrame;
import com.ryuqq.jobhub.core.contract.MessageTypes;
import com.ryuqq.jobhub.core.contract.Notification;
import com.ryuqq.jobhub.core.spi.AgentStatusProvider;

/**
 * {@code get_agent_status} → {@code agent_status_update} 응답.
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class AgentStatusHandler implements MessageHandler {

    private final BroadcastDispatcher dispatcher;
    private final AgentStatusProvider statusProvider;

    public AgentStatusHandler(BroadcastDispatcher dispatcher, AgentStatusProvider statusProvider) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (statusProvider == null) {
            throw new IllegalArgumentException("statusProvider cannot be null");
        }
        this.dispatcher = dispatcher;
        this.statusProvider = statusProvider;
    }

    @Override
    public void handle(Connection connection, InboundFrame frame) {
        dispatcher.sendTo(connection, Notification.of(
            MessageTypes.AGENT_STATUS_UPDATE,
            statusProvider.currentStatus(connection.getUserId())
        ));
    }
}
