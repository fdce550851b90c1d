package com.ryuqq.jobhub.adapter.runner.routing;

import com.ryuqq.jobhub.application.dispatch.BroadcastDispatcher;
import com.ryuqq.jobhub.core.connection.Connection;
import com.ryuqq.jobhub.core.contract.InboundFrame;
import com.ryuqq.jobhub.core.contract.MessageTypes;
import com.ryuqq.jobhub.core.contract.Notification;

import java.util.Map;

/**
 * {@code subscribe_to_jobs} → {@code subscription_confirmed} 응답.
 *
 * <p>연결된 모든 세션은 이미 자신의 Job 알림을 받으므로 별도 구독 상태를 두지 않습니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class SubscribeToJobsHandler implements MessageHandler {

    static final String JOB_UPDATES = "job_updates";

    private final BroadcastDispatcher dispatcher;

    public SubscribeToJobsHandler(BroadcastDispatcher dispatcher) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        this.dispatcher = dispatcher;
    }

    @Override
    public void handle(Connection connection, InboundFrame frame) {
        dispatcher.sendTo(connection,
            Notification.of(MessageTypes.SUBSCRIPTION_CONFIRMED, Map.of("subscription", JOB_UPDATES)));
    }
}
