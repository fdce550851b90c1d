package com.ryuqq.jobhub.adapter.runner.dispatch;

import com.ryuqq.jobhub.adapter.runner.codec.JacksonEnvelopeCodec;
import com.ryuqq.jobhub.adapter.runner.connection.ConnectionRegistry;
import com.ryuqq.jobhub.adapter.runner.support.FakeChannel;
import com.ryuqq.jobhub.core.connection.Connection;
import com.ryuqq.jobhub.core.contract.Notification;
import com.ryuqq.jobhub.core.model.UserId;
import com.ryuqq.jobhub.core.time.TimeSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RegistryBroadcastDispatcher 유닛 테스트.
 *
 * @author JobHub Team
 * @since 1.0.0
 */
class RegistryBroadcastDispatcherTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");
    private static final UserId ALICE = UserId.of("alice");
    private static final UserId BOB = UserId.of("bob");

    private ConnectionRegistry registry;
    private RegistryBroadcastDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        TimeSource fixed = NOW::toEpochMilli;
        dispatcher = new RegistryBroadcastDispatcher(registry, new JacksonEnvelopeCodec(), fixed);
    }

    private FakeChannel connect(UserId userId) {
        FakeChannel channel = new FakeChannel();
        registry.register(userId, FakeChannel.openConnection(userId.getValue(), channel));
        return channel;
    }

    @Test
    void unicast_연결이_없으면_0건이고_예외없음() {
        int written = dispatcher.unicastToUser(ALICE, Notification.of("job_progress"));

        assertThat(written).isZero();
    }

    @Test
    void unicast_N개_연결에_동일한_payload를_N번_기록하고_timestamp를_채움() {
        // given
        FakeChannel tab1 = connect(ALICE);
        FakeChannel tab2 = connect(ALICE);
        FakeChannel other = connect(BOB);

        // when
        int written = dispatcher.unicastToUser(ALICE, Notification.of("job_completed", Map.of("jobId", "j1")));

        // then
        assertThat(written).isEqualTo(2);
        assertThat(tab1.sent()).hasSize(1);
        assertThat(tab1.sent()).isEqualTo(tab2.sent());
        assertThat(tab1.sent().get(0)).contains("\"timestamp\":\"2024-01-15T10:00:00Z\"");
        assertThat(other.sent()).isEmpty();
    }

    @Test
    void unicast_OPEN이_아닌_연결은_건너뜀() {
        // given
        FakeChannel open = connect(ALICE);
        FakeChannel closing = new FakeChannel();
        Connection closingConn = FakeChannel.openConnection("alice", closing);
        registry.register(ALICE, closingConn);
        closingConn.close(1000, "bye");

        // when
        int written = dispatcher.unicastToUser(ALICE, Notification.of("pong"));

        // then
        assertThat(written).isEqualTo(1);
        assertThat(open.sent()).hasSize(1);
        assertThat(closing.sent()).isEmpty();
    }

    @Test
    void 한_연결의_쓰기_실패가_다른_연결에_영향없음() {
        // given
        FakeChannel broken = connect(ALICE);
        broken.failOnSend();
        FakeChannel healthy = connect(ALICE);

        // when
        int written = dispatcher.unicastToUser(ALICE, Notification.of("job_progress"));

        // then
        assertThat(written).isEqualTo(1);
        assertThat(healthy.sent()).hasSize(1);
    }

    @Test
    void 같은_연결에_대한_쓰기는_호출_순서_유지() {
        FakeChannel tab = connect(ALICE);

        for (int i = 0; i < 5; i++) {
            dispatcher.unicastToUser(ALICE, Notification.of("job_progress", Map.of("progress", i * 20)));
        }

        assertThat(tab.sent()).hasSize(5);
        for (int i = 0; i < 5; i++) {
            assertThat(tab.sent().get(i)).contains("\"progress\":" + (i * 20));
        }
    }

    @Test
    void broadcastAll_필터를_만족하는_사용자에게만_전송() {
        // given
        FakeChannel alice = connect(ALICE);
        FakeChannel bob = connect(BOB);

        // when
        int written = dispatcher.broadcastAll(Notification.of("system_notification"), ALICE::equals);

        // then
        assertThat(written).isEqualTo(1);
        assertThat(alice.sent()).hasSize(1);
        assertThat(bob.sent()).isEmpty();
    }

    @Test
    void broadcastAll_필터_예외는_해당_사용자만_건너뜀() {
        FakeChannel alice = connect(ALICE);
        FakeChannel bob = connect(BOB);

        int written = dispatcher.broadcastAll(Notification.of("system_notification"), userId -> {
            if (userId.equals(BOB)) {
                throw new IllegalStateException("plan lookup failed");
            }
            return true;
        });

        assertThat(written).isEqualTo(1);
        assertThat(alice.sent()).hasSize(1);
        assertThat(bob.sent()).isEmpty();
    }

    @Test
    void broadcastAll_필터없이_전체_전송() {
        connect(ALICE);
        connect(ALICE);
        connect(BOB);

        assertThat(dispatcher.broadcastAll(Notification.of("maintenance_notification"))).isEqualTo(3);
    }

    @Test
    void null_인자_예외() {
        assertThatThrownBy(() -> dispatcher.unicastToUser(null, Notification.of("x")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> dispatcher.broadcastAll(Notification.of("x"), null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
