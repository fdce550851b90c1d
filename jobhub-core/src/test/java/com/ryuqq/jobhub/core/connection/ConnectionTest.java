package com.ryuqq.jobhub.core.connection;

import com.ryuqq.jobhub.core.model.ConnectionId;
import com.ryuqq.jobhub.core.model.UserId;
import com.ryuqq.jobhub.core.spi.ConnectionChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Connection 상태 및 Liveness 테스트.
 *
 * @author JobHub Team
 * @since 1.0.0
 */
class ConnectionTest {

    private StubChannel channel;
    private Connection connection;

    @BeforeEach
    void setUp() {
        channel = new StubChannel();
        connection = Connection.of(UserId.of("user-1"), channel);
    }

    @Test
    void of_NewConnection_IsConnectingAndAlive() {
        assertEquals(ConnectionState.CONNECTING, connection.getState());
        assertEquals(Liveness.ALIVE, connection.getLiveness());
        assertEquals(channel.id(), connection.getId());
    }

    @Test
    void of_NullUserId_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Connection.of(null, channel));
    }

    @Test
    void send_BeforeOpen_DoesNotWrite() {
        // When
        boolean sent = connection.send("{}");

        // Then
        assertFalse(sent);
        assertTrue(channel.sent.isEmpty());
    }

    @Test
    void send_WhenOpen_WritesInCallOrder() {
        // Given
        connection.markOpen();

        // When
        connection.send("a");
        connection.send("b");
        connection.send("c");

        // Then
        assertEquals(List.of("a", "b", "c"), channel.sent);
    }

    @Test
    void send_ChannelClosedUnderneath_DoesNotWrite() {
        // Given
        connection.markOpen();
        channel.open = false;

        // When & Then
        assertFalse(connection.send("x"));
        assertTrue(channel.sent.isEmpty());
    }

    @Test
    void markOpen_Twice_ThrowsException() {
        connection.markOpen();

        assertThrows(IllegalStateException.class, () -> connection.markOpen());
    }

    @Test
    void awaitPong_FirstTickSendsPing_SecondTickWithoutPongIsDead() {
        // When & Then
        assertTrue(connection.awaitPong());
        assertEquals(Liveness.PENDING, connection.getLiveness());

        assertFalse(connection.awaitPong());
        assertEquals(Liveness.DEAD, connection.getLiveness());
    }

    @Test
    void onPong_BetweenTicks_KeepsConnectionAlive() {
        // Given
        connection.awaitPong();

        // When
        connection.onPong();

        // Then
        assertEquals(Liveness.ALIVE, connection.getLiveness());
        assertTrue(connection.awaitPong());
    }

    @Test
    void onPong_AfterDead_DoesNotRevive() {
        connection.awaitPong();
        connection.awaitPong();

        connection.onPong();

        assertEquals(Liveness.DEAD, connection.getLiveness());
    }

    @Test
    void close_WhenOpen_MovesToClosingAndSendsCloseFrame() {
        // Given
        connection.markOpen();

        // When
        connection.close(1001, "Server shutting down");

        // Then
        assertEquals(ConnectionState.CLOSING, connection.getState());
        assertEquals(1001, channel.closeCode);
        assertFalse(connection.send("late"));
    }

    @Test
    void terminate_ClosesChannelOnce() {
        // Given
        connection.markOpen();

        // When
        connection.terminate();
        connection.terminate();

        // Then
        assertEquals(ConnectionState.CLOSED, connection.getState());
        assertEquals(1, channel.terminations);
    }

    @Test
    void equals_BasedOnConnectionId() {
        Connection other = Connection.of(UserId.of("user-2"), channel);

        assertEquals(connection, other);
    }

    private static final class StubChannel implements ConnectionChannel {
        private final ConnectionId id = ConnectionId.random();
        private final List<String> sent = new ArrayList<>();
        private boolean open = true;
        private int terminations;
        private int closeCode;

        @Override
        public ConnectionId id() {
            return id;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void sendText(String payload) {
            sent.add(payload);
        }

        @Override
        public void ping() {
        }

        @Override
        public void terminate() {
            terminations++;
            open = false;
        }

        @Override
        public void close(int code, String reason) {
            closeCode = code;
        }
    }
}
