package com.ryuqq.jobhub.core.connection;

import org.junit.jupiter.api.Test;

import static com.ryuqq.jobhub.core.connection.ConnectionState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ConnectionStateTransition 테스트.
 *
 * @author JobHub Team
 * @since 1.0.0
 */
class ConnectionStateTransitionTest {

    // ========== 정상 전이 ==========

    @Test
    void validate_AllowedTransitions_Succeed() {
        assertDoesNotThrow(() -> ConnectionStateTransition.validate(CONNECTING, OPEN));
        assertDoesNotThrow(() -> ConnectionStateTransition.validate(CONNECTING, CLOSED));
        assertDoesNotThrow(() -> ConnectionStateTransition.validate(OPEN, CLOSING));
        assertDoesNotThrow(() -> ConnectionStateTransition.validate(OPEN, CLOSED));
        assertDoesNotThrow(() -> ConnectionStateTransition.validate(CLOSING, CLOSED));
    }

    // ========== 불법 전이 ==========

    @Test
    void validate_FromClosed_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> ConnectionStateTransition.validate(CLOSED, OPEN)
        );
        assertTrue(exception.getMessage().contains("CLOSED → OPEN"));
    }

    @Test
    void validate_ClosingBackToOpen_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> ConnectionStateTransition.validate(CLOSING, OPEN));
    }

    @Test
    void validate_ConnectingToClosing_ThrowsException() {
        assertFalse(ConnectionStateTransition.isAllowed(CONNECTING, CLOSING));
        assertThrows(IllegalStateException.class, () -> ConnectionStateTransition.validate(CONNECTING, CLOSING));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> ConnectionStateTransition.validate(null, OPEN));
    }
}
