package com.ryuqq.jobhub.core.contract;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Notification / NotificationEnvelope / InboundFrame 테스트.
 *
 * @author JobHub Team
 * @since 1.0.0
 */
class NotificationTest {

    @Test
    void of_NullData_UsesEmptyMap() {
        // When
        Notification notification = Notification.of("pong", null);

        // Then
        assertEquals("pong", notification.type());
        assertTrue(notification.data().isEmpty());
    }

    @Test
    void of_BlankType_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Notification.of(" "));
    }

    @Test
    void of_MutatingSourceMap_DoesNotAffectNotification() {
        // Given
        Map<String, Object> source = new HashMap<>();
        source.put("jobId", "j1");
        Notification notification = Notification.of("job_progress", source);

        // When
        source.put("progress", 50);

        // Then
        assertEquals(1, notification.data().size());
        assertThrows(UnsupportedOperationException.class, () -> notification.data().put("x", 1));
    }

    @Test
    void stamp_CopiesTypeAndData() {
        // Given
        Notification notification = Notification.of("job_completed", Map.of("jobId", "j1"));
        Instant now = Instant.parse("2024-01-15T10:00:00Z");

        // When
        NotificationEnvelope envelope = NotificationEnvelope.stamp(notification, now);

        // Then
        assertEquals("job_completed", envelope.type());
        assertEquals(Map.of("jobId", "j1"), envelope.data());
        assertEquals(now, envelope.timestamp());
    }

    @Test
    void stamp_NullTimestamp_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> NotificationEnvelope.stamp(Notification.of("pong"), null));
    }

    @Test
    void inboundFrame_AllowsNullValuesInData() {
        // Given
        Map<String, Object> data = new HashMap<>();
        data.put("filter", null);

        // When
        InboundFrame frame = new InboundFrame(MessageTypes.SUBSCRIBE_TO_JOBS, data);

        // Then
        assertTrue(frame.data().containsKey("filter"));
        assertNull(frame.data().get("filter"));
    }
}
