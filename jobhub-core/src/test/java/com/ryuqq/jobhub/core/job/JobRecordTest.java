package com.ryuqq.jobhub.core.job;

import com.ryuqq.jobhub.core.model.AgentType;
import com.ryuqq.jobhub.core.model.JobId;
import com.ryuqq.jobhub.core.model.UserId;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JobRecord 테스트.
 *
 * @author JobHub Team
 * @since 1.0.0
 */
class JobRecordTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    private JobRecord queued() {
        return JobRecord.queued(JobId.of("job-1"), UserId.of("user-1"), AgentType.LEADGEN, T0);
    }

    @Test
    void queued_StartsAtZeroProgress() {
        JobRecord job = queued();

        assertEquals(JobStatus.QUEUED, job.status());
        assertEquals(0, job.progress());
        assertTrue(job.result().isEmpty());
        assertNull(job.errorMessage());
    }

    @Test
    void withProgress_ThenComplete_SetsProgressToHundred() {
        // When
        JobRecord done = queued()
            .withProgress(40, T0.plusSeconds(1))
            .complete(Map.of("leadsFound", 12), T0.plusSeconds(2));

        // Then
        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(100, done.progress());
        assertEquals(12, done.result().get("leadsFound"));
        assertEquals(T0.plusSeconds(2), done.updatedAt());
    }

    @Test
    void fail_KeepsLastProgress() {
        JobRecord failed = queued().withProgress(70, T0).fail("quota exhausted", T0.plusSeconds(5));

        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals(70, failed.progress());
        assertEquals("quota exhausted", failed.errorMessage());
    }

    @Test
    void complete_FromQueued_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> queued().complete(Map.of(), T0));
    }

    @Test
    void withProgress_OutOfRange_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> queued().withProgress(101, T0)
        );
        assertTrue(exception.getMessage().contains("current: 101"));
    }
}
