package com.ryuqq.jobhub.adapter.inmemory.store;

import com.ryuqq.jobhub.core.job.JobRecord;
import com.ryuqq.jobhub.core.job.JobStatus;
import com.ryuqq.jobhub.core.model.AgentType;
import com.ryuqq.jobhub.core.model.JobId;
import com.ryuqq.jobhub.core.model.UserId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link InMemoryJobStatusStore}.
 *
 * @author JobHub Team
 * @since 1.0.0
 */
class InMemoryJobStatusStoreTest {

    private static final UserId ALICE = UserId.of("alice");
    private static final UserId BOB = UserId.of("bob");
    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    private InMemoryJobStatusStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStatusStore();
    }

    @Test
    void testSave_OverwritesPreviousRecordForSameJob() {
        // Given
        JobRecord queued = JobRecord.queued(JobId.of("job-1"), ALICE, AgentType.EMAIL, T0);
        store.save(queued);

        // When
        store.save(queued.withProgress(40, T0.plusSeconds(1)));

        // Then
        JobRecord stored = store.find(JobId.of("job-1")).orElseThrow();
        assertEquals(JobStatus.PROCESSING, stored.status());
        assertEquals(40, stored.progress());
        assertEquals(1, store.size());
    }

    @Test
    void testFind_UnknownJob_ReturnsEmpty() {
        assertTrue(store.find(JobId.of("missing")).isEmpty());
    }

    @Test
    void testFindByUser_ReturnsOnlyOwnedJobsOrderedByUpdatedAt() {
        // Given
        store.save(JobRecord.queued(JobId.of("late"), ALICE, AgentType.LEADGEN, T0.plusSeconds(30)));
        store.save(JobRecord.queued(JobId.of("early"), ALICE, AgentType.RESEARCH, T0));
        store.save(JobRecord.queued(JobId.of("other"), BOB, AgentType.EMAIL, T0.plusSeconds(10)));

        // When
        List<JobRecord> jobs = store.findByUser(ALICE);

        // Then
        assertEquals(2, jobs.size());
        assertEquals(JobId.of("early"), jobs.get(0).jobId());
        assertEquals(JobId.of("late"), jobs.get(1).jobId());
        assertTrue(store.findByUser(UserId.of("nobody")).isEmpty());
    }

    @Test
    void testNullArguments_AreRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.save(null));
        assertThrows(IllegalArgumentException.class, () -> store.find(null));
        assertThrows(IllegalArgumentException.class, () -> store.findByUser(null));
        assertThrows(IllegalArgumentException.class, () -> store.evictTerminalBefore(null));
    }

    @Test
    void testEvictTerminalBefore_RemovesOnlyOldFinishedJobs() {
        // Given
        JobRecord running = JobRecord.queued(JobId.of("running"), ALICE, AgentType.LEADGEN, T0)
            .withProgress(10, T0);
        store.save(running);
        store.save(JobRecord.queued(JobId.of("old-completed"), ALICE, AgentType.RESEARCH, T0)
            .withProgress(50, T0)
            .complete(Map.of("profiles", 3), T0.plusSeconds(10)));
        store.save(JobRecord.queued(JobId.of("old-failed"), BOB, AgentType.EMAIL, T0).fail("bounced", T0));
        store.save(JobRecord.queued(JobId.of("recent-failed"), BOB, AgentType.EMAIL, T0)
            .fail("bounced", T0.plusSeconds(3_600)));

        // When
        int evicted = store.evictTerminalBefore(T0.plusSeconds(60));

        // Then
        assertEquals(2, evicted);
        assertTrue(store.find(JobId.of("running")).isPresent());
        assertTrue(store.find(JobId.of("recent-failed")).isPresent());
        assertTrue(store.find(JobId.of("old-failed")).isEmpty());
        assertTrue(store.find(JobId.of("old-completed")).isEmpty());
    }

    @Test
    void testClear_RemovesEverything() {
        store.save(JobRecord.queued(JobId.of("job-1"), ALICE, AgentType.EMAIL, T0));

        store.clear();

        assertEquals(0, store.size());
        assertTrue(store.find(JobId.of("job-1")).isEmpty());
    }
}
