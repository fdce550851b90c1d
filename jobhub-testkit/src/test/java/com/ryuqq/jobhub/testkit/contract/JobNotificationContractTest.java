package com.ryuqq.jobhub.testkit.contract;

import com.ryuqq.jobhub.adapter.runner.job.JobStatusNotifier;
import com.ryuqq.jobhub.adapter.runner.job.JobStoreAgentStatusProvider;
import com.ryuqq.jobhub.core.contract.InboundFrame;
import com.ryuqq.jobhub.core.contract.MessageTypes;
import com.ryuqq.jobhub.core.job.JobRecord;
import com.ryuqq.jobhub.core.job.JobStatus;
import com.ryuqq.jobhub.core.model.AgentType;
import com.ryuqq.jobhub.core.model.JobId;
import com.ryuqq.jobhub.core.model.UserId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: job status reporting.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>every status change is stored and pushed to all of the owner's connections</li>
 *   <li>an offline owner still gets the stored state for reconciliation</li>
 *   <li>terminal jobs reject further updates without storing or sending</li>
 * </ul>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
class JobNotificationContractTest extends AbstractContractTest {

    private static final JobId JOB = JobId.of("research-7");
    private static final UserId OWNER = UserId.of("alice");

    private JobStatusNotifier notifier;

    @BeforeEach
    void setUpNotifier() {
        notifier = new JobStatusNotifier(jobStore, dispatcher, time);
    }

    @Test
    void testLifecycle_StoredAndPushedToEveryOwnerConnection() {
        // Given
        RecordingChannel laptop = connect("alice");
        RecordingChannel phone = connect("alice");
        RecordingChannel other = connect("bob");

        // When
        notifier.queued(JOB, OWNER, AgentType.RESEARCH);
        time.advance(1_000);
        notifier.progress(JOB, 60);
        time.advance(1_000);
        notifier.completed(JOB, Map.of("profilesResearched", 12));

        // Then
        assertSentTypes(laptop, MessageTypes.JOB_PROGRESS, MessageTypes.JOB_PROGRESS, MessageTypes.JOB_COMPLETED);
        assertEquals(laptop.sent(), phone.sent());
        assertTrue(other.sent().isEmpty());

        InboundFrame done = codec.decode(laptop.sent().get(2));
        assertEquals("completed", done.data().get("status"));
        assertEquals(100, done.data().get("progress"));

        JobRecord stored = jobStore.find(JOB).orElseThrow();
        assertEquals(JobStatus.COMPLETED, stored.status());
        assertEquals(time.now(), stored.updatedAt());
    }

    @Test
    void testOfflineOwner_StateStillStoredForReconciliation() {
        // When
        notifier.queued(JOB, OWNER, AgentType.LEADGEN);
        notifier.progress(JOB, 30);

        // Then
        assertEquals(30, jobStore.find(JOB).orElseThrow().progress());
        Map<String, Object> status = new JobStoreAgentStatusProvider(jobStore).currentStatus(OWNER);
        @SuppressWarnings("unchecked")
        Map<String, Object> leadgen = (Map<String, Object>) status.get("leadgenAgent");
        assertEquals("active", leadgen.get("status"));
        assertEquals(1, leadgen.get("activeJobs"));
    }

    @Test
    void testTerminalJob_RejectsFurtherUpdates() {
        // Given
        RecordingChannel channel = connect("alice");
        notifier.queued(JOB, OWNER, AgentType.EMAIL);
        notifier.failed(JOB, "mailbox quota exceeded");

        // When / Then
        assertThrows(IllegalStateException.class, () -> notifier.progress(JOB, 10));
        assertThrows(IllegalStateException.class, () -> notifier.completed(JOB, Map.of()));
        assertSentTypes(channel, MessageTypes.JOB_PROGRESS, MessageTypes.JOB_FAILED);
        assertEquals(JobStatus.FAILED, jobStore.find(JOB).orElseThrow().status());
    }
}
