package com.ryuqq.jobhub.adapter.websocket;

import com.ryuqq.jobhub.adapter.inmemory.store.InMemoryJobStatusStore;
import com.ryuqq.jobhub.adapter.websocket.config.HubServerConfig;
import com.ryuqq.jobhub.core.job.JobRecord;
import com.ryuqq.jobhub.core.model.AgentType;
import com.ryuqq.jobhub.core.model.JobId;
import com.ryuqq.jobhub.core.model.UserId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * HubApplication 유닛 테스트.
 *
 * @author JobHub Team
 * @since 1.0.0
 */
class HubApplicationTest {

    private static final String SECRET = "test-secret-for-jobhub-websocket-0123456789";
    private static final UserId ALICE = UserId.of("alice");

    private InMemoryJobStatusStore store;
    private HubApplication application;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStatusStore();
        application = new HubApplication(new HubServerConfig(SECRET).withJobRetentionMs(60_000L), store);
    }

    @AfterEach
    void tearDown() {
        application.stop();
    }

    @Test
    void 보관_시간이_지난_종료_Job만_제거() {
        // given
        Instant now = Instant.now();
        Instant hourAgo = now.minusSeconds(3_600);
        store.save(JobRecord.queued(JobId.of("stale-failed"), ALICE, AgentType.EMAIL, hourAgo)
            .fail("bounced", hourAgo));
        store.save(JobRecord.queued(JobId.of("fresh-failed"), ALICE, AgentType.EMAIL, now)
            .fail("bounced", now));
        store.save(JobRecord.queued(JobId.of("long-running"), ALICE, AgentType.RESEARCH, hourAgo)
            .withProgress(20, hourAgo));

        // when
        int evicted = application.evictFinishedJobs();

        // then
        assertThat(evicted).isEqualTo(1);
        assertThat(store.find(JobId.of("stale-failed"))).isEmpty();
        assertThat(store.find(JobId.of("fresh-failed"))).isPresent();
        assertThat(store.find(JobId.of("long-running"))).isPresent();
    }
}
