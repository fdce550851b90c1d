package com.ryuqq.jobhub.adapter.runner.job;

import com.ryuqq.jobhub.core.job.JobRecord;
import com.ryuqq.jobhub.core.job.JobStatus;
import com.ryuqq.jobhub.core.model.AgentType;
import com.ryuqq.jobhub.core.model.UserId;
import com.ryuqq.jobhub.core.spi.AgentStatusProvider;
import com.ryuqq.jobhub.core.spi.JobStatusStore;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JobStatusStore 기반 Agent 상태 공급원.
 *
 * <p><strong>응답 형태 (Agent 타입별):</strong></p>
 * <pre>
 * {
 *   "leadgenAgent":  {"status": "active", "activeJobs": 1, "queuedJobs": 2, "lastActivity": "2024-..."},
 *   "researchAgent": {"status": "idle",   "activeJobs": 0, "queuedJobs": 0, "lastActivity": null},
 *   "emailAgent":    {...}
 * }
 * </pre>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class JobStoreAgentStatusProvider implements AgentStatusProvider {

    private final JobStatusStore store;

    public JobStoreAgentStatusProvider(JobStatusStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public Map<String, Object> currentStatus(UserId userId) {
        List<JobRecord> jobs = store.findByUser(userId);
        Map<String, Object> status = new LinkedHashMap<>();
        for (AgentType agentType : AgentType.values()) {
            status.put(agentType.wireName() + "Agent", summarize(agentType, jobs));
        }
        return status;
    }

    private static Map<String, Object> summarize(AgentType agentType, List<JobRecord> jobs) {
        int active = 0;
        int queued = 0;
        Instant lastActivity = null;
        for (JobRecord job : jobs) {
            if (job.agentType() != agentType) {
                continue;
            }
            if (job.status() == JobStatus.PROCESSING) {
                active++;
            } else if (job.status() == JobStatus.QUEUED) {
                queued++;
            }
            if (lastActivity == null || job.updatedAt().isAfter(lastActivity)) {
                lastActivity = job.updatedAt();
            }
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("status", active > 0 ? "active" : "idle");
        summary.put("activeJobs", active);
        summary.put("queuedJobs", queued);
        summary.put("lastActivity", lastActivity == null ? null : lastActivity.toString());
        return summary;
    }
}
