package com.ryuqq.jobhub.adapter.runner.job;

import com.ryuqq.jobhub.application.dispatch.BroadcastDispatcher;
import com.ryuqq.jobhub.core.contract.MessageTypes;
import com.ryuqq.jobhub.core.contract.Notification;
import com.ryuqq.jobhub.core.job.JobRecord;
import com.ryuqq.jobhub.core.model.AgentType;
import com.ryuqq.jobhub.core.model.JobId;
import com.ryuqq.jobhub.core.model.UserId;
import com.ryuqq.jobhub.core.spi.JobStatusStore;
import com.ryuqq.jobhub.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 백그라운드 Agent의 Job 상태 보고 창구.
 *
 * <p><strong>처리 순서 (모든 호출):</strong></p>
 * <ol>
 *   <li>JobStatus 전이 검증 (종료 상태 이후 변경 불가)</li>
 *   <li>{@link JobStatusStore}에 새 레코드 저장 (재접속 클라이언트의 보정 기준)</li>
 *   <li>소유 사용자에게 job_progress / job_completed / job_failed 전송</li>
 * </ol>
 *
 * <p>실시간 전달은 best-effort 이며, 연결이 없어도 저장은 완료됩니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class JobStatusNotifier {

    private static final Logger log = LoggerFactory.getLogger(JobStatusNotifier.class);

    private final JobStatusStore store;
    private final BroadcastDispatcher dispatcher;
    private final TimeSource timeSource;

    public JobStatusNotifier(JobStatusStore store, BroadcastDispatcher dispatcher, TimeSource timeSource) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.store = store;
        this.dispatcher = dispatcher;
        this.timeSource = timeSource;
    }

    /**
     * 새 Job 등록.
     *
     * @throws IllegalStateException 같은 JobId가 이미 존재하는 경우
     */
    public synchronized JobRecord queued(JobId jobId, UserId userId, AgentType agentType) {
        if (store.find(jobId).isPresent()) {
            throw new IllegalStateException("Job already exists: " + jobId.getValue());
        }
        JobRecord record = JobRecord.queued(jobId, userId, agentType, timeSource.now());
        return publish(record, MessageTypes.JOB_PROGRESS);
    }

    /**
     * 진행률 갱신.
     *
     * @throws IllegalArgumentException 알 수 없는 JobId인 경우
     * @throws IllegalStateException 종료된 Job인 경우
     */
    public synchronized JobRecord progress(JobId jobId, int percent) {
        JobRecord next = load(jobId).withProgress(percent, timeSource.now());
        return publish(next, MessageTypes.JOB_PROGRESS);
    }

    /**
     * 완료 보고.
     */
    public synchronized JobRecord completed(JobId jobId, Map<String, Object> result) {
        JobRecord next = load(jobId).complete(result, timeSource.now());
        return publish(next, MessageTypes.JOB_COMPLETED);
    }

    /**
     * 실패 보고.
     */
    public synchronized JobRecord failed(JobId jobId, String errorMessage) {
        JobRecord next = load(jobId).fail(errorMessage, timeSource.now());
        return publish(next, MessageTypes.JOB_FAILED);
    }

    private JobRecord load(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        return store.find(jobId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown job: " + jobId.getValue()));
    }

    private JobRecord publish(JobRecord record, String type) {
        store.save(record);
        int written = dispatcher.unicastToUser(record.userId(), Notification.of(type, toData(record)));
        log.debug("{} {} {} ({}%) delivered to {} connections",
            type, record.jobId().getValue(), record.status(), record.progress(), written);
        return record;
    }

    private static Map<String, Object> toData(JobRecord record) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobId", record.jobId().getValue());
        data.put("agentType", record.agentType().wireName());
        data.put("status", record.status().wireName());
        data.put("progress", record.progress());
        if (!record.result().isEmpty()) {
            data.put("result", record.result());
        }
        if (record.errorMessage() != null) {
            data.put("error", record.errorMessage());
        }
        return data;
    }
}
