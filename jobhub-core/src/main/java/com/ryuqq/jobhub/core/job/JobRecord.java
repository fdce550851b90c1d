package com.ryuqq.jobhub.core.job;

import com.ryuqq.jobhub.core.model.AgentType;
import com.ryuqq.jobhub.core.model.JobId;
import com.ryuqq.jobhub.core.model.UserId;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 작업 상태 스냅샷.
 *
 * <p>상태가 바뀔 때마다 새 인스턴스를 만들어 저장합니다 (불변).</p>
 *
 * @param jobId 작업 식별자
 * @param userId 작업 소유자
 * @param agentType 작업을 처리하는 에이전트
 * @param status 현재 상태
 * @param progress 진행률 (0~100)
 * @param result 완료 결과 (COMPLETED가 아니면 빈 맵)
 * @param errorMessage 실패 사유 (FAILED가 아니면 null)
 * @param updatedAt 마지막 갱신 시각
 * @author JobHub Team
 * @since 1.0.0
 */
public record JobRecord(
    JobId jobId,
    UserId userId,
    AgentType agentType,
    JobStatus status,
    int progress,
    Map<String, Object> result,
    String errorMessage,
    Instant updatedAt
) {

    public JobRecord {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        if (agentType == null) {
            throw new IllegalArgumentException("agentType cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("progress must be between 0 and 100 (current: " + progress + ")");
        }
        if (updatedAt == null) {
            throw new IllegalArgumentException("updatedAt cannot be null");
        }
        result = result == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    /**
     * 대기열에 들어간 작업 생성.
     *
     * @param jobId 작업 식별자
     * @param userId 소유자
     * @param agentType 에이전트
     * @param now 생성 시각
     * @return QUEUED 상태 레코드
     */
    public static JobRecord queued(JobId jobId, UserId userId, AgentType agentType, Instant now) {
        return new JobRecord(jobId, userId, agentType, JobStatus.QUEUED, 0, Map.of(), null, now);
    }

    /**
     * 진행률 갱신.
     *
     * @param newProgress 진행률 (0~100)
     * @param now 갱신 시각
     * @return PROCESSING 상태 레코드
     * @throws IllegalStateException 종료 상태에서 호출한 경우
     */
    public JobRecord withProgress(int newProgress, Instant now) {
        JobStatusTransition.validate(status, JobStatus.PROCESSING);
        return new JobRecord(jobId, userId, agentType, JobStatus.PROCESSING, newProgress, Map.of(), null, now);
    }

    /**
     * 작업 완료.
     *
     * @param output 결과
     * @param now 완료 시각
     * @return COMPLETED 상태 레코드 (진행률 100)
     * @throws IllegalStateException PROCESSING 상태가 아닌 경우
     */
    public JobRecord complete(Map<String, Object> output, Instant now) {
        JobStatusTransition.validate(status, JobStatus.COMPLETED);
        return new JobRecord(jobId, userId, agentType, JobStatus.COMPLETED, 100, output, null, now);
    }

    /**
     * 작업 실패.
     *
     * @param reason 실패 사유
     * @param now 실패 시각
     * @return FAILED 상태 레코드
     * @throws IllegalStateException 종료 상태에서 호출한 경우
     */
    public JobRecord fail(String reason, Instant now) {
        JobStatusTransition.validate(status, JobStatus.FAILED);
        return new JobRecord(jobId, userId, agentType, JobStatus.FAILED, progress, Map.of(), reason, now);
    }
}
