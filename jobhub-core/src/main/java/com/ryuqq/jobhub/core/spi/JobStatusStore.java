package com.ryuqq.jobhub.core.spi;

import com.ryuqq.jobhub.core.job.JobRecord;
import com.ryuqq.jobhub.core.model.JobId;
import com.ryuqq.jobhub.core.model.UserId;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Job 상태 영속화 SPI.
 *
 * <p>실시간 전달은 best-effort / at-most-once 이므로, 재접속한 클라이언트는
 * 이 저장소의 상태를 조회하여 놓친 알림을 보정(reconcile)합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>thread-safe</li>
 *   <li>save()는 동일 JobId에 대해 마지막 기록으로 덮어씀 (upsert)</li>
 * </ul>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public interface JobStatusStore {

    /**
     * Job 상태 저장 (upsert).
     *
     * @param record 저장할 레코드
     * @throws IllegalArgumentException record가 null인 경우
     */
    void save(JobRecord record);

    /**
     * JobId로 조회.
     *
     * @param jobId Job ID
     * @return 레코드 (없으면 empty)
     */
    Optional<JobRecord> find(JobId jobId);

    /**
     * 사용자가 소유한 모든 Job 조회 (updatedAt 오름차순).
     *
     * @param userId 사용자 ID
     * @return 레코드 목록 (없으면 빈 목록)
     */
    List<JobRecord> findByUser(UserId userId);

    /**
     * 종료(COMPLETED/FAILED)된 지 오래된 Job 제거.
     *
     * <p>진행 중인 Job은 updatedAt과 무관하게 유지합니다.</p>
     *
     * @param cutoff 이 시각보다 이전에 마지막으로 갱신된 종료 Job을 제거
     * @return 제거된 레코드 수
     * @throws IllegalArgumentException cutoff가 null인 경우
     */
    int evictTerminalBefore(Instant cutoff);
}
