package com.ryuqq.jobhub.application.dispatch;

import com.ryuqq.jobhub.core.connection.Connection;
import com.ryuqq.jobhub.core.contract.Notification;
import com.ryuqq.jobhub.core.model.UserId;

import java.util.function.Predicate;

/**
 * 실시간 알림 전달자.
 *
 * <p>한 사용자의 모든 연결 또는 전체 사용자에게 Envelope를 전송합니다.
 * timestamp는 전송 시점에 Dispatcher가 채우며 호출자는 설정하지 않습니다.</p>
 *
 * <p><strong>전달 모델:</strong></p>
 * <ul>
 *   <li>Best-effort, 현재 열린 연결당 최대 1회 (at-most-once)</li>
 *   <li>연결이 없으면 조용히 무시 (재전송 큐 없음)</li>
 *   <li>같은 연결에 대한 쓰기 순서는 호출 순서와 동일 (FIFO)</li>
 *   <li>연결 간 순서는 보장하지 않음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Notification progress = Notification.of("job_progress", Map.of("jobId", "job-1", "progress", 40));
 * int written = dispatcher.unicastToUser(UserId.of("user-1"), progress);
 * </pre>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public interface BroadcastDispatcher {

    /**
     * 한 사용자의 모든 열린 연결에 전송.
     *
     * <p>Envelope는 한 번만 직렬화되어 모든 연결에 동일한 바이트로 기록됩니다.</p>
     *
     * @param userId 대상 사용자
     * @param notification 전송할 알림
     * @return 실제로 기록된 연결 수 (연결이 없으면 0)
     * @throws IllegalArgumentException userId 또는 notification이 null인 경우
     */
    int unicastToUser(UserId userId, Notification notification);

    /**
     * 연결된 모든 사용자에게 전송.
     *
     * @param notification 전송할 알림
     * @return 실제로 기록된 연결 수
     */
    int broadcastAll(Notification notification);

    /**
     * 조건을 만족하는 사용자에게만 전송 (예: 요금제 필터).
     *
     * @param notification 전송할 알림
     * @param userFilter 사용자 필터
     * @return 실제로 기록된 연결 수
     * @throws IllegalArgumentException userFilter가 null인 경우
     */
    int broadcastAll(Notification notification, Predicate<UserId> userFilter);

    /**
     * 특정 연결 하나에 전송 (요청-응답 회신용).
     *
     * @param connection 대상 연결
     * @param notification 전송할 알림
     * @return 기록되었으면 true
     */
    boolean sendTo(Connection connection, Notification notification);
}
