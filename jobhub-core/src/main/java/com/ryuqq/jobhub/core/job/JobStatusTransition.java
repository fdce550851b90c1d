package com.ryuqq.jobhub.core.job;

/**
 * 작업 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>QUEUED → PROCESSING, FAILED</li>
 *   <li>PROCESSING → PROCESSING (진행률 갱신), COMPLETED, FAILED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(COMPLETED, FAILED)에서는 어떤 상태로도 전이 불가</li>
 * </ul>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class JobStatusTransition {

    private JobStatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(JobStatus from, JobStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case QUEUED -> to == JobStatus.PROCESSING || to == JobStatus.FAILED;
            case PROCESSING -> to == JobStatus.PROCESSING || to == JobStatus.COMPLETED || to == JobStatus.FAILED;
            case COMPLETED, FAILED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }
}
