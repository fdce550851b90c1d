package com.ryuqq.jobhub.core.model;

/**
 * 백그라운드 Job 식별자.
 *
 * <p>Job의 영속 상태(JobStatusStore)와 실시간 알림 Envelope의 {@code jobId} 필드를 연결합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class JobId {

    private final String value;

    private JobId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("JobId cannot be null or blank");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("JobId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * JobId 생성.
     *
     * @param value JobId 값
     * @return JobId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static JobId of(String value) {
        return new JobId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobId jobId = (JobId) o;
        return value.equals(jobId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "JobId{" + value + '}';
    }
}
