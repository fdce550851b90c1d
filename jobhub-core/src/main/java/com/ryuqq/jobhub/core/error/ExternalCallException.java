package com.ryuqq.jobhub.core.error;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * 외부 서비스 호출 실패.
 *
 * <p>메일, 인물 검색, LLM, 챗봇 API 등 외부 협력자의 실패를 표현하는 공통 예외입니다.
 * 상태 코드 또는 명시적 {@link ErrorCategory}를 분류 힌트로 전달합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * throw ExternalCallException.withStatus(429, "Too many requests");
 * throw ExternalCallException.classified(ErrorCategory.AUTHENTICATION, "refresh token revoked");
 * </pre>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public class ExternalCallException extends RuntimeException implements ClassificationHint {

    private static final int NO_STATUS = -1;

    private final int statusCode;
    private final ErrorCategory category;

    /**
     * 힌트 없는 예외 생성 (메시지 패턴으로만 분류됨).
     *
     * @param message 오류 메시지
     */
    public ExternalCallException(String message) {
        this(message, NO_STATUS, null, null);
    }

    /**
     * 상태 코드 포함 예외 생성.
     *
     * @param message 오류 메시지
     * @param statusCode 상태 코드 (0 이상)
     * @param cause 원인 (null 가능)
     */
    public ExternalCallException(String message, int statusCode, Throwable cause) {
        this(message, statusCode, null, cause);
    }

    private ExternalCallException(String message, int statusCode, ErrorCategory category, Throwable cause) {
        super(message, cause);
        if (statusCode < NO_STATUS) {
            throw new IllegalArgumentException("statusCode must be non-negative (current: " + statusCode + ")");
        }
        this.statusCode = statusCode;
        this.category = category;
    }

    /**
     * 상태 코드로 예외 생성.
     *
     * @param statusCode 상태 코드
     * @param message 오류 메시지
     * @return 예외 인스턴스
     */
    public static ExternalCallException withStatus(int statusCode, String message) {
        return new ExternalCallException(message, statusCode, null, null);
    }

    /**
     * 명시적 분류로 예외 생성.
     *
     * @param category 분류
     * @param message 오류 메시지
     * @return 예외 인스턴스
     * @throws IllegalArgumentException category가 null인 경우
     */
    public static ExternalCallException classified(ErrorCategory category, String message) {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        return new ExternalCallException(message, NO_STATUS, category, null);
    }

    @Override
    public OptionalInt statusCode() {
        return statusCode == NO_STATUS ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }

    @Override
    public Optional<ErrorCategory> category() {
        return Optional.ofNullable(category);
    }
}
