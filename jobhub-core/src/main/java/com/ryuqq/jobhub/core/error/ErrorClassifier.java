package com.ryuqq.jobhub.core.error;

/**
 * 실패를 {@link ErrorCategory}로 분류.
 *
 * <p>Retry Executor는 분류 결과의 {@link ErrorCategory#isRetryable()}만으로
 * 재시도 여부를 결정합니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * 실패 분류.
     *
     * @param error 실패 원인 (래핑된 예외일 수 있음)
     * @return 분류 결과 (null 불가)
     */
    ErrorCategory classify(Throwable error);

    /**
     * 상태 코드와 메시지 패턴 기반 기본 분류기.
     *
     * @return 기본 분류기
     */
    static ErrorClassifier standard() {
        return StandardErrorClassifier.INSTANCE;
    }
}
