package com.ryuqq.jobhub.application.retry;

/**
 * 재시도 관찰자.
 *
 * <p>백오프 대기 직전에 호출됩니다. 리스너에서 발생한 예외는 실행기에서 로깅 후 무시됩니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RetryListener {

    RetryListener NONE = attempt -> { };

    void onRetry(RetryAttempt attempt);
}
