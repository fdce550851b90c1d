package com.ryuqq.jobhub.adapter.runner.retry;

import com.ryuqq.jobhub.application.retry.ResilientExecutor;
import com.ryuqq.jobhub.application.retry.RetryAttempt;
import com.ryuqq.jobhub.application.retry.RetryListener;
import com.ryuqq.jobhub.core.error.ErrorCategory;
import com.ryuqq.jobhub.core.error.ErrorClassifier;
import com.ryuqq.jobhub.core.protection.RateLimiter;
import com.ryuqq.jobhub.core.time.Delayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Rate Limiter 게이트 + 지수 백오프 재시도 실행기.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * attempt(k):
 *   1. rateLimiter.acquire()            (비동기 대기 가능)
 *   2. operation.get()
 *   3. 성공 → 결과 반환
 *   4. 실패 → classifier.classify(error)
 *      - 재시도 불가 → 원본 예외로 실패
 *      - 재시도 가능 &amp; k &lt; maxRetries → listener.onRetry, delay(backoff(k)), attempt(k+1)
 *      - 재시도 가능 &amp; k == maxRetries → 원본 예외로 실패 (Exhausted)
 * </pre>
 *
 * <p><strong>스레드 모델:</strong></p>
 * <ul>
 *   <li>대기(rate limit, backoff)는 {@link Delayer}로 비동기 처리되어 스레드를 점유하지 않음</li>
 *   <li>반환된 Future를 취소하면 다음 재개 지점에서 중단 (대기 중인 허용 요청도 취소)</li>
 * </ul>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class RateLimitedRetryExecutor implements ResilientExecutor {

    private static final Logger log = LoggerFactory.getLogger(RateLimitedRetryExecutor.class);

    private final RateLimiter rateLimiter;
    private final RetryConfig config;
    private final BackoffCalculator backoffCalculator;
    private final ErrorClassifier classifier;
    private final Delayer delayer;
    private final RetryListener listener;

    /**
     * 생성자 (기본 분류기, 리스너 없음).
     *
     * @param rateLimiter 시도별 허용 게이트
     * @param config 재시도 설정
     * @param delayer 백오프 대기 수단
     */
    public RateLimitedRetryExecutor(RateLimiter rateLimiter, RetryConfig config, Delayer delayer) {
        this(rateLimiter, config, new BackoffCalculator(config), ErrorClassifier.standard(), delayer, RetryListener.NONE);
    }

    /**
     * 생성자 (전체 주입).
     *
     * @param rateLimiter 시도별 허용 게이트
     * @param config 재시도 설정
     * @param backoffCalculator 백오프 계산기
     * @param classifier 실패 분류기
     * @param delayer 백오프 대기 수단
     * @param listener 재시도 관찰자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RateLimitedRetryExecutor(
        RateLimiter rateLimiter,
        RetryConfig config,
        BackoffCalculator backoffCalculator,
        ErrorClassifier classifier,
        Delayer delayer,
        RetryListener listener
    ) {
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (delayer == null) {
            throw new IllegalArgumentException("delayer cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.rateLimiter = rateLimiter;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
        this.classifier = classifier;
        this.delayer = delayer;
        this.listener = listener;
    }

    @Override
    public <T> CompletableFuture<T> execute(String operationName, Supplier<? extends CompletionStage<T>> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        String name = operationName == null ? "operation" : operationName;
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(name, operation, 0, result);
        return result;
    }

    private <T> void attempt(
        String name,
        Supplier<? extends CompletionStage<T>> operation,
        int retryIndex,
        CompletableFuture<T> result
    ) {
        if (result.isDone()) {
            log.debug("{} cancelled before attempt {}", name, retryIndex + 1);
            return;
        }

        CompletableFuture<Void> admission = rateLimiter.acquire();
        result.whenComplete((value, error) -> admission.cancel(false));
        admission
            .thenCompose(ignored -> {
                if (result.isDone()) {
                    return CompletableFuture.<T>completedFuture(null);
                }
                return invoke(operation);
            })
            .whenComplete((value, error) -> {
                if (result.isDone()) {
                    return;
                }
                if (error == null) {
                    if (retryIndex > 0) {
                        log.info("{} succeeded on attempt {}", name, retryIndex + 1);
                    }
                    result.complete(value);
                    return;
                }
                onFailure(name, operation, retryIndex, unwrap(error), result);
            });
    }

    private <T> void onFailure(
        String name,
        Supplier<? extends CompletionStage<T>> operation,
        int retryIndex,
        Throwable cause,
        CompletableFuture<T> result
    ) {
        ErrorCategory category = classifier.classify(cause);
        if (!category.isRetryable()) {
            log.warn("{} failed with non-retryable {} error: {}", name, category, cause.getMessage());
            result.completeExceptionally(cause);
            return;
        }
        if (retryIndex >= config.maxRetries()) {
            log.error("{} failed after {} attempts", name, retryIndex + 1, cause);
            result.completeExceptionally(cause);
            return;
        }

        long delayMs = backoffCalculator.calculate(retryIndex);
        log.warn("{} attempt {} failed ({}), retrying in {}ms: {}",
            name, retryIndex + 1, category, delayMs, cause.getMessage());
        notifyListener(new RetryAttempt(retryIndex, cause, delayMs));

        delayer.delay(delayMs).whenComplete((ignored, delayError) -> {
            if (delayError != null) {
                result.completeExceptionally(cause);
                return;
            }
            attempt(name, operation, retryIndex + 1, result);
        });
    }

    private void notifyListener(RetryAttempt attempt) {
        try {
            listener.onRetry(attempt);
        } catch (RuntimeException e) {
            log.warn("RetryListener failed for attempt {}", attempt.attemptIndex(), e);
        }
    }

    private static <T> CompletionStage<T> invoke(Supplier<? extends CompletionStage<T>> operation) {
        try {
            CompletionStage<T> stage = operation.get();
            if (stage == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("operation returned null stage"));
            }
            return stage;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
