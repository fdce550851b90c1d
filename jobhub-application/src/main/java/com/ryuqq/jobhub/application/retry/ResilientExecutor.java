package com.ryuqq.jobhub.application.retry;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Rate Limit + 재시도 실행기.
 *
 * <p>외부 서비스 호출 하나를 감싸 다음을 수행합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * ATTEMPT → 성공 → DONE
 * ATTEMPT → 실패 → CLASSIFY
 * CLASSIFY → 재시도 불가 → FAIL
 * CLASSIFY → 재시도 가능 &amp; 시도 남음 → BACKOFF → ATTEMPT
 * CLASSIFY → 재시도 가능 &amp; 시도 소진 → FAIL
 * </pre>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>모든 ATTEMPT 전에 Rate Limiter 허용을 기다림</li>
 *   <li>실패 시 마지막 원본 예외를 래핑 없이 전달</li>
 *   <li>반환된 Future를 취소하면 이후 시도와 백오프가 중단됨</li>
 * </ul>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public interface ResilientExecutor {

    /**
     * 작업 실행.
     *
     * @param operationName 로깅용 작업 이름
     * @param operation 호출마다 새 시도를 시작하는 작업
     * @param <T> 결과 타입
     * @return 결과 Future (실패 시 원본 예외로 완료)
     * @throws IllegalArgumentException operation이 null인 경우
     */
    <T> CompletableFuture<T> execute(String operationName, Supplier<? extends CompletionStage<T>> operation);
}
