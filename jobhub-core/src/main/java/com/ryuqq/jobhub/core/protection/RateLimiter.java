package com.ryuqq.jobhub.core.protection;

import java.util.concurrent.CompletableFuture;

/**
 * Rate Limiter SPI.
 *
 * <p>외부 서비스 호출을 초/분/일 단위 고정 윈도우 한도 아래로 제한합니다.
 * 한 인스턴스는 하나의 외부 서비스와 하나의 인증 주체에 대한 호출을 담당합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RateLimiter limiter = ...;
 *
 * limiter.acquire()
 *     .thenCompose(v -> mailApi.send(message));
 * }</pre>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 즉시 허용 여부 확인 (비블로킹).
     *
     * <p>허용되면 모든 윈도우의 카운트를 1 증가시키고 true를 반환합니다.
     * 어느 한 윈도우라도 가득 찼으면 카운트를 변경하지 않고 false를 반환합니다.</p>
     *
     * @return true: 허용, false: 한도 초과
     */
    boolean tryAcquire();

    /**
     * 허용될 때까지 비동기로 대기.
     *
     * <p>반환된 Future는 세 윈도우 모두에 여유가 생기고 카운트가 반영된 뒤 완료됩니다.
     * 대기 중 스레드를 점유하지 않습니다. 허용 전에 Future를 취소하면 카운트를 반영하지 않습니다.</p>
     *
     * @return 허용 시 완료되는 Future
     */
    CompletableFuture<Void> acquire();

    /**
     * Rate Limiter 설정 정보 조회.
     *
     * @return 윈도우별 한도
     */
    RateLimiterConfig getConfig();
}
