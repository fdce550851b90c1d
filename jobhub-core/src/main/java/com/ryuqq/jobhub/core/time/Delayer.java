package com.ryuqq.jobhub.core.time;

import java.util.concurrent.CompletableFuture;

/**
 * 비블로킹 지연 SPI.
 *
 * <p>Rate Limit 대기와 Backoff 대기는 스레드를 점유하지 않고 이 SPI를 통해 양보(yield)합니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Delayer {

    /**
     * 지정 시간 후 완료되는 Future 반환.
     *
     * @param delayMs 지연 시간 (밀리초, 0 이상)
     * @return 지연 후 완료되는 Future
     * @throws IllegalArgumentException delayMs가 음수인 경우
     */
    CompletableFuture<Void> delay(long delayMs);
}
