package com.ryuqq.jobhub.core.protection.noop;

import com.ryuqq.jobhub.core.protection.RateLimiter;
import com.ryuqq.jobhub.core.protection.RateLimiterConfig;

import java.util.concurrent.CompletableFuture;

/**
 * Rate Limiter NoOp 구현.
 *
 * <p>모든 요청을 즉시 허용합니다. 할당량 제약이 없는 협력자나 테스트에서 사용합니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    private static final RateLimiterConfig UNLIMITED_CONFIG =
        new RateLimiterConfig(Integer.MAX_VALUE, Integer.MAX_VALUE, Long.MAX_VALUE);

    @Override
    public boolean tryAcquire() {
        return true;
    }

    @Override
    public CompletableFuture<Void> acquire() {
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public RateLimiterConfig getConfig() {
        return UNLIMITED_CONFIG;
    }
}
