package com.ryuqq.jobhub.adapter.runner.ratelimit;

import com.ryuqq.jobhub.core.protection.RateLimiter;
import com.ryuqq.jobhub.core.protection.RateLimiterConfig;
import com.ryuqq.jobhub.core.time.Delayer;
import com.ryuqq.jobhub.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 초/분/일 고정 윈도우 Rate Limiter.
 *
 * <p>외부 자격 증명 하나당 인스턴스 하나를 사용합니다. 모든 윈도우는 생성 시점부터 시작합니다.</p>
 *
 * <p><strong>허용 알고리즘:</strong></p>
 * <pre>
 * 1. now ≥ resetAt 인 윈도우: count = 0, resetAt = now + duration
 * 2. 가득 찬 윈도우가 있으면: 해당 resetAt까지 비동기 대기 후 1부터 다시
 * 3. 아니면: 세 윈도우 count 모두 +1, 허용
 * </pre>
 *
 * <p><strong>주의:</strong> 고정 윈도우이므로 윈도우 경계에서 최대 약 2배의 버스트가 가능합니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class FixedWindowRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(FixedWindowRateLimiter.class);

    private final RateLimiterConfig config;
    private final TimeSource timeSource;
    private final Delayer delayer;
    private final List<RateWindow> windows;

    /**
     * 생성자.
     *
     * @param config 윈도우별 한도
     * @param timeSource 시각 공급원
     * @param delayer 비동기 대기 수단
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public FixedWindowRateLimiter(RateLimiterConfig config, TimeSource timeSource, Delayer delayer) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        if (delayer == null) {
            throw new IllegalArgumentException("delayer cannot be null");
        }
        this.config = config;
        this.timeSource = timeSource;
        this.delayer = delayer;

        long now = timeSource.currentTimeMillis();
        this.windows = List.of(
            new RateWindow(WindowGranularity.SECOND, config.maxPerSecond(), now),
            new RateWindow(WindowGranularity.MINUTE, config.maxPerMinute(), now),
            new RateWindow(WindowGranularity.DAY, config.maxPerDay(), now)
        );
    }

    @Override
    public boolean tryAcquire() {
        return admitOrWaitTime() == 0;
    }

    @Override
    public CompletableFuture<Void> acquire() {
        CompletableFuture<Void> admission = new CompletableFuture<>();
        admitWhenAvailable(admission);
        return admission;
    }

    @Override
    public RateLimiterConfig getConfig() {
        return config;
    }

    /**
     * 현재 윈도우의 허용 횟수.
     *
     * @param granularity 윈도우 단위
     * @return 현재 윈도우 안에서 허용된 호출 수
     */
    public synchronized long currentCount(WindowGranularity granularity) {
        for (RateWindow window : windows) {
            if (window.granularity() == granularity) {
                return window.count();
            }
        }
        throw new IllegalArgumentException("Unknown granularity: " + granularity);
    }

    /**
     * 허용될 때까지 윈도우 롤오버를 기다린 뒤 다시 시도. 이미 취소된 요청은 카운트하지 않습니다.
     */
    private void admitWhenAvailable(CompletableFuture<Void> admission) {
        if (admission.isDone()) {
            return;
        }
        long waitMs = admitOrWaitTime();
        if (waitMs == 0) {
            admission.complete(null);
            return;
        }
        log.debug("Rate limit reached, waiting {}ms for window rollover", waitMs);
        delayer.delay(waitMs).whenComplete((ignored, error) -> {
            if (error != null) {
                admission.completeExceptionally(error);
                return;
            }
            admitWhenAvailable(admission);
        });
    }

    /**
     * 허용 시 카운트를 반영하고 0을, 아니면 가장 늦게 풀리는 가득 찬 윈도우까지의 대기 시간을 반환.
     */
    private synchronized long admitOrWaitTime() {
        long now = timeSource.currentTimeMillis();
        for (RateWindow window : windows) {
            window.rollIfExpired(now);
        }

        long waitMs = 0;
        for (RateWindow window : windows) {
            if (window.isFull()) {
                waitMs = Math.max(waitMs, window.resetAt() - now);
            }
        }
        if (waitMs > 0) {
            return waitMs;
        }

        for (RateWindow window : windows) {
            window.increment();
        }
        return 0;
    }
}
