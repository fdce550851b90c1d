package com.ryuqq.jobhub.adapter.runner.time;

import com.ryuqq.jobhub.core.time.Delayer;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorService 기반 Delayer.
 *
 * <p>대기 중 스레드를 점유하지 않습니다. 반환된 Future를 취소하면 예약된 작업도 취소됩니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class ScheduledDelayer implements Delayer {

    private final ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param scheduler 예약 실행기 (수명은 호출자가 관리)
     * @throws IllegalArgumentException scheduler가 null인 경우
     */
    public ScheduledDelayer(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.scheduler = scheduler;
    }

    @Override
    public CompletableFuture<Void> delay(long delayMs) {
        if (delayMs <= 0) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        ScheduledFuture<?> scheduled = scheduler.schedule(() -> future.complete(null), delayMs, TimeUnit.MILLISECONDS);
        future.whenComplete((ignored, error) -> {
            if (future.isCancelled()) {
                scheduled.cancel(false);
            }
        });
        return future;
    }
}
