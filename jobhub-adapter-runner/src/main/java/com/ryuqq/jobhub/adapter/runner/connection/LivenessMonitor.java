package com.ryuqq.jobhub.adapter.runner.connection;

import com.ryuqq.jobhub.core.connection.Connection;
import com.ryuqq.jobhub.core.connection.ConnectionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 하트비트 기반 연결 생존 감시.
 *
 * <p><strong>tick 동작 (열린 연결마다):</strong></p>
 * <pre>
 * liveness == PENDING (직전 tick 이후 pong 없음) → terminate + unregister
 * 그 외                                         → PENDING 으로 표시 + ping 전송
 * pong 수신                                     → ALIVE
 * </pre>
 *
 * <p>감지 지연은 정확히 한 번의 누락된 간격이며, 그보다 빨리 종료하지 않습니다.
 * 하트비트 타임아웃은 오류가 아닌 정상 수명 주기 이벤트입니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class LivenessMonitor {

    private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);

    private final ConnectionRegistry registry;
    private final LivenessConfig config;
    private ScheduledFuture<?> task;

    /**
     * 생성자.
     *
     * @param registry 연결 Registry
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LivenessMonitor(ConnectionRegistry registry, LivenessConfig config) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.registry = registry;
        this.config = config;
    }

    /**
     * 한 번의 tick 수행.
     *
     * <p>연결별 실패는 로깅 후 격리되어 다른 연결 처리를 방해하지 않습니다.</p>
     *
     * @return 이번 tick에 종료된 연결 수
     */
    public int tick() {
        int evicted = 0;
        for (Connection connection : registry.allConnections()) {
            if (connection.getState() != ConnectionState.OPEN) {
                continue;
            }
            try {
                if (connection.awaitPong()) {
                    connection.ping();
                } else {
                    log.info("Evicting unresponsive {} of {}", connection.getId(), connection.getUserId());
                    connection.terminate();
                    registry.unregister(connection.getUserId(), connection);
                    evicted++;
                }
            } catch (RuntimeException e) {
                log.warn("Liveness check failed for {}", connection.getId(), e);
            }
        }
        if (evicted > 0) {
            log.debug("Liveness tick evicted {} connections", evicted);
        }
        return evicted;
    }

    /**
     * 고정 간격 tick 시작.
     *
     * @param scheduler 예약 실행기 (수명은 호출자가 관리)
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (task != null) {
            throw new IllegalStateException("LivenessMonitor already started");
        }
        long interval = config.heartbeatIntervalMs();
        task = scheduler.scheduleAtFixedRate(this::safeTick, interval, interval, TimeUnit.MILLISECONDS);
        log.info("LivenessMonitor started (interval: {}ms)", interval);
    }

    /**
     * tick 중단. 여러 번 호출해도 안전합니다.
     */
    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.info("LivenessMonitor stopped");
        }
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            // 예외가 전파되면 이후 예약 실행이 중단됨
            log.error("Liveness tick failed", e);
        }
    }
}
