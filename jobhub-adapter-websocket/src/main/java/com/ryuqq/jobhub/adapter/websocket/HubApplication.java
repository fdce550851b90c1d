package com.ryuqq.jobhub.adapter.websocket;

import com.ryuqq.jobhub.adapter.inmemory.store.InMemoryJobStatusStore;
import com.ryuqq.jobhub.adapter.runner.codec.JacksonEnvelopeCodec;
import com.ryuqq.jobhub.adapter.runner.connection.ConnectionAuthenticator;
import com.ryuqq.jobhub.adapter.runner.connection.ConnectionRegistry;
import com.ryuqq.jobhub.adapter.runner.connection.LivenessConfig;
import com.ryuqq.jobhub.adapter.runner.connection.LivenessMonitor;
import com.ryuqq.jobhub.adapter.runner.dispatch.RegistryBroadcastDispatcher;
import com.ryuqq.jobhub.adapter.runner.job.JobStatusNotifier;
import com.ryuqq.jobhub.adapter.runner.job.JobStoreAgentStatusProvider;
import com.ryuqq.jobhub.adapter.runner.notify.SystemNotifier;
import com.ryuqq.jobhub.adapter.runner.ratelimit.FixedWindowRateLimiter;
import com.ryuqq.jobhub.adapter.runner.retry.BackoffCalculator;
import com.ryuqq.jobhub.adapter.runner.retry.RateLimitedRetryExecutor;
import com.ryuqq.jobhub.adapter.runner.routing.MessageRouter;
import com.ryuqq.jobhub.adapter.runner.time.ScheduledDelayer;
import com.ryuqq.jobhub.adapter.websocket.auth.JwtCredentialVerifier;
import com.ryuqq.jobhub.adapter.websocket.config.HubServerConfig;
import com.ryuqq.jobhub.adapter.websocket.server.HubServer;
import com.ryuqq.jobhub.application.dispatch.BroadcastDispatcher;
import com.ryuqq.jobhub.application.retry.ResilientExecutor;
import com.ryuqq.jobhub.core.error.ErrorClassifier;
import com.ryuqq.jobhub.core.spi.JobStatusStore;
import com.ryuqq.jobhub.core.time.Delayer;
import com.ryuqq.jobhub.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 프로세스 단위 조립 지점.
 *
 * <p>모든 컴포넌트를 한 번만 생성하여 명시적으로 연결합니다. 알림을 보내야 하는
 * 백그라운드 Agent는 전역 접근 대신 이 인스턴스가 노출하는
 * {@link #jobStatusNotifier()}, {@link #systemNotifier()}, {@link #resilientExecutor()}를
 * 주입받아 사용합니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class HubApplication {

    private static final Logger log = LoggerFactory.getLogger(HubApplication.class);

    private static final long MAX_EVICTION_INTERVAL_MS = 60_000L;

    private final ScheduledExecutorService scheduler;
    private final TimeSource timeSource;
    private final long jobRetentionMs;
    private final ConnectionRegistry registry;
    private final BroadcastDispatcher dispatcher;
    private final JobStatusStore jobStatusStore;
    private final JobStatusNotifier jobStatusNotifier;
    private final SystemNotifier systemNotifier;
    private final ResilientExecutor resilientExecutor;
    private final HubServer server;

    /**
     * 설정으로 전체 컴포넌트 조립.
     *
     * @param config 서버 설정
     */
    public HubApplication(HubServerConfig config) {
        this(config, new InMemoryJobStatusStore());
    }

    /**
     * 설정과 Job 저장소로 전체 컴포넌트 조립.
     *
     * @param config 서버 설정
     * @param jobStatusStore Job 상태 저장소
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public HubApplication(HubServerConfig config, JobStatusStore jobStatusStore) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (jobStatusStore == null) {
            throw new IllegalArgumentException("jobStatusStore cannot be null");
        }
        this.timeSource = TimeSource.SYSTEM;
        this.jobRetentionMs = config.jobRetentionMs();
        JacksonEnvelopeCodec codec = new JacksonEnvelopeCodec();

        this.scheduler = Executors.newScheduledThreadPool(2);
        this.registry = new ConnectionRegistry();
        this.dispatcher = new RegistryBroadcastDispatcher(registry, codec, timeSource);
        this.jobStatusStore = jobStatusStore;
        this.jobStatusNotifier = new JobStatusNotifier(jobStatusStore, dispatcher, timeSource);
        this.systemNotifier = new SystemNotifier(dispatcher);

        Delayer delayer = new ScheduledDelayer(scheduler);
        this.resilientExecutor = new RateLimitedRetryExecutor(
            new FixedWindowRateLimiter(config.rateLimiter(), timeSource, delayer),
            config.retry(),
            new BackoffCalculator(config.retry()),
            ErrorClassifier.standard(),
            delayer,
            attempt -> log.debug("Retry #{} scheduled in {}ms", attempt.attemptIndex() + 1, attempt.backoffDelayMs())
        );

        MessageRouter router = MessageRouter.withDefaultHandlers(
            codec, dispatcher, timeSource, new JobStoreAgentStatusProvider(jobStatusStore));
        ConnectionAuthenticator authenticator = new ConnectionAuthenticator(
            new JwtCredentialVerifier(config.jwtSecret()), config.tokenParameter());
        LivenessMonitor livenessMonitor = new LivenessMonitor(
            registry, new LivenessConfig(config.heartbeatIntervalMs()));

        this.server = new HubServer(config, authenticator, registry, dispatcher, router, livenessMonitor, scheduler);
    }

    /**
     * 서버 시작.
     *
     * @throws InterruptedException 바인드 대기 중 인터럽트된 경우
     */
    public void start() throws InterruptedException {
        server.start();
        long interval = Math.min(jobRetentionMs, MAX_EVICTION_INTERVAL_MS);
        scheduler.scheduleAtFixedRate(this::evictFinishedJobsSafely, interval, interval, TimeUnit.MILLISECONDS);
    }

    /**
     * 보관 시간이 지난 종료 Job 제거.
     *
     * @return 제거된 레코드 수
     */
    int evictFinishedJobs() {
        Instant cutoff = timeSource.now().minusMillis(jobRetentionMs);
        int evicted = jobStatusStore.evictTerminalBefore(cutoff);
        if (evicted > 0) {
            log.debug("Evicted {} finished jobs last updated before {}", evicted, cutoff);
        }
        return evicted;
    }

    private void evictFinishedJobsSafely() {
        // an exception would cancel the periodic task
        try {
            evictFinishedJobs();
        } catch (RuntimeException e) {
            log.warn("Job eviction failed", e);
        }
    }

    /**
     * 서버 종료 및 스케줄러 정리.
     */
    public void stop() {
        server.stop();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public HubServer server() {
        return server;
    }

    public ConnectionRegistry registry() {
        return registry;
    }

    public BroadcastDispatcher dispatcher() {
        return dispatcher;
    }

    public JobStatusStore jobStatusStore() {
        return jobStatusStore;
    }

    public JobStatusNotifier jobStatusNotifier() {
        return jobStatusNotifier;
    }

    public SystemNotifier systemNotifier() {
        return systemNotifier;
    }

    public ResilientExecutor resilientExecutor() {
        return resilientExecutor;
    }

    public static void main(String[] args) throws InterruptedException {
        HubServerConfig config = HubServerConfig.load();
        log.info("Starting JobHub with {}", config);

        HubApplication application = new HubApplication(config);
        Runtime.getRuntime().addShutdownHook(new Thread(application::stop, "jobhub-shutdown"));
        application.start();
    }
}
