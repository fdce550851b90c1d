package com.ryuqq.jobhub.adapter.websocket.config;

import com.ryuqq.jobhub.adapter.runner.retry.RetryConfig;
import com.ryuqq.jobhub.core.protection.RateLimiterConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Properties;

/**
 * 알림 허브 서버 설정.
 *
 * <p><strong>프로퍼티 키 ({@code jobhub.properties}):</strong></p>
 * <ul>
 *   <li>jobhub.server.host / jobhub.server.port / jobhub.server.path</li>
 *   <li>jobhub.server.max-frame-bytes</li>
 *   <li>jobhub.auth.token-parameter / jobhub.auth.jwt-secret</li>
 *   <li>jobhub.liveness.heartbeat-interval-ms</li>
 *   <li>jobhub.jobs.retention-ms</li>
 *   <li>jobhub.ratelimit.max-per-second / max-per-minute / max-per-day</li>
 *   <li>jobhub.retry.max-retries / base-delay-ms / multiplier / max-delay-ms / jitter-factor</li>
 * </ul>
 *
 * <p>환경 변수 {@value #JWT_SECRET_ENV}가 있으면 jwt-secret 프로퍼티보다 우선합니다.</p>
 *
 * @param host 바인드 주소
 * @param port 포트 (0이면 임의 포트)
 * @param path WebSocket 엔드포인트 경로
 * @param tokenParameter 인증 토큰 쿼리 파라미터 이름
 * @param maxFrameBytes 수신 프레임 최대 크기
 * @param heartbeatIntervalMs 하트비트 간격
 * @param jobRetentionMs 종료된 Job 상태를 보관하는 시간
 * @param jwtSecret HMAC 서명 키
 * @param rateLimiter 외부 호출 한도
 * @param retry 외부 호출 재시도 정책
 * @author JobHub Team
 * @since 1.0.0
 */
public record HubServerConfig(
    String host,
    int port,
    String path,
    String tokenParameter,
    int maxFrameBytes,
    long heartbeatIntervalMs,
    long jobRetentionMs,
    String jwtSecret,
    RateLimiterConfig rateLimiter,
    RetryConfig retry
) {

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 5000;
    public static final String DEFAULT_PATH = "/ws";
    public static final String DEFAULT_TOKEN_PARAMETER = "token";
    public static final int DEFAULT_MAX_FRAME_BYTES = 65_536;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_JOB_RETENTION_MS = 3_600_000L;
    public static final double DEFAULT_RETRY_JITTER = 0.2;

    public static final String JWT_SECRET_ENV = "JOBHUB_JWT_SECRET";
    public static final String PROPERTIES_RESOURCE = "jobhub.properties";

    public HubServerConfig {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be blank");
        }
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port must be between 0 and 65535 (current: " + port + ")");
        }
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/' (current: " + path + ")");
        }
        if (tokenParameter == null || tokenParameter.isBlank()) {
            throw new IllegalArgumentException("tokenParameter cannot be blank");
        }
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive (current: " + maxFrameBytes + ")");
        }
        if (heartbeatIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "heartbeatIntervalMs must be positive (current: " + heartbeatIntervalMs + ")"
            );
        }
        if (jobRetentionMs <= 0) {
            throw new IllegalArgumentException("jobRetentionMs must be positive (current: " + jobRetentionMs + ")");
        }
        if (jwtSecret == null || jwtSecret.isBlank()) {
            throw new IllegalArgumentException("jwtSecret cannot be blank");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (retry == null) {
            throw new IllegalArgumentException("retry cannot be null");
        }
    }

    /**
     * 기본값 설정 (JWT 키만 지정).
     *
     * @param jwtSecret HMAC 서명 키
     */
    public HubServerConfig(String jwtSecret) {
        this(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_PATH, DEFAULT_TOKEN_PARAMETER, DEFAULT_MAX_FRAME_BYTES,
            DEFAULT_HEARTBEAT_INTERVAL_MS, DEFAULT_JOB_RETENTION_MS, jwtSecret, new RateLimiterConfig(),
            new RetryConfig().withJitterFactor(DEFAULT_RETRY_JITTER));
    }

    public HubServerConfig withHost(String newHost) {
        return new HubServerConfig(newHost, port, path, tokenParameter, maxFrameBytes, heartbeatIntervalMs,
            jobRetentionMs, jwtSecret, rateLimiter, retry);
    }

    public HubServerConfig withPort(int newPort) {
        return new HubServerConfig(host, newPort, path, tokenParameter, maxFrameBytes, heartbeatIntervalMs,
            jobRetentionMs, jwtSecret, rateLimiter, retry);
    }

    public HubServerConfig withHeartbeatIntervalMs(long newHeartbeatIntervalMs) {
        return new HubServerConfig(host, port, path, tokenParameter, maxFrameBytes, newHeartbeatIntervalMs,
            jobRetentionMs, jwtSecret, rateLimiter, retry);
    }

    public HubServerConfig withJobRetentionMs(long newJobRetentionMs) {
        return new HubServerConfig(host, port, path, tokenParameter, maxFrameBytes, heartbeatIntervalMs,
            newJobRetentionMs, jwtSecret, rateLimiter, retry);
    }

    /**
     * 클래스패스의 {@value #PROPERTIES_RESOURCE}와 환경 변수로 설정 생성.
     *
     * @return 설정
     * @throws IllegalStateException 리소스가 없는 경우
     * @throws IllegalArgumentException JWT 키가 비어 있는 경우
     */
    public static HubServerConfig load() {
        return load(System.getenv());
    }

    public static HubServerConfig load(Map<String, String> env) {
        Properties properties = new Properties();
        try (InputStream in = HubServerConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException(PROPERTIES_RESOURCE + " not found on classpath");
            }
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + PROPERTIES_RESOURCE, e);
        }
        return fromProperties(properties, env);
    }

    public static HubServerConfig fromProperties(Properties properties) {
        return fromProperties(properties, System.getenv());
    }

    /**
     * 프로퍼티와 환경 변수로 설정 생성. 없는 키는 기본값을 사용합니다.
     *
     * @param properties jobhub.* 프로퍼티
     * @param env 환경 변수
     * @return 설정
     * @throws IllegalArgumentException 값이 숫자가 아니거나 검증에 실패한 경우
     */
    public static HubServerConfig fromProperties(Properties properties, Map<String, String> env) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        if (env == null) {
            throw new IllegalArgumentException("env cannot be null");
        }
        String secret = env.getOrDefault(JWT_SECRET_ENV, properties.getProperty("jobhub.auth.jwt-secret"));

        RateLimiterConfig limits = new RateLimiterConfig(
            intValue(properties, "jobhub.ratelimit.max-per-second", RateLimiterConfig.DEFAULT_MAX_PER_SECOND),
            intValue(properties, "jobhub.ratelimit.max-per-minute", RateLimiterConfig.DEFAULT_MAX_PER_MINUTE),
            longValue(properties, "jobhub.ratelimit.max-per-day", RateLimiterConfig.DEFAULT_MAX_PER_DAY)
        );

        RetryConfig retryDefaults = new RetryConfig();
        RetryConfig retry = new RetryConfig(
            intValue(properties, "jobhub.retry.max-retries", retryDefaults.maxRetries()),
            longValue(properties, "jobhub.retry.base-delay-ms", retryDefaults.baseDelayMs()),
            doubleValue(properties, "jobhub.retry.multiplier", retryDefaults.multiplier()),
            longValue(properties, "jobhub.retry.max-delay-ms", retryDefaults.maxDelayMs()),
            doubleValue(properties, "jobhub.retry.jitter-factor", DEFAULT_RETRY_JITTER)
        );

        return new HubServerConfig(
            properties.getProperty("jobhub.server.host", DEFAULT_HOST),
            intValue(properties, "jobhub.server.port", DEFAULT_PORT),
            properties.getProperty("jobhub.server.path", DEFAULT_PATH),
            properties.getProperty("jobhub.auth.token-parameter", DEFAULT_TOKEN_PARAMETER),
            intValue(properties, "jobhub.server.max-frame-bytes", DEFAULT_MAX_FRAME_BYTES),
            longValue(properties, "jobhub.liveness.heartbeat-interval-ms", DEFAULT_HEARTBEAT_INTERVAL_MS),
            longValue(properties, "jobhub.jobs.retention-ms", DEFAULT_JOB_RETENTION_MS),
            secret,
            limits,
            retry
        );
    }

    private static int intValue(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (current: " + raw + ")", e);
        }
    }

    private static long longValue(Properties properties, String key, long defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (current: " + raw + ")", e);
        }
    }

    private static double doubleValue(Properties properties, String key, double defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number (current: " + raw + ")", e);
        }
    }

    @Override
    public String toString() {
        return "HubServerConfig{host=" + host + ", port=" + port + ", path=" + path
            + ", tokenParameter=" + tokenParameter + ", maxFrameBytes=" + maxFrameBytes
            + ", heartbeatIntervalMs=" + heartbeatIntervalMs + ", jobRetentionMs=" + jobRetentionMs
            + ", rateLimiter=" + rateLimiter
            + ", retry=" + retry + "}";
    }
}
