package com.ryuqq.jobhub.adapter.runner.connection;

import com.ryuqq.jobhub.core.error.AuthenticationException;
import com.ryuqq.jobhub.core.model.UserId;
import com.ryuqq.jobhub.core.spi.CredentialVerifier;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * 핸드셰이크 인증기.
 *
 * <p>연결 요청 URI의 쿼리 파라미터에서 자격 증명을 꺼내 {@link CredentialVerifier}로 검증합니다.
 * 실패하면 {@link AuthenticationException}을 던지고, 트랜스포트는 핸드셰이크를 거부합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * GET /ws?token=eyJhbGciOi...   → UserId
 * GET /ws                       → AuthenticationException("Authentication required")
 * </pre>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class ConnectionAuthenticator {

    public static final String DEFAULT_TOKEN_PARAMETER = "token";

    private final CredentialVerifier verifier;
    private final String tokenParameter;

    public ConnectionAuthenticator(CredentialVerifier verifier) {
        this(verifier, DEFAULT_TOKEN_PARAMETER);
    }

    /**
     * 생성자.
     *
     * @param verifier 자격 증명 검증기
     * @param tokenParameter 자격 증명을 담은 쿼리 파라미터 이름
     * @throws IllegalArgumentException 파라미터가 null이거나 비어 있는 경우
     */
    public ConnectionAuthenticator(CredentialVerifier verifier, String tokenParameter) {
        if (verifier == null) {
            throw new IllegalArgumentException("verifier cannot be null");
        }
        if (tokenParameter == null || tokenParameter.isBlank()) {
            throw new IllegalArgumentException("tokenParameter cannot be null or blank");
        }
        this.verifier = verifier;
        this.tokenParameter = tokenParameter;
    }

    /**
     * 요청 URI 인증.
     *
     * @param requestUri 핸드셰이크 요청 URI (경로 + 쿼리)
     * @return 인증된 사용자
     * @throws AuthenticationException 자격 증명이 없거나 검증에 실패한 경우
     */
    public UserId authenticate(String requestUri) {
        String credential = extractCredential(requestUri)
            .orElseThrow(() -> new AuthenticationException("Authentication required"));
        try {
            return verifier.verify(credential);
        } catch (AuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AuthenticationException("Credential verification failed", e);
        }
    }

    /**
     * 쿼리 문자열에서 자격 증명 추출.
     *
     * @param requestUri 요청 URI
     * @return 자격 증명 (없거나 비어 있으면 empty)
     */
    public Optional<String> extractCredential(String requestUri) {
        if (requestUri == null) {
            return Optional.empty();
        }
        int queryStart = requestUri.indexOf('?');
        if (queryStart < 0 || queryStart == requestUri.length() - 1) {
            return Optional.empty();
        }
        String query = requestUri.substring(queryStart + 1);
        int fragment = query.indexOf('#');
        if (fragment >= 0) {
            query = query.substring(0, fragment);
        }

        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            if (!tokenParameter.equals(decode(name))) {
                continue;
            }
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
            return value.isBlank() ? Optional.empty() : Optional.of(value);
        }
        return Optional.empty();
    }

    private static String decode(String raw) {
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return raw;
        }
    }
}
