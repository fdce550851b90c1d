package com.ryuqq.jobhub.adapter.websocket.auth;

import com.ryuqq.jobhub.core.error.AuthenticationException;
import com.ryuqq.jobhub.core.model.UserId;
import com.ryuqq.jobhub.core.spi.CredentialVerifier;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * HMAC 서명 JWT 검증기.
 *
 * <p>사용자 ID는 {@code userId} 클레임에서 읽고, 없으면 {@code sub}를 사용합니다.
 * 만료, 서명 불일치, 형식 오류는 모두 {@link AuthenticationException}으로 변환됩니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class JwtCredentialVerifier implements CredentialVerifier {

    public static final String USER_ID_CLAIM = "userId";

    private static final int MIN_SECRET_BYTES = 32;

    private final JwtParser parser;

    /**
     * 생성자.
     *
     * @param secret HMAC 키 (UTF-8 기준 32바이트 이상)
     * @throws IllegalArgumentException 키가 없거나 짧은 경우
     */
    public JwtCredentialVerifier(String secret) {
        this.parser = Jwts.parser().verifyWith(signingKey(secret)).build();
    }

    /**
     * 서명 키 생성.
     *
     * @param secret HMAC 키 문자열
     * @return SecretKey
     * @throws IllegalArgumentException 키가 없거나 32바이트 미만인 경우
     */
    public static SecretKey signingKey(String secret) {
        if (secret == null) {
            throw new IllegalArgumentException("secret cannot be null");
        }
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                "secret must be at least " + MIN_SECRET_BYTES + " bytes (current: " + bytes.length + ")"
            );
        }
        return Keys.hmacShaKeyFor(bytes);
    }

    @Override
    public UserId verify(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new AuthenticationException("Authentication required");
        }
        Claims claims;
        try {
            claims = parser.parseSignedClaims(credential).getPayload();
        } catch (ExpiredJwtException e) {
            throw new AuthenticationException("Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthenticationException("Invalid token", e);
        }

        Object claimed = claims.get(USER_ID_CLAIM);
        String userId = claimed != null ? claimed.toString() : claims.getSubject();
        if (userId == null || userId.isBlank()) {
            throw new AuthenticationException("Token carries no user id");
        }
        return UserId.of(userId);
    }
}
