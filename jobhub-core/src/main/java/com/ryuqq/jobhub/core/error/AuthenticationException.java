package com.ryuqq.jobhub.core.error;

/**
 * 핸드셰이크 인증 실패.
 *
 * <p>재시도 대상이 아니며, 트랜스포트는 이 예외를 정책 위반 close 코드(1008)로 변환합니다.
 * 인증되지 않은 트랜스포트는 절대 Registry에 도달하지 않습니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
