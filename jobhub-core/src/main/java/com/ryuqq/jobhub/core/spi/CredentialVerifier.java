package com.ryuqq.jobhub.core.spi;

import com.ryuqq.jobhub.core.error.AuthenticationException;
import com.ryuqq.jobhub.core.model.UserId;

/**
 * 핸드셰이크 자격 증명 검증 SPI.
 *
 * <p>서명과 만료를 검증하고, 성공 시 디코딩된 Identity를 반환합니다.
 * 토큰 발급은 범위 밖이며 검증만 수행합니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public interface CredentialVerifier {

    /**
     * 자격 증명 검증.
     *
     * @param credential 클라이언트가 제출한 자격 증명 (예: JWT)
     * @return 인증된 사용자 ID
     * @throws AuthenticationException 서명 불일치, 만료, 형식 오류, identity 누락 시
     */
    UserId verify(String credential);
}
