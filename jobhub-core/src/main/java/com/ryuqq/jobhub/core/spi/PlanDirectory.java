package com.ryuqq.jobhub.core.spi;

import com.ryuqq.jobhub.core.model.UserId;

import java.util.Optional;

/**
 * 사용자 요금제 조회 SPI.
 *
 * <p>요금제 기반 브로드캐스트 필터(예: "ultra" 사용자에게만 공지)에 사용됩니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PlanDirectory {

    /**
     * 사용자 요금제 이름.
     *
     * @param userId 사용자 ID
     * @return 요금제 이름 (알 수 없으면 empty)
     */
    Optional<String> planOf(UserId userId);
}
