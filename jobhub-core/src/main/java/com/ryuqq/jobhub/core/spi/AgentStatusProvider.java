package com.ryuqq.jobhub.core.spi;

import com.ryuqq.jobhub.core.model.UserId;

import java.util.Map;

/**
 * Agent 상태 조회 SPI.
 *
 * <p>{@code get_agent_status} 요청에 동기적으로 응답하기 위해 사용됩니다.
 * 구현체는 빠르게 반환해야 합니다 (트랜스포트 스레드에서 호출됨).</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AgentStatusProvider {

    /**
     * 사용자 관점의 현재 Agent 상태.
     *
     * @param userId 요청한 사용자
     * @return {@code agent_status_update} Envelope의 data
     */
    Map<String, Object> currentStatus(UserId userId);
}
