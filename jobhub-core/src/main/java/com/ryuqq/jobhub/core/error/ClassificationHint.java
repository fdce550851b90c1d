package com.ryuqq.jobhub.core.error;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * 실패 분류 힌트를 제공하는 오류의 최소 형태.
 *
 * <p>Retry Executor는 업스트림 프로토콜을 알지 못하며, 오류가 이 인터페이스를 통해
 * 제공하는 상태 코드와 명시적 분류만 참고합니다.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public interface ClassificationHint {

    /**
     * 상태 코드와 유사한 값 (예: HTTP status).
     *
     * @return 상태 코드 (없으면 empty)
     */
    OptionalInt statusCode();

    /**
     * 호출자가 명시한 분류. 상태 코드보다 우선합니다.
     *
     * @return 명시적 분류 (없으면 empty)
     */
    Optional<ErrorCategory> category();
}
