package com.ryuqq.jobhub.core.contract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 클라이언트가 보낸 인바운드 제어 프레임.
 *
 * <p>Wire 형식: {@code {"type": string, "data": object}}. {@code data}는 생략 가능합니다.</p>
 *
 * @param type 프레임 타입 (예: ping, subscribe_to_jobs)
 * @param data 프레임 데이터 (없으면 빈 Map)
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public record InboundFrame(
    String type,
    Map<String, Object> data
) {

    public InboundFrame {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        data = data == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
