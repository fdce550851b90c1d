package com.ryuqq.jobhub.core.spi;

import com.ryuqq.jobhub.core.contract.InboundFrame;
import com.ryuqq.jobhub.core.contract.NotificationEnvelope;

/**
 * Envelope 직렬화 SPI.
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public interface EnvelopeCodec {

    /**
     * 아웃바운드 Envelope을 UTF-8 JSON 문자열로 직렬화.
     *
     * @param envelope 전송할 Envelope
     * @return JSON 문자열
     * @throws IllegalArgumentException 직렬화할 수 없는 데이터가 포함된 경우
     */
    String encode(NotificationEnvelope envelope);

    /**
     * 인바운드 텍스트 프레임 역직렬화.
     *
     * @param text 수신한 텍스트
     * @return 디코딩된 프레임
     * @throws IllegalArgumentException JSON이 아니거나 type 필드가 없는 경우
     */
    InboundFrame decode(String text);
}
