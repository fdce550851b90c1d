package com.ryuqq.jobhub.adapter.runner.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.jobhub.core.contract.InboundFrame;
import com.ryuqq.jobhub.core.contract.NotificationEnvelope;
import com.ryuqq.jobhub.core.spi.EnvelopeCodec;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jackson 기반 JSON Envelope 코덱.
 *
 * <p><strong>와이어 포맷:</strong></p>
 * <pre>
 * 수신: {"type": "ping", "data": {...}}                           (data 생략 가능)
 * 송신: {"type": "pong", "data": {...}, "timestamp": "2024-01-15T10:00:00Z"}
 * </pre>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public final class JacksonEnvelopeCodec implements EnvelopeCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    public JacksonEnvelopeCodec() {
        this(new ObjectMapper());
    }

    public JacksonEnvelopeCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    @Override
    public String encode(NotificationEnvelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", envelope.type());
        wire.put("data", envelope.data());
        wire.put("timestamp", envelope.timestamp().toString());
        try {
            return objectMapper.writeValueAsString(wire);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize envelope of type " + envelope.type(), e);
        }
    }

    @Override
    public InboundFrame decode(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("frame cannot be null or blank");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("frame is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("frame must be a JSON object");
        }
        JsonNode type = root.get("type");
        if (type == null || !type.isTextual() || type.asText().isBlank()) {
            throw new IllegalArgumentException("frame has no textual type field");
        }

        JsonNode data = root.get("data");
        Map<String, Object> payload = data != null && data.isObject()
            ? objectMapper.convertValue(data, MAP_TYPE)
            : Map.of();
        return new InboundFrame(type.asText(), payload);
    }
}
