package com.phillippitts.scantomack.domain;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Lifecycle notification for one processing request.
 *
 * <p>PII note: payloads carry technical diagnostics only, never recognized text.
 */
public record ProcessingEvent(
        Type type,
        String correlationId,
        Instant timestamp,
        Map<String, Object> payload
) {

    public enum Type {
        STARTED,
        ENGINE_SELECTED,
        PREPROCESSING,
        ENGINE_COMPLETED,
        POST_PROCESSING,
        COMPLETED,
        ERROR,
        WARNING
    }

    public ProcessingEvent {
        Objects.requireNonNull(type, "type");
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static ProcessingEvent of(Type type, String correlationId, Map<String, Object> payload) {
        return new ProcessingEvent(type, correlationId, Instant.now(), payload);
    }
}
