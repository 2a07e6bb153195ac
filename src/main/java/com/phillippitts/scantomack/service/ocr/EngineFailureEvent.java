package com.phillippitts.scantomack.service.ocr;

import com.phillippitts.scantomack.domain.EngineId;

import java.time.Instant;
import java.util.Map;

/**
 * Published when an engine fails in a way that may affect its availability
 * (initialization failure, bridge timeout, dead process).
 *
 * <p>PII note: Do not include recognized text in context. Restrict to technical diagnostics.
 */
public record EngineFailureEvent(
        EngineId engine,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public EngineFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
