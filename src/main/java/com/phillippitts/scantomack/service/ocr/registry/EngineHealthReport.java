package com.phillippitts.scantomack.service.ocr.registry;

import com.phillippitts.scantomack.domain.EngineId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time engine availability.
 *
 * @param status             HEALTHY iff at least one engine is available
 * @param engines            availability of every configured engine
 * @param workerPoolSize     native worker threads running
 * @param bridgeProcessCount live bridge processes
 */
public record EngineHealthReport(
        Status status,
        Map<EngineId, Boolean> engines,
        int workerPoolSize,
        int bridgeProcessCount
) {
    public enum Status { HEALTHY, UNHEALTHY }

    public EngineHealthReport {
        engines = engines.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(engines));
    }

    public boolean isHealthy() {
        return status == Status.HEALTHY;
    }

    public long availableCount() {
        return engines.values().stream().filter(Boolean::booleanValue).count();
    }
}
