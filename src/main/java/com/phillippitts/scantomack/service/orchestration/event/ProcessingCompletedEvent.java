package com.phillippitts.scantomack.service.orchestration.event;

import com.phillippitts.scantomack.domain.EngineId;

import java.time.Instant;

/**
 * Application event published when a document request produced a result.
 *
 * @param correlationId  request correlation id
 * @param engineUsed     engine (or ensemble) that produced the result
 * @param totalMs        end-to-end duration
 * @param overallQuality overall quality score
 * @param timestamp      when processing completed
 */
public record ProcessingCompletedEvent(
        String correlationId,
        EngineId engineUsed,
        long totalMs,
        double overallQuality,
        Instant timestamp
) {}
