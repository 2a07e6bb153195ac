package com.phillippitts.scantomack.service.orchestration.event;

import java.time.Instant;

/**
 * Application event published when a document request was rejected or every engine failed.
 *
 * @param correlationId request correlation id
 * @param reason        failure kind (invalid_document, all_engines_failed)
 * @param message       exception message
 * @param timestamp     when processing failed
 */
public record ProcessingFailedEvent(
        String correlationId,
        String reason,
        String message,
        Instant timestamp
) {}
