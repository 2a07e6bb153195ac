package com.phillippitts.scantomack.service.ocr;

import com.phillippitts.scantomack.domain.EngineId;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

/**
 * Publishes {@link EngineFailureEvent}s on behalf of engines.
 *
 * <p>A null publisher is allowed (engines built by hand in tests). A listener that throws must
 * not turn an engine failure into a different one, so publication errors are logged and dropped.
 */
public final class EngineEventPublisher {

    private static final Logger LOG = LogManager.getLogger(EngineEventPublisher.class);

    private EngineEventPublisher() {
    }

    public static void publishFailure(ApplicationEventPublisher publisher,
                                      EngineId engine,
                                      String message,
                                      Throwable cause,
                                      Map<String, String> context) {
        if (publisher == null) {
            return;
        }
        try {
            publisher.publishEvent(new EngineFailureEvent(engine, Instant.now(), message, cause, context));
        } catch (RuntimeException e) {
            LOG.warn("Listener rejected {} failure event '{}': {}", engine, message, e.toString());
        }
    }
}
