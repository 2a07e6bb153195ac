package com.phillippitts.scantomack.exception;

import com.phillippitts.scantomack.domain.EngineId;

/**
 * Engine is not configured, failed its startup probe, was evicted, or is closed.
 * Never retried; the orchestrator moves straight on to fallbacks.
 */
public class EngineUnavailableException extends RecognitionException {

    public EngineUnavailableException(String message, EngineId engine) {
        super(message, engine);
    }
}
