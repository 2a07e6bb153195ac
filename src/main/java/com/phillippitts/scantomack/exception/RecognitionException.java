package com.phillippitts.scantomack.exception;

import com.phillippitts.scantomack.domain.EngineId;

/**
 * Thrown when a recognition engine fails to produce a result.
 *
 * <p>Subclasses distinguish failure kinds so the orchestrator can decide between retrying,
 * falling back, and giving up.
 */
public class RecognitionException extends ScanToMackException {

    private final EngineId engine;

    public RecognitionException(String message, EngineId engine) {
        super(message + " (engine: " + engine + ")");
        this.engine = engine;
    }

    public RecognitionException(String message, EngineId engine, Throwable cause) {
        super(message + " (engine: " + engine + ")", cause);
        this.engine = engine;
    }

    /**
     * @return engine that failed, or null when not attributable to one engine
     */
    public EngineId getEngine() {
        return engine;
    }
}
