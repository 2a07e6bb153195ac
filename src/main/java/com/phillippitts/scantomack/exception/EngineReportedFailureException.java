package com.phillippitts.scantomack.exception;

import com.phillippitts.scantomack.domain.EngineId;

/**
 * The engine ran but answered with a logical error ({@code success:false} on the wire,
 * or a native library error).
 */
public class EngineReportedFailureException extends RecognitionException {

    private final String engineError;

    public EngineReportedFailureException(String message, EngineId engine, String engineError) {
        super(message, engine);
        this.engineError = engineError;
    }

    public EngineReportedFailureException(String message, EngineId engine, String engineError, Throwable cause) {
        super(message, engine, cause);
        this.engineError = engineError;
    }

    /** Error text exactly as reported by the engine. */
    public String getEngineError() {
        return engineError;
    }
}
