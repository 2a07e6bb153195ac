package com.phillippitts.scantomack.exception;

import com.phillippitts.scantomack.domain.EngineId;

/**
 * No complete response arrived within the call's timeout. Usually worth retrying.
 */
public class EngineTimeoutException extends RecognitionException {

    public EngineTimeoutException(String message, EngineId engine) {
        super(message, engine);
    }

    public EngineTimeoutException(String message, EngineId engine, Throwable cause) {
        super(message, engine, cause);
    }
}
