package com.phillippitts.scantomack.exception;

import com.phillippitts.scantomack.domain.EngineId;

/**
 * Malformed response, dead process, or broken pipe on a process bridge.
 */
public class BridgeProtocolException extends RecognitionException {

    public BridgeProtocolException(String message, EngineId engine) {
        super(message, engine);
    }

    public BridgeProtocolException(String message, EngineId engine, Throwable cause) {
        super(message, engine, cause);
    }
}
