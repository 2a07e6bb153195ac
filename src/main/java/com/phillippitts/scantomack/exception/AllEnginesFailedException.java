package com.phillippitts.scantomack.exception;

import com.phillippitts.scantomack.domain.EngineId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every candidate engine of a request failed. Terminal: surfaced to the caller.
 *
 * <p>The cause is the last per-engine error; {@link #getFailures()} holds the first error of each
 * engine that was tried, in the order they were tried.
 */
public class AllEnginesFailedException extends ScanToMackException {

    private final Map<EngineId, RecognitionException> failures;

    public AllEnginesFailedException(String message, Map<EngineId, RecognitionException> failures,
                                     RecognitionException lastError) {
        super(message + " (tried: " + failures.keySet() + ")", lastError);
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public Map<EngineId, RecognitionException> getFailures() {
        return failures;
    }

    public RecognitionException getLastError() {
        return (RecognitionException) getCause();
    }
}
