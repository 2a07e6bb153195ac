package com.phillippitts.scantomack.exception;

/**
 * Base exception for all scanToMack application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class ScanToMackException extends RuntimeException {

    public ScanToMackException(String message) {
        super(message);
    }

    public ScanToMackException(String message, Throwable cause) {
        super(message, cause);
    }
}
