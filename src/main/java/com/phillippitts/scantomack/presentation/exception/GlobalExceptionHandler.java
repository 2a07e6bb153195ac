package com.phillippitts.scantomack.presentation.exception;

import com.phillippitts.scantomack.exception.AllEnginesFailedException;
import com.phillippitts.scantomack.exception.InvalidDocumentException;
import com.phillippitts.scantomack.exception.RecognitionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for the REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping internal details away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - unusable document or options (HTTP 400).
     */
    @ExceptionHandler(InvalidDocumentException.class)
    ResponseEntity<ApiError> handleInvalidDocument(InvalidDocumentException ex) {
        LOG.warn("Invalid document: size={}, reason={}", ex.getDocumentSize(), ex.getReason());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid document",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - missing or oversized upload (HTTP 400).
     */
    @ExceptionHandler({MultipartException.class, MaxUploadSizeExceededException.class})
    ResponseEntity<ApiError> handleBadUpload(MultipartException ex) {
        LOG.warn("Bad upload: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid upload",
                "Send the image as multipart field 'file'",
                Instant.now()
            ));
    }

    /**
     * Every engine failed - retry possible (HTTP 503).
     */
    @ExceptionHandler(AllEnginesFailedException.class)
    ResponseEntity<ApiError> handleAllEnginesFailed(AllEnginesFailedException ex) {
        LOG.error("All engines failed: {}", ex.getMessage());
        String tried = ex.getFailures().entrySet().stream()
            .map(e -> e.getKey().wireName() + "=" + e.getValue().getClass().getSimpleName())
            .collect(Collectors.joining(", "));
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "OCR service temporarily unavailable",
                tried.isEmpty() ? "No engines available" : "Engines failed: " + tried,
                Instant.now()
            ));
    }

    /**
     * Transient engine error - retry possible (HTTP 503).
     */
    @ExceptionHandler(RecognitionException.class)
    ResponseEntity<ApiError> handleRecognitionFailure(RecognitionException ex) {
        LOG.error("Recognition failed: engine={}", ex.getEngine(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "OCR service temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
