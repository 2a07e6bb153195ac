package com.phillippitts.scantomack.presentation.exception;

import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.exception.AllEnginesFailedException;
import com.phillippitts.scantomack.exception.EngineTimeoutException;
import com.phillippitts.scantomack.exception.EngineUnavailableException;
import com.phillippitts.scantomack.exception.InvalidDocumentException;
import com.phillippitts.scantomack.exception.RecognitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void invalidDocumentReturns400WithReason() {
        InvalidDocumentException ex = new InvalidDocumentException(12, "unsupported or corrupt image format");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleInvalidDocument(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("InvalidDocumentException");
        assertThat(response.getBody().message()).isEqualTo("Invalid document");
        assertThat(response.getBody().details()).contains("unsupported or corrupt image format");
    }

    @Test
    void missingUploadReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleBadUpload(new MultipartException("Current request is not a multipart request"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("Invalid upload");
    }

    @Test
    void oversizedUploadReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleBadUpload(new MaxUploadSizeExceededException(1024));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("MaxUploadSizeExceededException");
    }

    @Test
    void allEnginesFailedReturns503ListingEachEngine() {
        Map<EngineId, RecognitionException> failures = new LinkedHashMap<>();
        EngineTimeoutException timeout = new EngineTimeoutException("timed out", EngineId.TESSERACT);
        failures.put(EngineId.TESSERACT, timeout);
        AllEnginesFailedException ex = new AllEnginesFailedException("All engines failed", failures, timeout);

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleAllEnginesFailed(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().details()).isEqualTo("Engines failed: tesseract=EngineTimeoutException");
    }

    @Test
    void allEnginesFailedWithoutCandidatesSaysSo() {
        AllEnginesFailedException ex = new AllEnginesFailedException("No engines available", Map.of(), null);

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleAllEnginesFailed(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().details()).isEqualTo("No engines available");
    }

    @Test
    void recognitionFailureReturns503WithRetryHint() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleRecognitionFailure(
                new EngineUnavailableException("engine is not available", EngineId.EASYOCR));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString())
                .contains("EngineUnavailableException")
                .contains("Please retry in a few seconds");
    }

    @Test
    void unexpectedErrorReturns500WithoutInternalDetails() {
        Instant beforeCall = Instant.now().minusSeconds(1);

        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("secret internals"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("secret internals");
        assertThat(response.getBody().timestamp()).isAfter(beforeCall);
    }
}
