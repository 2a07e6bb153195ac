package com.phillippitts.scantomack.exception;

import com.phillippitts.scantomack.domain.EngineId;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for recognition failures carrying diagnostic context.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw RecognitionExceptionBuilder.create("No response from bridge")
 *         .engine(EngineId.EASYOCR)
 *         .durationMs(5000)
 *         .metadata("stderr", stderrSnippet)
 *         .buildTimeout();
 *
 * throw RecognitionExceptionBuilder.create("Failed to initialize Tesseract")
 *         .engine(EngineId.TESSERACT)
 *         .cause(e)
 *         .metadata("datapath", datapath)
 *         .build();
 * </pre>
 *
 * <p>Message format: {@code {message} (exitCode=..., durationMs=..., key=value, ...)}.
 */
public final class RecognitionExceptionBuilder {

    private final String message;
    private EngineId engine;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private RecognitionExceptionBuilder(String message) {
        this.message = message;
    }

    public static RecognitionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new RecognitionExceptionBuilder(message);
    }

    public RecognitionExceptionBuilder engine(EngineId engine) {
        this.engine = engine;
        return this;
    }

    public RecognitionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Process exit code, for bridges whose process died.
     */
    public RecognitionExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public RecognitionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key-value pair to the message; null keys or values are ignored.
     */
    public RecognitionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public RecognitionException build() {
        String detailed = buildDetailedMessage();
        return cause != null
                ? new RecognitionException(detailed, engine, cause)
                : new RecognitionException(detailed, engine);
    }

    public EngineTimeoutException buildTimeout() {
        String detailed = buildDetailedMessage();
        return cause != null
                ? new EngineTimeoutException(detailed, engine, cause)
                : new EngineTimeoutException(detailed, engine);
    }

    public BridgeProtocolException buildProtocolError() {
        String detailed = buildDetailedMessage();
        return cause != null
                ? new BridgeProtocolException(detailed, engine, cause)
                : new BridgeProtocolException(detailed, engine);
    }

    /**
     * @param engineError error text reported by the engine
     */
    public EngineReportedFailureException buildReportedFailure(String engineError) {
        String detailed = buildDetailedMessage();
        return cause != null
                ? new EngineReportedFailureException(detailed, engine, engineError, cause)
                : new EngineReportedFailureException(detailed, engine, engineError);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
