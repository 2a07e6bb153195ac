package com.phillippitts.scantomack.service.integration;

import com.phillippitts.scantomack.domain.CompleteResult;
import com.phillippitts.scantomack.domain.DocumentImage;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.domain.ProcessingEvent;
import com.phillippitts.scantomack.domain.ProcessingOptions;
import com.phillippitts.scantomack.exception.AllEnginesFailedException;
import com.phillippitts.scantomack.exception.InvalidDocumentException;
import com.phillippitts.scantomack.service.ocr.EngineCapabilities;
import com.phillippitts.scantomack.service.ocr.registry.EngineHealthReport;
import com.phillippitts.scantomack.service.ocr.registry.EngineRegistry;
import com.phillippitts.scantomack.service.orchestration.ProcessingOrchestrator;
import com.phillippitts.scantomack.service.orchestration.event.ProcessingCompletedEvent;
import com.phillippitts.scantomack.service.orchestration.event.ProcessingEventChannel;
import com.phillippitts.scantomack.service.orchestration.event.ProcessingEventSink;
import com.phillippitts.scantomack.service.orchestration.event.ProcessingFailedEvent;
import com.phillippitts.scantomack.service.orchestration.event.SerialEventChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Single entry point for processing a document image.
 *
 * <p>Adds what the orchestrator leaves to its caller:
 * <ul>
 *   <li>Request validation (size, decodable geometry)</li>
 *   <li>Correlation id assignment and {@link ThreadContext} propagation for logging</li>
 *   <li>STARTED, COMPLETED and ERROR events on the caller's sink</li>
 *   <li>Confidence and quality threshold warnings</li>
 *   <li>Request-level application events for metrics</li>
 * </ul>
 *
 * <p>Only {@link InvalidDocumentException} and {@link AllEnginesFailedException} escape; every
 * other problem is reported inside the returned {@link CompleteResult}.
 */
public class DocumentProcessingFacade {

    private static final Logger LOG = LogManager.getLogger(DocumentProcessingFacade.class);

    static final String CORRELATION_ID_KEY = "correlationId";

    private final ProcessingOrchestrator orchestrator;
    private final EngineRegistry registry;
    private final Executor eventExecutor;
    private final ApplicationEventPublisher publisher;
    private final long maxDocumentBytes;

    public DocumentProcessingFacade(ProcessingOrchestrator orchestrator,
                                    EngineRegistry registry,
                                    Executor eventExecutor,
                                    ApplicationEventPublisher publisher,
                                    long maxDocumentBytes) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.eventExecutor = Objects.requireNonNull(eventExecutor, "eventExecutor");
        this.publisher = publisher;
        this.maxDocumentBytes = maxDocumentBytes;
    }

    /**
     * Convenience overload for raw upload bytes.
     *
     * @throws InvalidDocumentException if the bytes are empty
     */
    public CompleteResult process(byte[] bytes, ProcessingOptions options, ProcessingEventSink sink) {
        return run(() -> DocumentImage.of(bytes), options, sink);
    }

    /**
     * Processes one document.
     *
     * @param document image to recognize
     * @param options  request options; a correlation id is generated when absent
     * @param sink     receiver of lifecycle events, or null
     * @return complete result, possibly degraded with errors and warnings
     * @throws InvalidDocumentException  if the document or options are unusable
     * @throws AllEnginesFailedException if no engine produced a result
     */
    public CompleteResult process(DocumentImage document, ProcessingOptions options, ProcessingEventSink sink) {
        return run(() -> document, options, sink);
    }

    private CompleteResult run(Supplier<DocumentImage> source, ProcessingOptions options, ProcessingEventSink sink) {
        Objects.requireNonNull(options, "options");
        String correlationId = options.correlationId() == null || options.correlationId().isBlank()
                ? UUID.randomUUID().toString() : options.correlationId();
        ProcessingOptions effective = options.withCorrelationId(correlationId);
        ProcessingEventChannel channel = sink == null
                ? ProcessingEventChannel.NOOP
                : new SerialEventChannel(correlationId, sink, eventExecutor);

        String previous = ThreadContext.get(CORRELATION_ID_KEY);
        ThreadContext.put(CORRELATION_ID_KEY, correlationId);
        try {
            DocumentImage document;
            try {
                document = source.get();
            } catch (InvalidDocumentException e) {
                channel.emit(ProcessingEvent.Type.STARTED, startedPayload(null, effective));
                throw e;
            }
            channel.emit(ProcessingEvent.Type.STARTED, startedPayload(document, effective));
            validate(document);
            CompleteResult result = orchestrator.process(document, effective, channel);
            result = applyThresholds(result, effective, channel);

            channel.emit(ProcessingEvent.Type.COMPLETED, Map.of(
                    "engine", result.recognition().engine().wireName(),
                    "totalMs", result.totalProcessingTimeMs(),
                    "overallQuality", result.overallQuality()));
            publish(new ProcessingCompletedEvent(correlationId, result.recognition().engine(),
                    result.totalProcessingTimeMs(), result.overallQuality(), Instant.now()));
            LOG.info("Processed document {} with {} in {}ms (quality={})", document.id(),
                    result.recognition().engine(), result.totalProcessingTimeMs(),
                    String.format("%.2f", result.overallQuality()));
            return result;
        } catch (InvalidDocumentException e) {
            LOG.warn("Rejected document: {}", e.getMessage());
            fail(channel, correlationId, "invalid_document", e, Map.of());
            throw e;
        } catch (AllEnginesFailedException e) {
            LOG.error("All engines failed: {}", e.getMessage());
            Map<String, Object> failures = new LinkedHashMap<>();
            e.getFailures().forEach((id, err) -> failures.put(id.wireName(), err.getClass().getSimpleName()));
            fail(channel, correlationId, "all_engines_failed", e, Map.of("failures", failures));
            throw e;
        } finally {
            if (previous == null) {
                ThreadContext.remove(CORRELATION_ID_KEY);
            } else {
                ThreadContext.put(CORRELATION_ID_KEY, previous);
            }
        }
    }

    public EngineHealthReport healthCheck() {
        return registry.health();
    }

    /**
     * @return capabilities of every engine that is currently available
     */
    public Map<EngineId, EngineCapabilities> availableEngines() {
        Map<EngineId, EngineCapabilities> engines = new EnumMap<>(EngineId.class);
        for (EngineId id : registry.availableEngines()) {
            engines.put(id, registry.capabilitiesOf(id));
        }
        return engines;
    }

    private void validate(DocumentImage document) {
        if (document == null) {
            throw new InvalidDocumentException("document is required");
        }
        if (maxDocumentBytes > 0 && document.bytes().length > maxDocumentBytes) {
            throw new InvalidDocumentException(document.bytes().length,
                    "exceeds maximum size of " + maxDocumentBytes + " bytes");
        }
        if (!document.hasGeometry()) {
            throw new InvalidDocumentException(document.bytes().length, "unsupported or corrupt image format");
        }
    }

    private static CompleteResult applyThresholds(CompleteResult result, ProcessingOptions options,
                                                  ProcessingEventChannel channel) {
        CompleteResult out = result;
        double confidence = result.recognition().confidence();
        if (confidence < options.confidenceThreshold()) {
            String message = String.format("OCR confidence %.2f is below threshold %.2f",
                    confidence, options.confidenceThreshold());
            out = out.withWarning(new CompleteResult.StageWarning(CompleteResult.Stage.OCR, message,
                    CompleteResult.Impact.MEDIUM));
            channel.emit(ProcessingEvent.Type.WARNING, Map.of("stage", CompleteResult.Stage.OCR.name(), "message", message));
        }
        if (result.overallQuality() < options.qualityThreshold()) {
            String message = String.format("Overall quality %.2f is below threshold %.2f",
                    result.overallQuality(), options.qualityThreshold());
            out = out.withWarning(new CompleteResult.StageWarning(CompleteResult.Stage.QUALITY_ASSESSMENT, message,
                    CompleteResult.Impact.HIGH));
            channel.emit(ProcessingEvent.Type.WARNING,
                    Map.of("stage", CompleteResult.Stage.QUALITY_ASSESSMENT.name(), "message", message));
        }
        return out;
    }

    private static Map<String, Object> startedPayload(DocumentImage document, ProcessingOptions options) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("engines", options.engines().key());
        payload.put("language", options.language());
        if (document != null) {
            payload.put("documentId", document.id());
            payload.put("sizeBytes", document.bytes().length);
        }
        return payload;
    }

    private void fail(ProcessingEventChannel channel, String correlationId, String reason, RuntimeException e,
                      Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>(extra);
        payload.put("reason", reason);
        payload.put("message", String.valueOf(e.getMessage()));
        channel.emit(ProcessingEvent.Type.ERROR, payload);
        publish(new ProcessingFailedEvent(correlationId, reason, e.getMessage(), Instant.now()));
    }

    private void publish(Object event) {
        if (publisher == null) {
            return;
        }
        try {
            publisher.publishEvent(event);
        } catch (RuntimeException e) {
            LOG.warn("Failed to publish {}: {}", event.getClass().getSimpleName(), e.toString());
        }
    }
}
