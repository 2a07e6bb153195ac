package com.phillippitts.scantomack.presentation.controller;

import com.phillippitts.scantomack.config.properties.OrchestrationProperties;
import com.phillippitts.scantomack.domain.CompleteResult;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.domain.EngineSelector;
import com.phillippitts.scantomack.domain.ProcessingOptions;
import com.phillippitts.scantomack.exception.InvalidDocumentException;
import com.phillippitts.scantomack.service.integration.DocumentProcessingFacade;
import com.phillippitts.scantomack.service.ocr.EngineCapabilities;
import com.phillippitts.scantomack.service.ocr.registry.EngineHealthReport;
import com.phillippitts.scantomack.service.orchestration.event.ProcessingEventSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * HTTP surface of the document processing facade.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/ocr} - multipart image upload; returns the complete result</li>
 *   <li>{@code GET /api/v1/ocr/engines} - capabilities of the available engines</li>
 *   <li>{@code GET /api/v1/ocr/health} - engine health report (503 when no engine is available)</li>
 * </ul>
 *
 * <p>Exceptions are mapped to responses by the global exception handler.
 */
@RestController
@RequestMapping("/api/v1/ocr")
class OcrController {

    private static final Logger LOG = LogManager.getLogger(OcrController.class);

    private static final ProcessingEventSink LOGGING_SINK =
            event -> LOG.debug("Processing event {} {}", event.type(), event.payload());

    private final DocumentProcessingFacade facade;
    private final OrchestrationProperties defaults;

    OcrController(DocumentProcessingFacade facade, OrchestrationProperties defaults) {
        this.facade = facade;
        this.defaults = defaults;
    }

    // CHECKSTYLE.OFF: ParameterNumber - one request parameter per processing option
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<CompleteResult> process(
            @RequestParam("file") MultipartFile file,
            @RequestParam(name = "engine", required = false) String engine,
            @RequestParam(name = "engines", required = false) String engines,
            @RequestParam(name = "language", required = false) String language,
            @RequestParam(name = "confidenceThreshold", required = false) Double confidenceThreshold,
            @RequestParam(name = "qualityThreshold", required = false) Double qualityThreshold,
            @RequestParam(name = "timeoutMs", required = false) Long timeoutMs,
            @RequestParam(name = "maxRetries", required = false) Integer maxRetries,
            @RequestParam(name = "fallback", required = false) Boolean fallback,
            @RequestParam(name = "postProcessing", required = false) Boolean postProcessing,
            @RequestParam(name = "caching", required = false) Boolean caching,
            @RequestParam(name = "preprocessing", required = false) List<String> preprocessing,
            @RequestHeader(name = "X-Correlation-ID", required = false) String correlationId) throws IOException {

        ProcessingOptions options;
        try {
            ProcessingOptions.Builder builder = defaults.defaultOptions().correlationId(correlationId);
            if (engines != null && !engines.isBlank()) {
                builder.engines(EngineSelector.explicit(Arrays.stream(engines.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .map(EngineId::fromName)
                        .toList()));
            } else if (engine != null && !engine.isBlank()) {
                builder.engines(EngineSelector.single(EngineId.fromName(engine)));
            }
            if (language != null) {
                builder.language(language);
            }
            if (confidenceThreshold != null) {
                builder.confidenceThreshold(confidenceThreshold);
            }
            if (qualityThreshold != null) {
                builder.qualityThreshold(qualityThreshold);
            }
            if (timeoutMs != null) {
                builder.timeout(Duration.ofMillis(timeoutMs));
            }
            if (maxRetries != null) {
                builder.maxRetries(maxRetries);
            }
            if (fallback != null) {
                builder.fallbackEnabled(fallback);
            }
            if (postProcessing != null) {
                builder.postProcessing(postProcessing);
            }
            if (caching != null) {
                builder.caching(caching);
            }
            if (preprocessing != null) {
                builder.preprocessingSteps(preprocessing);
            }
            options = builder.build();
        } catch (IllegalArgumentException e) {
            throw new InvalidDocumentException("invalid options: " + e.getMessage());
        }

        LOG.info("OCR request: file={}, size={}B, engines={}", file.getOriginalFilename(), file.getSize(),
                options.engines().key());
        return ResponseEntity.ok(facade.process(file.getBytes(), options, LOGGING_SINK));
    }
    // CHECKSTYLE.ON: ParameterNumber

    @GetMapping("/engines")
    ResponseEntity<Map<EngineId, EngineCapabilities>> engines() {
        return ResponseEntity.ok(facade.availableEngines());
    }

    @GetMapping("/health")
    ResponseEntity<EngineHealthReport> health() {
        EngineHealthReport report = facade.healthCheck();
        HttpStatus status = report.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(report);
    }
}
