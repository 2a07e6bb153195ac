package com.phillippitts.scantomack.service.orchestration;

import com.phillippitts.scantomack.domain.CompleteResult;
import com.phillippitts.scantomack.domain.DocumentImage;
import com.phillippitts.scantomack.domain.EngineSelector;
import com.phillippitts.scantomack.domain.EnsembleResult;
import com.phillippitts.scantomack.domain.ProcessingEvent;
import com.phillippitts.scantomack.domain.ProcessingOptions;
import com.phillippitts.scantomack.domain.RecognitionResult;
import com.phillippitts.scantomack.domain.TextCorrection;
import com.phillippitts.scantomack.exception.ScanToMackException;
import com.phillippitts.scantomack.service.cache.ResultCache;
import com.phillippitts.scantomack.service.ocr.registry.EngineRegistry;
import com.phillippitts.scantomack.service.orchestration.event.ProcessingEventChannel;
import com.phillippitts.scantomack.service.postprocess.PostProcessingResult;
import com.phillippitts.scantomack.service.postprocess.TextPostProcessor;
import com.phillippitts.scantomack.service.preprocess.DocumentPreprocessor;
import com.phillippitts.scantomack.service.preprocess.PreprocessedDocument;
import com.phillippitts.scantomack.service.quality.QualityAssessment;
import com.phillippitts.scantomack.service.quality.QualityAssessor;
import com.phillippitts.scantomack.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Turns one document request into a {@link CompleteResult}.
 *
 * <p>Stages, in order: cache check, in-flight deduplication, preprocessing, engine dispatch,
 * post-processing, quality assessment. Only dispatch can fail the request; a failing
 * preprocessor, post-processor, assessor or cache degrades the result with a warning instead.
 *
 * <p>Deduplication: requests with the same document identity and normalized options share one
 * execution. The first caller runs the pipeline; followers block on its future and receive the
 * identical result object (or the identical exception). Followers' channels only see the events
 * their own call emits, which is none.
 *
 * <p>Thread Safety: the in-flight map is the only mutable shared state.
 *
 * <p><b>Configuration:</b> Not annotated as {@code @Component}; see
 * {@link com.phillippitts.scantomack.config.orchestration.OrchestrationConfig} for bean wiring.
 */
public class ProcessingOrchestrator {

    private static final Logger LOG = LogManager.getLogger(ProcessingOrchestrator.class);

    private final EngineRegistry registry;
    private final RetryingDispatcher singleDispatcher;
    private final EnsembleDispatcher ensembleDispatcher;
    private final DocumentPreprocessor preprocessor;
    private final TextPostProcessor postProcessor;
    private final QualityAssessor assessor;
    private final ResultCache cache;
    private final Clock clock;
    private final String version;

    private final ConcurrentHashMap<String, CompletableFuture<CompleteResult>> inFlight = new ConcurrentHashMap<>();

    // CHECKSTYLE.OFF: ParameterNumber - collaborators are all required seams
    public ProcessingOrchestrator(EngineRegistry registry,
                                  RetryingDispatcher singleDispatcher,
                                  EnsembleDispatcher ensembleDispatcher,
                                  DocumentPreprocessor preprocessor,
                                  TextPostProcessor postProcessor,
                                  QualityAssessor assessor,
                                  ResultCache cache,
                                  Clock clock,
                                  String version) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.singleDispatcher = Objects.requireNonNull(singleDispatcher, "singleDispatcher");
        this.ensembleDispatcher = Objects.requireNonNull(ensembleDispatcher, "ensembleDispatcher");
        this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor");
        this.postProcessor = Objects.requireNonNull(postProcessor, "postProcessor");
        this.assessor = Objects.requireNonNull(assessor, "assessor");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.version = Objects.requireNonNull(version, "version");
    }
    // CHECKSTYLE.ON: ParameterNumber

    /**
     * @throws com.phillippitts.scantomack.exception.AllEnginesFailedException if no engine produced a result
     * @throws com.phillippitts.scantomack.exception.InvalidDocumentException if the image was rejected
     */
    public CompleteResult process(DocumentImage document, ProcessingOptions options, ProcessingEventChannel channel) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(options, "options");
        ProcessingEventChannel events = channel == null ? ProcessingEventChannel.NOOP : channel;
        String key = requestKey(document, options);

        if (options.caching()) {
            Optional<CompleteResult> cached = lookupCache(key);
            if (cached.isPresent()) {
                LOG.debug("Cache hit for document {}", document.id());
                return cached.get();
            }
        }

        CompletableFuture<CompleteResult> mine = new CompletableFuture<>();
        CompletableFuture<CompleteResult> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            LOG.debug("Joining in-flight request for document {}", document.id());
            return await(existing);
        }

        try {
            CompleteResult result = execute(document, options, events);
            mine.complete(result);
            if (options.caching()) {
                storeCache(key, result);
            }
            return result;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /**
     * Number of distinct requests currently executing.
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    static String requestKey(DocumentImage document, ProcessingOptions options) {
        return document.id() + ":" + options.normalizedKey();
    }

    private CompleteResult execute(DocumentImage document, ProcessingOptions options, ProcessingEventChannel events) {
        long start = System.nanoTime();
        List<CompleteResult.StageError> errors = new ArrayList<>();
        List<CompleteResult.StageWarning> warnings = new ArrayList<>();

        // Preprocessing
        long stageStart = System.nanoTime();
        events.emit(ProcessingEvent.Type.PREPROCESSING, Map.of("steps", options.preprocessingSteps()));
        PreprocessedDocument prepared;
        try {
            prepared = preprocessor.preprocess(document, options.preprocessingSteps());
        } catch (RuntimeException e) {
            LOG.warn("Preprocessing failed for {}; using original image: {}", document.id(), e.getMessage());
            warn(events, warnings, CompleteResult.Stage.PREPROCESSING,
                    "Preprocessing failed, original image used: " + e.getMessage(), CompleteResult.Impact.MEDIUM);
            prepared = PreprocessedDocument.unchanged(document);
        }
        long preprocessingMs = TimeUtils.elapsedMillis(stageStart);

        // Engine dispatch
        stageStart = System.nanoTime();
        RecognitionResult recognition = dispatch(prepared, options, events);
        long ocrMs = TimeUtils.elapsedMillis(stageStart);
        Double agreement = recognition instanceof EnsembleResult ensemble ? ensemble.agreementScore() : null;
        Map<String, Object> completed = new HashMap<>();
        completed.put("engine", recognition.engine().wireName());
        completed.put("durationMs", ocrMs);
        completed.put("confidence", recognition.confidence());
        if (agreement != null) {
            completed.put("agreement", agreement);
        }
        events.emit(ProcessingEvent.Type.ENGINE_COMPLETED, completed);

        // Post-processing
        stageStart = System.nanoTime();
        String text = recognition.text();
        List<TextCorrection> corrections = List.of();
        Double semantic = null;
        if (options.postProcessing()) {
            events.emit(ProcessingEvent.Type.POST_PROCESSING);
            try {
                PostProcessingResult post = postProcessor.process(recognition.text(), options);
                text = post.correctedText();
                corrections = post.corrections();
                semantic = post.semanticConfidence();
            } catch (RuntimeException e) {
                LOG.warn("Post-processing failed; keeping raw text: {}", e.getMessage());
                errors.add(new CompleteResult.StageError(CompleteResult.Stage.POSTPROCESSING, e.getMessage(),
                        CompleteResult.Severity.LOW, "Raw OCR text returned"));
                warn(events, warnings, CompleteResult.Stage.POSTPROCESSING,
                        "Post-processing failed, raw text returned", CompleteResult.Impact.LOW);
            }
        }
        long postprocessingMs = TimeUtils.elapsedMillis(stageStart);

        // Quality assessment
        stageStart = System.nanoTime();
        double overall = 0.0;
        List<String> recommendations = List.of();
        try {
            QualityAssessment assessment = assessor.assess(recognition, semantic, agreement);
            overall = assessment.overallScore();
            recommendations = assessment.recommendations();
        } catch (RuntimeException e) {
            LOG.warn("Quality assessment failed: {}", e.getMessage());
            warn(events, warnings, CompleteResult.Stage.QUALITY_ASSESSMENT,
                    "Quality assessment failed, overall quality set to 0", CompleteResult.Impact.MEDIUM);
        }
        long qualityMs = TimeUtils.elapsedMillis(stageStart);

        CompleteResult.Metadata metadata = new CompleteResult.Metadata(options.correlationId(),
                UUID.randomUUID().toString(), clock.instant(), version, recognition.engine());
        CompleteResult.StageTimings timings = new CompleteResult.StageTimings(
                preprocessingMs, ocrMs, postprocessingMs, qualityMs);
        return new CompleteResult(recognition, text, corrections, semantic, overall, recommendations,
                TimeUtils.elapsedMillis(start), timings, metadata, errors, warnings);
    }

    private RecognitionResult dispatch(PreprocessedDocument prepared, ProcessingOptions options,
                                       ProcessingEventChannel events) {
        EngineSelector selector = options.engines();
        if (selector instanceof EngineSelector.Single single) {
            return singleDispatcher.dispatch(single.engine(), prepared, options, events);
        }
        if (selector instanceof EngineSelector.Explicit explicit) {
            return ensembleDispatcher.dispatch(explicit.engines(), prepared, options, events);
        }
        return ensembleDispatcher.dispatch(List.copyOf(registry.availableEngines()), prepared, options, events);
    }

    private static void warn(ProcessingEventChannel events, List<CompleteResult.StageWarning> warnings,
                             CompleteResult.Stage stage, String message, CompleteResult.Impact impact) {
        warnings.add(new CompleteResult.StageWarning(stage, message, impact));
        events.emit(ProcessingEvent.Type.WARNING, Map.of("stage", stage.name(), "message", message));
    }

    private Optional<CompleteResult> lookupCache(String key) {
        try {
            return cache.lookup(key);
        } catch (RuntimeException e) {
            LOG.warn("Result cache lookup failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void storeCache(String key, CompleteResult result) {
        try {
            cache.store(key, result);
        } catch (RuntimeException e) {
            LOG.warn("Result cache store failed: {}", e.getMessage());
        }
    }

    private static CompleteResult await(CompletableFuture<CompleteResult> leader) {
        try {
            return leader.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new ScanToMackException("Deduplicated request failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanToMackException("Interrupted waiting for an identical in-flight request", e);
        }
    }
}
