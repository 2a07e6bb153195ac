package com.phillippitts.scantomack.service.orchestration;

import com.phillippitts.scantomack.domain.CompleteResult;
import com.phillippitts.scantomack.domain.DocumentImage;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.domain.EngineSelector;
import com.phillippitts.scantomack.domain.EnsembleResult;
import com.phillippitts.scantomack.domain.ProcessingEvent;
import com.phillippitts.scantomack.domain.ProcessingOptions;
import com.phillippitts.scantomack.exception.AllEnginesFailedException;
import com.phillippitts.scantomack.exception.EngineTimeoutException;
import com.phillippitts.scantomack.service.cache.InMemoryResultCache;
import com.phillippitts.scantomack.service.cache.NoOpResultCache;
import com.phillippitts.scantomack.service.cache.ResultCache;
import com.phillippitts.scantomack.service.combine.ResultCombiner;
import com.phillippitts.scantomack.service.combine.impl.ConfidenceSelector;
import com.phillippitts.scantomack.service.ocr.EngineResultAssembler;
import com.phillippitts.scantomack.service.ocr.registry.EngineRegistry;
import com.phillippitts.scantomack.service.postprocess.RuleBasedTextPostProcessor;
import com.phillippitts.scantomack.service.postprocess.TextPostProcessor;
import com.phillippitts.scantomack.service.preprocess.DocumentPreprocessor;
import com.phillippitts.scantomack.service.preprocess.PassThroughPreprocessor;
import com.phillippitts.scantomack.service.quality.QualityAssessor;
import com.phillippitts.scantomack.service.quality.QualityMetricsCalculator;
import com.phillippitts.scantomack.testutil.FakeRecognitionEngine;
import com.phillippitts.scantomack.testutil.RecordingBackoff;
import com.phillippitts.scantomack.testutil.RecordingEventSink;
import com.phillippitts.scantomack.testutil.SyncExecutor;
import com.phillippitts.scantomack.testutil.TestImages;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProcessingOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private final FakeRecognitionEngine tesseract = new FakeRecognitionEngine(EngineId.TESSERACT, "Total : 12.5O", 0.9);
    private final FakeRecognitionEngine easyocr = new FakeRecognitionEngine(EngineId.EASYOCR, "Total : 12.50", 0.8);
    private final RecordingEventSink events = new RecordingEventSink();
    private final DocumentImage document = DocumentImage.of(TestImages.png());

    private DocumentPreprocessor preprocessor = new PassThroughPreprocessor();
    private TextPostProcessor postProcessor = new RuleBasedTextPostProcessor();
    private ResultCache cache = new NoOpResultCache();

    private ProcessingOrchestrator orchestrator() {
        EngineRegistry registry = new EngineRegistry(List.of(tesseract, easyocr), Duration.ofSeconds(1));
        registry.initialize();
        EngineInvoker invoker = new EngineInvoker(registry, new EngineResultAssembler(new QualityMetricsCalculator()),
                ProcessingMetricsPublisher.NOOP);
        RetryingDispatcher single = new RetryingDispatcher(invoker, registry, new RecordingBackoff(),
                Duration.ofMillis(10));
        EnsembleDispatcher ensemble = new EnsembleDispatcher(invoker, new ResultCombiner(new ConfidenceSelector()),
                new SyncExecutor(), ProcessingMetricsPublisher.NOOP);
        return new ProcessingOrchestrator(registry, single, ensemble, preprocessor, postProcessor,
                new QualityAssessor(), cache, Clock.fixed(NOW, ZoneOffset.UTC), "test-version");
    }

    private static ProcessingOptions.Builder options() {
        return ProcessingOptions.builder().correlationId("cid-1").fallbackEnabled(false);
    }

    @Test
    void singleEnginePipelineRunsEveryStage() {
        CompleteResult result = orchestrator().process(document, options().build(), events);

        assertThat(events.types()).containsExactly(
                ProcessingEvent.Type.PREPROCESSING,
                ProcessingEvent.Type.ENGINE_SELECTED,
                ProcessingEvent.Type.ENGINE_COMPLETED,
                ProcessingEvent.Type.POST_PROCESSING);
        assertThat(result.recognition().text()).isEqualTo("Total : 12.5O");
        assertThat(result.postProcessedText()).isEqualTo("Total: 12.50");
        assertThat(result.textCorrections()).hasSize(2);
        assertThat(result.semanticConfidence()).isNotNull();
        assertThat(result.overallQuality()).isBetween(0.0, 1.0);
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.metadata().correlationId()).isEqualTo("cid-1");
        assertThat(result.metadata().timestamp()).isEqualTo(NOW);
        assertThat(result.metadata().version()).isEqualTo("test-version");
        assertThat(result.metadata().engineUsed()).isEqualTo(EngineId.TESSERACT);
        assertThat(result.metadata().processingId()).isNotBlank();
    }

    @Test
    void postProcessingCanBeDisabled() {
        CompleteResult result = orchestrator().process(document, options().postProcessing(false).build(), events);

        assertThat(result.postProcessedText()).isEqualTo("Total : 12.5O");
        assertThat(result.textCorrections()).isEmpty();
        assertThat(result.semanticConfidence()).isNull();
        assertThat(events.types()).doesNotContain(ProcessingEvent.Type.POST_PROCESSING);
    }

    @Test
    void postProcessingFailureDegradesToRawText() {
        postProcessor = (text, opts) -> {
            throw new IllegalStateException("dictionary unavailable");
        };

        CompleteResult result = orchestrator().process(document, options().build(), events);

        assertThat(result.postProcessedText()).isEqualTo("Total : 12.5O");
        assertThat(result.errors()).singleElement().satisfies(e -> {
            assertThat(e.stage()).isEqualTo(CompleteResult.Stage.POSTPROCESSING);
            assertThat(e.severity()).isEqualTo(CompleteResult.Severity.LOW);
            assertThat(e.error()).isEqualTo("dictionary unavailable");
        });
        assertThat(result.warnings()).extracting(CompleteResult.StageWarning::stage)
                .containsExactly(CompleteResult.Stage.POSTPROCESSING);
        assertThat(events.types()).contains(ProcessingEvent.Type.WARNING);
    }

    @Test
    void preprocessingFailureFallsBackToOriginalImage() {
        preprocessor = mock(DocumentPreprocessor.class);
        when(preprocessor.preprocess(any(), anyList())).thenThrow(new IllegalArgumentException("unknown step: warp"));

        CompleteResult result = orchestrator().process(document,
                options().preprocessingSteps(List.of("warp")).build(), events);

        assertThat(result.recognition().engine()).isEqualTo(EngineId.TESSERACT);
        assertThat(result.warnings()).singleElement().satisfies(w -> {
            assertThat(w.stage()).isEqualTo(CompleteResult.Stage.PREPROCESSING);
            assertThat(w.impact()).isEqualTo(CompleteResult.Impact.MEDIUM);
        });
    }

    @Test
    void ensembleSelectorCombinesAvailableEngines() {
        CompleteResult result = orchestrator().process(document,
                options().engines(EngineSelector.ensemble()).build(), events);

        assertThat(result.recognition()).isInstanceOf(EnsembleResult.class);
        assertThat(result.metadata().engineUsed()).isEqualTo(EngineId.ENSEMBLE);
        ProcessingEvent completed = events.ofType(ProcessingEvent.Type.ENGINE_COMPLETED).get(0);
        assertThat(completed.payload()).containsKey("agreement").containsEntry("engine", "ensemble");
    }

    @Test
    void totalEngineFailurePropagates() {
        tesseract.thenThrow(new EngineTimeoutException("slow", EngineId.TESSERACT))
                .thenThrow(new EngineTimeoutException("slow", EngineId.TESSERACT));
        ProcessingOrchestrator orchestrator = orchestrator();

        assertThatThrownBy(() -> orchestrator.process(document, options().build(), events))
                .isInstanceOf(AllEnginesFailedException.class);
        assertThat(orchestrator.inFlightCount()).isZero();
    }

    @Test
    void cachedResultIsReturnedWithoutRecognition() {
        cache = new InMemoryResultCache(10, Duration.ofMinutes(5));
        ProcessingOrchestrator orchestrator = orchestrator();

        CompleteResult first = orchestrator.process(document, options().caching(true).build(), events);
        CompleteResult second = orchestrator.process(document, options().caching(true).correlationId("cid-2").build(),
                new RecordingEventSink());

        assertThat(second).isSameAs(first);
        assertThat(tesseract.calls()).isEqualTo(1);
    }

    @Test
    void cachingDisabledAlwaysRecognizes() {
        cache = new InMemoryResultCache(10, Duration.ofMinutes(5));
        ProcessingOrchestrator orchestrator = orchestrator();

        orchestrator.process(document, options().build(), events);
        orchestrator.process(document, options().build(), events);

        assertThat(tesseract.calls()).isEqualTo(2);
    }

    @Test
    void failingCacheIsIgnored() {
        cache = mock(ResultCache.class);
        when(cache.lookup(any())).thenThrow(new IllegalStateException("cache down"));

        CompleteResult result = orchestrator().process(document, options().caching(true).build(), events);

        assertThat(result.recognition().engine()).isEqualTo(EngineId.TESSERACT);
    }

    @Test
    void identicalConcurrentRequestsShareOneExecution() throws Exception {
        tesseract.gated();
        ProcessingOrchestrator orchestrator = orchestrator();
        RecordingEventSink followerEvents = new RecordingEventSink();
        AtomicReference<CompleteResult> leaderResult = new AtomicReference<>();
        AtomicReference<CompleteResult> followerResult = new AtomicReference<>();

        Thread leader = new Thread(() -> leaderResult.set(
                orchestrator.process(document, options().correlationId("leader").build(), events)));
        leader.start();
        assertThat(tesseract.awaitEntered(5_000)).isTrue();

        Thread follower = new Thread(() -> followerResult.set(
                orchestrator.process(document, options().correlationId("follower").build(), followerEvents)));
        follower.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> follower.getState() == Thread.State.WAITING);
        assertThat(orchestrator.inFlightCount()).isEqualTo(1);

        tesseract.release();
        leader.join(5_000);
        follower.join(5_000);

        assertThat(tesseract.calls()).isEqualTo(1);
        assertThat(followerResult.get()).isSameAs(leaderResult.get());
        assertThat(followerEvents.events()).isEmpty();
        assertThat(orchestrator.inFlightCount()).isZero();
    }

    @Test
    void differentOptionsDoNotShareExecution() {
        ProcessingOrchestrator orchestrator = orchestrator();

        orchestrator.process(document, options().build(), events);
        orchestrator.process(document, options().language("deu").build(), events);

        assertThat(tesseract.calls()).isEqualTo(2);
    }

    @Test
    void requestKeyCombinesDocumentAndOptions() {
        String key = ProcessingOrchestrator.requestKey(document, options().build());

        assertThat(key).startsWith(document.id() + ":").endsWith(options().correlationId("other").build().normalizedKey());
    }
}
