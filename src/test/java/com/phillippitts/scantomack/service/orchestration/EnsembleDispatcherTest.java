package com.phillippitts.scantomack.service.orchestration;

import com.phillippitts.scantomack.domain.CombinationMethod;
import com.phillippitts.scantomack.domain.DocumentImage;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.domain.EngineSelector;
import com.phillippitts.scantomack.domain.EnsembleResult;
import com.phillippitts.scantomack.domain.ProcessingEvent;
import com.phillippitts.scantomack.domain.ProcessingOptions;
import com.phillippitts.scantomack.exception.AllEnginesFailedException;
import com.phillippitts.scantomack.exception.EngineTimeoutException;
import com.phillippitts.scantomack.exception.InvalidDocumentException;
import com.phillippitts.scantomack.service.combine.ResultCombiner;
import com.phillippitts.scantomack.service.combine.impl.ConfidenceSelector;
import com.phillippitts.scantomack.service.metrics.OcrMetrics;
import com.phillippitts.scantomack.service.ocr.EngineResultAssembler;
import com.phillippitts.scantomack.service.ocr.registry.EngineRegistry;
import com.phillippitts.scantomack.service.preprocess.PreprocessedDocument;
import com.phillippitts.scantomack.service.quality.QualityMetricsCalculator;
import com.phillippitts.scantomack.testutil.FakeRecognitionEngine;
import com.phillippitts.scantomack.testutil.RecordingEventSink;
import com.phillippitts.scantomack.testutil.SyncExecutor;
import com.phillippitts.scantomack.testutil.TestImages;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnsembleDispatcherTest {

    private final FakeRecognitionEngine tesseract = new FakeRecognitionEngine(EngineId.TESSERACT, "Total due 42", 0.9);
    private final FakeRecognitionEngine easyocr = new FakeRecognitionEngine(EngineId.EASYOCR, "Total due 42", 0.8);
    private final FakeRecognitionEngine paddle = new FakeRecognitionEngine(EngineId.PADDLEOCR, "Tota1 due 42", 0.7);
    private final RecordingEventSink events = new RecordingEventSink();
    private final PreprocessedDocument document = PreprocessedDocument.unchanged(DocumentImage.of(TestImages.png()));
    private final ProcessingOptions options = ProcessingOptions.builder().engines(EngineSelector.ensemble()).build();
    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();

    private final SyncExecutor executor = new SyncExecutor();
    private EnsembleDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        EngineRegistry registry = new EngineRegistry(List.of(tesseract, easyocr, paddle), Duration.ofSeconds(1));
        registry.initialize();
        ProcessingMetricsPublisher metrics = new ProcessingMetricsPublisher(new OcrMetrics(meters));
        EngineInvoker invoker = new EngineInvoker(registry,
                new EngineResultAssembler(new QualityMetricsCalculator()), metrics);
        dispatcher = new EnsembleDispatcher(invoker, new ResultCombiner(new ConfidenceSelector()),
                executor, metrics);
    }

    @Test
    void combinesAllSuccessfulEngines() {
        EnsembleResult result = dispatcher.dispatch(
                List.of(EngineId.TESSERACT, EngineId.EASYOCR, EngineId.PADDLEOCR), document, options, events);

        assertThat(result.engine()).isEqualTo(EngineId.ENSEMBLE);
        assertThat(result.text()).isEqualTo("Total due 42");
        assertThat(result.engineResults()).containsOnlyKeys(EngineId.TESSERACT, EngineId.EASYOCR, EngineId.PADDLEOCR);
        assertThat(result.combinationMethod()).isEqualTo(CombinationMethod.CONFIDENCE_WEIGHTED);
        assertThat(result.agreementScore()).isBetween(0.9, 1.0);
        assertThat(events.ofType(ProcessingEvent.Type.ENGINE_SELECTED)).hasSize(3);
        assertThat(executor.executedCount()).isEqualTo(3);
        assertThat(meters.get("scantomack.ocr.ensemble").tag("engines", "3").counter().count()).isEqualTo(1.0);
    }

    @Test
    void partialFailureStillCombinesSurvivors() {
        tesseract.thenThrow(new EngineTimeoutException("slow", EngineId.TESSERACT));

        EnsembleResult result = dispatcher.dispatch(
                List.of(EngineId.TESSERACT, EngineId.EASYOCR, EngineId.PADDLEOCR), document, options, events);

        assertThat(result.engineResults()).containsOnlyKeys(EngineId.EASYOCR, EngineId.PADDLEOCR);
        assertThat(result.confidence()).isEqualTo(result.engineResults().get(EngineId.EASYOCR).confidence());
        assertThat(meters.get("scantomack.ocr.failure").tag("reason", "timeout").counter().count()).isEqualTo(1.0);
    }

    @Test
    void failsWhenEveryEngineFails() {
        tesseract.thenThrow(new EngineTimeoutException("slow", EngineId.TESSERACT));
        easyocr.thenThrow(new EngineTimeoutException("slow", EngineId.EASYOCR));

        assertThatThrownBy(() -> dispatcher.dispatch(List.of(EngineId.TESSERACT, EngineId.EASYOCR),
                document, options, events))
                .isInstanceOfSatisfying(AllEnginesFailedException.class, e ->
                        assertThat(e.getFailures()).containsOnlyKeys(EngineId.TESSERACT, EngineId.EASYOCR));
    }

    @Test
    void documentRejectedByEveryEngineIsInvalid() {
        tesseract.thenThrow(new InvalidDocumentException("corrupt"));
        easyocr.thenThrow(new InvalidDocumentException("corrupt"));

        assertThatThrownBy(() -> dispatcher.dispatch(List.of(EngineId.TESSERACT, EngineId.EASYOCR),
                document, options, events))
                .isInstanceOf(InvalidDocumentException.class);
    }

    @Test
    void emptyEngineListFails() {
        assertThatThrownBy(() -> dispatcher.dispatch(List.of(), document, options, events))
                .isInstanceOf(AllEnginesFailedException.class)
                .hasMessageContaining("No engines available");
    }

    @Test
    void duplicateEnginesRunOnce() {
        EnsembleResult result = dispatcher.dispatch(List.of(EngineId.EASYOCR, EngineId.EASYOCR), document, options,
                events);

        assertThat(easyocr.calls()).isEqualTo(1);
        assertThat(result.engineResults()).containsOnlyKeys(EngineId.EASYOCR);
        assertThat(result.agreementScore()).isEqualTo(1.0);
    }
}
