package com.phillippitts.scantomack.service.orchestration;

import com.phillippitts.scantomack.domain.CombinationMethod;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.exception.BridgeProtocolException;
import com.phillippitts.scantomack.exception.EngineReportedFailureException;
import com.phillippitts.scantomack.exception.EngineTimeoutException;
import com.phillippitts.scantomack.exception.EngineUnavailableException;
import com.phillippitts.scantomack.exception.RecognitionException;
import com.phillippitts.scantomack.service.metrics.OcrMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessingMetricsPublisherTest {

    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final ProcessingMetricsPublisher publisher = new ProcessingMetricsPublisher(new OcrMetrics(meters));

    @Test
    void mapsFailureKindsToReasonTags() {
        assertThat(ProcessingMetricsPublisher.failureReason(new EngineTimeoutException("t", EngineId.EASYOCR)))
                .isEqualTo("timeout");
        assertThat(ProcessingMetricsPublisher.failureReason(
                new EngineReportedFailureException("r", EngineId.EASYOCR, "oom"))).isEqualTo("reported_failure");
        assertThat(ProcessingMetricsPublisher.failureReason(new BridgeProtocolException("p", EngineId.EASYOCR)))
                .isEqualTo("protocol_error");
        assertThat(ProcessingMetricsPublisher.failureReason(new EngineUnavailableException("u", EngineId.EASYOCR)))
                .isEqualTo("unavailable");
        assertThat(ProcessingMetricsPublisher.failureReason(new RecognitionException("x", EngineId.EASYOCR)))
                .isEqualTo("error");
    }

    @Test
    void recordsSuccessLatencyAndCount() {
        publisher.recordSuccess(EngineId.TESSERACT, TimeUnit.MILLISECONDS.toNanos(120));

        assertThat(meters.get("scantomack.ocr.success").tag("engine", "tesseract").counter().count()).isEqualTo(1.0);
        assertThat(meters.get("scantomack.ocr.latency").tag("engine", "tesseract").timer()
                .totalTime(TimeUnit.MILLISECONDS)).isEqualTo(120.0);
    }

    @Test
    void recordsFailureAndEnsemble() {
        publisher.recordFailure(EngineId.PADDLEOCR, new EngineTimeoutException("t", EngineId.PADDLEOCR));
        publisher.recordEnsemble(CombinationMethod.CONSENSUS, 2);

        assertThat(meters.get("scantomack.ocr.failure").tags("engine", "paddleocr", "reason", "timeout")
                .counter().count()).isEqualTo(1.0);
        assertThat(meters.get("scantomack.ocr.ensemble").tags("method", "consensus", "engines", "2")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void noopRecordsNothing() {
        ProcessingMetricsPublisher.NOOP.recordSuccess(EngineId.TESSERACT, 1L);
        ProcessingMetricsPublisher.NOOP.recordFailure(EngineId.TESSERACT, new RecognitionException("x", EngineId.TESSERACT));

        assertThat(ProcessingMetricsPublisher.NOOP.isEnabled()).isFalse();
        assertThat(publisher.isEnabled()).isTrue();
    }
}
