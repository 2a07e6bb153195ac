package com.phillippitts.scantomack.service.metrics;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class OcrMetricsTest {

    private SimpleMeterRegistry registry;
    private OcrMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new OcrMetrics(registry);
    }

    @Test
    void recordsLatencyPerEngine() {
        metrics.recordLatency("tesseract", TimeUnit.MILLISECONDS.toNanos(120));
        metrics.recordLatency("tesseract", TimeUnit.MILLISECONDS.toNanos(80));

        Timer timer = registry.find("scantomack.ocr.latency").tag("engine", "tesseract").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(200.0);
    }

    @Test
    void countsSuccessesAndFailuresSeparately() {
        metrics.incrementSuccess("easyocr");
        metrics.incrementFailure("easyocr", "timeout");
        metrics.incrementFailure("easyocr", "timeout");
        metrics.incrementFailure("easyocr", "protocol_error");

        assertThat(registry.get("scantomack.ocr.success").tag("engine", "easyocr").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("scantomack.ocr.failure").tags("engine", "easyocr", "reason", "timeout")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("scantomack.ocr.failure").tags("engine", "easyocr", "reason", "protocol_error")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void tagsEnsembleByMethodAndEngineCount() {
        metrics.recordEnsemble("CONFIDENCE_WEIGHTED", 2);

        assertThat(registry.get("scantomack.ocr.ensemble")
                .tags("method", "CONFIDENCE_WEIGHTED", "engines", "2").counter().count()).isEqualTo(1.0);
    }

    @Test
    void countsRequestOutcomes() {
        metrics.recordRequest("completed", "tesseract");
        metrics.recordRequest("invalid_document", "none");

        assertThat(registry.get("scantomack.ocr.requests").tags("outcome", "completed", "engine", "tesseract")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("scantomack.ocr.requests").tags("outcome", "invalid_document", "engine", "none")
                .counter().count()).isEqualTo(1.0);
    }
}
