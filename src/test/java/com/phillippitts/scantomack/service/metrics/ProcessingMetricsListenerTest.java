package com.phillippitts.scantomack.service.metrics;

import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.service.orchestration.event.ProcessingCompletedEvent;
import com.phillippitts.scantomack.service.orchestration.event.ProcessingFailedEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessingMetricsListenerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ProcessingMetricsListener listener = new ProcessingMetricsListener(new OcrMetrics(registry));

    @Test
    void completedRequestIsCountedUnderItsEngine() {
        listener.onCompleted(new ProcessingCompletedEvent("c-1", EngineId.ENSEMBLE, 420, 0.8, Instant.now()));

        assertThat(registry.get("scantomack.ocr.requests").tags("outcome", "completed", "engine", "ensemble")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void failedRequestIsCountedUnderItsReason() {
        listener.onFailed(new ProcessingFailedEvent("c-2", "all_engines_failed", "boom", Instant.now()));
        listener.onFailed(new ProcessingFailedEvent("c-3", "all_engines_failed", "boom", Instant.now()));

        assertThat(registry.get("scantomack.ocr.requests").tags("outcome", "all_engines_failed", "engine", "none")
                .counter().count()).isEqualTo(2.0);
    }
}
