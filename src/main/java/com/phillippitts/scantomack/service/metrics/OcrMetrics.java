package com.phillippitts.scantomack.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for recognition work.
 *
 * <p>Provides:
 * <ul>
 *   <li>Engine call latency per engine (tesseract, easyocr, paddleocr)</li>
 *   <li>Success/failure counts per engine, failures tagged with the error kind</li>
 *   <li>Ensemble combinations by method</li>
 *   <li>Request outcomes at the facade</li>
 * </ul>
 *
 * <p>All meters are exposed at /actuator/prometheus.
 */
@Component
public class OcrMetrics {

    private static final String METRIC_PREFIX = "scantomack.ocr";

    private final MeterRegistry registry;

    public OcrMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLatency(String engineName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by one engine call")
                .tag("engine", engineName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String engineName) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful engine calls")
                .tag("engine", engineName)
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure kind (timeout, reported_failure, protocol_error, unavailable, error)
     */
    public void incrementFailure(String engineName, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed engine calls")
                .tag("engine", engineName)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordEnsemble(String method, int engineCount) {
        Counter.builder(METRIC_PREFIX + ".ensemble")
                .description("Number of ensemble combinations by method and contributing engine count")
                .tag("method", method)
                .tag("engines", Integer.toString(engineCount))
                .register(registry)
                .increment();
    }

    /**
     * @param outcome completed, failed or rejected
     */
    public void recordRequest(String outcome, String engineName) {
        Counter.builder(METRIC_PREFIX + ".requests")
                .description("Processed document requests by outcome")
                .tag("outcome", outcome)
                .tag("engine", engineName)
                .register(registry)
                .increment();
    }
}
