package com.phillippitts.scantomack.testutil;

import com.phillippitts.scantomack.domain.DocumentImage;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.exception.EngineUnavailableException;
import com.phillippitts.scantomack.exception.RecognitionException;
import com.phillippitts.scantomack.service.ocr.EngineCapabilities;
import com.phillippitts.scantomack.service.ocr.RawRecognition;
import com.phillippitts.scantomack.service.ocr.RecognitionEngine;

import java.time.Duration;
import java.util.Deque;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for RecognitionEngine with scripted outcomes.
 *
 * <p>Each {@link #recognize} call consumes the next scripted outcome (a result or an exception);
 * once the script is empty the default text is returned. An optional gate blocks calls until the
 * test releases it, for concurrency scenarios.
 *
 * <p><b>Mutable fields:</b> {@code healthy} and {@code probeResult} are public to simulate
 * failures after start-up.
 */
public class FakeRecognitionEngine implements RecognitionEngine {

    private final EngineId id;
    private final String defaultText;
    private final double defaultConfidence;
    private final Deque<Object> script = new ConcurrentLinkedDeque<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger closes = new AtomicInteger();

    public volatile boolean healthy = true;
    public volatile boolean probeResult = true;
    private volatile RuntimeException initializeFailure;
    private volatile CountDownLatch gate;
    private volatile CountDownLatch entered = new CountDownLatch(1);
    private volatile boolean initialized;

    public FakeRecognitionEngine(EngineId id, String text, double confidence) {
        this.id = id;
        this.defaultText = text;
        this.defaultConfidence = confidence;
    }

    public FakeRecognitionEngine thenReturn(String text, double confidence) {
        script.add(new RawRecognition(TestImages.line(text, confidence), "fake-1.0"));
        return this;
    }

    public FakeRecognitionEngine thenThrow(RuntimeException failure) {
        script.add(failure);
        return this;
    }

    public FakeRecognitionEngine failingInitialize(RuntimeException failure) {
        this.initializeFailure = failure;
        return this;
    }

    /**
     * Makes every call block until {@link #release()}.
     */
    public FakeRecognitionEngine gated() {
        this.gate = new CountDownLatch(1);
        this.entered = new CountDownLatch(1);
        return this;
    }

    public void release() {
        CountDownLatch g = gate;
        if (g != null) {
            g.countDown();
        }
    }

    public boolean awaitEntered(long millis) throws InterruptedException {
        return entered.await(millis, TimeUnit.MILLISECONDS);
    }

    public int calls() {
        return calls.get();
    }

    public int closes() {
        return closes.get();
    }

    @Override
    public EngineId id() {
        return id;
    }

    @Override
    public void initialize() {
        if (initializeFailure != null) {
            throw initializeFailure;
        }
        initialized = true;
    }

    @Override
    public boolean probe(Duration timeout) {
        return probeResult;
    }

    @Override
    public RawRecognition recognize(DocumentImage document, String language, Duration timeout) {
        calls.incrementAndGet();
        entered.countDown();
        CountDownLatch g = gate;
        if (g != null) {
            try {
                if (!g.await(5, TimeUnit.SECONDS)) {
                    throw new RecognitionException("gate never released", id);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RecognitionException("interrupted", id, e);
            }
        }
        if (!healthy) {
            throw new EngineUnavailableException("fake engine unhealthy", id);
        }
        Object next = script.poll();
        if (next instanceof RuntimeException failure) {
            throw failure;
        }
        if (next instanceof RawRecognition raw) {
            return raw;
        }
        return new RawRecognition(TestImages.line(defaultText, defaultConfidence), "fake-1.0");
    }

    @Override
    public EngineCapabilities capabilities() {
        return new EngineCapabilities(Set.of("eng"), Set.of("png"), Set.of("text_detection"), Set.of(), 1);
    }

    @Override
    public boolean isHealthy() {
        return initialized && healthy;
    }

    @Override
    public void close() {
        closes.incrementAndGet();
        initialized = false;
    }
}
