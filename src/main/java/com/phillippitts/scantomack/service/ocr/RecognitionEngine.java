package com.phillippitts.scantomack.service.ocr;

import com.phillippitts.scantomack.domain.DocumentImage;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.exception.RecognitionException;

import java.time.Duration;

/**
 * Contract for text-recognition engines.
 *
 * <p>There is exactly one implementation per dispatchable {@link EngineId}: the in-process
 * Tesseract pool and one bridge per external engine.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Engine is constructed with configuration</li>
 *   <li>{@link #initialize()} starts workers or spawns the process</li>
 *   <li>{@link #probe(Duration)} confirms the engine actually answers</li>
 *   <li>{@link #recognize} is called concurrently by the orchestrator</li>
 *   <li>{@link #close()} releases workers or terminates the process</li>
 * </ol>
 *
 * <p>Thread Safety: implementations must accept concurrent {@link #recognize} calls; they may
 * serialize them internally.
 */
public interface RecognitionEngine extends AutoCloseable {

    EngineId id();

    /**
     * Starts the engine. Idempotent.
     *
     * @throws RecognitionException if the engine cannot start
     */
    void initialize();

    /**
     * Checks that the engine answers within the timeout. Never throws.
     */
    boolean probe(Duration timeout);

    /**
     * Recognizes words in the document.
     *
     * @param document decoded-able document image
     * @param language Tesseract-style language code (e.g. "eng")
     * @param timeout  wall-clock limit for this call
     * @return words and engine version
     * @throws RecognitionException (or a subclass) on failure
     */
    RawRecognition recognize(DocumentImage document, String language, Duration timeout);

    EngineCapabilities capabilities();

    boolean isHealthy();

    /**
     * Number of native worker units this engine runs (0 for bridged engines).
     */
    default int workerCount() {
        return 0;
    }

    /**
     * Number of live external processes this engine owns (0 for native engines).
     */
    default int processCount() {
        return 0;
    }

    /**
     * Releases all resources. Idempotent; never throws for already-closed engines.
     */
    @Override
    void close();
}
