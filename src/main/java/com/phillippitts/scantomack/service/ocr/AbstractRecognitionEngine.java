package com.phillippitts.scantomack.service.ocr;

import com.phillippitts.scantomack.exception.EngineUnavailableException;
import com.phillippitts.scantomack.exception.RecognitionException;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Map;

/**
 * Base class for recognition engines providing common lifecycle and state management.
 *
 * <p>Template Method: subclasses implement {@link #doInitialize()} and {@link #doClose()};
 * this class guarantees both run at most once per lifecycle under {@link #lock}.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li><b>Uninitialized:</b> engine created but not yet started</li>
 *   <li><b>Initialized:</b> {@link #initialize()} succeeded</li>
 *   <li><b>Closed:</b> {@link #close()} called, engine no longer usable</li>
 * </ol>
 *
 * <p>A closed engine reports {@link #isHealthy()} as false. Bridged engines close themselves after
 * a timed-out call, which is how a tainted process drops out of the registry.
 *
 * @see com.phillippitts.scantomack.service.ocr.tesseract.TesseractEngine
 * @see com.phillippitts.scantomack.service.ocr.bridge.BridgedRecognitionEngine
 */
public abstract class AbstractRecognitionEngine implements RecognitionEngine {

    /**
     * Guards {@link #initialized} and {@link #closed}.
     */
    protected final Object lock = new Object();

    // @GuardedBy("lock")
    protected boolean initialized = false;

    // @GuardedBy("lock")
    protected boolean closed = false;

    /**
     * Starts the engine once; repeated calls on a running engine are no-ops.
     *
     * @throws RecognitionException if initialization fails
     */
    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized && !closed) {
                return;
            }
            doInitialize();
            initialized = true;
            closed = false;
        }
    }

    /**
     * Engine-specific start-up, called under {@link #lock}. Must throw on failure and leave no
     * half-started resources behind.
     */
    protected abstract void doInitialize();

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed && isOperational();
        }
    }

    /**
     * Extra liveness check for subclasses (e.g. bridge process still alive). Called under {@link #lock}.
     */
    protected boolean isOperational() {
        return true;
    }

    @Override
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            try {
                doClose();
            } finally {
                closed = true;
                initialized = false;
            }
        }
    }

    /**
     * Engine-specific cleanup, called under {@link #lock}. Must tolerate partially-initialized state.
     */
    protected abstract void doClose();

    /**
     * @throws EngineUnavailableException if the engine is not running
     */
    protected final void ensureInitialized() {
        synchronized (lock) {
            if (!initialized || closed) {
                throw new EngineUnavailableException("engine not initialized or closed", id());
            }
        }
    }

    /**
     * Publishes a failure event and returns the exception to throw: recognition exceptions are
     * preserved, anything else is wrapped with engine context.
     *
     * <pre>{@code
     * try {
     *     return recognizeInternal(document);
     * } catch (Exception e) {
     *     throw handleRecognitionError(e, publisher, context);
     * }
     * }</pre>
     */
    protected final RecognitionException handleRecognitionError(
            Exception exception,
            ApplicationEventPublisher publisher,
            Map<String, String> context) {

        EngineEventPublisher.publishFailure(publisher, id(), "recognition failure", exception, context);

        if (exception instanceof RecognitionException re) {
            return re;
        }
        return new RecognitionException(id() + " recognition failed: " + exception.getMessage(), id(), exception);
    }
}
