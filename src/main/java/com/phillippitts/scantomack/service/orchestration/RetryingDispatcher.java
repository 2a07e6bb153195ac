package com.phillippitts.scantomack.service.orchestration;

import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.domain.EngineResult;
import com.phillippitts.scantomack.domain.ProcessingEvent;
import com.phillippitts.scantomack.domain.ProcessingOptions;
import com.phillippitts.scantomack.exception.AllEnginesFailedException;
import com.phillippitts.scantomack.exception.BridgeProtocolException;
import com.phillippitts.scantomack.exception.EngineReportedFailureException;
import com.phillippitts.scantomack.exception.EngineTimeoutException;
import com.phillippitts.scantomack.exception.RecognitionException;
import com.phillippitts.scantomack.service.ocr.registry.EngineRegistry;
import com.phillippitts.scantomack.service.orchestration.event.ProcessingEventChannel;
import com.phillippitts.scantomack.service.preprocess.PreprocessedDocument;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Single-engine dispatch: retries on the primary engine, then one-shot fallbacks.
 *
 * <p>Retry policy for the primary:
 * <ul>
 *   <li>Timeouts and engine-reported failures are retried up to {@code maxRetries} attempts</li>
 *   <li>A protocol error is retried once; a second one ends the primary's attempts</li>
 *   <li>Unavailable engines and other recognition failures are not retried</li>
 *   <li>Invalid documents propagate immediately; no other engine would do better</li>
 * </ul>
 * Backoff runs between attempts only, never after the last one. An engine that drops out of the
 * registry between attempts is not retried.
 *
 * <p>Fallbacks come from {@link FallbackTable}, skip engines that are already tried or not
 * available, and get exactly one attempt each. The first success wins and keeps its own engine id.
 */
public class RetryingDispatcher {

    private static final Logger LOG = LogManager.getLogger(RetryingDispatcher.class);

    private static final int MAX_PROTOCOL_ERRORS = 2;

    private final EngineInvoker invoker;
    private final EngineRegistry registry;
    private final Backoff backoff;
    private final Duration backoffBase;

    public RetryingDispatcher(EngineInvoker invoker, EngineRegistry registry, Backoff backoff, Duration backoffBase) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.backoffBase = Objects.requireNonNull(backoffBase, "backoffBase");
    }

    /**
     * @throws AllEnginesFailedException if the primary and every fallback failed
     * @throws com.phillippitts.scantomack.exception.InvalidDocumentException if an engine rejects the image
     */
    public EngineResult dispatch(EngineId primary,
                                 PreprocessedDocument document,
                                 ProcessingOptions options,
                                 ProcessingEventChannel channel) {
        Map<EngineId, RecognitionException> failures = new LinkedHashMap<>();
        RecognitionException last = null;

        int attempts = Math.max(1, options.maxRetries());
        int protocolErrors = 0;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            channel.emit(ProcessingEvent.Type.ENGINE_SELECTED,
                    Map.of("engine", primary.wireName(), "attempt", attempt, "fallback", false));
            try {
                return invoker.invoke(primary, document, options);
            } catch (RecognitionException e) {
                // the first failure explains the outage; later attempts mostly report its fallout
                failures.putIfAbsent(primary, e);
                last = e;
                boolean retryable;
                if (e instanceof EngineTimeoutException || e instanceof EngineReportedFailureException) {
                    retryable = true;
                } else if (e instanceof BridgeProtocolException) {
                    retryable = ++protocolErrors < MAX_PROTOCOL_ERRORS;
                } else {
                    retryable = false;
                }
                LOG.warn("{} attempt {}/{} failed ({}): {}", primary, attempt, attempts,
                        e.getClass().getSimpleName(), e.getMessage());
                if (!retryable || attempt == attempts) {
                    break;
                }
                if (!registry.isAvailable(primary)) {
                    LOG.warn("{} left the registry after attempt {}; not retrying", primary, attempt);
                    break;
                }
                if (!pause(attempt)) {
                    break;
                }
            }
        }

        if (options.fallbackEnabled() && !Thread.currentThread().isInterrupted()) {
            for (EngineId fallback : FallbackTable.fallbacksFor(primary)) {
                if (failures.containsKey(fallback)) {
                    continue;
                }
                if (!registry.isAvailable(fallback)) {
                    LOG.debug("Skipping fallback {}: not available", fallback);
                    continue;
                }
                channel.emit(ProcessingEvent.Type.ENGINE_SELECTED,
                        Map.of("engine", fallback.wireName(), "attempt", 1, "fallback", true));
                try {
                    EngineResult result = invoker.invoke(fallback, document, options);
                    LOG.info("Fallback {} succeeded after {} failed", fallback, primary);
                    return result;
                } catch (RecognitionException e) {
                    failures.put(fallback, e);
                    last = e;
                    LOG.warn("Fallback {} failed ({}): {}", fallback, e.getClass().getSimpleName(), e.getMessage());
                }
            }
        }

        throw new AllEnginesFailedException("All engines failed", failures, last);
    }

    private boolean pause(int failedAttempt) {
        Duration delay = Backoff.delayAfter(failedAttempt, backoffBase);
        try {
            backoff.pause(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted during retry backoff; giving up");
            return false;
        }
    }
}
