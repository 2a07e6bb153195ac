package com.phillippitts.scantomack.service.orchestration;

import com.phillippitts.scantomack.domain.CombinationMethod;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.exception.BridgeProtocolException;
import com.phillippitts.scantomack.exception.EngineReportedFailureException;
import com.phillippitts.scantomack.exception.EngineTimeoutException;
import com.phillippitts.scantomack.exception.EngineUnavailableException;
import com.phillippitts.scantomack.exception.RecognitionException;
import com.phillippitts.scantomack.service.metrics.OcrMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/**
 * Records engine-call metrics on behalf of the dispatchers.
 *
 * <p>All methods are no-ops when constructed without {@link OcrMetrics}, so orchestration code
 * never checks for metrics itself.
 */
public final class ProcessingMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(ProcessingMetricsPublisher.class);

    /**
     * Publisher that records nothing; for tests and builder defaults.
     */
    public static final ProcessingMetricsPublisher NOOP = new ProcessingMetricsPublisher(null);

    private final OcrMetrics metrics;

    public ProcessingMetricsPublisher(OcrMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("ProcessingMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordSuccess(EngineId engine, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(engine.wireName(), durationNanos);
        metrics.incrementSuccess(engine.wireName());
    }

    public void recordFailure(EngineId engine, RecognitionException error) {
        if (metrics == null) {
            return;
        }
        metrics.incrementFailure(engine.wireName(), failureReason(error));
    }

    public void recordEnsemble(CombinationMethod method, int engineCount) {
        if (metrics == null) {
            return;
        }
        metrics.recordEnsemble(method.name().toLowerCase(Locale.ROOT), engineCount);
    }

    public boolean isEnabled() {
        return metrics != null;
    }

    static String failureReason(RecognitionException error) {
        if (error instanceof EngineTimeoutException) {
            return "timeout";
        }
        if (error instanceof EngineReportedFailureException) {
            return "reported_failure";
        }
        if (error instanceof BridgeProtocolException) {
            return "protocol_error";
        }
        if (error instanceof EngineUnavailableException) {
            return "unavailable";
        }
        return "error";
    }
}
