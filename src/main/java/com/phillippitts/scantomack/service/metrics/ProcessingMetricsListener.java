package com.phillippitts.scantomack.service.metrics;

import com.phillippitts.scantomack.service.orchestration.event.ProcessingCompletedEvent;
import com.phillippitts.scantomack.service.orchestration.event.ProcessingFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Counts request outcomes from the facade's application events.
 */
@Component
public class ProcessingMetricsListener {

    private static final Logger LOG = LogManager.getLogger(ProcessingMetricsListener.class);

    private final OcrMetrics metrics;

    public ProcessingMetricsListener(OcrMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    public void onCompleted(ProcessingCompletedEvent event) {
        metrics.recordRequest("completed", event.engineUsed().wireName());
    }

    @EventListener
    public void onFailed(ProcessingFailedEvent event) {
        LOG.debug("Request {} failed: {}", event.correlationId(), event.reason());
        metrics.recordRequest(event.reason(), "none");
    }
}
