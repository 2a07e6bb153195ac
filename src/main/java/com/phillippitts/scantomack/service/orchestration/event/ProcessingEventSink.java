package com.phillippitts.scantomack.service.orchestration.event;

import com.phillippitts.scantomack.domain.ProcessingEvent;

/**
 * Caller-supplied receiver of processing lifecycle events.
 *
 * <p>Exceptions thrown here are caught and logged; they never affect processing.
 */
@FunctionalInterface
public interface ProcessingEventSink {

    void onEvent(ProcessingEvent event);
}
